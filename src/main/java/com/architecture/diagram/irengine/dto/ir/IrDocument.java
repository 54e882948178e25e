package com.architecture.diagram.irengine.dto.ir;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The {@code ir} member of a versioned document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IrDocument {
    private Diagram diagram;
}
