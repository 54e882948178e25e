package com.architecture.diagram.irengine.dto.patch;

import com.architecture.diagram.irengine.dto.ir.DiffSummary;
import com.architecture.diagram.irengine.dto.ir.IrDocument;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a successful patch. The IR is a fresh copy; the input document is never touched.
 */
@Value
@Builder
public class PatchResult {
    IrDocument ir;
    List<PatchLogEntry> patchLog;
    DiffSummary diffSummary;
}
