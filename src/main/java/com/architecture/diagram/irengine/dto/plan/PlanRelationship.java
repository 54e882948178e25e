package com.architecture.diagram.irengine.dto.plan;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A relationship between two labels as stated by the plan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlanRelationship {

    @JsonAlias({"from_", "source"})
    private String from;

    @JsonAlias("target")
    private String to;

    private String type;        // sync, async, data, auth

    @JsonAlias("label")
    private String description;
}
