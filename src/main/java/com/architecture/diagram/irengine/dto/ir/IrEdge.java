package com.architecture.diagram.irengine.dto.ir;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.TreeMap;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"edge_id", "from", "to", "relation_type", "direction", "category", "mode", "label", "confidence"})
public class IrEdge {

    @JsonProperty("edge_id")
    private String edgeId;

    private String from;
    private String to;

    @JsonProperty("relation_type")
    private String relationType;

    private EdgeDirection direction;
    private EdgeCategory category;
    private EdgeMode mode;
    private String label;
    private double confidence;

    // Set on edges synthesised by connectivity inference
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Boolean inferred;

    @Builder.Default
    private Map<String, Object> extensions = new TreeMap<>();

    public boolean touches(String blockId) {
        return blockId.equals(from) || blockId.equals(to);
    }

    @JsonAnyGetter
    public Map<String, Object> getExtensions() {
        return extensions;
    }

    @JsonAnySetter
    public void putExtension(String key, Object value) {
        extensions.put(key, value);
    }
}
