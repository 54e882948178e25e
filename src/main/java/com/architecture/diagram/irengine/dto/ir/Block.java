package com.architecture.diagram.irengine.dto.ir;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.TreeMap;

/**
 * A rendering-ready node inside {@code ir.diagram.blocks}.
 * Keys outside the schema are carried through untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"id", "type", "text", "bbox", "style", "annotations", "version", "hidden", "zone"})
public class Block {

    private String id;
    private String type;
    private String text;
    private BoundingBox bbox;

    @Builder.Default
    private Map<String, Object> style = new TreeMap<>();

    @Builder.Default
    private Map<String, Object> annotations = new TreeMap<>();

    @Builder.Default
    private int version = 1;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Boolean hidden;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String zone;

    @Builder.Default
    private Map<String, Object> extensions = new TreeMap<>();

    public boolean hidden() {
        return Boolean.TRUE.equals(hidden);
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
