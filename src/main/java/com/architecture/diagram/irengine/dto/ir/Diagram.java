package com.architecture.diagram.irengine.dto.ir;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"id", "type", "blocks", "edges"})
public class Diagram {

    private String id;
    private String type;

    @Builder.Default
    private List<Block> blocks = new ArrayList<>();

    @Builder.Default
    private List<IrEdge> edges = new ArrayList<>();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String layout;

    @JsonProperty("zone_order")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<String> zoneOrder;

    @JsonProperty("global_intent")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Map<String, Object> globalIntent;

    public Optional<Block> findBlock(String blockId) {
        return blocks.stream().filter(b -> b.getId().equals(blockId)).findFirst();
    }

    @JsonIgnore
    public List<String> getBlockIds() {
        return blocks.stream().map(Block::getId).toList();
    }
}
