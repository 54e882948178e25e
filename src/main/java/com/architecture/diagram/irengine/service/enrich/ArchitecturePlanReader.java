package com.architecture.diagram.irengine.service.enrich;

import com.architecture.diagram.irengine.dto.plan.ArchitecturePlan;
import com.architecture.diagram.irengine.exception.SchemaValidationException;
import com.architecture.diagram.irengine.service.schema.IrJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

/**
 * Reads the plan JSON handed over by the planning layer.
 */
@Component
@Slf4j
public class ArchitecturePlanReader {

    private final ObjectMapper objectMapper = IrJson.newMapper();

    public ArchitecturePlan read(String json) {
        if (json == null || json.isBlank()) {
            throw new SchemaValidationException("/", "empty plan payload", null);
        }
        try {
            return read(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            log.warn("Rejecting malformed plan payload: {}", e.getOriginalMessage());
            throw new SchemaValidationException("/", "malformed plan JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Bind a parsed payload, rejecting unknown zone names up front.
     */
    public ArchitecturePlan read(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new SchemaValidationException("/", "plan must be a JSON object", null);
        }
        JsonNode zones = payload.get("zones");
        if (zones != null && !zones.isNull() && !zones.isObject()) {
            throw new SchemaValidationException("/zones", "must be an object of zone -> labels", null);
        }
        ArchitecturePlan plan;
        try {
            plan = objectMapper.treeToValue(payload, ArchitecturePlan.class);
        } catch (JsonProcessingException e) {
            throw new SchemaValidationException("/", "plan does not match the expected shape: "
                    + e.getOriginalMessage(), e);
        }
        plan.zoneLabels();
        if (plan.getRelationships() == null) {
            plan.setRelationships(new ArrayList<>());
        }
        log.debug("Read plan '{}' with {} relationships", plan.getSystemName(), plan.getRelationships().size());
        return plan;
    }
}
