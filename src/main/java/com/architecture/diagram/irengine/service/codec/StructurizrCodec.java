package com.architecture.diagram.irengine.service.codec;

import com.architecture.diagram.irengine.dto.codec.DiagramFormat;
import com.architecture.diagram.irengine.dto.codec.StructuralEdge;
import com.architecture.diagram.irengine.dto.codec.StructuralIr;
import com.architecture.diagram.irengine.dto.codec.StructuralNode;
import com.architecture.diagram.irengine.exception.IrEngineException;
import com.architecture.diagram.irengine.service.schema.IrJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * StructuralIr to a Structurizr workspace JSON document. Element ids are sequential in node
 * order; the workspace carries a top-level {@code fingerprint} of the document without it.
 */
@Component
public class StructurizrCodec extends FingerprintingCodec {

    private static final Set<String> PERSON_KINDS = Set.of("actor", "person", "user");

    private final ObjectMapper objectMapper = IrJson.newMapper();

    public StructurizrCodec(ContentFingerprint contentFingerprint) {
        super(contentFingerprint);
    }

    @Override
    public DiagramFormat format() {
        return DiagramFormat.STRUCTURIZR;
    }

    @Override
    protected String body(StructuralIr ir) {
        return write(workspace(ir));
    }

    @Override
    protected String attach(String body, String fingerprint) {
        try {
            ObjectNode workspace = (ObjectNode) objectMapper.readTree(body);
            workspace.put("fingerprint", fingerprint);
            return write(workspace);
        } catch (JsonProcessingException e) {
            throw new IrEngineException("Failed to attach fingerprint to Structurizr workspace", e);
        }
    }

    ObjectNode workspace(StructuralIr ir) {
        ObjectNode workspace = objectMapper.createObjectNode();
        workspace.put("name", labelOrId(ir.getTitle(), "Generated Workspace"));
        workspace.put("description", "Generated " + ir.getDiagramKind() + " diagram");

        ObjectNode model = workspace.putObject("model");
        ArrayNode people = model.putArray("people");
        ArrayNode systems = model.putArray("softwareSystems");
        ArrayNode relationships = model.putArray("relationships");
        ArrayNode viewElements = objectMapper.createArrayNode();

        Map<String, String> elementIds = new HashMap<>();
        int nextId = 1;
        for (StructuralNode node : ir.getNodes()) {
            String elementId = String.valueOf(nextId++);
            elementIds.put(node.getId(), elementId);
            boolean person = node.getKind() != null && PERSON_KINDS.contains(node.getKind());
            ObjectNode element = (person ? people : systems).addObject();
            element.put("id", elementId);
            element.put("name", labelOrId(node.getLabel(), node.getId()));
            element.put("tags", person ? "Element,Person" : "Element,Software System," + kindOrDefault(node));
            if (node.getGroup() != null) {
                element.putObject("properties").put("group", node.getGroup());
            }
            viewElements.addObject().put("id", elementId);
        }

        String systemId;
        if (systems.isEmpty()) {
            systemId = String.valueOf(nextId++);
            ObjectNode placeholder = systems.addObject();
            placeholder.put("id", systemId);
            placeholder.put("name", "System");
        } else {
            systemId = systems.get(0).get("id").asText();
        }

        for (StructuralEdge edge : ir.getEdges()) {
            ObjectNode relationship = relationships.addObject();
            relationship.put("id", String.valueOf(nextId++));
            relationship.put("sourceId", elementIds.get(edge.getFrom()));
            relationship.put("destinationId", elementIds.get(edge.getTo()));
            relationship.put("description", description(edge));
        }
        if (!ir.getUnresolved().isEmpty()) {
            ArrayNode unresolved = workspace.putArray("unresolvedRelationships");
            for (StructuralEdge edge : ir.getUnresolved()) {
                ObjectNode entry = unresolved.addObject();
                entry.put("id", edge.getId());
                entry.put("sourceId", edge.getFrom() != null ? elementIds.get(edge.getFrom()) : null);
                entry.put("destinationId", edge.getTo() != null ? elementIds.get(edge.getTo()) : null);
                entry.put("description", description(edge));
            }
        }

        ObjectNode view = workspace.putObject("views").putArray("systemContextViews").addObject();
        view.put("key", "SystemContext");
        view.put("softwareSystemId", systemId);
        view.put("description", "Generated");
        view.set("elements", viewElements);
        view.putObject("automaticLayout").put("rankDirection", ir.getLayout().isHorizontal() ? "LeftRight" : "TopBottom");
        return workspace;
    }

    private String write(ObjectNode workspace) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(workspace);
        } catch (JsonProcessingException e) {
            throw new IrEngineException("Failed to serialize Structurizr workspace", e);
        }
    }

    private static String description(StructuralEdge edge) {
        if (edge.getLabel() != null && !edge.getLabel().isBlank()) {
            return edge.getLabel();
        }
        return edge.getType() != null && !edge.getType().isBlank() ? edge.getType() : "interaction";
    }

    private static String kindOrDefault(StructuralNode node) {
        return node.getKind() == null || node.getKind().isBlank() ? "container" : node.getKind();
    }
}
