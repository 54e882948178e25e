package com.architecture.diagram.irengine.service.codec;

import com.architecture.diagram.irengine.dto.codec.DiagramFormat;
import com.architecture.diagram.irengine.dto.codec.StructuralEdge;
import com.architecture.diagram.irengine.dto.codec.StructuralGroup;
import com.architecture.diagram.irengine.dto.codec.StructuralIr;
import com.architecture.diagram.irengine.dto.codec.StructuralNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * StructuralIr to Mermaid: {@code flowchart LR|TB} with one subgraph per group, or
 * {@code sequenceDiagram} for sequence diagrams.
 */
@Component
public class MermaidCodec extends FingerprintingCodec {

    static final String FINGERPRINT_PREFIX = "%% fingerprint: ";
    private static final String INDENT = "    ";

    public MermaidCodec(ContentFingerprint contentFingerprint) {
        super(contentFingerprint);
    }

    @Override
    public DiagramFormat format() {
        return DiagramFormat.MERMAID;
    }

    @Override
    protected String body(StructuralIr ir) {
        IdentifierSanitizer ids = new IdentifierSanitizer();
        ir.getNodes().forEach(n -> ids.idFor(n.getId()));

        List<String> lines = new ArrayList<>();
        if (ir.isSequence()) {
            writeSequence(ir, ids, lines);
        } else {
            writeFlowchart(ir, ids, lines);
        }
        for (StructuralEdge edge : ir.getUnresolved()) {
            String from = edge.getFrom() != null ? ids.idFor(edge.getFrom()) : orUnknown(null);
            String to = edge.getTo() != null ? ids.idFor(edge.getTo()) : orUnknown(null);
            lines.add(INDENT + "%% unresolved " + edge.getId() + ": " + from + " to " + to);
        }
        return String.join("\n", lines);
    }

    @Override
    protected String attach(String body, String fingerprint) {
        return body + "\n" + FINGERPRINT_PREFIX + fingerprint;
    }

    private void writeFlowchart(StructuralIr ir, IdentifierSanitizer ids, List<String> lines) {
        lines.add("flowchart " + (ir.getLayout().isHorizontal() ? "LR" : "TB"));

        Map<String, StructuralNode> byId = new LinkedHashMap<>();
        ir.getNodes().forEach(n -> byId.put(n.getId(), n));
        Set<String> placed = new HashSet<>();

        for (StructuralGroup group : ir.getGroups()) {
            List<StructuralNode> members = new ArrayList<>();
            for (String member : group.getMembers()) {
                StructuralNode node = byId.get(member);
                if (node != null && placed.add(member)) {
                    members.add(node);
                }
            }
            if (members.isEmpty()) {
                continue;
            }
            lines.add(INDENT + "subgraph " + ids.idFor("group", group.getId())
                    + "[\"" + escape(labelOrId(group.getLabel(), group.getId())) + "\"]");
            members.forEach(n -> lines.add(INDENT + INDENT + shape(n, ids)));
            lines.add(INDENT + "end");
        }
        for (StructuralNode node : ir.getNodes()) {
            if (!placed.contains(node.getId())) {
                lines.add(INDENT + shape(node, ids));
            }
        }
        for (StructuralEdge edge : ir.getEdges()) {
            String arrow = edge.getLabel() == null || edge.getLabel().isBlank()
                    ? " --> "
                    : " -->|" + escape(edge.getLabel()) + "| ";
            lines.add(INDENT + ids.idFor(edge.getFrom()) + arrow + ids.idFor(edge.getTo()));
        }
    }

    private String shape(StructuralNode node, IdentifierSanitizer ids) {
        String id = ids.idFor(node.getId());
        String label = "\"" + escape(labelOrId(node.getLabel(), node.getId())) + "\"";
        String kind = node.getKind() == null ? "" : node.getKind();
        switch (kind) {
            case "data_store":
            case "database":
                return id + "[(" + label + ")]";
            case "actor":
            case "person":
                return id + "([" + label + "])";
            case "external":
                return id + "{{" + label + "}}";
            default:
                return id + "[" + label + "]";
        }
    }

    private void writeSequence(StructuralIr ir, IdentifierSanitizer ids, List<String> lines) {
        lines.add("sequenceDiagram");
        for (StructuralNode node : ir.getNodes()) {
            String keyword = "actor".equals(PlantUmlCodec.keyword(node.getKind())) ? "actor" : "participant";
            lines.add(INDENT + keyword + " " + ids.idFor(node.getId()) + " as "
                    + escape(labelOrId(node.getLabel(), node.getId())));
        }
        List<StructuralEdge> messages = new ArrayList<>(ir.getEdges());
        messages.sort(Comparator.comparingInt(e -> e.getOrder() != null ? e.getOrder() : 0));
        for (StructuralEdge edge : messages) {
            String label = edge.getLabel() == null || edge.getLabel().isBlank() ? "call" : edge.getLabel();
            lines.add(INDENT + ids.idFor(edge.getFrom()) + "->>" + ids.idFor(edge.getTo()) + ": " + escape(label));
        }
    }

    private static String escape(String text) {
        return text.replace("\r", " ").replace("\n", " ").replace("\"", "#quot;").trim();
    }
}
