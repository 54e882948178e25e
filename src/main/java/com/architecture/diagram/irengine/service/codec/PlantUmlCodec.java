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
 * StructuralIr to PlantUML. Component diagrams use one {@code -->} line per resolved edge;
 * sequence diagrams use {@code participant} lines and {@code ->} messages in message order.
 * Unresolved edges are kept as {@code '} comments. The last line is {@code ' fingerprint: <hex>}.
 */
@Component
public class PlantUmlCodec extends FingerprintingCodec {

    static final String FINGERPRINT_PREFIX = "' fingerprint: ";

    public PlantUmlCodec(ContentFingerprint contentFingerprint) {
        super(contentFingerprint);
    }

    @Override
    public DiagramFormat format() {
        return DiagramFormat.PLANTUML;
    }

    @Override
    protected String body(StructuralIr ir) {
        IdentifierSanitizer ids = new IdentifierSanitizer();
        ir.getNodes().forEach(n -> ids.idFor(n.getId()));

        List<String> lines = new ArrayList<>();
        lines.add("@startuml");
        if (ir.isSequence()) {
            writeSequence(ir, ids, lines);
        } else {
            writeComponents(ir, ids, lines);
        }
        writeUnresolved(ir, ids, lines);
        lines.add("@enduml");
        return String.join("\n", lines);
    }

    @Override
    protected String attach(String body, String fingerprint) {
        return body + "\n" + FINGERPRINT_PREFIX + fingerprint;
    }

    // ========================= COMPONENT DIAGRAMS =========================

    private void writeComponents(StructuralIr ir, IdentifierSanitizer ids, List<String> lines) {
        lines.add(ir.getLayout().isHorizontal() ? "left to right direction" : "top to bottom direction");
        lines.add("title " + quoteless(labelOrId(ir.getTitle(), "Architecture Diagram")));

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
            lines.add("rectangle \"" + quoteless(labelOrId(group.getLabel(), group.getId())) + "\" as "
                    + ids.idFor("group", group.getId()) + " {");
            members.forEach(n -> lines.add("  " + declaration(n, ids)));
            lines.add("}");
        }
        for (StructuralNode node : ir.getNodes()) {
            if (!placed.contains(node.getId())) {
                lines.add(declaration(node, ids));
            }
        }
        for (StructuralEdge edge : ir.getEdges()) {
            lines.add(ids.idFor(edge.getFrom()) + " --> " + ids.idFor(edge.getTo()) + labelSuffix(edge.getLabel()));
        }
    }

    private String declaration(StructuralNode node, IdentifierSanitizer ids) {
        return keyword(node.getKind()) + " \"" + quoteless(labelOrId(node.getLabel(), node.getId())) + "\" as "
                + ids.idFor(node.getId());
    }

    static String keyword(String kind) {
        if (kind == null) {
            return "component";
        }
        switch (kind) {
            case "actor":
            case "person":
                return "actor";
            case "data_store":
            case "database":
                return "database";
            case "external":
                return "cloud";
            case "system":
                return "rectangle";
            default:
                return "component";
        }
    }

    // ========================= SEQUENCE DIAGRAMS =========================

    private void writeSequence(StructuralIr ir, IdentifierSanitizer ids, List<String> lines) {
        lines.add("title " + quoteless(labelOrId(ir.getTitle(), "Sequence Diagram")));
        for (StructuralNode node : ir.getNodes()) {
            String keyword = "actor".equals(keyword(node.getKind())) ? "actor" : "participant";
            lines.add(keyword + " \"" + quoteless(labelOrId(node.getLabel(), node.getId())) + "\" as "
                    + ids.idFor(node.getId()));
        }
        List<StructuralEdge> messages = new ArrayList<>(ir.getEdges());
        messages.sort(Comparator.comparingInt(e -> e.getOrder() != null ? e.getOrder() : 0));
        for (StructuralEdge edge : messages) {
            lines.add(ids.idFor(edge.getFrom()) + " -> " + ids.idFor(edge.getTo()) + labelSuffix(edge.getLabel()));
        }
    }

    // ========================= HELPERS =========================

    private void writeUnresolved(StructuralIr ir, IdentifierSanitizer ids, List<String> lines) {
        for (StructuralEdge edge : ir.getUnresolved()) {
            String from = edge.getFrom() != null ? ids.idFor(edge.getFrom()) : orUnknown(null);
            String to = edge.getTo() != null ? ids.idFor(edge.getTo()) : orUnknown(null);
            lines.add("' unresolved " + edge.getId() + ": " + from + " to " + to + labelSuffix(edge.getLabel()));
        }
    }

    private static String labelSuffix(String label) {
        return label == null || label.isBlank() ? "" : " : " + oneLine(label);
    }

    private static String quoteless(String text) {
        return oneLine(text).replace('"', '\'');
    }

    private static String oneLine(String text) {
        return text.replace("\r", " ").replace("\n", " ").trim();
    }
}
