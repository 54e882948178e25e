package com.architecture.diagram.irengine.service.enrich;

import com.architecture.diagram.irengine.dto.enrich.Density;
import com.architecture.diagram.irengine.dto.enrich.EnrichedEdge;
import com.architecture.diagram.irengine.dto.enrich.EnrichedIr;
import com.architecture.diagram.irengine.dto.enrich.EnrichedNode;
import com.architecture.diagram.irengine.dto.enrich.EnrichmentMetadata;
import com.architecture.diagram.irengine.dto.enrich.GlobalIntent;
import com.architecture.diagram.irengine.dto.enrich.Layout;
import com.architecture.diagram.irengine.dto.enrich.NodeKind;
import com.architecture.diagram.irengine.dto.enrich.NodeProvenance;
import com.architecture.diagram.irengine.dto.enrich.NodeStyle;
import com.architecture.diagram.irengine.dto.enrich.RelationType;
import com.architecture.diagram.irengine.dto.enrich.RenderingHints;
import com.architecture.diagram.irengine.dto.enrich.TextStyle;
import com.architecture.diagram.irengine.dto.plan.ArchitecturePlan;
import com.architecture.diagram.irengine.dto.plan.NodeRole;
import com.architecture.diagram.irengine.dto.plan.PlanRelationship;
import com.architecture.diagram.irengine.dto.plan.Zone;
import com.architecture.diagram.irengine.exception.EnrichmentException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Deterministic enrichment of a minimal architecture plan into a fully styled, connected IR.
 *
 * <p>Pipeline: palette and intent, zone nodes, relationship-endpoint nodes, explicit edges,
 * connectivity inference, zone-then-label ordering, validation. The same plan always yields
 * an identical result.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IrEnricher {

    public static final String GENERATED_BY = "diagram-ir-engine/enricher";
    public static final String SCHEMA_VERSION = "v1";

    private static final double EXPLICIT_NODE_CONFIDENCE = 0.98;
    private static final double INFERRED_NODE_CONFIDENCE = 0.8;
    private static final double DESCRIBED_EDGE_CONFIDENCE = 0.95;
    private static final double UNDESCRIBED_EDGE_CONFIDENCE = 0.85;

    private final AestheticResolver aestheticResolver;
    private final NodeRoleClassifier roleClassifier;
    private final ConnectivityInferencer connectivityInferencer;
    private final EnrichedIrValidator validator;

    /**
     * Enrich a plan.
     *
     * @throws EnrichmentException if the result does not validate
     */
    public EnrichedIr enrich(ArchitecturePlan plan) {
        Map<Zone, List<String>> zones = plan.zoneLabels();
        List<String> palette = aestheticResolver.resolvePalette(plan.getAestheticIntent());
        List<Zone> zoneOrder = resolveZoneOrder(zones);
        Map<Zone, String[]> zoneColors = assignZoneColors(zoneOrder, palette);

        log.info("Enriching plan '{}': {} zones, {} relationships",
                plan.getSystemName(), zones.size(), relationships(plan).size());

        EnrichmentContext context = new EnrichmentContext(palette, zoneOrder);

        // ========================= NODES =========================
        for (Zone zone : zoneOrder) {
            for (String label : zones.getOrDefault(zone, List.of())) {
                if (label != null && !label.isBlank()) {
                    addNode(context, label.trim(), zone, zoneColors, false);
                }
            }
        }
        for (PlanRelationship relationship : relationships(plan)) {
            for (String endpoint : Arrays.asList(relationship.getFrom(), relationship.getTo())) {
                String label = endpoint == null ? "" : endpoint.trim();
                if (!label.isEmpty() && context.findByLabel(label) == null) {
                    addNode(context, label, null, zoneColors, true);
                    context.warn(String.format("Inferred node '%s' from relationship endpoints", label));
                }
            }
        }

        // ========================= EDGES =========================
        for (PlanRelationship relationship : relationships(plan)) {
            addExplicitEdge(context, relationship);
        }
        int inferred = connectivityInferencer.infer(context);

        List<EnrichedNode> nodes = new ArrayList<>(context.getNodes());
        nodes.sort(Comparator.<EnrichedNode>comparingInt(n -> context.zoneRank(n.getZone()))
                .thenComparing(n -> n.getLabel().toLowerCase(Locale.ROOT))
                .thenComparing(EnrichedNode::getNodeId));

        context.info("Enriched deterministically");
        Layout layout = Layout.normalize(plan.getVisualHints() != null ? plan.getVisualHints().getLayout() : null);
        Density density = aestheticResolver.resolveDensity(plan.getAestheticIntent(), nodes.size());

        EnrichedIr enriched = EnrichedIr.builder()
                .systemName(plan.getSystemName())
                .diagramType(resolveDiagramType(plan))
                .layout(layout)
                .zoneOrder(zoneOrder.stream().map(Zone::getValue).collect(Collectors.toList()))
                .nodes(nodes)
                .edges(new ArrayList<>(context.getEdges()))
                .inferences(new ArrayList<>(context.getInferences()))
                .globalIntent(GlobalIntent.builder()
                        .palette(palette)
                        .layout(layout)
                        .density(density)
                        .mood(aestheticResolver.resolveMood(plan.getAestheticIntent()))
                        .contrast(aestheticResolver.resolveContrast(plan.getAestheticIntent()))
                        .fontFamily(AestheticResolver.FONT_FAMILY)
                        .zoneColors(zoneColorMap(zoneColors))
                        .build())
                .metadata(EnrichmentMetadata.builder()
                        .generatedBy(GENERATED_BY)
                        .schemaVersion(SCHEMA_VERSION)
                        .sourceSystem(plan.getSystemName())
                        .validation(new ArrayList<>(context.getValidation()))
                        .build())
                .build();

        List<String> problems = validator.validate(enriched);
        if (!problems.isEmpty()) {
            log.error("Enriched IR for '{}' failed validation: {}", plan.getSystemName(), problems);
            throw new EnrichmentException(problems);
        }
        log.info("Enriched '{}': {} nodes, {} edges ({} inferred)",
                plan.getSystemName(), nodes.size(), enriched.getEdges().size(), inferred);
        return enriched;
    }

    // ========================= NODE MATERIALIZATION =========================

    private void addNode(EnrichmentContext context, String label, Zone zone,
                         Map<Zone, String[]> zoneColors, boolean inferred) {
        if (context.findByLabel(label) != null) {
            log.debug("Label '{}' already placed, skipping duplicate in zone {}", label, zone);
            return;
        }
        NodeRole role = roleClassifier.classify(label, zone);
        NodeKind kind = NodeKind.forRole(role);
        String[] colors = zone != null && zoneColors.containsKey(zone)
                ? zoneColors.get(zone)
                : new String[]{context.paletteColor(0), context.paletteColor(1)};
        List<String> palette = context.getPalette();

        EnrichedNode node = EnrichedNode.builder()
                .nodeId(EnrichmentContext.uniqueSlug(label, context.getNodeIds(), "node"))
                .label(label)
                .role(role)
                .zone(zone)
                .type(kind)
                .stereotype(role.getStereotype())
                .shape(kind.getShape())
                .sizeHint(kind.getSizeHint())
                .nodeStyle(NodeStyle.builder()
                        .fillColor(colors[0])
                        .borderColor(colors[1])
                        .textColor(palette.get(palette.size() - 1))
                        .borderWidth(2)
                        .fontSize(12)
                        .fontFamily(AestheticResolver.FONT_FAMILY)
                        .padding(kind.getPadding())
                        .build())
                .renderingHints(RenderingHints.builder()
                        .plantuml(new RenderingHints.PlantUml(kind.getPlantUmlShape(), colors[0], label))
                        .mermaid(new RenderingHints.Mermaid(kind.getMermaidType(), mermaidIdentifier(label)))
                        .build())
                .metadata(inferred
                        ? new NodeProvenance(INFERRED_NODE_CONFIDENCE, "derived from relationship", "relationships")
                        : new NodeProvenance(EXPLICIT_NODE_CONFIDENCE, "explicit zone membership", "zones." + zone.getValue()))
                .build();
        context.addNode(node);
    }

    // ========================= EXPLICIT EDGES =========================

    private void addExplicitEdge(EnrichmentContext context, PlanRelationship relationship) {
        String fromLabel = relationship.getFrom() == null ? "" : relationship.getFrom().trim();
        String toLabel = relationship.getTo() == null ? "" : relationship.getTo().trim();
        if (fromLabel.isEmpty() || toLabel.isEmpty()) {
            context.warn("Skipped relationship with a missing endpoint");
            return;
        }
        EnrichedNode from = context.findByLabel(fromLabel);
        EnrichedNode to = context.findByLabel(toLabel);

        RelationType type = RelationType.fromString(relationship.getType());
        if (type == null) {
            if (relationship.getType() != null && !relationship.getType().isBlank()) {
                context.warn(String.format("Unknown relationship type '%s' between '%s' and '%s', using sync",
                        relationship.getType(), fromLabel, toLabel));
            }
            type = RelationType.SYNC;
        }

        String description = relationship.getDescription();
        boolean described = description != null && !description.isBlank();
        String color = type.colorFrom(context.getPalette());
        String edgeId = EnrichmentContext.uniqueId(
                from.getNodeId() + "__" + to.getNodeId() + "__" + type.getValue(), context.getEdgeIds());

        context.addEdge(EnrichedEdge.builder()
                .edgeId(edgeId)
                .fromId(from.getNodeId())
                .toId(to.getNodeId())
                .relType(type)
                .label(described ? description : fromLabel + " -> " + toLabel)
                .style(type.getPreset().getLineStyle())
                .color(color)
                .width(2)
                .arrowhead(type.getPreset().getArrowShape())
                .textStyle(new TextStyle(AestheticResolver.FONT_FAMILY, 11, color))
                .curvature(type.getPreset().getCurvature())
                .opacity(1.0)
                .confidence(described ? DESCRIBED_EDGE_CONFIDENCE : UNDESCRIBED_EDGE_CONFIDENCE)
                .reason(described ? "explicit relationship" : "relationship inferred")
                .inferred(false)
                .build());
    }

    // ========================= PLAN-LEVEL SETTINGS =========================

    private List<PlanRelationship> relationships(ArchitecturePlan plan) {
        return plan.getRelationships() != null ? plan.getRelationships() : List.of();
    }

    /**
     * Default zone order restricted to zones that hold labels; the full default order when none do.
     */
    private List<Zone> resolveZoneOrder(Map<Zone, List<String>> zones) {
        List<Zone> populated = Arrays.stream(Zone.values())
                .filter(z -> zones.get(z) != null && zones.get(z).stream().anyMatch(l -> l != null && !l.isBlank()))
                .collect(Collectors.toList());
        return populated.isEmpty() ? List.of(Zone.values()) : populated;
    }

    private Map<Zone, String[]> assignZoneColors(List<Zone> zoneOrder, List<String> palette) {
        Map<Zone, String[]> colors = new TreeMap<>();
        for (int i = 0; i < zoneOrder.size(); i++) {
            colors.put(zoneOrder.get(i), new String[]{
                    palette.get(i % palette.size()),
                    palette.get((i + 1) % palette.size())
            });
        }
        return colors;
    }

    private Map<String, Map<String, String>> zoneColorMap(Map<Zone, String[]> zoneColors) {
        Map<String, Map<String, String>> result = new TreeMap<>();
        zoneColors.forEach((zone, colors) -> {
            Map<String, String> entry = new TreeMap<>();
            entry.put("fill", colors[0]);
            entry.put("border", colors[1]);
            result.put(zone.getValue(), entry);
        });
        return result;
    }

    private String resolveDiagramType(ArchitecturePlan plan) {
        if (plan.getDiagramType() != null && !plan.getDiagramType().isBlank()) {
            return plan.getDiagramType().trim();
        }
        if (plan.getDiagramViews() != null && !plan.getDiagramViews().isEmpty()) {
            return plan.getDiagramViews().get(0);
        }
        return "diagram";
    }

    static String mermaidIdentifier(String label) {
        StringBuilder identifier = new StringBuilder();
        for (String part : label.split("[^a-zA-Z0-9]")) {
            if (!part.isEmpty()) {
                identifier.append(Character.toUpperCase(part.charAt(0)))
                        .append(part.substring(1).toLowerCase(Locale.ROOT));
            }
        }
        return identifier.length() > 0 ? identifier.toString() : "Node";
    }
}
