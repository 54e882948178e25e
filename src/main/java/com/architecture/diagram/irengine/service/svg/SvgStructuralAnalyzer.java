package com.architecture.diagram.irengine.service.svg;

import com.architecture.diagram.irengine.dto.svg.AnalysisOptions;
import com.architecture.diagram.irengine.dto.svg.Bounds;
import com.architecture.diagram.irengine.dto.svg.ElementRole;
import com.architecture.diagram.irengine.dto.svg.EndpointResolution;
import com.architecture.diagram.irengine.dto.svg.Point;
import com.architecture.diagram.irengine.dto.svg.StructuralElement;
import com.architecture.diagram.irengine.dto.svg.StructuralGraph;
import com.architecture.diagram.irengine.dto.svg.SvgEdge;
import com.architecture.diagram.irengine.dto.svg.SvgGroup;
import com.architecture.diagram.irengine.dto.svg.SvgNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a typed node/edge/group graph from SVG markup.
 *
 * Groups ({@code <g>} with an id) are classified by {@code data-kind} or by the PlantUML class
 * convention ({@code entity}, {@code cluster}, {@code link}); every classified group claims its
 * subtree. Remaining shapes and lines with an id become standalone nodes and edges.
 * Output lists follow document order.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SvgStructuralAnalyzer {

    public static final double DEFAULT_WIDTH = 960;
    public static final double DEFAULT_HEIGHT = 720;
    public static final String METADATA_ID = "ir_metadata";

    private static final Set<String> NODE_SHAPES = Set.of("rect", "circle", "ellipse", "polygon");
    private static final Set<String> EDGE_SHAPES = Set.of("line", "path", "polyline");
    private static final Set<String> GROUP_SHAPES = Set.of("rect", "circle", "ellipse", "polygon", "path");
    private static final Set<String> NON_RENDERED = Set.of(
            "defs", "marker", "clippath", "mask", "pattern", "symbol", "lineargradient",
            "radialgradient", "filter", "metadata", "style", "script", "title", "desc");
    private static final Pattern METADATA_DIAGRAM_TYPE = Pattern.compile("\"diagram_type\"\\s*:\\s*\"([^\"]+)\"");

    private final AnalysisOptions defaultOptions;

    private enum GroupKind { NODE, BOUNDARY, EDGE, LABEL, DECORATION }

    public StructuralGraph analyze(String svgText, String svgId) {
        return analyze(SvgDocumentParser.parse(svgText), svgId, defaultOptions);
    }

    public StructuralGraph analyze(String svgText, String svgId, AnalysisOptions options) {
        return analyze(SvgDocumentParser.parse(svgText), svgId, options);
    }

    public StructuralGraph analyze(SvgDocument document, String svgId, AnalysisOptions options) {
        SvgElement root = document.getRoot();
        double width = SvgGeometry.length(root.attr("width"), DEFAULT_WIDTH);
        double height = SvgGeometry.length(root.attr("height"), DEFAULT_HEIGHT);
        String viewbox = root.attr("viewBox") != null
                ? root.attr("viewBox")
                : "0 0 " + formatNumber(width) + " " + formatNumber(height);

        String irMetadata = document.findById(METADATA_ID)
                .filter(e -> e.is("metadata"))
                .map(e -> document.textContent(e).trim())
                .orElse(null);

        List<SvgNode> nodes = new ArrayList<>();
        List<SvgEdge> edges = new ArrayList<>();
        List<SvgGroup> groups = new ArrayList<>();

        int i = 1;
        while (i < document.size()) {
            SvgElement element = document.get(i);
            int next = i + 1 + document.descendants(element).size();
            String tag = element.getLocalName().toLowerCase(Locale.ROOT);

            if (NON_RENDERED.contains(tag)) {
                i = next;
                continue;
            }
            GroupKind kind = "g".equals(tag) ? classify(element) : null;
            if (kind != null) {
                switch (kind) {
                    case NODE:
                        nodes.add(nodeFromGroup(document, element, ElementRole.NODE));
                        break;
                    case LABEL:
                        nodes.add(nodeFromGroup(document, element, ElementRole.LABEL));
                        break;
                    case BOUNDARY:
                        groups.add(groupFromElement(document, element));
                        break;
                    case EDGE:
                        edges.add(edgeFromGroup(document, element));
                        break;
                    default:
                        log.trace("Skipping decoration group {}", element.getId());
                }
                i = next;
                continue;
            }
            if (element.getId() != null) {
                if (EDGE_SHAPES.contains(tag)) {
                    edges.add(standaloneEdge(document, element));
                } else if (NODE_SHAPES.contains(tag)) {
                    nodes.add(standaloneNode(document, element));
                }
            }
            i++;
        }

        List<SvgEdge> resolvedEdges = resolveEndpoints(edges, nodes, options);
        List<SvgGroup> populatedGroups = new ArrayList<>();
        List<SvgNode> placedNodes = assignMembership(nodes, groups, populatedGroups);

        Map<String, StructuralElement> elementIndex = new LinkedHashMap<>();
        placedNodes.forEach(n -> elementIndex.putIfAbsent(n.getId(), n));
        resolvedEdges.forEach(e -> elementIndex.putIfAbsent(e.getId(), e));
        populatedGroups.forEach(g -> elementIndex.putIfAbsent(g.getId(), g));

        StructuralGraph graph = StructuralGraph.builder()
                .svgId(svgId)
                .diagramType(inferDiagramType(document, root, irMetadata))
                .width(width)
                .height(height)
                .viewbox(viewbox)
                .nodes(List.copyOf(placedNodes))
                .edges(List.copyOf(resolvedEdges))
                .groups(List.copyOf(populatedGroups))
                .duplicateIds(findDuplicateIds(document))
                .irMetadata(irMetadata)
                .elementIndex(Collections.unmodifiableMap(elementIndex))
                .build();

        log.debug("Analyzed SVG {}: {} nodes, {} edges, {} groups",
                svgId, graph.getNodes().size(), graph.getEdges().size(), graph.getGroups().size());
        return graph;
    }

    // ========================= CLASSIFICATION =========================

    private GroupKind classify(SvgElement g) {
        if (g.getId() == null) {
            return null;
        }
        String dataKind = g.attr("data-kind");
        if (dataKind != null && !dataKind.isBlank()) {
            switch (dataKind.trim().toLowerCase(Locale.ROOT)) {
                case "node":
                case "entity":
                    return GroupKind.NODE;
                case "boundary":
                case "cluster":
                case "zone":
                    return GroupKind.BOUNDARY;
                case "edge":
                case "link":
                    return GroupKind.EDGE;
                case "label":
                    return GroupKind.LABEL;
                default:
                    return GroupKind.DECORATION;
            }
        }
        if (g.hasClassToken("entity")) {
            return GroupKind.NODE;
        }
        if (g.hasClassToken("cluster")) {
            return GroupKind.BOUNDARY;
        }
        if (g.hasClassToken("link")) {
            return GroupKind.EDGE;
        }
        return null;
    }

    // ========================= NODES =========================

    private SvgNode nodeFromGroup(SvgDocument document, SvgElement group, ElementRole role) {
        String gid = group.getId();
        Point offset = cumulativeOffset(document, group, true);
        List<SvgElement> children = document.children(group);

        SvgElement shapeWithId = null;
        SvgElement firstShape = null;
        SvgElement firstRect = null;
        SvgElement firstText = null;
        for (SvgElement child : children) {
            String tag = child.getLocalName().toLowerCase(Locale.ROOT);
            if (GROUP_SHAPES.contains(tag)) {
                if (firstShape == null) {
                    firstShape = child;
                }
                if (firstRect == null && "rect".equals(tag)) {
                    firstRect = child;
                }
                if (shapeWithId == null && child.getId() != null) {
                    shapeWithId = child;
                }
            } else if ("text".equals(tag) && firstText == null) {
                firstText = child;
            }
        }

        String textSelector = null;
        if (firstText != null) {
            textSelector = firstText.getId() != null
                    ? CssSelectors.byId(firstText.getId())
                    : CssSelectors.descendant(gid, "text");
        }

        String animatable;
        if (role == ElementRole.LABEL) {
            animatable = textSelector != null ? textSelector : CssSelectors.byId(gid);
        } else if (shapeWithId != null) {
            animatable = CssSelectors.byId(shapeWithId.getId());
        } else if (firstShape != null) {
            animatable = CssSelectors.descendant(gid, firstShape.getLocalName());
        } else {
            animatable = CssSelectors.byId(gid);
        }

        SvgElement boundsSource = firstRect != null ? firstRect : firstShape != null ? firstShape : firstText;
        Bounds bounds = boundsSource != null
                ? SvgGeometry.offset(SvgGeometry.shapeBounds(boundsSource), offset)
                : Bounds.of(offset.getX(), offset.getY(), 0, 0);

        String label = firstText != null ? document.textContent(firstText).trim() : "";
        if (label.isEmpty()) {
            String declared = firstNonBlank(group.attr("data-label"), group.attr("data-entity"));
            label = declared != null ? declared : "";
        }

        return SvgNode.builder()
                .id(gid)
                .elementType(role == ElementRole.LABEL ? "label" : "g")
                .selector(CssSelectors.byId(gid))
                .label(label)
                .center(bounds.getCenter())
                .bounds(bounds)
                .role(role)
                .zone(blankToNull(group.attr("data-zone")))
                .animatableSelector(animatable)
                .textSelector(textSelector)
                .attributes(describe(group))
                .build();
    }

    private SvgNode standaloneNode(SvgDocument document, SvgElement shape) {
        String id = shape.getId();
        Bounds bounds = SvgGeometry.offset(SvgGeometry.shapeBounds(shape), cumulativeOffset(document, shape, false));
        SvgElement text = siblingText(document, shape);
        return SvgNode.builder()
                .id(id)
                .elementType(shape.getLocalName().toLowerCase(Locale.ROOT))
                .selector(CssSelectors.byId(id))
                .label(text != null ? document.textContent(text).trim() : "")
                .center(bounds.getCenter())
                .bounds(bounds)
                .role(ElementRole.NODE)
                .zone(blankToNull(shape.attr("data-zone")))
                .animatableSelector(CssSelectors.byId(id))
                .textSelector(text != null && text.getId() != null ? CssSelectors.byId(text.getId()) : null)
                .attributes(describe(shape))
                .build();
    }

    /**
     * The first {@code text} sibling after the shape, before any other shape; otherwise the
     * nearest preceding one.
     */
    private SvgElement siblingText(SvgDocument document, SvgElement shape) {
        SvgElement parent = document.parent(shape).orElse(null);
        if (parent == null) {
            return null;
        }
        List<SvgElement> siblings = document.children(parent);
        int pos = siblings.indexOf(shape);
        for (int k = pos + 1; k < siblings.size(); k++) {
            SvgElement s = siblings.get(k);
            if (s.is("text")) {
                return s;
            }
            if (NODE_SHAPES.contains(s.getLocalName().toLowerCase(Locale.ROOT))) {
                break;
            }
        }
        for (int k = pos - 1; k >= 0; k--) {
            if (siblings.get(k).is("text")) {
                return siblings.get(k);
            }
        }
        return null;
    }

    // ========================= GROUPS =========================

    private SvgGroup groupFromElement(SvgDocument document, SvgElement group) {
        String gid = group.getId();
        Point offset = cumulativeOffset(document, group, true);
        Bounds bounds = Bounds.EMPTY;
        String label = null;
        for (SvgElement child : document.children(group)) {
            if (bounds == Bounds.EMPTY && GROUP_SHAPES.contains(child.getLocalName().toLowerCase(Locale.ROOT))) {
                bounds = SvgGeometry.offset(SvgGeometry.shapeBounds(child), offset);
            } else if (label == null && child.is("text")) {
                label = document.textContent(child).trim();
            }
        }
        return SvgGroup.builder()
                .id(gid)
                .elementType("g")
                .selector(CssSelectors.byId(gid))
                .label(firstNonBlank(label, group.attr("data-role"), group.attr("data-zone"), gid))
                .bounds(bounds)
                .memberIds(List.of())
                .build();
    }

    // ========================= EDGES =========================

    private SvgEdge edgeFromGroup(SvgDocument document, SvgElement group) {
        String gid = group.getId();
        SvgElement stroke = null;
        String label = null;
        for (SvgElement child : document.children(group)) {
            if (stroke == null && EDGE_SHAPES.contains(child.getLocalName().toLowerCase(Locale.ROOT))) {
                stroke = child;
            } else if (label == null && child.is("text")) {
                label = document.textContent(child).trim();
            }
        }
        if (stroke == null) {
            stroke = document.descendants(group).stream()
                    .filter(d -> EDGE_SHAPES.contains(d.getLocalName().toLowerCase(Locale.ROOT)))
                    .findFirst()
                    .orElse(null);
        }

        String edgeId = stroke != null && stroke.getId() != null ? stroke.getId() : gid;
        String animatable;
        if (stroke == null) {
            animatable = CssSelectors.byId(gid);
        } else if (stroke.getId() != null) {
            animatable = CssSelectors.byId(stroke.getId());
        } else {
            animatable = CssSelectors.descendant(gid, stroke.getLocalName());
        }

        List<Point> points = stroke != null
                ? SvgGeometry.offset(SvgGeometry.points(stroke), cumulativeOffset(document, stroke, false))
                : List.of();
        Map<String, String> attributes = describe(group);
        if (stroke != null) {
            describe(stroke).forEach(attributes::putIfAbsent);
        }

        return SvgEdge.builder()
                .id(edgeId)
                .groupId(gid)
                .elementType(stroke != null ? stroke.getLocalName().toLowerCase(Locale.ROOT) : "g")
                .selector(CssSelectors.byId(edgeId))
                .edgeType(firstNonBlank(group.attr("data-role"), group.attr("data-edge-type"), "directed"))
                .animatableSelector(animatable)
                .label(label != null ? label : "")
                .bounds(Bounds.enclosing(points))
                .points(List.copyOf(points))
                .attributes(attributes)
                .build();
    }

    private SvgEdge standaloneEdge(SvgDocument document, SvgElement stroke) {
        String id = stroke.getId();
        List<Point> points = SvgGeometry.offset(SvgGeometry.points(stroke), cumulativeOffset(document, stroke, false));
        return SvgEdge.builder()
                .id(id)
                .elementType(stroke.getLocalName().toLowerCase(Locale.ROOT))
                .selector(CssSelectors.byId(id))
                .edgeType(firstNonBlank(stroke.attr("data-role"), stroke.attr("data-edge-type"), "directed"))
                .animatableSelector(CssSelectors.byId(id))
                .label("")
                .bounds(Bounds.enclosing(points))
                .points(List.copyOf(points))
                .attributes(describe(stroke))
                .build();
    }

    // ========================= ENDPOINT RESOLUTION =========================

    private List<SvgEdge> resolveEndpoints(List<SvgEdge> edges, List<SvgNode> nodes, AnalysisOptions options) {
        List<SvgNode> candidates = nodes.stream().filter(n -> n.getRole() == ElementRole.NODE).toList();
        Map<String, String> idsByLowercase = new LinkedHashMap<>();
        candidates.forEach(n -> idsByLowercase.putIfAbsent(n.getId().toLowerCase(Locale.ROOT), n.getId()));

        List<SvgEdge> resolved = new ArrayList<>(edges.size());
        for (SvgEdge edge : edges) {
            String source = matchNodeId(idsByLowercase, firstNonBlank(
                    edge.getAttributes().get("data-source"), edge.getAttributes().get("data-entity-1")));
            String target = matchNodeId(idsByLowercase, firstNonBlank(
                    edge.getAttributes().get("data-target"), edge.getAttributes().get("data-entity-2")));
            EndpointResolution method = source != null || target != null
                    ? EndpointResolution.EXPLICIT_ATTRIBUTE : EndpointResolution.UNRESOLVED;

            if (source == null || target == null) {
                List<String> embedded = embeddedNodeIds(edge, idsByLowercase);
                boolean usedSubstring = false;
                for (String candidate : embedded) {
                    if (source == null && !candidate.equals(target)) {
                        source = candidate;
                        usedSubstring = true;
                    } else if (target == null && !candidate.equals(source)) {
                        target = candidate;
                        usedSubstring = true;
                    }
                }
                if (usedSubstring) {
                    method = EndpointResolution.ID_SUBSTRING;
                }
            }

            if ((source == null || target == null) && options.isGeometricEndpointFallback()
                    && edge.getPoints().size() >= 2) {
                List<Point> pts = edge.getPoints();
                boolean usedGeometry = false;
                if (source == null) {
                    source = nearestNode(candidates, pts.get(0), target);
                    usedGeometry = source != null;
                }
                if (target == null) {
                    target = nearestNode(candidates, pts.get(pts.size() - 1), source);
                    usedGeometry |= target != null;
                }
                if (usedGeometry) {
                    method = EndpointResolution.GEOMETRIC;
                }
            }

            if (source == null && target == null) {
                method = EndpointResolution.UNRESOLVED;
                log.debug("Edge {} has no resolvable endpoints", edge.getId());
            }
            resolved.add(edge.toBuilder()
                    .sourceId(source)
                    .targetId(target)
                    .endpointResolution(method)
                    .endpointConfidence(method.confidence())
                    .build());
        }
        return resolved;
    }

    private String matchNodeId(Map<String, String> idsByLowercase, String raw) {
        if (raw == null) {
            return null;
        }
        return idsByLowercase.get(raw.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Node ids occurring in the edge id or its group id, bounded by non-alphanumeric characters,
     * in order of first occurrence. Longer ids win when two start at the same position.
     */
    private List<String> embeddedNodeIds(SvgEdge edge, Map<String, String> idsByLowercase) {
        List<String> ordered = new ArrayList<>();
        List<String> haystacks = new ArrayList<>();
        haystacks.add(edge.getId());
        if (edge.getGroupId() != null && !edge.getGroupId().equals(edge.getId())) {
            haystacks.add(edge.getGroupId());
        }
        for (String haystack : haystacks) {
            String text = haystack.toLowerCase(Locale.ROOT);
            List<int[]> hits = new ArrayList<>();
            List<String> hitIds = new ArrayList<>();
            for (Map.Entry<String, String> entry : idsByLowercase.entrySet()) {
                String needle = entry.getKey();
                if (needle.equals(text)) {
                    continue;
                }
                int from = 0;
                int pos;
                while ((pos = text.indexOf(needle, from)) >= 0) {
                    if (isTokenBoundary(text, pos - 1) && isTokenBoundary(text, pos + needle.length())) {
                        hits.add(new int[]{pos, needle.length(), hitIds.size()});
                        hitIds.add(entry.getValue());
                    }
                    from = pos + 1;
                }
            }
            hits.sort(Comparator.<int[]>comparingInt(h -> h[0]).thenComparing(h -> -h[1]));
            int consumedTo = 0;
            for (int[] hit : hits) {
                if (hit[0] < consumedTo) {
                    continue;
                }
                consumedTo = hit[0] + hit[1];
                String id = hitIds.get(hit[2]);
                if (!ordered.contains(id)) {
                    ordered.add(id);
                }
            }
            if (ordered.size() >= 2) {
                break;
            }
        }
        return ordered;
    }

    private boolean isTokenBoundary(String text, int index) {
        return index < 0 || index >= text.length() || !Character.isLetterOrDigit(text.charAt(index));
    }

    private String nearestNode(List<SvgNode> candidates, Point point, String exclude) {
        SvgNode best = null;
        double bestDistance = Double.MAX_VALUE;
        for (SvgNode node : candidates) {
            if (node.getId().equals(exclude)) {
                continue;
            }
            double distance = node.getCenter().distanceTo(point);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = node;
            }
        }
        return best != null ? best.getId() : null;
    }

    // ========================= GROUP MEMBERSHIP =========================

    private List<SvgNode> assignMembership(List<SvgNode> nodes, List<SvgGroup> groups, List<SvgGroup> populated) {
        Map<String, List<String>> members = new HashMap<>();
        List<SvgNode> placed = new ArrayList<>(nodes.size());
        for (SvgNode node : nodes) {
            SvgGroup parent = null;
            for (SvgGroup group : groups) {
                if (!group.getBounds().hasPositiveArea() || !group.getBounds().contains(node.getCenter())) {
                    continue;
                }
                members.computeIfAbsent(group.getId(), k -> new ArrayList<>()).add(node.getId());
                if (parent == null || group.getBounds().getArea() < parent.getBounds().getArea()) {
                    parent = group;
                }
            }
            placed.add(parent == null ? node : node.toBuilder().parentId(parent.getId()).build());
        }
        for (SvgGroup group : groups) {
            populated.add(group.toBuilder()
                    .memberIds(List.copyOf(members.getOrDefault(group.getId(), List.of())))
                    .build());
        }
        return placed;
    }

    // ========================= HELPERS =========================

    private String inferDiagramType(SvgDocument document, SvgElement root, String irMetadata) {
        String declared = root.attr("data-diagram-type");
        if (declared != null && !declared.isBlank()) {
            return declared.trim();
        }
        if (irMetadata != null) {
            Matcher m = METADATA_DIAGRAM_TYPE.matcher(irMetadata);
            if (m.find()) {
                return m.group(1);
            }
        }
        for (SvgElement element : document.getElements()) {
            if (!element.is("metadata")) {
                continue;
            }
            String text = document.textContent(element).toLowerCase(Locale.ROOT);
            if (text.contains("sequence")) {
                return "sequence";
            }
            if (text.contains("component")) {
                return "component";
            }
            if (text.contains("container")) {
                return "container";
            }
            if (text.contains("context")) {
                return "system_context";
            }
        }
        return "architecture";
    }

    private Point cumulativeOffset(SvgDocument document, SvgElement element, boolean includeSelf) {
        double dx = 0;
        double dy = 0;
        SvgElement current = includeSelf ? element : document.parent(element).orElse(null);
        while (current != null) {
            Point t = SvgGeometry.translateOffset(current.attr("transform"));
            dx += t.getX();
            dy += t.getY();
            current = document.parent(current).orElse(null);
        }
        return Point.of(dx, dy);
    }

    private List<String> findDuplicateIds(SvgDocument document) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new TreeSet<>();
        for (SvgElement element : document.getElements()) {
            String id = element.getId();
            if (id != null && !seen.add(id)) {
                duplicates.add(id);
            }
        }
        return List.copyOf(duplicates);
    }

    private Map<String, String> describe(SvgElement element) {
        Map<String, String> attributes = new LinkedHashMap<>();
        element.getAttributes().forEach((name, value) -> {
            String local = SvgElement.stripPrefix(name).toLowerCase(Locale.ROOT);
            if (local.startsWith("data-") || local.equals("class") || local.equals("fill") || local.equals("stroke")) {
                attributes.put(local, value);
            }
        });
        return attributes;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v.trim();
            }
        }
        return null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
