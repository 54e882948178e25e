package com.architecture.diagram.irengine.service.invariance;

import com.architecture.diagram.irengine.dto.invariance.InvarianceCheckResult;
import com.architecture.diagram.irengine.dto.invariance.InvarianceViolation;
import com.architecture.diagram.irengine.dto.invariance.Severity;
import com.architecture.diagram.irengine.dto.invariance.ViolationType;
import com.architecture.diagram.irengine.dto.svg.AnalysisOptions;
import com.architecture.diagram.irengine.dto.svg.StructuralElement;
import com.architecture.diagram.irengine.dto.svg.StructuralGraph;
import com.architecture.diagram.irengine.dto.svg.SvgEdge;
import com.architecture.diagram.irengine.service.svg.SvgDocument;
import com.architecture.diagram.irengine.service.svg.SvgElement;
import com.architecture.diagram.irengine.service.svg.SvgStructuralAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Verifies that a cosmetic transform (animation, styling) left the diagram's semantic graph
 * untouched: same nodes, edges, groups, labels and connections.
 *
 * Reports rather than throws; callers decide what a failed check means.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SemanticInvarianceChecker {

    public static final Set<String> ALLOWED_MODIFICATIONS = Set.of(
            "style", "script", "class", "animation",
            "stroke-dasharray", "stroke-dashoffset", "transform-origin");

    static final double SIMILARITY_WARNING_THRESHOLD = 0.95;
    static final double SIMILARITY_ERROR_THRESHOLD = 0.80;

    private final SvgStructuralAnalyzer analyzer;

    public InvarianceCheckResult check(String preSvg, String postSvg) {
        return check(preSvg, postSvg, true);
    }

    public InvarianceCheckResult check(String preSvg, String postSvg, boolean strict) {
        StructuralGraph pre = analyzer.analyze(preSvg, "pre");
        StructuralGraph post = analyzer.analyze(postSvg, "post");
        return check(pre, post, strict);
    }

    /**
     * Checks two parsed documents. In addition to the graph comparison, attribute edits on
     * retained elements outside {@link #ALLOWED_MODIFICATIONS} are reported as warnings.
     */
    public InvarianceCheckResult check(SvgDocument preDocument, SvgDocument postDocument, boolean strict) {
        StructuralGraph pre = analyzer.analyze(preDocument, "pre", AnalysisOptions.DEFAULT);
        StructuralGraph post = analyzer.analyze(postDocument, "post", AnalysisOptions.DEFAULT);
        return evaluate(pre, post, strict, attributeDrift(preDocument, postDocument));
    }

    public InvarianceCheckResult check(StructuralGraph pre, StructuralGraph post, boolean strict) {
        return evaluate(pre, post, strict, List.of());
    }

    private InvarianceCheckResult evaluate(StructuralGraph pre, StructuralGraph post, boolean strict,
                                           List<InvarianceViolation> extra) {
        List<InvarianceViolation> violations = new ArrayList<>();
        Severity additionSeverity = strict ? Severity.WARNING : Severity.INFO;

        // ========================= NODES =========================
        Map<String, StructuralElement> preNodes = indexById(pre.getNodes());
        Map<String, StructuralElement> postNodes = indexById(post.getNodes());
        Set<String> missingNodes = difference(preNodes.keySet(), postNodes.keySet());
        Set<String> addedNodes = difference(postNodes.keySet(), preNodes.keySet());

        for (String id : missingNodes) {
            violations.add(violation(ViolationType.NODE_MISSING, id,
                    "Node '" + id + "' (" + describeLabel(preNodes.get(id)) + ") is missing after transform",
                    Severity.ERROR));
        }
        for (String id : addedNodes) {
            violations.add(violation(ViolationType.NODE_ADDED, id,
                    "Node '" + id + "' was added by transform", additionSeverity));
        }
        for (String id : new TreeSet<>(preNodes.keySet())) {
            StructuralElement after = postNodes.get(id);
            if (after == null) {
                continue;
            }
            String beforeLabel = normalize(preNodes.get(id).getLabel());
            String afterLabel = normalize(after.getLabel());
            if (!beforeLabel.equals(afterLabel)) {
                violations.add(violation(ViolationType.LABEL_CHANGED, id,
                        "Label of '" + id + "' changed from '" + beforeLabel + "' to '" + afterLabel + "'",
                        Severity.ERROR));
            }
        }

        // ========================= EDGES =========================
        Map<String, StructuralElement> preEdges = indexById(pre.getEdges());
        Map<String, StructuralElement> postEdges = indexById(post.getEdges());
        Set<String> missingEdges = difference(preEdges.keySet(), postEdges.keySet());
        Set<String> addedEdges = difference(postEdges.keySet(), preEdges.keySet());

        for (String id : missingEdges) {
            violations.add(violation(ViolationType.EDGE_MISSING, id,
                    "Edge '" + id + "' is missing after transform", Severity.ERROR));
        }
        for (String id : addedEdges) {
            violations.add(violation(ViolationType.EDGE_ADDED, id,
                    "Edge '" + id + "' was added by transform", additionSeverity));
        }

        // Connections are also compared by (source, target) so a reconnected edge is caught
        Map<String, Set<String>> preKeys = connectionKeys(pre.getEdges());
        Map<String, Set<String>> postKeys = connectionKeys(post.getEdges());
        for (Map.Entry<String, Set<String>> entry : preKeys.entrySet()) {
            if (!postKeys.containsKey(entry.getKey()) && !missingEdges.containsAll(entry.getValue())) {
                violations.add(violation(ViolationType.EDGE_MISSING, entry.getKey(),
                        "Connection " + entry.getKey() + " no longer exists", Severity.ERROR));
            }
        }
        for (Map.Entry<String, Set<String>> entry : postKeys.entrySet()) {
            if (!preKeys.containsKey(entry.getKey()) && !addedEdges.containsAll(entry.getValue())) {
                violations.add(violation(ViolationType.EDGE_ADDED, entry.getKey(),
                        "Connection " + entry.getKey() + " appeared after transform", additionSeverity));
            }
        }

        // ========================= GROUPS =========================
        Set<String> preGroups = pre.getGroupIds();
        Set<String> postGroups = post.getGroupIds();
        for (String id : difference(preGroups, postGroups)) {
            violations.add(violation(ViolationType.GROUP_MISSING, id,
                    "Group '" + id + "' is missing after transform", Severity.ERROR));
        }
        for (String id : difference(postGroups, preGroups)) {
            violations.add(violation(ViolationType.GROUP_ADDED, id,
                    "Group '" + id + "' was added by transform", additionSeverity));
        }

        // ========================= IDS & METADATA =========================
        for (String id : difference(new HashSet<>(post.getDuplicateIds()), new HashSet<>(pre.getDuplicateIds()))) {
            violations.add(violation(ViolationType.ID_COLLISION, id,
                    "Id '" + id + "' is used by more than one element after transform", Severity.ERROR));
        }
        if (pre.getIrMetadata() != null && !Objects.equals(pre.getIrMetadata(), post.getIrMetadata())) {
            violations.add(violation(ViolationType.STRUCTURE_CHANGED, SvgStructuralAnalyzer.METADATA_ID,
                    post.getIrMetadata() == null
                            ? "IR metadata block was dropped by transform"
                            : "IR metadata block was altered by transform",
                    Severity.ERROR));
        }

        violations.addAll(extra);

        // ========================= SIMILARITY =========================
        int total = Math.max(preNodes.size() + preEdges.size(), 1);
        int nodeDelta = missingNodes.size() + addedNodes.size();
        int edgeDelta = missingEdges.size() + addedEdges.size();
        double similarity = 1.0 - (double) (nodeDelta + edgeDelta) / (2.0 * total);
        if (similarity < SIMILARITY_ERROR_THRESHOLD) {
            violations.add(violation(ViolationType.STRUCTURE_CHANGED, "root",
                    String.format("Structural similarity %.2f is below %.2f", similarity, SIMILARITY_ERROR_THRESHOLD),
                    Severity.ERROR));
        } else if (similarity < SIMILARITY_WARNING_THRESHOLD) {
            violations.add(violation(ViolationType.STRUCTURE_CHANGED, "root",
                    String.format("Structural similarity %.2f is below %.2f", similarity, SIMILARITY_WARNING_THRESHOLD),
                    Severity.WARNING));
        }

        boolean valid = violations.stream().noneMatch(v -> v.getSeverity() == Severity.ERROR);
        InvarianceCheckResult result = InvarianceCheckResult.builder()
                .valid(valid)
                .violations(violations)
                .similarity(similarity)
                .preStats(pre.stats())
                .postStats(post.stats())
                .build();
        result.setSummary(summarize(result));

        if (!valid) {
            log.warn("Invariance check failed for {} -> {}: {}", pre.getSvgId(), post.getSvgId(), result.getSummary());
        } else {
            log.debug("Invariance check passed for {} -> {}", pre.getSvgId(), post.getSvgId());
        }
        return result;
    }

    /**
     * Human-readable multi-line report of a check result.
     */
    public String renderReport(InvarianceCheckResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append(result.getSummary()).append('\n');
        sb.append(String.format("Similarity: %.3f%n", result.getSimilarity()));
        sb.append("Before: ").append(new TreeMap<>(result.getPreStats()))
                .append("  After: ").append(new TreeMap<>(result.getPostStats())).append('\n');
        for (Severity severity : Severity.values()) {
            List<InvarianceViolation> group = result.bySeverity(severity);
            if (group.isEmpty()) {
                continue;
            }
            sb.append(severity.name()).append(" (").append(group.size()).append("):\n");
            for (InvarianceViolation v : group) {
                sb.append("  - [").append(v.getViolationType().wireName()).append("] ")
                        .append(v.getDescription()).append('\n');
            }
        }
        return sb.toString();
    }

    private String summarize(InvarianceCheckResult result) {
        if (result.getViolations().isEmpty()) {
            return "Semantic invariance preserved: no violations detected";
        }
        return String.format("Semantic invariance %s: %d errors, %d warnings, %d info",
                result.isValid() ? "preserved" : "violated",
                result.bySeverity(Severity.ERROR).size(),
                result.bySeverity(Severity.WARNING).size(),
                result.bySeverity(Severity.INFO).size());
    }

    private List<InvarianceViolation> attributeDrift(SvgDocument pre, SvgDocument post) {
        Map<String, SvgElement> postById = new LinkedHashMap<>();
        post.getElements().forEach(e -> {
            if (e.getId() != null) {
                postById.putIfAbsent(e.getId(), e);
            }
        });
        List<InvarianceViolation> drift = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (SvgElement before : pre.getElements()) {
            String id = before.getId();
            if (id == null || !seen.add(id) || !postById.containsKey(id)) {
                continue;
            }
            SvgElement after = postById.get(id);
            Set<String> names = new TreeSet<>(before.getAttributes().keySet());
            names.addAll(after.getAttributes().keySet());
            for (String name : names) {
                String local = name.toLowerCase(Locale.ROOT);
                if (ALLOWED_MODIFICATIONS.contains(local) || local.startsWith("data-anim")) {
                    continue;
                }
                if (!Objects.equals(before.getAttributes().get(name), after.getAttributes().get(name))) {
                    drift.add(violation(ViolationType.STRUCTURE_CHANGED, id,
                            "Attribute '" + name + "' of '" + id + "' changed outside the cosmetic allow-list",
                            Severity.WARNING));
                }
            }
        }
        return drift;
    }

    private static Map<String, Set<String>> connectionKeys(List<SvgEdge> edges) {
        Map<String, Set<String>> keys = new TreeMap<>();
        for (SvgEdge edge : edges) {
            if (edge.isFullyResolved()) {
                keys.computeIfAbsent(edge.getSourceId() + "->" + edge.getTargetId(), k -> new TreeSet<>())
                        .add(edge.getId());
            }
        }
        return keys;
    }

    private static <T extends StructuralElement> Map<String, StructuralElement> indexById(List<T> elements) {
        Map<String, StructuralElement> map = new LinkedHashMap<>();
        elements.forEach(e -> map.putIfAbsent(e.getId(), e));
        return map;
    }

    private static Set<String> difference(Set<String> left, Set<String> right) {
        Set<String> result = new TreeSet<>(left);
        result.removeAll(right);
        return result;
    }

    private static String describeLabel(StructuralElement element) {
        String label = normalize(element.getLabel());
        return label.isEmpty() ? "unlabelled" : "label '" + label + "'";
    }

    private static String normalize(String label) {
        return label == null ? "" : label.trim();
    }

    private static InvarianceViolation violation(ViolationType type, String elementId, String description,
                                                 Severity severity) {
        return InvarianceViolation.builder()
                .violationType(type)
                .elementId(elementId)
                .description(description)
                .severity(severity)
                .build();
    }
}
