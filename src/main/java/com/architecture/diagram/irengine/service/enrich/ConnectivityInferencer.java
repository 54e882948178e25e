package com.architecture.diagram.irengine.service.enrich;

import com.architecture.diagram.irengine.dto.enrich.EnrichedEdge;
import com.architecture.diagram.irengine.dto.enrich.EnrichedNode;
import com.architecture.diagram.irengine.dto.enrich.InferenceRule;
import com.architecture.diagram.irengine.dto.enrich.RelationType;
import com.architecture.diagram.irengine.dto.plan.Zone;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Adds inferred edges so an enriched diagram is never a set of disconnected nodes.
 *
 * <p>Rules run in a fixed order over label-sorted nodes:
 * <ol>
 *   <li>zone cascade: one bridging edge per adjacent zone pair with no edge between them</li>
 *   <li>tech dependency: keyword pairs such as kafka/consumer</li>
 *   <li>completion guard: attach every isolated node, then join any remaining components</li>
 * </ol>
 * An existing edge for the exact (from, to) pair always suppresses an inferred one.
 */
@Component
@Slf4j
public class ConnectivityInferencer {

    private static final List<Zone[]> CASCADE_PAIRS = List.of(
            new Zone[]{Zone.CLIENTS, Zone.EDGE},
            new Zone[]{Zone.EDGE, Zone.CORE_SERVICES},
            new Zone[]{Zone.CORE_SERVICES, Zone.DATA_STORES},
            new Zone[]{Zone.EXTERNAL_SERVICES, Zone.CORE_SERVICES}
    );

    private static final List<TechDependency> TECH_DEPENDENCIES = List.of(
            new TechDependency("kafka", "consumer", RelationType.ASYNC, "kafka feeds consumer"),
            new TechDependency("kafka", "processor", RelationType.ASYNC, "kafka feeds processor"),
            new TechDependency("kafka", "worker", RelationType.ASYNC, "kafka feeds worker"),
            new TechDependency("streaming", "consumer", RelationType.ASYNC, "streaming feeds consumer"),
            new TechDependency("streaming", "processor", RelationType.ASYNC, "streaming feeds processor"),
            new TechDependency("producer", "kafka", RelationType.ASYNC, "producer publishes to kafka"),
            new TechDependency("producer", "streaming", RelationType.ASYNC, "producer publishes to streaming"),
            new TechDependency("prometheus", "grafana", RelationType.DATA, "prometheus scrapes to grafana"),
            new TechDependency("metrics", "grafana", RelationType.DATA, "metrics flow to grafana"),
            new TechDependency("airflow", "spark", RelationType.ASYNC, "airflow orchestrates spark"),
            new TechDependency("scheduler", "spark", RelationType.ASYNC, "scheduler triggers spark"),
            new TechDependency("scheduler", "worker", RelationType.ASYNC, "scheduler dispatches to worker"),
            new TechDependency("ingress", "service", RelationType.SYNC, "ingress routes to service"),
            new TechDependency("gateway", "service", RelationType.SYNC, "gateway routes to service"),
            new TechDependency("service", "postgres", RelationType.DATA, "service reads/writes postgres"),
            new TechDependency("service", "mysql", RelationType.DATA, "service reads/writes mysql"),
            new TechDependency("service", "mongo", RelationType.DATA, "service reads/writes mongo"),
            new TechDependency("service", "redis", RelationType.DATA, "service uses redis cache"),
            new TechDependency("primary", "replica", RelationType.DATA, "primary replicates to replica"),
            new TechDependency("primary", "secondary", RelationType.DATA, "primary replicates to secondary"),
            new TechDependency("dc", "dr", RelationType.DATA, "dc replicates to dr site")
    );

    /**
     * Run all rules against the context, appending inferred edges and their records.
     *
     * @return number of edges added
     */
    int infer(EnrichmentContext context) {
        if (context.getNodes().isEmpty()) {
            return 0;
        }
        int before = context.getEdges().size();
        Graph graph = new Graph(context);

        List<EnrichedNode> sorted = context.getNodes().stream()
                .sorted(Comparator.comparing(n -> n.getLabel().toLowerCase(Locale.ROOT)))
                .collect(Collectors.toList());
        Map<Zone, List<EnrichedNode>> byZone = new EnumMap<>(Zone.class);
        for (EnrichedNode node : sorted) {
            if (node.getZone() != null) {
                byZone.computeIfAbsent(node.getZone(), z -> new ArrayList<>()).add(node);
            }
        }

        applyZoneCascade(context, graph, byZone);
        applyTechDependencies(context, graph, sorted);
        applyCompletionGuard(context, graph, sorted, byZone);

        int added = context.getEdges().size() - before;
        log.debug("Connectivity inference added {} edges over {} nodes", added, sorted.size());
        return added;
    }

    // ========================= ZONE CASCADE =========================

    private void applyZoneCascade(EnrichmentContext context, Graph graph, Map<Zone, List<EnrichedNode>> byZone) {
        for (Zone[] pair : CASCADE_PAIRS) {
            List<EnrichedNode> fromNodes = byZone.getOrDefault(pair[0], List.of());
            List<EnrichedNode> toNodes = byZone.getOrDefault(pair[1], List.of());
            if (fromNodes.isEmpty() || toNodes.isEmpty()) {
                continue;
            }
            if (bridged(context, ids(fromNodes), ids(toNodes))) {
                continue;
            }
            String reason = String.format("zone layer cascade: %s -> %s", pair[0].getValue(), pair[1].getValue());
            graph.connect(fromNodes.get(0), toNodes.get(0), RelationType.ASYNC, InferenceRule.ZONE_CASCADE, reason);
        }
    }

    private boolean bridged(EnrichmentContext context, Set<String> zoneA, Set<String> zoneB) {
        for (EnrichedEdge edge : context.getEdges()) {
            boolean forward = zoneA.contains(edge.getFromId()) && zoneB.contains(edge.getToId());
            boolean backward = zoneB.contains(edge.getFromId()) && zoneA.contains(edge.getToId());
            if (forward || backward) {
                return true;
            }
        }
        return false;
    }

    // ========================= TECH DEPENDENCY =========================

    private void applyTechDependencies(EnrichmentContext context, Graph graph, List<EnrichedNode> sorted) {
        for (int i = 0; i < sorted.size(); i++) {
            EnrichedNode a = sorted.get(i);
            String la = a.getLabel().toLowerCase(Locale.ROOT);
            for (int j = i + 1; j < sorted.size(); j++) {
                EnrichedNode b = sorted.get(j);
                String lb = b.getLabel().toLowerCase(Locale.ROOT);
                for (TechDependency dependency : TECH_DEPENDENCIES) {
                    if (la.contains(dependency.fromKeyword) && lb.contains(dependency.toKeyword)) {
                        graph.connect(a, b, dependency.type, InferenceRule.TECH_DEPENDENCY, dependency.reason);
                        break;
                    }
                    if (lb.contains(dependency.fromKeyword) && la.contains(dependency.toKeyword)) {
                        graph.connect(b, a, dependency.type, InferenceRule.TECH_DEPENDENCY,
                                dependency.reason + " (reversed)");
                        break;
                    }
                }
            }
        }
    }

    // ========================= COMPLETION GUARD =========================

    private void applyCompletionGuard(EnrichmentContext context, Graph graph, List<EnrichedNode> sorted,
                                      Map<Zone, List<EnrichedNode>> byZone) {
        for (EnrichedNode node : sorted) {
            if (graph.degree(node) > 0) {
                continue;
            }
            EnrichedNode anchor = firstConnected(byZone.getOrDefault(node.getZone(), List.of()), node, graph);
            if (anchor == null) {
                anchor = firstConnected(sorted, node, graph);
            }
            if (anchor == null) {
                anchor = sorted.stream().filter(c -> c != node).findFirst().orElse(null);
            }
            if (anchor == null) {
                continue;
            }
            String reason = String.format("completion guard: '%s' had no edges", node.getLabel());
            graph.connect(anchor, node, RelationType.ASYNC, InferenceRule.COMPLETION_GUARD, reason);
        }

        // Isolated pairs can still leave several components; join each to the first one
        EnrichedNode root = sorted.get(0);
        for (EnrichedNode node : sorted) {
            if (graph.sameComponent(root, node)) {
                continue;
            }
            EnrichedNode anchor = sorted.stream()
                    .filter(c -> graph.sameComponent(root, c))
                    .filter(c -> Objects.equals(c.getZone(), node.getZone()))
                    .findFirst()
                    .orElse(root);
            String reason = String.format("completion guard: '%s' was disconnected from the main graph", node.getLabel());
            graph.connect(anchor, node, RelationType.ASYNC, InferenceRule.COMPLETION_GUARD, reason);
        }
    }

    private EnrichedNode firstConnected(List<EnrichedNode> candidates, EnrichedNode self, Graph graph) {
        for (EnrichedNode candidate : candidates) {
            if (candidate != self && graph.degree(candidate) > 0) {
                return candidate;
            }
        }
        return null;
    }

    private Set<String> ids(List<EnrichedNode> nodes) {
        Set<String> ids = new HashSet<>();
        nodes.forEach(n -> ids.add(n.getNodeId()));
        return ids;
    }

    // ========================= GRAPH BOOKKEEPING =========================

    /**
     * Degree counts, existing (from, to) pairs and a union-find over the current edges.
     */
    private static final class Graph {
        private final EnrichmentContext context;
        private final Map<String, Integer> degree = new HashMap<>();
        private final Set<String> pairs = new HashSet<>();
        private final Map<String, String> parent = new HashMap<>();

        Graph(EnrichmentContext context) {
            this.context = context;
            context.getNodes().forEach(n -> parent.put(n.getNodeId(), n.getNodeId()));
            context.getEdges().forEach(this::record);
        }

        int degree(EnrichedNode node) {
            return degree.getOrDefault(node.getNodeId(), 0);
        }

        boolean sameComponent(EnrichedNode a, EnrichedNode b) {
            return find(a.getNodeId()).equals(find(b.getNodeId()));
        }

        /**
         * Adds the inferred edge unless the exact pair already exists.
         */
        void connect(EnrichedNode from, EnrichedNode to, RelationType type, InferenceRule rule, String reason) {
            if (pairs.contains(pairKey(from.getNodeId(), to.getNodeId()))) {
                return;
            }
            record(context.addInferredEdge(from, to, type, rule, reason));
        }

        private void record(EnrichedEdge edge) {
            pairs.add(pairKey(edge.getFromId(), edge.getToId()));
            degree.merge(edge.getFromId(), 1, Integer::sum);
            degree.merge(edge.getToId(), 1, Integer::sum);
            String a = find(edge.getFromId());
            String b = find(edge.getToId());
            if (!a.equals(b)) {
                parent.put(b, a);
            }
        }

        private String find(String id) {
            String current = id;
            while (!parent.getOrDefault(current, current).equals(current)) {
                current = parent.get(current);
            }
            return current;
        }

        private static String pairKey(String from, String to) {
            return from + "->" + to;
        }
    }

    private static final class TechDependency {
        private final String fromKeyword;
        private final String toKeyword;
        private final RelationType type;
        private final String reason;

        private TechDependency(String fromKeyword, String toKeyword, RelationType type, String reason) {
            this.fromKeyword = fromKeyword;
            this.toKeyword = toKeyword;
            this.type = type;
            this.reason = reason;
        }
    }
}
