package com.architecture.diagram.irengine.service.enrich;

import com.architecture.diagram.irengine.dto.plan.NodeRole;
import com.architecture.diagram.irengine.dto.plan.Zone;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Assigns a role from the zone when there is one, otherwise from label keywords.
 */
@Component
public class NodeRoleClassifier {

    // Checked in insertion order; first keyword hit wins
    private static final Map<NodeRole, List<String>> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put(NodeRole.ACTOR, List.of("user", "client", "portal", "browser", "mobile"));
        KEYWORDS.put(NodeRole.GATEWAY, List.of("gateway", "edge", "ingress"));
        KEYWORDS.put(NodeRole.DATA_STORE, List.of("db", "database", "store", "storage", "cache"));
        KEYWORDS.put(NodeRole.EXTERNAL, List.of("email", "sms", "auth", "payment", "third", "external"));
    }

    public NodeRole classify(String label, Zone zone) {
        if (zone != null) {
            return zone.getRole();
        }
        return classifyLabel(label);
    }

    public NodeRole classifyLabel(String label) {
        String lowered = label == null ? "" : label.toLowerCase(Locale.ROOT);
        for (Map.Entry<NodeRole, List<String>> entry : KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (lowered.contains(keyword)) {
                    return entry.getKey();
                }
            }
        }
        return NodeRole.SERVICE;
    }
}
