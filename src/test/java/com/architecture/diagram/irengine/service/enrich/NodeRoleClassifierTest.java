package com.architecture.diagram.irengine.service.enrich;

import com.architecture.diagram.irengine.dto.plan.NodeRole;
import com.architecture.diagram.irengine.dto.plan.Zone;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NodeRoleClassifierTest {

    private final NodeRoleClassifier classifier = new NodeRoleClassifier();

    @Test
    void takesRoleFromZone_whenZoned() {
        assertThat(classifier.classify("Redis Cache", Zone.CORE_SERVICES)).isEqualTo(NodeRole.SERVICE);
        assertThat(classifier.classify("Anything", Zone.EDGE)).isEqualTo(NodeRole.GATEWAY);
    }

    @Test
    void infersRoleFromLabelKeywords_whenUnzoned() {
        assertThat(classifier.classify("Mobile App", null)).isEqualTo(NodeRole.ACTOR);
        assertThat(classifier.classify("Ingress Controller", null)).isEqualTo(NodeRole.GATEWAY);
        assertThat(classifier.classify("Redis Cache", null)).isEqualTo(NodeRole.DATA_STORE);
        assertThat(classifier.classify("Email Relay", null)).isEqualTo(NodeRole.EXTERNAL);
        assertThat(classifier.classify("Billing", null)).isEqualTo(NodeRole.SERVICE);
    }

    @Test
    void checksActorKeywordsBeforeDataStoreKeywords() {
        // "user" wins over "store"
        assertThat(classifier.classifyLabel("User Store")).isEqualTo(NodeRole.ACTOR);
    }
}
