package com.architecture.diagram.irengine.service.codec;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifierSanitizerTest {

    @Test
    void replacesDisallowedCharacters_andPrefixesLeadingDigits() {
        assertThat(IdentifierSanitizer.sanitize("order-service")).isEqualTo("order_service");
        assertThat(IdentifierSanitizer.sanitize("  api gateway ")).isEqualTo("api_gateway");
        assertThat(IdentifierSanitizer.sanitize("9lives")).isEqualTo("n_9lives");
        assertThat(IdentifierSanitizer.sanitize("_private")).isEqualTo("n__private");
        assertThat(IdentifierSanitizer.sanitize(null)).isEqualTo("node");
        assertThat(IdentifierSanitizer.sanitize("   ")).isEqualTo("node");
    }

    @Test
    void suffixesCollidingIds_insteadOfMergingThem() {
        IdentifierSanitizer ids = new IdentifierSanitizer();

        assertThat(ids.idFor("a-b")).isEqualTo("a_b");
        assertThat(ids.idFor("a.b")).isEqualTo("a_b_2");
        assertThat(ids.idFor("a b")).isEqualTo("a_b_3");

        // stable on repeat lookups
        assertThat(ids.idFor("a-b")).isEqualTo("a_b");
        assertThat(ids.lookup("a.b")).contains("a_b_2");
        assertThat(ids.lookup("never-seen")).isEmpty();
    }

    @Test
    void keepsNamespacesApart_whileSharingOneTokenPool() {
        IdentifierSanitizer ids = new IdentifierSanitizer();

        String node = ids.idFor("core");
        String group = ids.idFor("group", "core");

        assertThat(node).isEqualTo("core");
        assertThat(group).isEqualTo("core_2");
        assertThat(ids.idFor("group", "core")).isEqualTo("core_2");
    }
}
