package com.architecture.diagram.irengine.service.svg;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CssSelectorsTest {

    @Test
    void leavesPlainIdentifiers_untouched() {
        assertThat(CssSelectors.byId("api_rect")).isEqualTo("#api_rect");
        assertThat(CssSelectors.descendant("db-1", "rect")).isEqualTo("#db-1 rect");
    }

    @Test
    void escapesLeadingDigit_asHexCodePoint() {
        assertThat(CssSelectors.escapeIdentifier("1st")).isEqualTo("\\31 st");
        assertThat(CssSelectors.escapeIdentifier("-2x")).isEqualTo("-\\32 x");
    }

    @Test
    void escapesSelectorPunctuation_withBackslash() {
        assertThat(CssSelectors.byId("1st.node")).isEqualTo("#\\31 st\\.node");
        assertThat(CssSelectors.byId("a:b")).isEqualTo("#a\\:b");
        assertThat(CssSelectors.byId("x y#z")).isEqualTo("#x\\ y\\#z");
        assertThat(CssSelectors.escapeIdentifier("-")).isEqualTo("\\-");
    }
}
