package com.architecture.diagram.irengine.service.svg;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SvgDocumentTest {

    private static final String MIXED_LABEL = "<svg xmlns=\"http://www.w3.org/2000/svg\">"
            + "<g id=\"api\" data-kind=\"node\"><rect x=\"0\" y=\"0\" width=\"10\" height=\"10\"/>"
            + "<text>Order <tspan font-weight=\"bold\">API</tspan> v2</text></g></svg>";

    @Test
    void keepsTextAfterChildElements_inDocumentOrder() {
        SvgDocument document = SvgDocumentParser.parse(MIXED_LABEL);

        SvgElement text = document.getElements().stream().filter(e -> e.is("text")).findFirst().orElseThrow();
        SvgElement tspan = document.children(text).get(0);

        assertThat(text.getText()).isEqualTo("Order ");
        assertThat(tspan.getText()).isEqualTo("API");
        assertThat(tspan.getTail()).isEqualTo(" v2");
        assertThat(document.textContent(text)).isEqualTo("Order API v2");
    }

    @Test
    void writesMixedContentBack_unchanged() {
        String written = SvgDocumentWriter.write(SvgDocumentParser.parse(MIXED_LABEL));

        assertThat(written)
                .withFailMessage("mixed content reordered: %s", written)
                .contains("<text>Order <tspan font-weight=\"bold\">API</tspan> v2</text>");
    }

    @Test
    void dropsIndentation_butKeepsSpacesInsideText() {
        String svg = "<svg xmlns=\"http://www.w3.org/2000/svg\">\n  <g id=\"n\">\n    <rect/>\n  </g>\n"
                + "  <text>a <tspan>b</tspan> </text>\n</svg>";

        String written = SvgDocumentWriter.write(SvgDocumentParser.parse(svg));

        assertThat(written).isEqualTo("<svg xmlns=\"http://www.w3.org/2000/svg\"><g id=\"n\"><rect/></g>"
                + "<text>a <tspan>b</tspan> </text></svg>");
    }

    @Test
    void movesTailToPreviousSibling_whenElementRemoved() {
        SvgDocument document = SvgDocumentParser.parse(
                "<svg xmlns=\"http://www.w3.org/2000/svg\"><text>one <tspan>two</tspan> three "
                        + "<tspan id=\"drop\">four</tspan> five</text></svg>");
        int drop = document.findById("drop").orElseThrow().getIndex();

        SvgDocument trimmed = document.toBuilder().remove(drop).build();

        SvgElement text = trimmed.getElements().stream().filter(e -> e.is("text")).findFirst().orElseThrow();
        assertThat(trimmed.textContent(text)).isEqualTo("one two three  five");
        assertThat(SvgDocumentWriter.write(trimmed))
                .contains("<text>one <tspan>two</tspan> three  five</text>");
    }

    @Test
    void movesTailToParentText_whenFirstChildRemoved() {
        SvgDocument document = SvgDocumentParser.parse(
                "<svg xmlns=\"http://www.w3.org/2000/svg\"><text>a <tspan id=\"drop\">b</tspan> c</text></svg>");

        SvgDocument trimmed = document.toBuilder().remove(document.findById("drop").orElseThrow().getIndex()).build();

        assertThat(SvgDocumentWriter.write(trimmed)).contains("<text>a  c</text>");
    }
}
