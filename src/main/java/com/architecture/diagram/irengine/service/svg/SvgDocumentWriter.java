package com.architecture.diagram.irengine.service.svg;

import java.util.Map;

/**
 * Serializes an {@link SvgDocument} arena back to SVG markup.
 */
public final class SvgDocumentWriter {

    private SvgDocumentWriter() {
    }

    public static String write(SvgDocument document) {
        StringBuilder sb = new StringBuilder();
        writeElement(document, document.getRoot(), sb);
        return sb.toString();
    }

    private static void writeElement(SvgDocument document, SvgElement element, StringBuilder sb) {
        sb.append('<').append(element.getQualifiedName());
        for (Map.Entry<String, String> attr : element.getAttributes().entrySet()) {
            sb.append(' ').append(attr.getKey()).append("=\"").append(escape(attr.getValue(), true)).append('"');
        }
        if (element.getChildIndexes().isEmpty() && element.getText().isEmpty()) {
            sb.append("/>");
            return;
        }
        sb.append('>');
        sb.append(escape(element.getText(), false));
        for (SvgElement child : document.children(element)) {
            writeElement(document, child, sb);
            sb.append(escape(child.getTail(), false));
        }
        sb.append("</").append(element.getQualifiedName()).append('>');
    }

    static String escape(String value, boolean attribute) {
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '&':
                    sb.append("&amp;");
                    break;
                case '<':
                    sb.append("&lt;");
                    break;
                case '>':
                    sb.append("&gt;");
                    break;
                case '"':
                    sb.append(attribute ? "&quot;" : "\"");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }
}
