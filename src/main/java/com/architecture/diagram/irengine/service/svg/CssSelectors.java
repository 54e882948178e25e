package com.architecture.diagram.irengine.service.svg;

/**
 * Builds CSS selectors from SVG ids. Identifiers are serialized with the CSSOM
 * {@code CSS.escape} rules, so ids such as {@code 1st.node} or {@code a:b} stay selectable.
 */
public final class CssSelectors {

    private CssSelectors() {
    }

    public static String byId(String id) {
        return "#" + escapeIdentifier(id);
    }

    public static String descendant(String ancestorId, String tag) {
        return byId(ancestorId) + " " + tag;
    }

    public static String escapeIdentifier(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        int length = value.length();
        for (int i = 0; i < length; i++) {
            char ch = value.charAt(i);
            if (ch == 0) {
                sb.append('\uFFFD');
            } else if ((ch >= 0x01 && ch <= 0x1F) || ch == 0x7F
                    || (i == 0 && isDigit(ch))
                    || (i == 1 && isDigit(ch) && value.charAt(0) == '-')) {
                sb.append('\\').append(Integer.toHexString(ch)).append(' ');
            } else if (i == 0 && ch == '-' && length == 1) {
                sb.append("\\-");
            } else if (ch >= 0x80 || ch == '-' || ch == '_' || isDigit(ch)
                    || (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z')) {
                sb.append(ch);
            } else {
                sb.append('\\').append(ch);
            }
        }
        return sb.toString();
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }
}
