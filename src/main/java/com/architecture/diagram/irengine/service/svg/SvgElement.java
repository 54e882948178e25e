package com.architecture.diagram.irengine.service.svg;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One element slot in an {@link SvgDocument} arena. Parent and children are referenced
 * by arena index, never by object identity.
 */
@Value
public class SvgElement {

    int index;
    int parentIndex;            // -1 for the root
    String qualifiedName;       // as written, e.g. "svg:rect"
    String localName;           // namespace prefix stripped
    Map<String, String> attributes;
    String text;                // character data before the first child element
    String tail;                // character data after this element, up to the next sibling
    List<Integer> childIndexes;

    public SvgElement withTail(String tail) {
        return new SvgElement(index, parentIndex, qualifiedName, localName, attributes, text, tail, childIndexes);
    }

    public boolean is(String tag) {
        return localName.equalsIgnoreCase(tag);
    }

    public boolean isRoot() {
        return parentIndex < 0;
    }

    /**
     * Attribute lookup that ignores namespace prefixes and case.
     */
    public String attr(String name) {
        String exact = attributes.get(name);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, String> entry : attributes.entrySet()) {
            if (stripPrefix(entry.getKey()).equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public String getId() {
        String id = attr("id");
        return id == null || id.isBlank() ? null : id;
    }

    public boolean hasClassToken(String token) {
        String cls = attr("class");
        return cls != null && cls.toLowerCase().contains(token);
    }

    static String stripPrefix(String name) {
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }
}
