package com.architecture.diagram.irengine.service.svg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable arena holding a parsed SVG tree in document (pre-)order.
 * Element {@code i}'s subtree occupies the contiguous index range {@code [i, subtreeEnd(i))}.
 * Transforms obtain a {@link Builder}, edit it, and build a fresh arena.
 */
public final class SvgDocument {

    private final List<SvgElement> elements;
    private final int[] subtreeEnd;

    SvgDocument(List<SvgElement> elements) {
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("SVG document must have a root element");
        }
        this.elements = Collections.unmodifiableList(elements);
        this.subtreeEnd = new int[elements.size()];
        for (int i = elements.size() - 1; i >= 0; i--) {
            List<Integer> children = elements.get(i).getChildIndexes();
            subtreeEnd[i] = children.isEmpty() ? i + 1 : subtreeEnd[children.get(children.size() - 1)];
        }
    }

    public SvgElement getRoot() {
        return elements.get(0);
    }

    public SvgElement get(int index) {
        return elements.get(index);
    }

    public List<SvgElement> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public List<SvgElement> children(SvgElement element) {
        List<SvgElement> children = new ArrayList<>(element.getChildIndexes().size());
        for (int idx : element.getChildIndexes()) {
            children.add(elements.get(idx));
        }
        return children;
    }

    public Optional<SvgElement> parent(SvgElement element) {
        return element.isRoot() ? Optional.empty() : Optional.of(elements.get(element.getParentIndex()));
    }

    /**
     * Descendants of {@code element} in document order, excluding the element itself.
     */
    public List<SvgElement> descendants(SvgElement element) {
        return elements.subList(element.getIndex() + 1, subtreeEnd[element.getIndex()]);
    }

    public boolean isDescendantOf(SvgElement element, SvgElement ancestor) {
        int idx = element.getIndex();
        return idx > ancestor.getIndex() && idx < subtreeEnd[ancestor.getIndex()];
    }

    /**
     * Character data of the element and all of its descendants, in document order.
     */
    public String textContent(SvgElement element) {
        StringBuilder sb = new StringBuilder();
        appendText(element, sb);
        return sb.toString();
    }

    private void appendText(SvgElement element, StringBuilder sb) {
        sb.append(element.getText());
        for (int idx : element.getChildIndexes()) {
            SvgElement child = elements.get(idx);
            appendText(child, sb);
            sb.append(child.getTail());
        }
    }

    public Optional<SvgElement> findById(String id) {
        for (SvgElement e : elements) {
            if (id.equals(e.getId())) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Mutable working copy of an arena. Indices of elements copied from the source document
     * stay valid until {@link #build()}; inserted elements get indices past the original size.
     */
    public static final class Builder {

        private final List<Draft> drafts = new ArrayList<>();

        private Builder(SvgDocument source) {
            for (SvgElement e : source.elements) {
                Draft draft = new Draft(e.getQualifiedName(), new LinkedHashMap<>(e.getAttributes()),
                        e.getText(), new ArrayList<>(e.getChildIndexes()));
                draft.tail = e.getTail();
                drafts.add(draft);
            }
        }

        public Builder setAttribute(int index, String name, String value) {
            drafts.get(index).attributes.put(name, value);
            return this;
        }

        public Builder removeAttribute(int index, String name) {
            drafts.get(index).attributes.remove(name);
            return this;
        }

        public Builder setText(int index, String text) {
            drafts.get(index).text = text == null ? "" : text;
            return this;
        }

        /**
         * Inserts a new childless element under {@code parentIndex} at {@code position}
         * (clamped to the child count). The new element inherits the parent's namespace prefix.
         */
        public int insertChild(int parentIndex, int position, String localName,
                               Map<String, String> attributes, String text) {
            Draft parent = drafts.get(parentIndex);
            int colon = parent.qualifiedName.indexOf(':');
            String qualified = colon >= 0 ? parent.qualifiedName.substring(0, colon + 1) + localName : localName;
            drafts.add(new Draft(qualified, new LinkedHashMap<>(attributes), text == null ? "" : text,
                    new ArrayList<>()));
            int newIndex = drafts.size() - 1;
            int at = Math.max(0, Math.min(position, parent.children.size()));
            parent.children.add(at, newIndex);
            return newIndex;
        }

        public int appendChild(int parentIndex, String localName, Map<String, String> attributes, String text) {
            return insertChild(parentIndex, Integer.MAX_VALUE, localName, attributes, text);
        }

        /**
         * Detaches the element (and its subtree) from its parent. Text that followed the element
         * stays in the parent, joined to whatever preceded the element.
         */
        public Builder remove(int index) {
            if (index == 0) {
                throw new IllegalArgumentException("Cannot remove the root element");
            }
            String tail = drafts.get(index).tail;
            for (Draft d : drafts) {
                int pos = d.children.indexOf(index);
                if (pos < 0) {
                    continue;
                }
                d.children.remove(pos);
                if (!tail.isEmpty()) {
                    if (pos == 0) {
                        d.text = d.text + tail;
                    } else {
                        Draft previous = drafts.get(d.children.get(pos - 1));
                        previous.tail = previous.tail + tail;
                    }
                }
            }
            drafts.get(index).tail = "";
            return this;
        }

        public SvgDocument build() {
            List<SvgElement> out = new ArrayList<>();
            emit(0, -1, out);
            return new SvgDocument(out);
        }

        private int emit(int draftIndex, int parentIndex, List<SvgElement> out) {
            Draft d = drafts.get(draftIndex);
            int index = out.size();
            out.add(null);
            List<Integer> childIndexes = new ArrayList<>();
            for (int child : d.children) {
                childIndexes.add(emit(child, index, out));
            }
            out.set(index, new SvgElement(index, parentIndex, d.qualifiedName,
                    SvgElement.stripPrefix(d.qualifiedName),
                    Collections.unmodifiableMap(new LinkedHashMap<>(d.attributes)),
                    d.text, d.tail, List.copyOf(childIndexes)));
            return index;
        }
    }

    private static final class Draft {
        final String qualifiedName;
        final Map<String, String> attributes;
        String text;
        String tail = "";
        final List<Integer> children;

        Draft(String qualifiedName, Map<String, String> attributes, String text, List<Integer> children) {
            this.qualifiedName = qualifiedName;
            this.attributes = attributes;
            this.text = text;
            this.children = children;
        }
    }
}
