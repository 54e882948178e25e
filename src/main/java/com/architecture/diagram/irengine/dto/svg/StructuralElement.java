package com.architecture.diagram.irengine.dto.svg;

/**
 * Common view over nodes, edges and groups of a {@link StructuralGraph}.
 */
public interface StructuralElement {

    String getId();

    String getElementType();

    String getSelector();

    String getLabel();

    Bounds getBounds();
}
