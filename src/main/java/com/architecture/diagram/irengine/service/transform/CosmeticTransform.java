package com.architecture.diagram.irengine.service.transform;

import com.architecture.diagram.irengine.dto.svg.StructuralGraph;
import com.architecture.diagram.irengine.service.svg.SvgDocument;

/**
 * A visual-only rewrite of an SVG document. Implementations build a new arena and must not
 * add, remove, relabel or reconnect any diagram element.
 */
@FunctionalInterface
public interface CosmeticTransform {

    /**
     * @param document the current document
     * @param graph    structural graph of the untransformed input, for selector lookup
     */
    SvgDocument apply(SvgDocument document, StructuralGraph graph);

    default String name() {
        return getClass().getSimpleName();
    }
}
