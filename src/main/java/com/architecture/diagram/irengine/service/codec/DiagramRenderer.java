package com.architecture.diagram.irengine.service.codec;

import com.architecture.diagram.irengine.dto.codec.DiagramFormat;

/**
 * Adapter for an external rendering engine (a PlantUML server, the Mermaid CLI, Structurizr)
 * that turns encoded diagram text into SVG.
 */
public interface DiagramRenderer {

    /**
     * The input format this renderer consumes.
     */
    DiagramFormat inputFormat();

    /**
     * Whether the engine can be reached right now; unavailable renderers are skipped.
     */
    boolean isAvailable();

    String renderSvg(String source);
}
