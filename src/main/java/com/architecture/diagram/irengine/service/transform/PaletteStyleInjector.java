package com.architecture.diagram.irengine.service.transform;

import com.architecture.diagram.irengine.dto.svg.ElementRole;
import com.architecture.diagram.irengine.dto.svg.StructuralGraph;
import com.architecture.diagram.irengine.dto.svg.SvgNode;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fills nodes from a palette, one colour per zone (zones sorted by name, unzoned nodes take
 * the first colour).
 */
public class PaletteStyleInjector extends StyleSheetTransform {

    static final String STYLE_ID = "ir-palette";

    private final List<String> palette;

    public PaletteStyleInjector(List<String> palette) {
        if (palette == null || palette.isEmpty()) {
            throw new IllegalArgumentException("Palette must contain at least one colour");
        }
        this.palette = List.copyOf(palette);
    }

    @Override
    protected String styleId() {
        return STYLE_ID;
    }

    @Override
    protected String buildCss(StructuralGraph graph) {
        Map<String, Integer> zoneSlots = new TreeMap<>();
        for (SvgNode node : graph.getNodes()) {
            if (node.getZone() != null) {
                zoneSlots.putIfAbsent(node.getZone(), 0);
            }
        }
        int next = 1;
        for (Map.Entry<String, Integer> entry : zoneSlots.entrySet()) {
            entry.setValue(next++);
        }

        StringBuilder css = new StringBuilder();
        for (SvgNode node : graph.getNodes()) {
            if (node.getRole() != ElementRole.NODE) {
                continue;
            }
            int slot = node.getZone() != null ? zoneSlots.get(node.getZone()) : 0;
            String fill = palette.get(slot % palette.size());
            String stroke = palette.get((slot + 1) % palette.size());
            css.append(node.getAnimatableSelector())
                    .append(" { fill: ").append(fill)
                    .append("; stroke: ").append(stroke).append("; }\n");
        }
        return css.toString();
    }
}
