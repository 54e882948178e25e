package com.architecture.diagram.irengine.service.transform;

import com.architecture.diagram.irengine.dto.svg.ElementRole;
import com.architecture.diagram.irengine.dto.svg.StructuralGraph;
import com.architecture.diagram.irengine.dto.svg.SvgEdge;
import com.architecture.diagram.irengine.dto.svg.SvgNode;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Adds a pulse animation to every node and a flowing dash to every edge, using the analyzer's
 * animatable selectors. Node delays are staggered so the diagram does not pulse in unison.
 */
@Component
public class AnimationCssInjector extends StyleSheetTransform {

    static final String STYLE_ID = "ir-animation";
    private static final double STAGGER_SECONDS = 0.15;
    private static final int STAGGER_SLOTS = 10;

    @Override
    protected String styleId() {
        return STYLE_ID;
    }

    @Override
    protected String buildCss(StructuralGraph graph) {
        StringBuilder css = new StringBuilder();
        css.append("@keyframes animNodePulse { 0%, 100% { opacity: 1; } 50% { opacity: 0.72; } }\n");
        css.append("@keyframes animEdgeFlow { to { stroke-dashoffset: -24; } }\n");

        int slot = 0;
        for (SvgNode node : graph.getNodes()) {
            if (node.getRole() != ElementRole.NODE || node.getAnimatableSelector() == null) {
                continue;
            }
            double delay = (slot++ % STAGGER_SLOTS) * STAGGER_SECONDS;
            css.append(String.format(Locale.ROOT,
                    "%s { animation: animNodePulse 2.4s ease-in-out %.2fs infinite; "
                            + "transform-origin: center; transform-box: fill-box; }\n",
                    node.getAnimatableSelector(), delay));
        }
        for (SvgEdge edge : graph.getEdges()) {
            if (edge.getAnimatableSelector() == null) {
                continue;
            }
            css.append(edge.getAnimatableSelector())
                    .append(" { stroke-dasharray: 6 6; animation: animEdgeFlow 1.2s linear infinite; }\n");
        }
        return css.toString();
    }
}
