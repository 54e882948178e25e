package com.architecture.diagram.irengine.service.transform;

import com.architecture.diagram.irengine.dto.svg.StructuralGraph;
import com.architecture.diagram.irengine.service.svg.SvgDocument;
import com.architecture.diagram.irengine.service.svg.SvgElement;

import java.util.Map;
import java.util.Optional;

/**
 * Base for transforms that express themselves as a single {@code <style>} element placed first
 * under the root. Re-applying replaces the previous sheet.
 */
public abstract class StyleSheetTransform implements CosmeticTransform {

    protected abstract String styleId();

    protected abstract String buildCss(StructuralGraph graph);

    @Override
    public SvgDocument apply(SvgDocument document, StructuralGraph graph) {
        String css = buildCss(graph);
        SvgDocument.Builder builder = document.toBuilder();
        Optional<SvgElement> existing = document.findById(styleId()).filter(e -> e.is("style"));
        if (existing.isPresent()) {
            builder.setText(existing.get().getIndex(), css);
        } else {
            builder.insertChild(0, 0, "style", Map.of("id", styleId()), css);
        }
        return builder.build();
    }
}
