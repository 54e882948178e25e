package com.architecture.diagram.irengine.service.patch;

import com.architecture.diagram.irengine.dto.patch.FeedbackRequest;
import com.architecture.diagram.irengine.exception.PatchValidationException;
import com.architecture.diagram.irengine.exception.UnsupportedActionException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeedbackParserTest {

    private final FeedbackParser parser = new FeedbackParser();

    private static FeedbackRequest request(String action, String blockId, Map<String, Object> payload) {
        return FeedbackRequest.builder()
                .diagramId("d")
                .action(action)
                .blockId(blockId)
                .payload(payload)
                .build();
    }

    @Test
    void rejectsUnknownAction() {
        assertThatThrownBy(() -> parser.parse(request("explode", "a", Map.of())))
                .isInstanceOf(UnsupportedActionException.class)
                .satisfies(e -> assertThat(((UnsupportedActionException) e).getAction()).isEqualTo("explode"));
    }

    @Test
    void requiresBlockId_forBlockLevelActions() {
        assertThatThrownBy(() -> parser.parse(request("edit_text", " ", Map.of("text", "x"))))
                .isInstanceOf(PatchValidationException.class)
                .hasMessage("block_id required for edit_text");
    }

    @Test
    void parsesEditText_caseInsensitively() {
        BlockPatch patch = parser.parse(request("EDIT_TEXT", "a", Map.of("text", "Hello")));

        assertThat(patch).isEqualTo(new EditTextPatch("a", "Hello"));
    }

    @Test
    void coercesNumericStrings_inReposition() {
        Map<String, Object> bbox = new LinkedHashMap<>();
        bbox.put("x", "10");
        bbox.put("y", 20);
        BlockPatch patch = parser.parse(request("reposition", "a", Map.of("bbox", bbox)));

        assertThat(patch).isEqualTo(new RepositionPatch("a", 10.0, 20.0, null, null));
    }

    @Test
    void rejectsNonNumericCoordinate_keepingCause() {
        Map<String, Object> payload = Map.of("bbox", Map.of("x", "ten"));

        assertThatThrownBy(() -> parser.parse(request("reposition", "a", payload)))
                .isInstanceOf(PatchValidationException.class)
                .hasMessageContaining("bbox.x")
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    void rejectsStyleThatIsNotAnObject() {
        assertThatThrownBy(() -> parser.parse(request("style", "a", Map.of("style", "red"))))
                .isInstanceOf(PatchValidationException.class)
                .hasMessage("style must be an object");
    }

    @Test
    void parsesAddBlock_withoutBlockId() {
        BlockPatch patch = parser.parse(request("add_block", null,
                Map.of("text", "Cache", "bbox", Map.of("x", 5, "y", 6))));

        assertThat(patch).isInstanceOf(AddBlockPatch.class);
        AddBlockPatch add = (AddBlockPatch) patch;
        assertThat(add.getId()).isNull();
        assertThat(add.getText()).isEqualTo("Cache");
        assertThat(add.getBbox().getX()).isEqualTo(5.0);
        assertThat(add.getBbox().getW()).isEqualTo(120.0);
    }

    @Test
    void mapsHideAndShowToVisibilityPatches() {
        assertThat(parser.parse(request("hide", "a", null))).isEqualTo(new VisibilityPatch("a", true));
        assertThat(parser.parse(request("show", "a", null))).isEqualTo(new VisibilityPatch("a", false));
    }
}
