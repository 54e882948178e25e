package com.architecture.diagram.irengine.dto.patch;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Patch verbs accepted from user feedback.
 */
public enum FeedbackAction {
    EDIT_TEXT("edit_text"),
    REPOSITION("reposition"),
    STYLE("style"),
    ANNOTATE("annotate"),
    HIDE("hide"),
    SHOW("show"),
    ADD_BLOCK("add_block"),
    REMOVE_BLOCK("remove_block");

    private final String value;

    FeedbackAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean requiresBlockId() {
        return this != ADD_BLOCK;
    }

    public static FeedbackAction fromString(String value) {
        if (value == null) return null;
        for (FeedbackAction action : values()) {
            if (action.value.equalsIgnoreCase(value.trim())) {
                return action;
            }
        }
        return null;
    }
}
