package com.eainde.refinement.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Excerpts of the neighbouring sections, passed to a repair so the new text
 * still reads continuously. Either side may be null.
 */
public record ContextAnchors(
        @JsonProperty("precedingExcerpt") String precedingExcerpt,
        @JsonProperty("followingExcerpt") String followingExcerpt
) {

    public static ContextAnchors none() {
        return new ContextAnchors(null, null);
    }

    public boolean isEmpty() {
        return isBlank(precedingExcerpt) && isBlank(followingExcerpt);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
