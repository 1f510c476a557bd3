package com.eainde.refinement.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single section of a generated document.
 *
 * <p>The identifier is stable for the whole refinement run; {@link #content()}
 * is the only field a repair ever replaces.</p>
 *
 * @param id      stable section identifier (e.g. "sec_2")
 * @param title   section heading
 * @param content section body text
 * @param ordinal zero-based position within the document
 */
public record Section(
        @JsonProperty("id")      String id,
        @JsonProperty("title")   String title,
        @JsonProperty("content") String content,
        @JsonProperty("ordinal") int ordinal
) {

    public Section {
        Objects.requireNonNull(id, "id");
        title = title != null ? title : "";
        content = content != null ? content : "";
    }

    /**
     * @return a copy of this section with the body replaced
     */
    public Section withContent(String newContent) {
        return new Section(id, title, newContent, ordinal);
    }
}
