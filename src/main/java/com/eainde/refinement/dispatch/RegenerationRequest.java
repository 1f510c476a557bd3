package com.eainde.refinement.dispatch;

import com.eainde.refinement.model.ContextAnchors;

import java.util.List;

/**
 * Input of the full-regeneration strategy.
 *
 * @param sectionSpec    the section to rewrite
 * @param lessonOutline  section titles of the whole document, in order
 * @param contextAnchors neighbouring excerpts for coherence
 */
public record RegenerationRequest(
        SectionSpec sectionSpec,
        List<String> lessonOutline,
        ContextAnchors contextAnchors
) {

    public RegenerationRequest {
        lessonOutline = List.copyOf(lessonOutline);
        contextAnchors = contextAnchors != null ? contextAnchors : ContextAnchors.none();
    }
}
