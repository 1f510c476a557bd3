package com.eainde.refinement.dispatch;

import com.eainde.refinement.model.ContextAnchors;

/**
 * Input of the localized-edit strategy.
 *
 * @param sectionId       target section
 * @param sectionTitle    heading of the section
 * @param sectionContent  current body text
 * @param fixInstructions combined instructions of every issue raised against the section
 * @param contextAnchors  neighbouring excerpts for coherence
 */
public record EditRequest(
        String sectionId,
        String sectionTitle,
        String sectionContent,
        String fixInstructions,
        ContextAnchors contextAnchors
) {

    public EditRequest {
        contextAnchors = contextAnchors != null ? contextAnchors : ContextAnchors.none();
    }
}
