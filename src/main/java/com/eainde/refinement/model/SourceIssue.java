package com.eainde.refinement.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single defect raised by the upstream evaluator against one section.
 *
 * @param description     concise description of the problem
 * @param quotedText      optional excerpt the issue points at (may be null)
 * @param fixInstructions what the repair should do
 * @param severity        "critical", "major" or "minor"
 */
public record SourceIssue(
        @JsonProperty("description")     String description,
        @JsonProperty("quotedText")      String quotedText,
        @JsonProperty("fixInstructions") String fixInstructions,
        @JsonProperty("severity")        Severity severity
) {

    public SourceIssue {
        Objects.requireNonNull(description, "description");
        fixInstructions = fixInstructions != null ? fixInstructions : "";
        severity = severity != null ? severity : Severity.MAJOR;
    }

    public static SourceIssue of(String description, String fixInstructions, Severity severity) {
        return new SourceIssue(description, null, fixInstructions, severity);
    }

    public boolean hasQuote() {
        return quotedText != null && !quotedText.isBlank();
    }
}
