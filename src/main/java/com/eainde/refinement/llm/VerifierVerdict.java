package com.eainde.refinement.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON answer of the verification prompt.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VerifierVerdict(
        @JsonProperty("score")            Double score,
        @JsonProperty("issues_resolved")  Integer issuesResolved,
        @JsonProperty("issues_remaining") Integer issuesRemaining,
        @JsonProperty("summary")          String summary
) {}
