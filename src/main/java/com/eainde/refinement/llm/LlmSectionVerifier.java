package com.eainde.refinement.llm;

import com.eainde.refinement.dispatch.SectionVerifier;
import com.eainde.refinement.dispatch.VerificationResult;
import com.eainde.refinement.model.SourceIssue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.log4j.Log4j2;

import java.util.List;
import java.util.Map;

/**
 * Re-scores a repaired section with a chat model.
 *
 * <h3>Expected answer</h3>
 * <pre>
 * {"score": 0.87, "issues_resolved": 2, "issues_remaining": 0, "summary": "..."}
 * </pre>
 * A fenced code block around the JSON is tolerated. An unparseable answer or a
 * missing score yields a {@link VerificationResult} with a NaN score, which the
 * dispatcher treats as a failed repair while still counting the tokens.
 *
 * Prompt: {@value PromptNames#VERIFY_SECTION}
 */
@Log4j2
public class LlmSectionVerifier implements SectionVerifier {

    private final ChatModel chatModel;
    private final PromptService promptService;
    private final ObjectMapper objectMapper;

    public LlmSectionVerifier(ChatModel chatModel, PromptService promptService, ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.promptService = promptService;
        this.objectMapper = objectMapper;
    }

    @Override
    public VerificationResult verify(List<SourceIssue> originalIssues, String repairedContent) {
        ChatResponse response = LlmCalls.chat(chatModel, promptService, PromptNames.VERIFY_SECTION, Map.of(
                "issues", LlmCalls.formatIssues(originalIssues),
                "issueCount", originalIssues.size(),
                "content", LlmCalls.orEmpty(repairedContent)));
        long tokens = LlmCalls.totalTokens(response);
        String json = LlmCalls.text(response);

        VerifierVerdict verdict;
        try {
            verdict = objectMapper.readValue(json, VerifierVerdict.class);
        } catch (JsonProcessingException e) {
            log.warn("Verifier answer is not valid JSON: {}", e.getOriginalMessage());
            return invalid(originalIssues, tokens);
        }
        if (verdict == null || verdict.score() == null) {
            log.warn("Verifier answer has no score: {}", json);
            return invalid(originalIssues, tokens);
        }

        int total = originalIssues.size();
        int resolved = verdict.issuesResolved() != null ? clamp(verdict.issuesResolved(), total) : 0;
        int remaining = verdict.issuesRemaining() != null
                ? Math.max(0, verdict.issuesRemaining())
                : total - resolved;
        log.debug("Verifier: score={}, resolved={}/{}, summary={}", verdict.score(), resolved, total, verdict.summary());
        return new VerificationResult(verdict.score(), resolved, remaining, tokens);
    }

    private static VerificationResult invalid(List<SourceIssue> originalIssues, long tokens) {
        return new VerificationResult(Double.NaN, 0, originalIssues.size(), tokens);
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }
}
