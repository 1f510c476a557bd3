package com.eainde.refinement.llm;

import com.eainde.refinement.dispatch.EditRequest;
import com.eainde.refinement.dispatch.RepairResult;
import com.eainde.refinement.dispatch.SurgicalEditStrategy;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.log4j.Log4j2;

import java.util.Map;

/**
 * Localized edit through a chat model. The model receives the section, the
 * numbered fix instructions and neighbouring excerpts, and answers with the
 * complete patched section text.
 *
 * Prompt: {@value PromptNames#SURGICAL_EDIT}
 */
@Log4j2
public class LlmSurgicalEditStrategy implements SurgicalEditStrategy {

    private final ChatModel chatModel;
    private final PromptService promptService;

    public LlmSurgicalEditStrategy(ChatModel chatModel, PromptService promptService) {
        this.chatModel = chatModel;
        this.promptService = promptService;
    }

    @Override
    public RepairResult edit(EditRequest request) {
        long start = System.currentTimeMillis();
        ChatResponse response;
        try {
            response = LlmCalls.chat(chatModel, promptService, PromptNames.SURGICAL_EDIT, Map.of(
                    "sectionId", request.sectionId(),
                    "sectionTitle", LlmCalls.orEmpty(request.sectionTitle()),
                    "sectionContent", LlmCalls.orEmpty(request.sectionContent()),
                    "fixInstructions", LlmCalls.orEmpty(request.fixInstructions()),
                    "precedingContext", LlmCalls.orEmpty(request.contextAnchors().precedingExcerpt()),
                    "followingContext", LlmCalls.orEmpty(request.contextAnchors().followingExcerpt())));
        } catch (RuntimeException e) {
            log.warn("Surgical edit call failed for section {}: {}", request.sectionId(), e.getMessage());
            return RepairResult.failure(request.sectionContent(), 0, "Model call failed: " + e.getMessage());
        }

        long tokens = LlmCalls.totalTokens(response);
        String patched = LlmCalls.text(response);
        if (patched.isBlank()) {
            return RepairResult.failure(request.sectionContent(), tokens, "Model returned no content");
        }

        long durationMs = System.currentTimeMillis() - start;
        log.debug("Section {} patched: {} -> {} chars, {} tokens",
                request.sectionId(), LlmCalls.orEmpty(request.sectionContent()).length(), patched.length(), tokens);
        return RepairResult.success(patched, tokens, durationMs,
                diffSummary(request.sectionContent(), patched));
    }

    private static String diffSummary(String before, String after) {
        int delta = after.length() - LlmCalls.orEmpty(before).length();
        return "Patched section (" + (delta >= 0 ? "+" : "") + delta + " chars)";
    }
}
