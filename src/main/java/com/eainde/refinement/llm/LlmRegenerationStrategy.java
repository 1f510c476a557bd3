package com.eainde.refinement.llm;

import com.eainde.refinement.dispatch.RegenerationRequest;
import com.eainde.refinement.dispatch.RegenerationStrategy;
import com.eainde.refinement.dispatch.RepairResult;
import com.eainde.refinement.dispatch.SectionSpec;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.log4j.Log4j2;

import java.util.List;
import java.util.Map;

/**
 * Rewrites a whole section through a chat model, given the document outline and
 * the issues the previous version had.
 *
 * Prompt: {@value PromptNames#REGENERATE_SECTION}
 */
@Log4j2
public class LlmRegenerationStrategy implements RegenerationStrategy {

    private final ChatModel chatModel;
    private final PromptService promptService;

    public LlmRegenerationStrategy(ChatModel chatModel, PromptService promptService) {
        this.chatModel = chatModel;
        this.promptService = promptService;
    }

    @Override
    public RepairResult regenerate(RegenerationRequest request) {
        SectionSpec spec = request.sectionSpec();
        long start = System.currentTimeMillis();
        ChatResponse response;
        try {
            response = LlmCalls.chat(chatModel, promptService, PromptNames.REGENERATE_SECTION, Map.of(
                    "sectionId", spec.sectionId(),
                    "sectionTitle", LlmCalls.orEmpty(spec.title()),
                    "outline", formatOutline(request.lessonOutline(), spec.ordinal()),
                    "currentContent", LlmCalls.orEmpty(spec.currentContent()),
                    "issues", LlmCalls.formatIssues(spec.issues()),
                    "precedingContext", LlmCalls.orEmpty(request.contextAnchors().precedingExcerpt()),
                    "followingContext", LlmCalls.orEmpty(request.contextAnchors().followingExcerpt())));
        } catch (RuntimeException e) {
            log.warn("Regeneration call failed for section {}: {}", spec.sectionId(), e.getMessage());
            return RepairResult.failure(spec.currentContent(), 0, "Model call failed: " + e.getMessage());
        }

        long tokens = LlmCalls.totalTokens(response);
        String regenerated = LlmCalls.text(response);
        if (regenerated.isBlank()) {
            return RepairResult.failure(spec.currentContent(), tokens, "Model returned no content");
        }
        log.debug("Section {} regenerated: {} chars, {} tokens", spec.sectionId(), regenerated.length(), tokens);
        return RepairResult.success(regenerated, tokens, System.currentTimeMillis() - start, "Regenerated section");
    }

    /**
     * Numbered outline with the section being rewritten marked.
     */
    static String formatOutline(List<String> outline, int currentOrdinal) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < outline.size(); i++) {
            if (i > 0) sb.append('\n');
            sb.append(i + 1).append(". ").append(outline.get(i));
            if (i == currentOrdinal) sb.append("  <- rewrite this section");
        }
        return sb.toString();
    }
}
