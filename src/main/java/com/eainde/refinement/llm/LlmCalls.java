package com.eainde.refinement.llm;

import com.eainde.refinement.model.SourceIssue;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.input.PromptTemplate;
import dev.langchain4j.model.output.TokenUsage;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared plumbing of the language-model adapters: prompt rendering, the chat
 * call itself and response clean-up.
 */
final class LlmCalls {

    private LlmCalls() {}

    /**
     * Renders the named system and user templates with {@code variables} and sends them.
     * Null variable values render as empty strings.
     */
    static ChatResponse chat(ChatModel chatModel, PromptService promptService,
                             String promptName, Map<String, Object> variables) {
        Map<String, Object> values = new HashMap<>();
        variables.forEach((k, v) -> values.put(k, v != null ? v : ""));

        String system = PromptTemplate.from(promptService.getSystemPrompt(promptName)).apply(values).text();
        String user = PromptTemplate.from(promptService.getUserPrompt(promptName)).apply(values).text();

        ChatRequest request = ChatRequest.builder()
                .messages(SystemMessage.from(system), UserMessage.from(user))
                .build();
        return chatModel.chat(request);
    }

    static long totalTokens(ChatResponse response) {
        TokenUsage usage = response.tokenUsage();
        if (usage == null || usage.totalTokenCount() == null) {
            return 0;
        }
        return usage.totalTokenCount();
    }

    static String text(ChatResponse response) {
        if (response.aiMessage() == null || response.aiMessage().text() == null) {
            return "";
        }
        return stripCodeFences(response.aiMessage().text());
    }

    /**
     * Removes a surrounding markdown code fence (```json ... ```), if present.
     */
    static String stripCodeFences(String text) {
        String trimmed = text.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        if (firstNewline < 0) {
            return "";
        }
        String body = trimmed.substring(firstNewline + 1);
        int closing = body.lastIndexOf("```");
        if (closing >= 0) {
            body = body.substring(0, closing);
        }
        return body.trim();
    }

    static String formatIssues(List<SourceIssue> issues) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < issues.size(); i++) {
            SourceIssue issue = issues.get(i);
            if (i > 0) sb.append('\n');
            sb.append(i + 1).append(". [").append(issue.severity().wireName()).append("] ")
                    .append(issue.description());
            if (issue.hasQuote()) {
                sb.append("\n   Quoted: \"").append(issue.quotedText()).append('"');
            }
            if (!issue.fixInstructions().isBlank()) {
                sb.append("\n   Fix: ").append(issue.fixInstructions());
            }
        }
        return sb.toString();
    }

    static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
