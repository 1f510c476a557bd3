package com.eainde.refinement.llm;

/**
 * Source of system and user prompt templates, looked up by prompt name.
 * Templates use {@code {{variable}}} placeholders.
 */
public interface PromptService {

    String getSystemPrompt(String promptName);

    String getUserPrompt(String promptName);
}
