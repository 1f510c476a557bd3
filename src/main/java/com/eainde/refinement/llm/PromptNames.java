package com.eainde.refinement.llm;

/**
 * Prompt template names used by the language-model adapters.
 */
public final class PromptNames {

    public static final String SURGICAL_EDIT = "section-surgical-edit";
    public static final String REGENERATE_SECTION = "section-regenerate";
    public static final String VERIFY_SECTION = "section-verify";

    private PromptNames() {}
}
