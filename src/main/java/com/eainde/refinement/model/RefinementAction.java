package com.eainde.refinement.model;

/**
 * How a section is repaired.
 */
public enum RefinementAction {
    /** Localized, instruction-guided patch of the existing text. */
    SURGICAL_EDIT,
    /** Full rewrite of the section from its title, outline position and issues. */
    REGENERATE_SECTION
}
