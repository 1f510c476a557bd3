package com.eainde.refinement.dispatch;

import com.eainde.refinement.model.SourceIssue;

import java.util.List;

/**
 * What a regenerated section has to be: its identity, the text it replaces and
 * the issues the replacement must avoid.
 */
public record SectionSpec(
        String sectionId,
        String title,
        int ordinal,
        String currentContent,
        List<SourceIssue> issues
) {

    public SectionSpec {
        issues = List.copyOf(issues);
    }
}
