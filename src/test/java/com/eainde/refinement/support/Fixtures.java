package com.eainde.refinement.support;

import com.eainde.refinement.model.Document;
import com.eainde.refinement.model.Section;
import com.eainde.refinement.model.Severity;
import com.eainde.refinement.model.SourceIssue;

import java.util.ArrayList;
import java.util.List;

/**
 * Small documents and issues for tests.
 */
public final class Fixtures {

    private Fixtures() {}

    /**
     * @return document with sections sec_1 .. sec_n, titled "Section i", content "original i"
     */
    public static Document document(int sectionCount) {
        List<Section> sections = new ArrayList<>();
        for (int i = 1; i <= sectionCount; i++) {
            sections.add(new Section("sec_" + i, "Section " + i, "original " + i, i - 1));
        }
        return new Document(sections);
    }

    public static SourceIssue issue(String description) {
        return SourceIssue.of(description, "fix " + description, Severity.MAJOR);
    }

    public static SourceIssue issue(String description, Severity severity) {
        return SourceIssue.of(description, "fix " + description, severity);
    }
}
