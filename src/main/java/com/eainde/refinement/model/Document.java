package com.eainde.refinement.model;

import com.eainde.refinement.config.RefinementConfigurationException;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, immutable sequence of {@link Section}s.
 *
 * <p>Every mutation returns a new instance. The orchestrator swaps its reference
 * once per iteration, after all repair outcomes of that iteration are known.</p>
 */
public record Document(@JsonProperty("sections") List<Section> sections) {

    public Document {
        if (sections == null || sections.isEmpty()) {
            throw new RefinementConfigurationException("Document must contain at least one section");
        }
        Set<String> ids = new HashSet<>();
        for (Section section : sections) {
            if (section == null) {
                throw new RefinementConfigurationException("Document contains a null section");
            }
            if (!ids.add(section.id())) {
                throw new RefinementConfigurationException("Duplicate section id: " + section.id());
            }
        }
        sections = List.copyOf(sections);
    }

    public static Document of(Section... sections) {
        return new Document(List.of(sections));
    }

    public Optional<Section> section(String sectionId) {
        return sections.stream().filter(s -> s.id().equals(sectionId)).findFirst();
    }

    public boolean contains(String sectionId) {
        return section(sectionId).isPresent();
    }

    /**
     * Returns a new document in which the given section carries {@code newContent}.
     * Unknown ids leave the document unchanged.
     */
    public Document withSectionContent(String sectionId, String newContent) {
        List<Section> updated = new ArrayList<>(sections.size());
        boolean changed = false;
        for (Section section : sections) {
            if (section.id().equals(sectionId)) {
                updated.add(section.withContent(newContent));
                changed = true;
            } else {
                updated.add(section);
            }
        }
        return changed ? new Document(updated) : this;
    }

    /**
     * @return section titles in document order, used as the outline for regeneration
     */
    public List<String> outline() {
        return sections.stream().map(Section::title).toList();
    }
}
