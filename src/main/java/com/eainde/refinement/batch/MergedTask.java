package com.eainde.refinement.batch;

import com.eainde.refinement.model.ContextAnchors;
import com.eainde.refinement.model.RefinementAction;
import com.eainde.refinement.model.RefinementTask;
import com.eainde.refinement.model.Severity;
import com.eainde.refinement.model.SourceIssue;

import java.util.List;
import java.util.stream.Collectors;

/**
 * All tasks targeting one section within one iteration, collapsed into a single
 * dispatch. Exactly one repair attempt is made per merged task.
 *
 * @param sectionId      target section
 * @param action         REGENERATE_SECTION if any member asked for it, else SURGICAL_EDIT
 * @param priority       most severe member priority
 * @param issues         union of member issues, in input order
 * @param contextAnchors first non-empty member anchors
 * @param members        the original tasks
 */
public record MergedTask(
        String sectionId,
        RefinementAction action,
        Severity priority,
        List<SourceIssue> issues,
        ContextAnchors contextAnchors,
        List<RefinementTask> members
) {

    public MergedTask {
        issues = List.copyOf(issues);
        members = List.copyOf(members);
    }

    /**
     * Fix instructions of every issue, one numbered line each.
     */
    public String combinedInstructions() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < issues.size(); i++) {
            SourceIssue issue = issues.get(i);
            if (i > 0) sb.append('\n');
            sb.append(i + 1).append(". [").append(issue.severity().wireName()).append("] ")
                    .append(issue.description());
            if (issue.hasQuote()) {
                sb.append(" (\"").append(issue.quotedText()).append("\")");
            }
            if (!issue.fixInstructions().isBlank()) {
                sb.append(" -> ").append(issue.fixInstructions());
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "MergedTask{" + sectionId + ", " + action + ", " + priority.wireName()
                + ", issues=" + issues.size() + ", members=" + members.size() + '}';
    }

    static MergedTask of(List<RefinementTask> tasks) {
        RefinementTask first = tasks.get(0);
        RefinementAction action = tasks.stream()
                .anyMatch(t -> t.action() == RefinementAction.REGENERATE_SECTION)
                ? RefinementAction.REGENERATE_SECTION
                : RefinementAction.SURGICAL_EDIT;
        Severity priority = tasks.stream()
                .map(RefinementTask::priority)
                .reduce(Severity.MINOR, Severity::mostSevere);
        List<SourceIssue> issues = tasks.stream()
                .flatMap(t -> t.sourceIssues().stream())
                .distinct()
                .collect(Collectors.toList());
        ContextAnchors anchors = tasks.stream()
                .map(RefinementTask::contextAnchors)
                .filter(a -> !a.isEmpty())
                .findFirst()
                .orElse(ContextAnchors.none());
        return new MergedTask(first.sectionId(), action, priority, issues, anchors, tasks);
    }
}
