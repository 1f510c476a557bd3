package com.eainde.refinement.dispatch;

import com.eainde.refinement.model.SourceIssue;

import java.util.List;

/**
 * Scores a repaired section against the issues it was meant to fix.
 */
@FunctionalInterface
public interface SectionVerifier {

    VerificationResult verify(List<SourceIssue> originalIssues, String repairedContent);
}
