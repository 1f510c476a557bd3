package com.eainde.refinement.dispatch;

/**
 * Full replacement of a section's text from its specification.
 */
@FunctionalInterface
public interface RegenerationStrategy {

    RepairResult regenerate(RegenerationRequest request);
}
