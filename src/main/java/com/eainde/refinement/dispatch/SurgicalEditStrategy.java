package com.eainde.refinement.dispatch;

/**
 * Localized, instruction-guided patch of an existing section.
 *
 * Implementations may block on a remote model call. They may throw or return a
 * failed {@link RepairResult}; the dispatcher treats both the same way.
 */
@FunctionalInterface
public interface SurgicalEditStrategy {

    RepairResult edit(EditRequest request);
}
