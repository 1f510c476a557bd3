package com.eainde.refinement.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-section edit counters and lock flags for one refinement run.
 *
 * <h3>Lock rules</h3>
 * <ul>
 *   <li><b>max_edits</b>: every dispatched repair attempt (successful or not)
 *       increments the counter; reaching {@code lockAfterEdits} locks.</li>
 *   <li><b>regression</b>: the convergence tracker saw the section's score drop;
 *       locks immediately regardless of the counter.</li>
 * </ul>
 *
 * Locks are monotonic. Created with every target section unlocked.
 */
public class SectionLockRegistry {

    private static final Logger log = LoggerFactory.getLogger(SectionLockRegistry.class);

    private final int lockAfterEdits;
    private final Map<String, SectionLockState> states = new LinkedHashMap<>();

    /**
     * @param sectionIds     sections tracked by this run (usually the task targets)
     * @param lockAfterEdits edit attempts after which a section locks
     */
    public SectionLockRegistry(Collection<String> sectionIds, int lockAfterEdits) {
        if (lockAfterEdits < 1) throw new IllegalArgumentException("lockAfterEdits must be >= 1");
        this.lockAfterEdits = lockAfterEdits;
        for (String sectionId : sectionIds) {
            states.put(sectionId, new SectionLockState(sectionId));
        }
    }

    // =========================================================================
    //  Queries
    // =========================================================================

    public boolean isLocked(String sectionId) {
        SectionLockState state = states.get(sectionId);
        return state != null && state.isLocked();
    }

    public int editCount(String sectionId) {
        SectionLockState state = states.get(sectionId);
        return state != null ? state.getEditCount() : 0;
    }

    public Optional<SectionLockState> state(String sectionId) {
        return Optional.ofNullable(states.get(sectionId));
    }

    /**
     * @return true when every tracked section is locked (false for an empty registry)
     */
    public boolean allLocked() {
        return !states.isEmpty() && states.values().stream().allMatch(SectionLockState::isLocked);
    }

    public Set<String> lockedSections() {
        Set<String> locked = new LinkedHashSet<>();
        states.values().stream()
                .filter(SectionLockState::isLocked)
                .forEach(s -> locked.add(s.getSectionId()));
        return locked;
    }

    // =========================================================================
    //  Updates (orchestrator thread, between batches)
    // =========================================================================

    /**
     * Counts one repair attempt against the section.
     *
     * @return true if the section became locked by this attempt
     */
    public boolean recordAttempt(String sectionId) {
        SectionLockState state = states.computeIfAbsent(sectionId, SectionLockState::new);
        state.incrementEdits();
        if (state.getEditCount() >= lockAfterEdits && state.lock(LockReason.MAX_EDITS)) {
            log.info("Section {} locked after {} edit attempts", sectionId, state.getEditCount());
            return true;
        }
        return false;
    }

    /**
     * Locks a section whose score regressed.
     *
     * @return true if the section was unlocked before this call
     */
    public boolean lockForRegression(String sectionId) {
        SectionLockState state = states.computeIfAbsent(sectionId, SectionLockState::new);
        if (state.lock(LockReason.REGRESSION)) {
            log.info("Section {} locked after score regression", sectionId);
            return true;
        }
        return false;
    }
}
