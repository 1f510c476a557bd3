package com.eainde.refinement.lock;

import lombok.Getter;

/**
 * Edit counter and lock flag of one section. Once locked, a section stays
 * locked; {@link #lock(LockReason)} on a locked section is a no-op.
 *
 * Not thread-safe: owned by the orchestrator thread.
 */
@Getter
public final class SectionLockState {

    private final String sectionId;
    private int editCount;
    private boolean locked;
    private LockReason lockReason;

    SectionLockState(String sectionId) {
        this.sectionId = sectionId;
    }

    void incrementEdits() {
        editCount++;
    }

    /**
     * @return true if this call transitioned the section to locked
     */
    boolean lock(LockReason reason) {
        if (locked) {
            return false;
        }
        locked = true;
        lockReason = reason;
        return true;
    }

    @Override
    public String toString() {
        return "SectionLockState{" + sectionId + ", edits=" + editCount
                + (locked ? ", locked=" + lockReason.wireName() : "") + '}';
    }
}
