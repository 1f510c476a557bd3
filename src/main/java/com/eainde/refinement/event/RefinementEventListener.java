package com.eainde.refinement.event;

/**
 * Receives {@link RefinementEvent}s as the loop emits them.
 *
 * Called on the orchestrator thread. Exceptions thrown here are logged and
 * dropped; a listener cannot change the course of a run.
 */
@FunctionalInterface
public interface RefinementEventListener {

    RefinementEventListener NO_OP = event -> { };

    void onEvent(RefinementEvent event);
}
