package com.canihazhouze.agent.core;

/**
 * Control signals the turn loop polls at its checkpoints. Set asynchronously
 * by the control surface; the loop never blocks on them.
 */
public interface RunSignals {

    boolean isPauseRequested();

    boolean isCancelRequested();

    /** Called after every completed iteration with the new turn count. */
    default void progress(int turnCount) {
    }
}
