package io.studiograph.core.graph;

/**
 * Receives the feedback-loop status of a {@link StudioGraph} whenever it changes.
 */
@FunctionalInterface
public interface LoopStatusListener {

    void loopStatusChanged(CycleReport report);
}
