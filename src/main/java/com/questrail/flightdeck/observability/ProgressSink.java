package com.questrail.flightdeck.observability;

/**
 * Main interface for consuming a run's progress.
 * Implementations can provide logging, reporting, persistence or UI updates.
 */
public interface ProgressSink {
    /**
     * Called for every node status change, in sequence order.
     * @param event the transition
     */
    void onTransition(NodeTransition event);

    /**
     * Called once when the run has finished; nothing follows.
     * @param event the completion event with the final result tree
     */
    void onRunCompleted(RunCompleted event);

    /**
     * Called when an error or anomaly occurs.
     * @param event the error event
     */
    void onError(RunErrorEvent event);
}
