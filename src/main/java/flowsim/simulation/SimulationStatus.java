package flowsim.simulation;

/**
 * Lifecycle of an engine run.
 */
public enum SimulationStatus {
    /** Initialized, not started. */
    IDLE,
    RUNNING,
    PAUSED,
    /** Cancelled through stop() before the queue drained. */
    STOPPED,
    /** The event queue drained. */
    COMPLETED
}
