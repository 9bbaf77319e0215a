package flowsim.simulation;

/**
 * Observer of a running simulation.
 *
 * Callbacks are invoked on the simulation thread while an event executes, so implementations
 * must return quickly and must only read the published values they are given.
 */
public interface SimulationListener {

    /**
     * Called for every entity creation, consumption and counter update.
     */
    void onSimulationEvent(SimulationEvent event);

    /**
     * Called once per consumed event, after its command has run.
     */
    default void onTimeUpdated(double simulationTime) {
    }

    default void onStarted() {
    }

    default void onPaused() {
    }

    default void onResumed() {
    }

    /**
     * Called when a run ends, either because the queue drained or because it was stopped.
     */
    default void onStopped(SimulationStatus finalStatus) {
    }
}
