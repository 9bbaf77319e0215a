package flowsim.simulation;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans notifications out to every registered listener.
 * A listener that throws is logged and skipped so the executing event still completes.
 */
final class SimulationListeners implements SimulationListener {

    private static final Logger logger = Logger.getLogger(SimulationListeners.class.getName());

    private final List<SimulationListener> listeners = new CopyOnWriteArrayList<>();

    void add(SimulationListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    void remove(SimulationListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void onSimulationEvent(SimulationEvent event) {
        forEach(listener -> listener.onSimulationEvent(event));
    }

    @Override
    public void onTimeUpdated(double simulationTime) {
        forEach(listener -> listener.onTimeUpdated(simulationTime));
    }

    @Override
    public void onStarted() {
        forEach(SimulationListener::onStarted);
    }

    @Override
    public void onPaused() {
        forEach(SimulationListener::onPaused);
    }

    @Override
    public void onResumed() {
        forEach(SimulationListener::onResumed);
    }

    @Override
    public void onStopped(SimulationStatus finalStatus) {
        forEach(listener -> listener.onStopped(finalStatus));
    }

    private void forEach(Consumer<SimulationListener> notification) {
        for (SimulationListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Simulation listener " + listener + " failed", e);
            }
        }
    }
}
