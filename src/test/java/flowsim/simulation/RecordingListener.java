package flowsim.simulation;

import flowsim.topology.NodeId;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Test listener that keeps every notification it receives.
 */
class RecordingListener implements SimulationListener {

    final List<SimulationEvent> events = new CopyOnWriteArrayList<>();
    final List<Double> times = new CopyOnWriteArrayList<>();
    final List<SimulationStatus> stops = new CopyOnWriteArrayList<>();
    final List<String> lifecycle = new CopyOnWriteArrayList<>();

    @Override
    public void onSimulationEvent(SimulationEvent event) {
        events.add(event);
    }

    @Override
    public void onTimeUpdated(double simulationTime) {
        times.add(simulationTime);
    }

    @Override
    public void onStarted() {
        lifecycle.add("started");
    }

    @Override
    public void onPaused() {
        lifecycle.add("paused");
    }

    @Override
    public void onResumed() {
        lifecycle.add("resumed");
    }

    @Override
    public void onStopped(SimulationStatus finalStatus) {
        stops.add(finalStatus);
        lifecycle.add("stopped:" + finalStatus);
    }

    List<SimulationEvent> ofType(SimulationEventType type) {
        return events.stream().filter(e -> e.eventType() == type).collect(Collectors.toList());
    }

    List<SimulationEvent> at(NodeId nodeId) {
        return events.stream().filter(e -> e.nodeId().equals(nodeId)).collect(Collectors.toList());
    }

    /**
     * Compact "TYPE@time node #entity" trace, convenient for comparing whole runs.
     */
    List<String> trace() {
        List<String> trace = new ArrayList<>();
        for (SimulationEvent event : events) {
            trace.add(event.eventType() + "@" + event.simulationTime() + " " + event.nodeId() + " #" + event.entity().id());
        }
        return trace;
    }

    void clear() {
        events.clear();
        times.clear();
        stops.clear();
        lifecycle.clear();
    }
}
