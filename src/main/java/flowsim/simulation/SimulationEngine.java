package flowsim.simulation;

import flowsim.random.RandomVariateSampler;
import flowsim.stats.CounterSnapshot;
import flowsim.topology.CounterConfig;
import flowsim.topology.DashboardConfig;
import flowsim.topology.NodeId;
import flowsim.topology.SimulationRole;
import flowsim.topology.Topology;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Discrete-event simulation engine. Owns the clock and the event queue and drives generators,
 * routing and statistics for one topology.
 *
 * Execution model:
 * - One logical simulation thread. Each event, including all routing and statistics updates it
 *   triggers, runs to completion while holding the engine lock.
 * - Control calls (pause, resume, stop, reset) and snapshot reads take the same lock, so they are
 *   only ever observed between events.
 * - The loop suspends in exactly two places: the pacing wait after an event and the wait while
 *   paused. Stop requests are honored only there.
 *
 * Hosts either call {@link #start()} (blocking, paced) or drive the run themselves with {@link #step()}.
 */
public class SimulationEngine {

    private static final Logger logger = Logger.getLogger(SimulationEngine.class.getName());
    private static final long NO_LOOP = -1L;

    private final SimulationConfig config;
    private final RandomVariateSampler sampler;
    private final Pacer pacer;
    private final SimulationState state = new SimulationState();
    private final SimulationListeners listeners = new SimulationListeners();

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition controlChanged = lock.newCondition();

    private Topology topology;
    private EntityGenerator generator;

    private SimulationStatus status = SimulationStatus.IDLE;
    private double speedMultiplier;
    private long eventsConsumed;
    private long runId;
    private long loopRunId = NO_LOOP;

    public SimulationEngine(SimulationConfig config) {
        this(config, new RandomVariateSampler(config.seed()));
    }

    public SimulationEngine(SimulationConfig config, RandomVariateSampler sampler) {
        this(config, sampler, config.pacingEnabled() ? new RealTimePacer(config) : Pacer.NONE);
    }

    public SimulationEngine(SimulationConfig config, RandomVariateSampler sampler, Pacer pacer) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.sampler = Objects.requireNonNull(sampler, "Sampler cannot be null");
        this.pacer = Objects.requireNonNull(pacer, "Pacer cannot be null");
        this.speedMultiplier = config.speedMultiplier();
    }

    public void addListener(SimulationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SimulationListener listener) {
        listeners.remove(listener);
    }

    /**
     * Binds the engine to a topology and clears everything from a previous run: queue, clock,
     * statistics, emission ledgers and id counters. The sampler is reseeded so the next run
     * replays identically. Safe to call repeatedly; an active run is cancelled first.
     */
    public void initialize(Topology topology) {
        Objects.requireNonNull(topology, "Topology cannot be null");
        lock.lock();
        try {
            cancelActiveLoop();
            this.topology = topology;
            state.reset();
            sampler.reset();
            eventsConsumed = 0;

            NodeProcessor processor = new NodeProcessor(state, listeners);
            EntityRouter router = new EntityRouter(topology, state, sampler, processor, config.maxRoutingDepth());
            this.generator = new EntityGenerator(topology, state, sampler, router, listeners, config.generatorEpsilon());

            for (NodeId counterId : topology.nodesWithRole(SimulationRole.COUNTER)) {
                topology.roleOf(counterId)
                        .filter(CounterConfig.class::isInstance)
                        .map(CounterConfig.class::cast)
                        .ifPresent(counter -> state.statistics().registerCounter(counterId, counter.throughputWindow()));
            }
            for (NodeId generatorId : topology.nodesWithRole(SimulationRole.GENERATOR)) {
                state.registerGenerator(generatorId);
            }
            status = SimulationStatus.IDLE;
            logger.fine(() -> "Initialized simulation with " + topology.size() + " nodes and "
                    + topology.getAllEdges().size() + " edges");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Starts the run, or resumes it when paused, and executes events on the calling thread until
     * the queue drains or the run is stopped. Returns immediately when another thread is already
     * running the loop; a paused run is resumed either way. A finished run is reset before starting again.
     * An exception thrown while executing an event stops the run and is rethrown.
     *
     * @return the status when this call returns
     */
    public SimulationStatus start() {
        long myRun;
        lock.lock();
        try {
            requireInitialized();
            if (loopRunId != NO_LOOP) {
                if (status == SimulationStatus.PAUSED) {
                    resume();
                }
                return status;
            }
            if (status == SimulationStatus.PAUSED) {
                resume();
            } else if (status == SimulationStatus.STOPPED || status == SimulationStatus.COMPLETED) {
                initialize(topology);
            }
            if (status == SimulationStatus.IDLE) {
                begin();
            }
            myRun = ++runId;
            loopRunId = myRun;
        } finally {
            lock.unlock();
        }

        runLoop(myRun);
        return status();
    }

    /**
     * Runs {@link #start()} on the given executor.
     *
     * @return a future completed with the final status of the run
     */
    public CompletableFuture<SimulationStatus> startAsync(Executor executor) {
        return CompletableFuture.supplyAsync(this::start, executor);
    }

    /**
     * Executes exactly one event without pacing, for hosts that drive the run from their own
     * event loop. Starts the run on the first call.
     *
     * @return true if an event was executed, false if paused, stopped or out of events
     * @throws IllegalStateException if a {@link #start()} loop is active
     * @throws RuntimeException if the event fails; the run is stopped first
     */
    public boolean step() {
        lock.lock();
        try {
            requireInitialized();
            if (loopRunId != NO_LOOP) {
                throw new IllegalStateException("Cannot step while the simulation loop is running");
            }
            if (status == SimulationStatus.IDLE) {
                begin();
            }
            if (status != SimulationStatus.RUNNING) {
                return false;
            }
            ScheduledEvent event = state.eventQueue().poll();
            if (event == null) {
                complete();
                return false;
            }
            try {
                execute(event);
            } catch (RuntimeException | Error e) {
                abort(e);
                throw e;
            }
            if (state.eventQueue().isEmpty()) {
                complete();
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Freezes the clock and event consumption. Queued events are kept.
     */
    public void pause() {
        lock.lock();
        try {
            if (status != SimulationStatus.RUNNING) {
                return;
            }
            status = SimulationStatus.PAUSED;
            controlChanged.signalAll();
            logger.info(() -> "Simulation paused at t=" + state.now());
            listeners.onPaused();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Continues a paused run exactly where it left off.
     */
    public void resume() {
        lock.lock();
        try {
            if (status != SimulationStatus.PAUSED) {
                return;
            }
            status = SimulationStatus.RUNNING;
            controlChanged.signalAll();
            logger.info(() -> "Simulation resumed at t=" + state.now());
            listeners.onResumed();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels the run. The loop exits at its next suspension point; an executing event always completes.
     */
    public void stop() {
        lock.lock();
        try {
            if (status != SimulationStatus.RUNNING && status != SimulationStatus.PAUSED) {
                return;
            }
            cancelActiveLoop();
            status = SimulationStatus.STOPPED;
            logger.info(() -> "Simulation stopped at t=" + state.now());
            listeners.onStopped(SimulationStatus.STOPPED);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the run and restores the freshly initialized state.
     */
    public void reset() {
        lock.lock();
        try {
            stop();
            if (topology != null) {
                initialize(topology);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Changes playback speed. Takes effect from the next pacing computation.
     */
    public void setSpeedMultiplier(double speedMultiplier) {
        if (!(speedMultiplier > 0)) {
            throw new IllegalArgumentException("speedMultiplier must be positive");
        }
        lock.lock();
        try {
            this.speedMultiplier = speedMultiplier;
        } finally {
            lock.unlock();
        }
    }

    private void begin() {
        generator.scheduleGenerators();
        status = SimulationStatus.RUNNING;
        logger.info(() -> "Simulation started with " + state.eventQueue().size() + " generator(s), seed="
                + sampler.getSeed());
        listeners.onStarted();
    }

    private void runLoop(long myRun) {
        try {
            while (true) {
                lock.lock();
                try {
                    while (status == SimulationStatus.PAUSED && runId == myRun) {
                        controlChanged.await();
                    }
                    if (runId != myRun) {
                        return;
                    }
                    ScheduledEvent event = state.eventQueue().poll();
                    if (event == null) {
                        complete();
                        return;
                    }
                    double previousTime = state.now();
                    execute(event);
                    awaitPacing(pacer.delayNanos(state.now() - previousTime, speedMultiplier, eventsConsumed), myRun);
                } finally {
                    lock.unlock();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.log(Level.INFO, "Simulation thread interrupted, stopping", e);
            stop();
        } catch (RuntimeException | Error e) {
            lock.lock();
            try {
                if (runId == myRun) {
                    abort(e);
                }
            } finally {
                lock.unlock();
            }
            throw e;
        } finally {
            lock.lock();
            try {
                if (loopRunId == myRun) {
                    loopRunId = NO_LOOP;
                }
            } finally {
                lock.unlock();
            }
        }
    }

    private void awaitPacing(long delayNanos, long myRun) throws InterruptedException {
        long remaining = delayNanos;
        while (remaining > 0 && runId == myRun && status == SimulationStatus.RUNNING) {
            remaining = controlChanged.awaitNanos(remaining);
        }
    }

    private void execute(ScheduledEvent event) {
        state.clock().advanceTo(event.time());
        eventsConsumed++;
        SimulationCommand command = event.command();
        logger.fine(() -> "t=" + event.time() + " executing " + command);
        switch (command.kind()) {
            case GENERATE_ENTITIES -> generator.generate(command.targetNodeId());
        }
        listeners.onTimeUpdated(state.now());
    }

    /**
     * Ends the run after an event failed part way. Caller holds the lock.
     */
    private void abort(Throwable cause) {
        cancelActiveLoop();
        status = SimulationStatus.STOPPED;
        logger.log(Level.SEVERE, "Simulation aborted at t=" + state.now(), cause);
        listeners.onStopped(SimulationStatus.STOPPED);
    }

    private void complete() {
        status = SimulationStatus.COMPLETED;
        loopRunId = NO_LOOP;
        logger.info(() -> "Simulation completed at t=" + state.now() + " after " + eventsConsumed + " events");
        listeners.onStopped(SimulationStatus.COMPLETED);
    }

    private void cancelActiveLoop() {
        runId++;
        loopRunId = NO_LOOP;
        controlChanged.signalAll();
    }

    private void requireInitialized() {
        if (topology == null) {
            throw new IllegalStateException("Simulation has not been initialized with a topology");
        }
    }

    public SimulationStatus status() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    public double clockTime() {
        lock.lock();
        try {
            return state.now();
        } finally {
            lock.unlock();
        }
    }

    public double speedMultiplier() {
        lock.lock();
        try {
            return speedMultiplier;
        } finally {
            lock.unlock();
        }
    }

    public long eventsConsumed() {
        lock.lock();
        try {
            return eventsConsumed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the queued events in execution order, for inspection.
     */
    public List<ScheduledEvent> pendingEvents() {
        lock.lock();
        try {
            return state.eventQueue().pending();
        } finally {
            lock.unlock();
        }
    }

    public Optional<CounterSnapshot> counterStatistics(NodeId counterId) {
        lock.lock();
        try {
            return state.statistics().snapshot(counterId);
        } finally {
            lock.unlock();
        }
    }

    public Map<NodeId, CounterSnapshot> allCounterStatistics() {
        lock.lock();
        try {
            return state.statistics().snapshotAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Evaluates a dashboard node's stats against the current counters.
     *
     * @return label to value in declared order, empty if the node is not a dashboard
     */
    public Map<String, Double> dashboardValues(NodeId dashboardId) {
        lock.lock();
        try {
            if (topology == null) {
                return Map.of();
            }
            return topology.roleOf(dashboardId)
                    .filter(DashboardConfig.class::isInstance)
                    .map(DashboardConfig.class::cast)
                    .map(dashboard -> state.statistics().dashboardValues(dashboard))
                    .orElse(Map.of());
        } finally {
            lock.unlock();
        }
    }

    public SimulationConfig getConfig() {
        return config;
    }
}
