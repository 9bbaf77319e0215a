package flowsim.simulation;

import flowsim.entity.Entity;
import flowsim.random.RandomVariateSampler;
import flowsim.topology.GeneratorConfig;
import flowsim.topology.NodeId;
import flowsim.topology.SimulationRole;
import flowsim.topology.TerminationCondition;
import flowsim.topology.TimingMode;
import flowsim.topology.Topology;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Self-rescheduling producer of entities.
 *
 * Each generator tick emits one batch at the current clock time, routes every member straight
 * away, and schedules the next tick from one sampled inter-arrival interval unless a termination
 * rule says otherwise.
 */
final class EntityGenerator {

    private static final Logger logger = Logger.getLogger(EntityGenerator.class.getName());

    private final Topology topology;
    private final SimulationState state;
    private final RandomVariateSampler sampler;
    private final EntityRouter router;
    private final SimulationListener listener;
    private final double epsilon;

    EntityGenerator(Topology topology, SimulationState state, RandomVariateSampler sampler,
                    EntityRouter router, SimulationListener listener, double epsilon) {
        this.topology = topology;
        this.state = state;
        this.sampler = sampler;
        this.router = router;
        this.listener = listener;
        this.epsilon = epsilon;
    }

    /**
     * Schedules the first tick of every generator at its start time, in node declaration order.
     */
    void scheduleGenerators() {
        for (NodeId generatorId : topology.nodesWithRole(SimulationRole.GENERATOR)) {
            configOf(generatorId).ifPresent(config ->
                    state.eventQueue().schedule(config.startTime(), SimulationCommand.generate(generatorId)));
        }
    }

    /**
     * Runs one tick of a generator.
     */
    void generate(NodeId generatorId) {
        GeneratorConfig config = configOf(generatorId).orElse(null);
        if (config == null) {
            return;
        }

        double now = state.now();
        TerminationCondition termination = config.termination();
        if (termination.isTimeBounded() && now >= config.stopTime()) {
            return;
        }
        if (ceilingReached(generatorId, config)) {
            return;
        }

        for (int i = 0; i < config.batchSize(); i++) {
            Entity entity = new Entity(state.nextEntityId(), config.entityType(), config.color(), now, generatorId);
            state.recordEmission(generatorId);

            listener.onSimulationEvent(new SimulationEvent(now, SimulationEventType.ENTITY_CREATED, generatorId,
                    entity.snapshot(), "Generated " + entity));
            router.route(entity, generatorId);

            if (ceilingReached(generatorId, config)) {
                break;
            }
        }

        if (ceilingReached(generatorId, config)) {
            return;
        }

        double interval = nextInterval(config);
        if (!Double.isFinite(interval)) {
            logger.warning(() -> "Generator " + generatorId + " sampled a non-finite interval from "
                    + config.distribution() + ", no further arrivals");
            return;
        }
        double nextTime = now + Math.max(epsilon, interval);
        if (termination.isTimeBounded() && nextTime > config.stopTime()) {
            return;
        }
        state.eventQueue().schedule(nextTime, SimulationCommand.generate(generatorId));
    }

    private double nextInterval(GeneratorConfig config) {
        double sample = sampler.sample(config.distribution());
        if (config.timingMode() == TimingMode.RATE_PER_UNIT && sample > 0) {
            return 1.0 / sample;
        }
        return sample;
    }

    private boolean ceilingReached(NodeId generatorId, GeneratorConfig config) {
        return config.termination().isCountBounded() && state.emittedBy(generatorId) >= config.maxEntities();
    }

    private Optional<GeneratorConfig> configOf(NodeId generatorId) {
        return topology.roleOf(generatorId)
                .filter(GeneratorConfig.class::isInstance)
                .map(GeneratorConfig.class::cast);
    }
}
