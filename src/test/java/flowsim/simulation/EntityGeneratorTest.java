package flowsim.simulation;

import flowsim.random.Distribution;
import flowsim.random.RandomVariateSampler;
import flowsim.topology.GeneratorConfig;
import flowsim.topology.TerminationCondition;
import flowsim.topology.TimingMode;
import flowsim.topology.Topology;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class EntityGeneratorTest {

    private SimulationState state;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        state = new SimulationState();
        listener = new RecordingListener();
    }

    /**
     * Drives the generator through the queue the way the engine does, without pacing.
     */
    private void runToCompletion(Topology topology) {
        RandomVariateSampler sampler = new RandomVariateSampler(42);
        NodeProcessor processor = new NodeProcessor(state, listener);
        EntityRouter router = new EntityRouter(topology, state, sampler, processor, 100);
        EntityGenerator generator = new EntityGenerator(topology, state, sampler, router, listener, 0.001);
        state.registerGenerator(TestTopologies.GENERATOR);

        generator.scheduleGenerators();
        ScheduledEvent event;
        int guard = 0;
        while ((event = state.eventQueue().poll()) != null && guard++ < 10_000) {
            state.clock().advanceTo(event.time());
            generator.generate(event.command().targetNodeId());
        }
    }

    private List<Double> creationTimes() {
        return listener.ofType(SimulationEventType.ENTITY_CREATED).stream()
                .map(SimulationEvent::simulationTime)
                .collect(Collectors.toList());
    }

    @Test
    void shouldStopAtMaxEntities() {
        runToCompletion(TestTopologies.countedLine(1.0, 5));

        assertEquals(List.of(0.0, 1.0, 2.0, 3.0, 4.0), creationTimes());
        assertEquals(5, state.emittedBy(TestTopologies.GENERATOR));
        assertTrue(state.eventQueue().isEmpty());
    }

    @Test
    void shouldTruncateBatchAtCeiling() {
        // Given - batches of 4 against a ceiling of 10
        runToCompletion(TestTopologies.line(GeneratorConfig.builder()
                .distribution(Distribution.constant(1.0))
                .batchSize(4)
                .termination(TerminationCondition.COUNT)
                .maxEntities(10)
                .build()));

        // Then - 4 + 4 + 2
        assertEquals(List.of(0.0, 0.0, 0.0, 0.0, 1.0, 1.0, 1.0, 1.0, 2.0, 2.0), creationTimes());
        assertEquals(10, state.emittedBy(TestTopologies.GENERATOR));
    }

    @Test
    void shouldEmitNothingWithZeroCeiling() {
        runToCompletion(TestTopologies.countedLine(1.0, 0));

        assertTrue(listener.events.isEmpty());
    }

    @Test
    void shouldStopBeforeStopTime() {
        runToCompletion(TestTopologies.line(GeneratorConfig.builder()
                .distribution(Distribution.constant(2.0))
                .termination(TerminationCondition.TIME)
                .stopTime(5.0)
                .build()));

        assertEquals(List.of(0.0, 2.0, 4.0), creationTimes());
    }

    @Test
    void shouldTreatStopTimeAsExclusive() {
        runToCompletion(TestTopologies.line(GeneratorConfig.builder()
                .distribution(Distribution.constant(2.0))
                .termination(TerminationCondition.TIME)
                .stopTime(4.0)
                .build()));

        assertEquals(List.of(0.0, 2.0), creationTimes());
    }

    @Test
    void shouldStopOnWhicheverLimitComesFirst() {
        runToCompletion(TestTopologies.line(GeneratorConfig.builder()
                .distribution(Distribution.constant(1.0))
                .termination(TerminationCondition.COUNT_OR_TIME)
                .maxEntities(100)
                .stopTime(3.5)
                .build()));

        assertEquals(List.of(0.0, 1.0, 2.0, 3.0), creationTimes());
    }

    @Test
    void shouldInvertSampleInRateMode() {
        runToCompletion(TestTopologies.line(GeneratorConfig.builder()
                .distribution(Distribution.constant(4.0))
                .timingMode(TimingMode.RATE_PER_UNIT)
                .termination(TerminationCondition.COUNT)
                .maxEntities(3)
                .build()));

        assertEquals(List.of(0.0, 0.25, 0.5), creationTimes());
    }

    @Test
    void shouldBeginAtStartTime() {
        runToCompletion(TestTopologies.line(GeneratorConfig.builder()
                .distribution(Distribution.constant(1.0))
                .startTime(3.0)
                .termination(TerminationCondition.COUNT)
                .maxEntities(2)
                .build()));

        assertEquals(List.of(3.0, 4.0), creationTimes());
    }

    @Test
    void shouldAdvanceByEpsilonOnZeroInterval() {
        runToCompletion(TestTopologies.countedLine(0.0, 3));

        List<Double> times = creationTimes();
        assertEquals(3, times.size());
        assertEquals(0.0, times.get(0));
        assertEquals(0.001, times.get(1), 1e-12);
        assertEquals(0.002, times.get(2), 1e-12);
    }

    @Test
    void shouldStopOnNonFiniteInterval() {
        runToCompletion(TestTopologies.line(GeneratorConfig.builder()
                .distribution(Distribution.constant(Double.POSITIVE_INFINITY))
                .build()));

        assertEquals(List.of(0.0), creationTimes());
        assertTrue(state.eventQueue().isEmpty());
    }

    @Test
    void shouldAssignIncreasingEntityIds() {
        runToCompletion(TestTopologies.countedLine(1.0, 3));

        List<Long> ids = listener.ofType(SimulationEventType.ENTITY_CREATED).stream()
                .map(event -> event.entity().id())
                .collect(Collectors.toList());
        assertEquals(List.of(1L, 2L, 3L), ids);
    }
}
