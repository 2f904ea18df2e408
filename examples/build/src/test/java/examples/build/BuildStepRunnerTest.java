package examples.build;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import fakedb.AddedStep;
import fakedb.FakeStepsConnector;
import fakedb.StepModel;
import fakedb.UrlModel;
import fakedb.ValidationException;
import fakedb.VirtualClock;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BuildStepRunnerTest {
    private static final int BUILD_ID = 12;

    private VirtualClock clock;
    private FakeStepsConnector steps;
    private BuildStepRunner runner;

    @BeforeEach
    void setUp() {
        clock = new VirtualClock(1_000L);
        steps = new FakeStepsConnector(clock);
        runner = new BuildStepRunner(steps, clock::seconds);
    }

    @Test
    void recordsEveryStepWithTimingAndUrls() throws Exception {
        BuildResult result = runner.runAndWait(BUILD_ID, List.of(
                StepDefinition.of("checkout", id -> {
                    clock.advance(5L);
                    return StepOutcome.success();
                }),
                new StepDefinition("compile", true, false, id -> {
                    clock.advance(30L);
                    return StepOutcome.success(new UrlModel("log", "http://ci/log/" + id));
                })));

        assertEquals(StepResult.SUCCESS, result.result());
        List<StepModel> recorded = steps.getSteps(BUILD_ID).join();
        assertEquals(2, recorded.size());

        StepModel checkout = recorded.get(0);
        assertEquals("checkout", checkout.name());
        assertEquals(0, checkout.number());
        assertEquals(Instant.ofEpochSecond(1_000L), checkout.startedAt());
        assertNull(checkout.locksAcquiredAt());
        assertEquals(Instant.ofEpochSecond(1_005L), checkout.completeAt());
        assertEquals("checkout passed", checkout.stateString());

        StepModel compile = recorded.get(1);
        assertEquals(1, compile.number());
        assertEquals(Instant.ofEpochSecond(1_005L), compile.startedAt());
        assertEquals(Instant.ofEpochSecond(1_005L), compile.locksAcquiredAt());
        assertEquals(Instant.ofEpochSecond(1_035L), compile.completeAt());
        assertEquals(Integer.valueOf(StepResult.SUCCESS.code()), compile.results());
        assertEquals(List.of(new UrlModel("log", "http://ci/log/" + compile.id())), compile.urls());
    }

    @Test
    void repeatedStepNamesAreDisambiguated() throws Exception {
        BuildResult result = runner.runAndWait(BUILD_ID, List.of(
                StepDefinition.of("test", id -> StepOutcome.success()),
                StepDefinition.of("test", id -> StepOutcome.success()),
                StepDefinition.of("test", id -> StepOutcome.success())));

        assertEquals(List.of("test", "test_1", "test_2"),
                result.steps().stream().map(AddedStep::name).toList());
    }

    @Test
    void actionExceptionsFinishTheStepAsException() throws Exception {
        BuildResult result = runner.runAndWait(BUILD_ID, List.of(
                StepDefinition.of("flaky", id -> {
                    throw new IllegalStateException("boom");
                }),
                StepDefinition.of("after", id -> StepOutcome.success())));

        assertEquals(StepResult.EXCEPTION, result.result());
        StepModel flaky = steps.getStepByBuild(BUILD_ID, null, "flaky").join();
        assertEquals(Integer.valueOf(StepResult.EXCEPTION.code()), flaky.results());
        assertEquals("flaky exception", flaky.stateString());
        StepModel after = steps.getStepByBuild(BUILD_ID, 1, null).join();
        assertEquals(Integer.valueOf(StepResult.SUCCESS.code()), after.results());
    }

    @Test
    void unrecordableOutcomeFinishesStepAsException() throws Exception {
        BuildResult result = runner.runAndWait(BUILD_ID, List.of(
                StepDefinition.of("compile", id -> {
                    clock.advance(2.5);
                    return StepOutcome.success(new UrlModel("bad name", "http://ci/log"));
                }),
                StepDefinition.of("test", id -> StepOutcome.success())));

        assertEquals(StepResult.EXCEPTION, result.result());
        assertEquals(2, steps.getSteps(BUILD_ID).join().size());

        StepModel compile = steps.getStepByBuild(BUILD_ID, null, "compile").join();
        assertEquals("compile exception", compile.stateString());
        assertEquals(Integer.valueOf(StepResult.EXCEPTION.code()), compile.results());
        assertEquals(Instant.ofEpochSecond(1_002L, 500_000_000L), compile.completeAt());
        assertTrue(compile.urls().isEmpty());

        StepModel test = steps.getStepByBuild(BUILD_ID, null, "test").join();
        assertEquals(Integer.valueOf(StepResult.SUCCESS.code()), test.results());
        assertEquals("test passed", test.stateString());
    }

    @Test
    void haltOnFailureSkipsRemainingSteps() throws Exception {
        AtomicInteger ran = new AtomicInteger();
        BuildResult result = runner.runAndWait(BUILD_ID, List.of(
                new StepDefinition("compile", false, true, id -> StepOutcome.of(StepResult.FAILURE)),
                StepDefinition.of("test", id -> {
                    ran.incrementAndGet();
                    return StepOutcome.success();
                })));

        assertEquals(StepResult.FAILURE, result.result());
        assertEquals(0, ran.get());
        StepModel skipped = steps.getStepByBuild(BUILD_ID, 1, "test").join();
        assertEquals(Integer.valueOf(StepResult.SKIPPED.code()), skipped.results());
        assertNull(skipped.startedAt());
        assertFalse(skipped.hidden());
    }

    @Test
    void hiddenOutcomeHidesStep() throws Exception {
        runner.runAndWait(BUILD_ID, List.of(StepDefinition.of("optional", id -> StepOutcome.skipped().asHidden())));

        StepModel optional = steps.getStepByBuild(BUILD_ID, 0, null).join();
        assertTrue(optional.hidden());
        assertEquals(Integer.valueOf(StepResult.SKIPPED.code()), optional.results());
    }

    @Test
    void invalidStepNameFailsTheBuild() {
        ValidationException error = assertThrows(ValidationException.class,
                () -> runner.runAndWait(BUILD_ID, List.of(StepDefinition.of("not valid", id -> StepOutcome.success()))));

        assertEquals("name", error.field());
        assertTrue(steps.getSteps(BUILD_ID).join().isEmpty());
    }

    @Test
    void worstResultWins() {
        assertEquals(StepResult.FAILURE, StepResult.worst(StepResult.WARNINGS, StepResult.FAILURE));
        assertEquals(StepResult.SUCCESS, StepResult.worst(StepResult.SKIPPED, StepResult.SUCCESS));
        assertEquals(StepResult.EXCEPTION, StepResult.worst(StepResult.EXCEPTION, StepResult.FAILURE));
        assertEquals(StepResult.WARNINGS, StepResult.fromCode(1));
        assertNull(StepResult.fromCode(null));
    }
}
