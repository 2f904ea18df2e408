package examples.build;

import fakedb.AddedStep;
import fakedb.StepsConnector;
import fakedb.UrlModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the steps of one build in order and records each of them through a {@link StepsConnector}.
 *
 * <p>Once a step marked {@code haltOnFailure} fails, the remaining steps are still added to the
 * build but finished as {@link StepResult#SKIPPED} without running. A step whose outcome cannot be
 * recorded, for example because it carries an invalid URL name, is finished as
 * {@link StepResult#EXCEPTION} and the build goes on.
 */
public final class BuildStepRunner {
    private static final Logger log = LoggerFactory.getLogger(BuildStepRunner.class);

    private final StepsConnector steps;
    private final DoubleSupplier clock;

    public BuildStepRunner(StepsConnector steps, DoubleSupplier clock) {
        this.steps = Objects.requireNonNull(steps, "steps");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CompletableFuture<BuildResult> run(int buildId, List<StepDefinition> definitions) {
        Objects.requireNonNull(definitions, "definitions");
        RunState state = new RunState();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (StepDefinition definition : definitions) {
            chain = chain.thenCompose(ignored -> runStep(buildId, definition, state));
        }
        return chain.thenApply(ignored -> new BuildResult(buildId, state.added, state.result));
    }

    public BuildResult runAndWait(int buildId, List<StepDefinition> definitions) throws Exception {
        return await(run(buildId, definitions));
    }

    private CompletableFuture<Void> runStep(int buildId, StepDefinition definition, RunState state) {
        return steps.addStep(buildId, definition.name(), "pending").thenCompose(added -> {
            state.added.add(added);
            if (state.halted) {
                log.info("Skipping step {} of build {} after an earlier failure", added.name(), buildId);
                return record(added, StepOutcome.skipped())
                        .thenAccept(outcome -> state.result = StepResult.worst(state.result, outcome.result()));
            }
            return steps.startStep(added.id(), clock.getAsDouble(), definition.needsLocks())
                    .thenCompose(ignored -> steps.setStepStateString(added.id(), added.name() + " running"))
                    .thenApply(ignored -> execute(added, definition))
                    .thenCompose(outcome -> record(added, outcome))
                    .thenAccept(outcome -> {
                        state.result = StepResult.worst(state.result, outcome.result());
                        if (definition.haltOnFailure() && outcome.result().isFailure()) {
                            state.halted = true;
                        }
                    });
        });
    }

    private StepOutcome execute(AddedStep added, StepDefinition definition) {
        try {
            StepOutcome outcome = definition.action().run(added.id());
            return outcome == null ? StepOutcome.of(StepResult.SUCCESS) : outcome;
        } catch (Exception e) {
            log.warn("Step {} (id={}) raised an exception", added.name(), added.id(), e);
            return StepOutcome.of(StepResult.EXCEPTION);
        }
    }

    private CompletableFuture<StepOutcome> record(AddedStep added, StepOutcome outcome) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (UrlModel url : outcome.urls()) {
            chain = chain.thenCompose(ignored -> steps.addUrl(added.id(), url.name(), url.url()));
        }
        return chain
                .thenCompose(ignored -> finish(added, outcome))
                .exceptionallyCompose(failure -> {
                    if (outcome.result() == StepResult.EXCEPTION) {
                        return CompletableFuture.failedFuture(failure);
                    }
                    log.warn("Could not record step {} (id={}), finishing it as exception",
                            added.name(), added.id(), unwrap(failure));
                    return finish(added, StepOutcome.of(StepResult.EXCEPTION));
                });
    }

    private CompletableFuture<StepOutcome> finish(AddedStep added, StepOutcome outcome) {
        return steps.setStepStateString(added.id(), added.name() + " " + outcome.result().label())
                .thenCompose(ignored -> steps.finishStep(added.id(), outcome.result().code(), outcome.hidden()))
                .thenApply(ignored -> {
                    log.debug("Step {} (id={}) finished {}", added.name(), added.id(), outcome.result());
                    return outcome;
                });
    }

    private static Throwable unwrap(Throwable failure) {
        return failure instanceof CompletionException && failure.getCause() != null ? failure.getCause() : failure;
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof Exception checked) {
                throw checked;
            }
            throw e;
        }
    }

    private static final class RunState {
        private final List<AddedStep> added = new ArrayList<>();
        private StepResult result = StepResult.SUCCESS;
        private boolean halted;
    }
}
