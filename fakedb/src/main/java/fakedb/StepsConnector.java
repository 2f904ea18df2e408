package fakedb;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Access to the {@code steps} table. Lookups complete with {@code null} when no row matches and
 * mutators complete normally for unknown step ids; malformed arguments fail the returned future.
 */
public interface StepsConnector {
    CompletableFuture<StepModel> getStep(int stepId);

    /**
     * Finds a step of {@code buildId} by number, name or both.
     *
     * <p>Fails with {@link StepLookupException} when neither {@code number} nor {@code name} is given.
     */
    CompletableFuture<StepModel> getStepByBuild(int buildId, Integer number, String name);

    CompletableFuture<List<StepModel>> getSteps(int buildId);

    CompletableFuture<AddedStep> addStep(int buildId, String name, String stateString);

    CompletableFuture<Void> startStep(int stepId, double startedAt, boolean locksAcquired);

    CompletableFuture<Void> setStepLocksAcquiredAt(int stepId, double locksAcquiredAt);

    CompletableFuture<Void> setStepStateString(int stepId, String stateString);

    CompletableFuture<Void> addUrl(Integer stepId, String name, String url);

    CompletableFuture<Void> finishStep(int stepId, Integer results, boolean hidden);
}
