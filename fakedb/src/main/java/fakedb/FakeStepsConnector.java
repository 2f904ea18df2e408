package fakedb;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link StepsConnector} for tests. Every call runs on the caller's thread before the
 * returned future is handed back; the futures only keep the calling convention of a real backend.
 * Instances are not thread safe.
 */
public final class FakeStepsConnector implements StepsConnector {
    private static final Logger log = LoggerFactory.getLogger(FakeStepsConnector.class);
    private static final Executor CALLER_THREAD = Runnable::run;

    private final Map<Integer, StepRow> steps = new LinkedHashMap<>();
    private final VirtualClock clock;
    private final FakeDbConfig config;
    private final UrlListCodec urlCodec;
    private final StepProjector projector;
    private final IdentifierValidator nameValidator;

    public FakeStepsConnector(VirtualClock clock) {
        this(clock, FakeDbConfig.DEFAULTS);
    }

    public FakeStepsConnector(VirtualClock clock, FakeDbConfig config) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.config = Objects.requireNonNull(config, "config");
        this.urlCodec = new UrlListCodec();
        this.projector = new StepProjector(urlCodec);
        this.nameValidator = new IdentifierValidator(config.maxNameLength());
    }

    public void insertTestData(Collection<StepRow> rows) {
        for (StepRow row : rows) {
            StepRow stored = row.copy();
            if (stored.id == null) {
                stored.id = newId();
            }
            steps.put(stored.id, stored);
        }
        log.debug("Preloaded {} step rows", rows.size());
    }

    @Override
    public CompletableFuture<StepModel> getStep(int stepId) {
        return call(() -> {
            StepRow row = steps.get(stepId);
            return row == null ? null : projector.toModel(row);
        });
    }

    @Override
    public CompletableFuture<StepModel> getStepByBuild(int buildId, Integer number, String name) {
        return call(() -> {
            if (number == null && name == null) {
                throw new StepLookupException("Looking up a step by build requires a number or a name");
            }
            for (StepRow row : steps.values()) {
                if (row.buildid != buildId) {
                    continue;
                }
                if (number != null && row.number != number) {
                    continue;
                }
                if (name != null && !name.equals(row.name)) {
                    continue;
                }
                return projector.toModel(row);
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<List<StepModel>> getSteps(int buildId) {
        return call(() -> stepsOf(buildId).stream()
                .sorted(Comparator.comparingInt(StepRow::number))
                .map(projector::toModel)
                .toList());
    }

    @Override
    public CompletableFuture<AddedStep> addStep(int buildId, String name, String stateString) {
        return call(() -> {
            StringValidator.INSTANCE.validate("state_string", stateString);
            nameValidator.validate("name", name);

            List<StepRow> buildSteps = stepsOf(buildId);
            int number = 0;
            String uniqueName = name;
            if (!buildSteps.isEmpty()) {
                number = Math.addExact(buildSteps.stream().mapToInt(StepRow::number).max().getAsInt(), 1);
                uniqueName = disambiguate(name, buildSteps);
            }

            int id = newId();
            steps.put(id, StepRow.created(id, buildId, number, uniqueName, stateString));
            log.debug("Added step id={} buildid={} number={} name={}", id, buildId, number, uniqueName);
            return new AddedStep(id, number, uniqueName);
        });
    }

    @Override
    public CompletableFuture<Void> startStep(int stepId, double startedAt, boolean locksAcquired) {
        return call(() -> {
            StepRow row = steps.get(stepId);
            if (row != null) {
                row.startedAt = startedAt;
                if (locksAcquired) {
                    row.locksAcquiredAt = startedAt;
                }
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> setStepLocksAcquiredAt(int stepId, double locksAcquiredAt) {
        return call(() -> {
            StepRow row = steps.get(stepId);
            if (row != null) {
                row.locksAcquiredAt = locksAcquiredAt;
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> setStepStateString(int stepId, String stateString) {
        return call(() -> {
            StringValidator.INSTANCE.validate("state_string", stateString);
            StepRow row = steps.get(stepId);
            if (row != null) {
                row.stateString = stateString;
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> addUrl(Integer stepId, String name, String url) {
        return call(() -> {
            IntValidator.INSTANCE.validate("stepid", stepId);
            nameValidator.validate("name", name);
            StringValidator.INSTANCE.validate("url", url);
            StepRow row = steps.get(stepId);
            if (row != null) {
                row.urlsJson = urlCodec.append(row.urlsJson, new UrlModel(name, url));
                log.debug("Step {} urls now {}", stepId, row.urlsJson);
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> finishStep(int stepId, Integer results, boolean hidden) {
        return call(() -> {
            double now = clock.seconds();
            StepRow row = steps.get(stepId);
            if (row != null) {
                row.completeAt = now;
                row.results = results;
                row.hidden = hidden;
                log.debug("Finished step {} at {} with results={} hidden={}", stepId, now, results, hidden);
            }
            return null;
        });
    }

    private List<StepRow> stepsOf(int buildId) {
        List<StepRow> matching = new ArrayList<>();
        for (StepRow row : steps.values()) {
            if (row.buildid == buildId) {
                matching.add(row);
            }
        }
        return matching;
    }

    private static String disambiguate(String name, List<StepRow> buildSteps) {
        Set<String> names = new HashSet<>();
        for (StepRow row : buildSteps) {
            names.add(row.name);
        }
        if (!names.contains(name)) {
            return name;
        }
        int suffix = 1;
        while (names.contains(name + "_" + suffix)) {
            suffix++;
        }
        return name + "_" + suffix;
    }

    private int newId() {
        int id = config.firstStepId();
        while (steps.containsKey(id)) {
            id++;
        }
        return id;
    }

    private static <T> CompletableFuture<T> call(Supplier<T> operation) {
        return CompletableFuture.supplyAsync(operation, CALLER_THREAD);
    }
}
