package examples.build;

import java.util.Objects;

public record StepDefinition(String name, boolean needsLocks, boolean haltOnFailure, StepAction action) {
    public StepDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(action, "action");
    }

    public static StepDefinition of(String name, StepAction action) {
        return new StepDefinition(name, false, false, action);
    }
}
