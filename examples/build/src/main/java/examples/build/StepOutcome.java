package examples.build;

import fakedb.UrlModel;

import java.util.List;
import java.util.Objects;

public record StepOutcome(StepResult result, List<UrlModel> urls, boolean hidden) {
    public StepOutcome {
        Objects.requireNonNull(result, "result");
        urls = urls == null ? List.of() : List.copyOf(urls);
    }

    public static StepOutcome of(StepResult result) {
        return new StepOutcome(result, List.of(), false);
    }

    public static StepOutcome success(UrlModel... urls) {
        return new StepOutcome(StepResult.SUCCESS, List.of(urls), false);
    }

    public static StepOutcome skipped() {
        return of(StepResult.SKIPPED);
    }

    public StepOutcome asHidden() {
        return new StepOutcome(result, urls, true);
    }
}
