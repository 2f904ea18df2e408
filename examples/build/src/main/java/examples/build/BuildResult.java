package examples.build;

import fakedb.AddedStep;

import java.util.List;

public record BuildResult(int buildId, List<AddedStep> steps, StepResult result) {
    public BuildResult {
        steps = List.copyOf(steps);
    }
}
