package examples.build;

@FunctionalInterface
public interface StepAction {
    StepOutcome run(int stepId) throws Exception;
}
