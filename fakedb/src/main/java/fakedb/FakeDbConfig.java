package fakedb;

public record FakeDbConfig(int firstStepId, int maxNameLength) {
    public static final FakeDbConfig DEFAULTS = new FakeDbConfig(100, 50);

    public FakeDbConfig {
        if (firstStepId < 0) {
            throw new IllegalArgumentException("firstStepId must not be negative: " + firstStepId);
        }
        if (maxNameLength <= 0) {
            throw new IllegalArgumentException("maxNameLength must be positive: " + maxNameLength);
        }
    }
}
