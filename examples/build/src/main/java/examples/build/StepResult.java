package examples.build;

public enum StepResult {
    SUCCESS(0, "passed"),
    WARNINGS(1, "warnings"),
    FAILURE(2, "failed"),
    SKIPPED(3, "skipped"),
    EXCEPTION(4, "exception");

    private static final StepResult[] WORST_FIRST = {EXCEPTION, FAILURE, WARNINGS, SUCCESS, SKIPPED};

    private final int code;
    private final String label;

    StepResult(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public int code() {
        return code;
    }

    public String label() {
        return label;
    }

    public boolean isFailure() {
        return this == FAILURE || this == EXCEPTION;
    }

    public static StepResult fromCode(Integer code) {
        if (code == null) {
            return null;
        }
        for (StepResult result : values()) {
            if (result.code == code) {
                return result;
            }
        }
        throw new IllegalArgumentException("Unknown step result code: " + code);
    }

    public static StepResult worst(StepResult a, StepResult b) {
        for (StepResult candidate : WORST_FIRST) {
            if (candidate == a || candidate == b) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("No result given");
    }
}
