package fakedb;

public final class ValidationException extends IllegalArgumentException {
    private final String field;

    public ValidationException(String field, Object value, String reason) {
        super("Invalid value for " + field + ": " + describe(value) + " (" + reason + ")");
        this.field = field;
    }

    public String field() {
        return field;
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String text) {
            return "'" + text + "'";
        }
        return value + " <" + value.getClass().getSimpleName() + ">";
    }
}
