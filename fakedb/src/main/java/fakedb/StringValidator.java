package fakedb;

public final class StringValidator implements Validator {
    public static final StringValidator INSTANCE = new StringValidator();

    @Override
    public void validate(String field, Object value) {
        if (!(value instanceof String)) {
            throw new ValidationException(field, value, "not a string");
        }
    }
}
