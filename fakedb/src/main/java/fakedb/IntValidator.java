package fakedb;

public final class IntValidator implements Validator {
    public static final IntValidator INSTANCE = new IntValidator();

    @Override
    public void validate(String field, Object value) {
        if (!(value instanceof Integer || value instanceof Long)) {
            throw new ValidationException(field, value, "not an integer");
        }
    }
}
