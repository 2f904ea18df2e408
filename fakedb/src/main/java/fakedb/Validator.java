package fakedb;

@FunctionalInterface
public interface Validator {
    /**
     * Checks the shape of a caller supplied value.
     *
     * @throws ValidationException when the value does not match
     */
    void validate(String field, Object value);
}
