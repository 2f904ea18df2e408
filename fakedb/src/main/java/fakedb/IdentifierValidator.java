package fakedb;

import java.util.regex.Pattern;

public final class IdentifierValidator implements Validator {
    private static final Pattern IDENTIFIER_PATTERN =
            Pattern.compile("^[a-zA-Z\\u00a0-\\x{10FFFF}_-][a-zA-Z0-9\\u00a0-\\x{10FFFF}_-]*$");

    private final int maxLength;

    public IdentifierValidator(int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
        }
        this.maxLength = maxLength;
    }

    @Override
    public void validate(String field, Object value) {
        if (!(value instanceof String identifier)) {
            throw new ValidationException(field, value, "not an identifier string");
        }
        if (identifier.codePointCount(0, identifier.length()) > maxLength) {
            throw new ValidationException(field, value, "longer than " + maxLength + " characters");
        }
        if (!IDENTIFIER_PATTERN.matcher(identifier).matches()) {
            throw new ValidationException(field, value, "not an identifier");
        }
    }
}
