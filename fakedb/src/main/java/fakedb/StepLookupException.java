package fakedb;

public final class StepLookupException extends IllegalArgumentException {
    public StepLookupException(String message) {
        super(message);
    }
}
