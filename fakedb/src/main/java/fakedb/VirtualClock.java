package fakedb;

/**
 * Time source for the fake tables, in fractional epoch seconds. Only the test harness moves it
 * forward.
 */
public final class VirtualClock {
    private double seconds;

    public VirtualClock() {
        this(0.0);
    }

    public VirtualClock(double startSeconds) {
        this.seconds = startSeconds;
    }

    public double seconds() {
        return seconds;
    }

    public void advance(double deltaSeconds) {
        if (deltaSeconds < 0) {
            throw new IllegalArgumentException("Virtual time cannot move backwards: " + deltaSeconds);
        }
        seconds += deltaSeconds;
    }

    public void setSeconds(double seconds) {
        this.seconds = seconds;
    }
}
