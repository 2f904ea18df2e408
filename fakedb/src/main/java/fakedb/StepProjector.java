package fakedb;

import java.time.Instant;
import java.util.Objects;

public final class StepProjector {
    private final UrlListCodec urlCodec;

    public StepProjector(UrlListCodec urlCodec) {
        this.urlCodec = Objects.requireNonNull(urlCodec, "urlCodec");
    }

    public StepModel toModel(StepRow row) {
        return new StepModel(
                row.id(),
                row.buildid(),
                row.number(),
                row.name(),
                toInstant(row.startedAt()),
                toInstant(row.locksAcquiredAt()),
                toInstant(row.completeAt()),
                row.stateString(),
                row.results(),
                urlCodec.decode(row.urlsJson()),
                row.hidden());
    }

    private static Instant toInstant(Double epochSeconds) {
        if (epochSeconds == null) {
            return null;
        }
        double whole = Math.floor(epochSeconds);
        long nanos = Math.round((epochSeconds - whole) * 1_000_000_000L);
        return Instant.ofEpochSecond((long) whole, nanos);
    }
}
