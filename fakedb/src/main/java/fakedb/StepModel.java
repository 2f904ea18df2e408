package fakedb;

import java.time.Instant;
import java.util.List;

public record StepModel(
        int id,
        int buildid,
        int number,
        String name,
        Instant startedAt,
        Instant locksAcquiredAt,
        Instant completeAt,
        String stateString,
        Integer results,
        List<UrlModel> urls,
        boolean hidden) {

    public StepModel {
        urls = urls == null ? List.of() : List.copyOf(urls);
    }
}
