package fakedb;

import java.util.Objects;

public record UrlModel(String name, String url) {
    public UrlModel {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(url, "url");
    }
}
