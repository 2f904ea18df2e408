package fakedb;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the {@code urls_json} column: a JSON array of {@code {"name", "url"}} objects.
 */
public final class UrlListCodec {
    private static final TypeReference<List<UrlModel>> URL_LIST = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public UrlListCodec() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String encode(List<UrlModel> urls) {
        try {
            return mapper.writeValueAsString(urls == null ? List.of() : urls);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize step urls", e);
        }
    }

    public List<UrlModel> decode(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            List<UrlModel> urls = mapper.readValue(json, URL_LIST);
            return urls == null ? new ArrayList<>() : new ArrayList<>(urls);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize step urls: " + json, e);
        }
    }

    /**
     * Returns the encoded list with {@code url} appended, or the same list re-encoded when an
     * identical pair is already present.
     */
    public String append(String json, UrlModel url) {
        List<UrlModel> urls = decode(json);
        if (!urls.contains(url)) {
            urls.add(url);
        }
        return encode(urls);
    }
}
