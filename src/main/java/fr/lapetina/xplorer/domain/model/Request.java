package fr.lapetina.xplorer.domain.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Transport-agnostic request routed to an endpoint handler.
 * Immutable and thread-safe: maps are copied on construction and the body is
 * copied both on the way in and on the way out.
 *
 * @param path        absolute endpoint path, e.g. {@code /files/list}
 * @param queryParams query parameters, keys unique
 * @param body        optional opaque payload, {@code null} when absent
 * @param metadata    transport headers and annotations
 */
public record Request(
        String path,
        Map<String, String> queryParams,
        byte[] body,
        Map<String, String> metadata
) {
    public Request {
        Objects.requireNonNull(path, "Path is required");
        if (!path.startsWith("/")) {
            throw new IllegalArgumentException("Path must be absolute: " + path);
        }
        queryParams = queryParams != null ? Map.copyOf(queryParams) : Map.of();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        body = body != null ? body.clone() : null;
    }

    /**
     * Creates a request with no query, body or metadata.
     */
    public static Request of(String path) {
        return new Request(path, null, null, null);
    }

    /**
     * Creates a request with query parameters only.
     */
    public static Request of(String path, Map<String, String> queryParams) {
        return new Request(path, queryParams, null, null);
    }

    @Override
    public byte[] body() {
        return body != null ? body.clone() : null;
    }

    public boolean hasBody() {
        return body != null;
    }

    /**
     * Returns the body decoded as UTF-8, or an empty string when absent.
     */
    public String bodyAsString() {
        return body != null ? new String(body, StandardCharsets.UTF_8) : "";
    }

    public Optional<String> queryParam(String name) {
        return Optional.ofNullable(queryParams.get(name));
    }

    /**
     * Returns a copy of this request addressed to another path.
     * Used when a parent router delegates to a mounted sub-router.
     */
    public Request withPath(String newPath) {
        return new Request(newPath, queryParams, body, metadata);
    }

    /**
     * Returns a copy of this request with one extra metadata entry.
     */
    public Request withMetadata(String key, String value) {
        Map<String, String> merged = new LinkedHashMap<>(metadata);
        merged.put(key, value);
        return new Request(path, queryParams, body, merged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Request other)) return false;
        return path.equals(other.path)
                && queryParams.equals(other.queryParams)
                && Arrays.equals(body, other.body)
                && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(path, queryParams, metadata);
        return 31 * result + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "Request[path=" + path
                + ", queryParams=" + queryParams
                + ", body=" + (body != null ? body.length + " bytes" : "none")
                + ", metadata=" + metadata + "]";
    }

    public static Builder builder(String path) {
        return new Builder(path);
    }

    public static final class Builder {
        private final String path;
        private final Map<String, String> queryParams = new LinkedHashMap<>();
        private final Map<String, String> metadata = new LinkedHashMap<>();
        private byte[] body;

        private Builder(String path) {
            this.path = path;
        }

        public Builder queryParam(String name, String value) {
            this.queryParams.put(name, value);
            return this;
        }

        public Builder queryParams(Map<String, String> params) {
            this.queryParams.putAll(params);
            return this;
        }

        public Builder metadata(String key, String value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, String> entries) {
            this.metadata.putAll(entries);
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder body(String body) {
            this.body = body.getBytes(StandardCharsets.UTF_8);
            return this;
        }

        public Request build() {
            return new Request(path, queryParams, body, metadata);
        }
    }
}
