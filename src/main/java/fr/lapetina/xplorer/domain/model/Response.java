package fr.lapetina.xplorer.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Transport-agnostic response produced by an endpoint handler.
 * Immutable and thread-safe.
 *
 * @param status      outcome of the call
 * @param contentType type of {@code body}
 * @param body        payload, never {@code null}
 */
public record Response(
        ResponseStatus status,
        ContentType contentType,
        byte[] body
) {
    private static final Logger log = LoggerFactory.getLogger(Response.class);

    private static final ObjectMapper JSON = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();

    private static final byte[] EMPTY_OBJECT = "{}".getBytes(StandardCharsets.UTF_8);

    public Response {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(contentType, "Content type is required");
        body = body != null ? body.clone() : new byte[0];
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public boolean isOk() {
        return status == ResponseStatus.OK;
    }

    // ==================== FACTORIES ====================

    /**
     * Serializes {@code value} with Jackson (pretty printed, keys sorted).
     * A value that cannot be serialized yields an empty JSON object.
     */
    public static Response json(Object value, ResponseStatus status) {
        byte[] bytes;
        try {
            bytes = JSON.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize JSON response of type {}", value.getClass().getName(), e);
            bytes = EMPTY_OBJECT;
        }
        return new Response(status, ContentType.JSON, bytes);
    }

    public static Response json(Object value) {
        return json(value, ResponseStatus.OK);
    }

    public static Response html(String html, ResponseStatus status) {
        return new Response(status, ContentType.HTML, html.getBytes(StandardCharsets.UTF_8));
    }

    public static Response html(String html) {
        return html(html, ResponseStatus.OK);
    }

    public static Response text(String text, ResponseStatus status) {
        return new Response(status, ContentType.TEXT, text.getBytes(StandardCharsets.UTF_8));
    }

    public static Response text(String text) {
        return text(text, ResponseStatus.OK);
    }

    public static Response png(byte[] data) {
        return new Response(ResponseStatus.OK, ContentType.PNG, data);
    }

    public static Response jpeg(byte[] data) {
        return new Response(ResponseStatus.OK, ContentType.JPEG, data);
    }

    public static Response binary(byte[] data) {
        return new Response(ResponseStatus.OK, ContentType.BINARY, data);
    }

    public static Response notFound(String message) {
        return json(Map.of("error", message), ResponseStatus.NOT_FOUND);
    }

    public static Response notFound() {
        return notFound("Not Found");
    }

    public static Response badRequest(String message) {
        return json(Map.of("error", message), ResponseStatus.BAD_REQUEST);
    }

    public static Response error(String message, ResponseStatus status) {
        return json(Map.of("error", message), status);
    }

    public static Response error(String message) {
        return error(message, ResponseStatus.INTERNAL_ERROR);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Response other)) return false;
        return status == other.status
                && contentType == other.contentType
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(status, contentType) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "Response[status=" + status + ", contentType=" + contentType
                + ", body=" + body.length + " bytes]";
    }
}
