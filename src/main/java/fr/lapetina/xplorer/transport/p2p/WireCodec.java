package fr.lapetina.xplorer.transport.p2p;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.xplorer.domain.model.ContentType;
import fr.lapetina.xplorer.domain.model.Request;
import fr.lapetina.xplorer.domain.model.Response;
import fr.lapetina.xplorer.domain.model.ResponseStatus;

import java.io.IOException;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON wire documents exchanged inside stream frames.
 *
 * <pre>
 * request:  { "path": string, "query"?: {string:string}, "metadata"?: {string:string}, "body"?: base64 }
 * response: { "status": int, "content_type": string, "body": base64 }
 * </pre>
 */
public final class WireCodec {

    static final String PATH = "path";
    static final String QUERY = "query";
    static final String METADATA = "metadata";
    static final String BODY = "body";
    static final String STATUS = "status";
    static final String CONTENT_TYPE = "content_type";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private WireCodec() {
    }

    // ==================== REQUEST ====================

    public static byte[] encodeRequest(Request request) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(PATH, request.path());
        if (!request.queryParams().isEmpty()) {
            ObjectNode query = node.putObject(QUERY);
            request.queryParams().forEach(query::put);
        }
        if (!request.metadata().isEmpty()) {
            ObjectNode metadata = node.putObject(METADATA);
            request.metadata().forEach(metadata::put);
        }
        if (request.hasBody()) {
            node.put(BODY, Base64.getEncoder().encodeToString(request.body()));
        }
        return write(node);
    }

    /**
     * @throws ProtocolException if the payload is not a valid request document
     */
    public static Request decodeRequest(byte[] payload) {
        JsonNode root = read(payload);

        JsonNode path = root.get(PATH);
        if (path == null || !path.isTextual()) {
            throw new ProtocolException("Missing or non-string 'path'");
        }
        if (!path.asText().startsWith("/")) {
            throw new ProtocolException("Path must be absolute: " + path.asText());
        }

        Request.Builder builder = Request.builder(path.asText())
                .queryParams(stringMap(root, QUERY))
                .metadata(stringMap(root, METADATA));

        JsonNode body = root.get(BODY);
        if (body != null && !body.isNull()) {
            builder.body(base64(body, BODY));
        }
        return builder.build();
    }

    // ==================== RESPONSE ====================

    public static byte[] encodeResponse(Response response) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(STATUS, response.status().code());
        node.put(CONTENT_TYPE, response.contentType().mimeType());
        node.put(BODY, Base64.getEncoder().encodeToString(response.body()));
        return write(node);
    }

    /**
     * Unknown status codes decode as {@link ResponseStatus#INTERNAL_ERROR},
     * unknown content types as {@link ContentType#BINARY}.
     *
     * @throws ProtocolException if the payload is not a valid response document
     */
    public static Response decodeResponse(byte[] payload) {
        JsonNode root = read(payload);

        JsonNode status = root.get(STATUS);
        if (status == null || !status.isInt()) {
            throw new ProtocolException("Missing or non-integer 'status'");
        }
        JsonNode contentType = root.get(CONTENT_TYPE);
        if (contentType == null || !contentType.isTextual()) {
            throw new ProtocolException("Missing or non-string 'content_type'");
        }
        JsonNode body = root.get(BODY);
        byte[] bytes = body == null || body.isNull() ? new byte[0] : base64(body, BODY);

        return new Response(
                ResponseStatus.fromCode(status.asInt()),
                ContentType.fromMimeType(contentType.asText()),
                bytes);
    }

    // ==================== HELPERS ====================

    private static byte[] write(JsonNode node) {
        try {
            return MAPPER.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            // A tree of strings and ints always serializes
            throw new IllegalStateException("Failed to encode wire document", e);
        }
    }

    private static JsonNode read(byte[] payload) {
        JsonNode root;
        try {
            root = MAPPER.readTree(payload);
        } catch (IOException e) {
            throw new ProtocolException("Malformed JSON document: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException("Wire document must be a JSON object");
        }
        return root;
    }

    private static Map<String, String> stringMap(JsonNode root, String field) {
        JsonNode node = root.get(field);
        Map<String, String> map = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return map;
        }
        if (!node.isObject()) {
            throw new ProtocolException("'" + field + "' must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!entry.getValue().isTextual()) {
                throw new ProtocolException("'" + field + "." + entry.getKey() + "' must be a string");
            }
            map.put(entry.getKey(), entry.getValue().asText());
        }
        return map;
    }

    private static byte[] base64(JsonNode node, String field) {
        if (!node.isTextual()) {
            throw new ProtocolException("'" + field + "' must be a base64 string");
        }
        try {
            return Base64.getDecoder().decode(node.asText());
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("'" + field + "' is not valid base64", e);
        }
    }
}
