package fr.lapetina.xplorer.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseTest {

    @Nested
    @DisplayName("Factories")
    class Factories {

        @Test
        @DisplayName("should create text response")
        void shouldCreateText() {
            Response response = Response.text("Kyle");

            assertThat(response.status()).isEqualTo(ResponseStatus.OK);
            assertThat(response.contentType()).isEqualTo(ContentType.TEXT);
            assertThat(response.bodyAsString()).isEqualTo("Kyle");
            assertThat(response.isOk()).isTrue();
        }

        @Test
        @DisplayName("should serialize JSON with sorted keys")
        void shouldSerializeSortedJson() {
            Map<String, Object> value = new LinkedHashMap<>();
            value.put("b", 2);
            value.put("a", 1);

            Response response = Response.json(value);

            assertThat(response.contentType()).isEqualTo(ContentType.JSON);
            assertThat(response.bodyAsString().indexOf("\"a\""))
                    .isLessThan(response.bodyAsString().indexOf("\"b\""));
        }

        @Test
        @DisplayName("should fall back to empty object when value cannot be serialized")
        void shouldFallBackToEmptyObject() {
            Response response = Response.json(new Object());

            assertThat(response.status()).isEqualTo(ResponseStatus.OK);
            assertThat(response.bodyAsString()).isEqualTo("{}");
        }

        @Test
        @DisplayName("should wrap error messages in a JSON object")
        void shouldCreateErrors() {
            assertThat(Response.notFound("nope").status()).isEqualTo(ResponseStatus.NOT_FOUND);
            assertThat(Response.badRequest("bad").status()).isEqualTo(ResponseStatus.BAD_REQUEST);

            Response error = Response.error("boom");
            assertThat(error.status()).isEqualTo(ResponseStatus.INTERNAL_ERROR);
            assertThat(error.bodyAsString()).contains("\"error\"").contains("boom");
            assertThat(error.isOk()).isFalse();
        }

        @Test
        @DisplayName("should use empty body when none given")
        void shouldDefaultToEmptyBody() {
            Response response = new Response(ResponseStatus.OK, ContentType.BINARY, null);

            assertThat(response.body()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Codes and types")
    class CodesAndTypes {

        @Test
        @DisplayName("should map status codes")
        void shouldMapStatusCodes() {
            assertThat(ResponseStatus.OK.code()).isEqualTo(200);
            assertThat(ResponseStatus.BAD_REQUEST.code()).isEqualTo(400);
            assertThat(ResponseStatus.NOT_FOUND.code()).isEqualTo(404);
            assertThat(ResponseStatus.INTERNAL_ERROR.code()).isEqualTo(500);
            assertThat(ResponseStatus.fromCode(404)).isEqualTo(ResponseStatus.NOT_FOUND);
        }

        @Test
        @DisplayName("should resolve MIME types ignoring parameters and case")
        void shouldResolveMimeTypes() {
            assertThat(ContentType.fromMimeType("application/json")).isEqualTo(ContentType.JSON);
            assertThat(ContentType.fromMimeType("Text/Plain; charset=utf-8")).isEqualTo(ContentType.TEXT);
            assertThat(ContentType.fromMimeType("video/mp4")).isEqualTo(ContentType.BINARY);
            assertThat(ContentType.fromMimeType(null)).isEqualTo(ContentType.BINARY);
            assertThat(ContentType.PNG.mimeType()).isEqualTo("image/png");
        }
    }

    @Test
    @DisplayName("should compare bodies by content")
    void shouldCompareByContent() {
        assertThat(Response.text("a")).isEqualTo(Response.text("a"));
        assertThat(Response.text("a")).hasSameHashCodeAs(Response.text("a"));
        assertThat(Response.text("a")).isNotEqualTo(Response.text("b"));
    }
}
