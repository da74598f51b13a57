package fr.lapetina.xplorer.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestTest {

    @Test
    @DisplayName("should build request with query, metadata and body")
    void shouldBuildRequest() {
        Request request = Request.builder("/echo")
                .queryParam("name", "Kyle")
                .metadata("transport", "http")
                .body("hello")
                .build();

        assertThat(request.path()).isEqualTo("/echo");
        assertThat(request.queryParam("name")).contains("Kyle");
        assertThat(request.queryParam("missing")).isEmpty();
        assertThat(request.metadata()).containsEntry("transport", "http");
        assertThat(request.hasBody()).isTrue();
        assertThat(request.bodyAsString()).isEqualTo("hello");
    }

    @Test
    @DisplayName("should distinguish absent body from empty body")
    void shouldDistinguishAbsentBody() {
        Request absent = Request.of("/a");
        Request empty = Request.builder("/a").body(new byte[0]).build();

        assertThat(absent.hasBody()).isFalse();
        assertThat(absent.body()).isNull();
        assertThat(absent.bodyAsString()).isEmpty();
        assertThat(empty.hasBody()).isTrue();
        assertThat(empty.body()).isEmpty();
        assertThat(absent).isNotEqualTo(empty);
    }

    @Test
    @DisplayName("should reject relative path")
    void shouldRejectRelativePath() {
        assertThatThrownBy(() -> Request.of("echo"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should not expose internal body array")
    void shouldCopyBody() {
        byte[] bytes = "abc".getBytes(StandardCharsets.UTF_8);
        Request request = Request.builder("/a").body(bytes).build();

        bytes[0] = 'x';
        request.body()[1] = 'y';

        assertThat(request.bodyAsString()).isEqualTo("abc");
    }

    @Test
    @DisplayName("should keep everything but the path when re-addressed")
    void shouldReplacePath() {
        Request request = Request.builder("/files/list")
                .queryParam("dir", "tmp")
                .metadata("peer", "abc")
                .body("x")
                .build();

        Request moved = request.withPath("/list");

        assertThat(moved.path()).isEqualTo("/list");
        assertThat(moved.queryParams()).isEqualTo(Map.of("dir", "tmp"));
        assertThat(moved.metadata()).isEqualTo(request.metadata());
        assertThat(moved.bodyAsString()).isEqualTo("x");
    }

    @Test
    @DisplayName("should add metadata without touching the original")
    void shouldAddMetadata() {
        Request request = Request.of("/a");

        Request annotated = request.withMetadata("transport", "p2p");

        assertThat(annotated.metadata()).containsEntry("transport", "p2p");
        assertThat(request.metadata()).isEmpty();
    }
}
