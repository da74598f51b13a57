package fr.lapetina.xplorer.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.xplorer.domain.model.ContentType;
import fr.lapetina.xplorer.domain.model.Request;
import fr.lapetina.xplorer.domain.model.Response;
import fr.lapetina.xplorer.domain.model.ResponseStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IndexEndpointTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private Router root;

    @BeforeEach
    void setUp() {
        root = new Router("Xplorer Debug Server");
        IndexEndpoint.register(root);
        root.register("/echo", "Echoes the name", request -> Response.text("x"));

        Router files = Router.withIndex("File browser");
        files.register("/list", "Lists files", request -> Response.text("files"));
        root.mount("/files", files);
        root.freeze();
    }

    private JsonNode index(Request request) throws Exception {
        Response response = root.handle(request);
        assertThat(response.status()).isEqualTo(ResponseStatus.OK);
        assertThat(response.contentType()).isEqualTo(ContentType.JSON);
        return mapper.readTree(response.body());
    }

    @Test
    @DisplayName("should describe every endpoint with absolute paths")
    void shouldDescribeEndpoints() throws Exception {
        JsonNode doc = index(Request.of("/"));

        assertThat(doc.get("path").asText()).isEqualTo("/");
        assertThat(doc.get("description").asText()).isEqualTo("Xplorer Debug Server");
        assertThat(doc.get("endpointCount").asInt()).isEqualTo(4);

        JsonNode index = doc.get("endpoints").get(0);
        assertThat(index.get("path").asText()).isEqualTo("/");
        assertThat(index.get("runsOnMainThread").asBoolean()).isFalse();
        assertThat(index.get("parameters").get(0).get("name").asText()).isEqualTo("depth");

        JsonNode echo = doc.get("endpoints").get(1);
        assertThat(echo.get("path").asText()).isEqualTo("/echo");
        assertThat(echo.has("parameters")).isFalse();

        JsonNode files = doc.get("routers").get(0);
        assertThat(files.get("path").asText()).isEqualTo("/files");
        assertThat(files.get("endpoints")).extracting(e -> e.get("path").asText())
                .containsExactly("/files/", "/files/list");
    }

    @Test
    @DisplayName("should summarize sub-routers when depth is shallow")
    void shouldSummarizeWhenShallow() throws Exception {
        JsonNode shallow = index(Request.of("/", Map.of("depth", "SHALLOW")));

        JsonNode files = shallow.get("routers").get(0);
        assertThat(files.get("path").asText()).isEqualTo("/files");
        assertThat(files.get("description").asText()).isEqualTo("File browser");
        assertThat(files.get("endpointCount").asInt()).isEqualTo(2);
        assertThat(files.has("endpoints")).isFalse();
    }

    @Test
    @DisplayName("should produce no larger document when shallow")
    void shallowShouldNotExceedFull() {
        Response full = root.handle(Request.of("/"));
        Response shallow = root.handle(Request.of("/", Map.of("depth", "shallow")));

        assertThat(shallow.body().length).isLessThanOrEqualTo(full.body().length);
    }

    @Test
    @DisplayName("should treat unknown depth as full")
    void shouldTreatUnknownDepthAsFull() {
        Response full = root.handle(Request.of("/"));
        Response other = root.handle(Request.of("/", Map.of("depth", "whatever")));

        assertThat(other).isEqualTo(full);
    }

    @Test
    @DisplayName("should answer sub-router index with and without trailing slash")
    void shouldAnswerSubRouterIndex() throws Exception {
        JsonNode bare = index(Request.of("/files"));
        JsonNode slash = index(Request.of("/files/"));

        assertThat(bare).isEqualTo(slash);
        assertThat(bare.get("path").asText()).isEqualTo("/files");
        assertThat(bare.get("endpointCount").asInt()).isEqualTo(2);
    }
}
