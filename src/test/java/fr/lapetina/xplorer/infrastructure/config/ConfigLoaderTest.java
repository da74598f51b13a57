package fr.lapetina.xplorer.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static XplorerConfig parse(String yaml) {
        return new ConfigLoader("unused.yaml")
                .loadFromStream(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("should load configuration from classpath")
        void shouldLoadFromClasspath() {
            XplorerConfig config = new ConfigLoader("test-config.yaml").load();

            assertThat(config.getServer().getDescription()).isEqualTo("Test Server");
            assertThat(config.getHttp().getPort()).isZero();
            assertThat(config.getHttp().getStopDelaySeconds()).isZero();
            assertThat(config.getP2p().isEnabled()).isFalse();
            assertThat(config.getP2p().getStartupTimeoutMs()).isEqualTo(5000);
            assertThat(config.getDispatch().getRingBufferSize()).isEqualTo(64);
            assertThat(config.getDispatch().getWaitStrategy()).isEqualTo("sleeping");
            assertThat(config.getDispatch().getTimeoutMs()).isEqualTo(2000);
            assertThat(config.getMetrics().getPrefix()).isEqualTo("xplorer_test");
        }

        @Test
        @DisplayName("should prefer file system over classpath")
        void shouldLoadFromFile(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("test-config.yaml");
            Files.writeString(file, "server:\n  description: \"From file\"\n");

            XplorerConfig config = new ConfigLoader(file.toString()).load();

            assertThat(config.getServer().getDescription()).isEqualTo("From file");
        }

        @Test
        @DisplayName("should keep defaults for omitted sections")
        void shouldKeepDefaults() {
            XplorerConfig config = parse("http:\n  port: 9090\n");

            assertThat(config.getHttp().getPort()).isEqualTo(9090);
            assertThat(config.getHttp().getHost()).isEqualTo("127.0.0.1");
            assertThat(config.getServer().getDescription()).isEqualTo("Xplorer Debug Server");
            assertThat(config.getP2p().isEnabled()).isFalse();
            assertThat(config.getP2p().getStoragePath()).isNull();
            assertThat(config.getDispatch().getWaitStrategy()).isEqualTo("blocking");
            assertThat(config.getMetrics().isEnabled()).isTrue();
        }

        @Test
        @DisplayName("should yield defaults for empty document")
        void shouldYieldDefaultsForEmptyDocument() {
            XplorerConfig config = parse("");

            assertThat(config.getHttp().getPort()).isEqualTo(8080);
        }

        @Test
        @DisplayName("should fail when file is missing")
        void shouldFailWhenMissing() {
            assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        @DisplayName("should fail on unknown property")
        void shouldFailOnUnknownProperty() {
            assertThatThrownBy(() -> parse("http:\n  colour: blue\n"))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("should reject ring buffer size that is not a power of 2")
        void shouldRejectRingBufferSize() {
            assertThatThrownBy(() -> parse("dispatch:\n  ringBufferSize: 1000\n"))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("ringBufferSize");
        }

        @Test
        @DisplayName("should reject negative dispatch timeout")
        void shouldRejectNegativeTimeout() {
            assertThatThrownBy(() -> parse("dispatch:\n  timeoutMs: -1\n"))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class);
        }

        @Test
        @DisplayName("should reject port out of range")
        void shouldRejectPort() {
            assertThatThrownBy(() -> parse("p2p:\n  port: 70000\n"))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("p2p.port");
        }

        @Test
        @DisplayName("should reject non-positive startup timeout")
        void shouldRejectStartupTimeout() {
            assertThatThrownBy(() -> parse("p2p:\n  startupTimeoutMs: 0\n"))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class);
        }
    }
}
