package fr.lapetina.xplorer.infrastructure.metrics;

import fr.lapetina.xplorer.domain.model.ResponseStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class XplorerMetricsTest {

    private XplorerMetrics metrics;

    @BeforeEach
    void setUp() {
        metrics = new XplorerMetrics("test");
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should count requests per transport and status")
    void shouldCountRequests() {
        metrics.incrementRequestCount("http", ResponseStatus.OK);
        metrics.incrementRequestCount("http", ResponseStatus.OK);
        metrics.incrementRequestCount("p2p", ResponseStatus.NOT_FOUND);

        assertThat(metrics.getRegistry().get("test_requests_total")
                .tag("transport", "http").tag("status", "200").counter().count()).isEqualTo(2.0);
        assertThat(metrics.getRegistry().get("test_requests_total")
                .tag("transport", "p2p").tag("status", "404").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should track active connections")
    void shouldTrackConnections() {
        metrics.connectionOpened();
        metrics.connectionOpened();
        metrics.connectionClosed();

        assertThat(metrics.getActiveConnections()).isEqualTo(1);
        assertThat(metrics.getRegistry().get("test_p2p_connections_active").gauge().value()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should record dispatch latency per placement")
    void shouldRecordDispatch() {
        metrics.recordDispatch(true, TimeUnit.MILLISECONDS.toNanos(5));
        metrics.recordDispatch(false, TimeUnit.MILLISECONDS.toNanos(1));

        assertThat(metrics.getRegistry().get("test_dispatch_latency").tag("affinity", "true").timer().count())
                .isEqualTo(1);
        assertThat(metrics.getRegistry().get("test_dispatch_latency").tag("affinity", "false").timer().count())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("should expose counters in Prometheus format")
    void shouldScrape() {
        metrics.incrementStreamCount("ok");

        assertThat(metrics.scrape())
                .contains("test_p2p_streams_total")
                .contains("outcome=\"ok\"")
                .contains("jvm_memory_used_bytes");
    }

    @Test
    @DisplayName("should scrape nothing when disabled")
    void shouldScrapeNothingWhenDisabled() {
        XplorerMetrics disabled = XplorerMetrics.disabled();
        disabled.incrementStreamCount("ok");

        assertThat(disabled.scrape()).isEmpty();
        assertThat(disabled.getRegistry().get("xplorer_p2p_streams_total").counter().count()).isEqualTo(1.0);
    }
}
