package fr.lapetina.xplorer.transport.p2p;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeAddrTest {

    private static final String NODE_ID = "ab".repeat(32);

    @Test
    @DisplayName("should format ticket with every address")
    void shouldFormatTicket() {
        NodeAddr addr = new NodeAddr(NODE_ID, List.of(
                new InetSocketAddress("127.0.0.1", 4000),
                new InetSocketAddress("::1", 4001)));

        assertThat(addr.toTicket()).isEqualTo(NODE_ID + "@127.0.0.1:4000,[0:0:0:0:0:0:0:1]:4001");
    }

    @Test
    @DisplayName("should parse ticket")
    void shouldParseTicket() {
        NodeAddr addr = NodeAddr.parse(NODE_ID + "@127.0.0.1:4000,[::1]:4001");

        assertThat(addr.nodeId()).isEqualTo(NODE_ID);
        assertThat(addr.directAddresses()).extracting(InetSocketAddress::getPort).containsExactly(4000, 4001);
        assertThat(addr.directAddresses().get(1).getAddress().isLoopbackAddress()).isTrue();
    }

    @Test
    @DisplayName("should reject malformed tickets")
    void shouldRejectMalformed() {
        assertThatThrownBy(() -> NodeAddr.parse("127.0.0.1:4000"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NodeAddr.parse("nothex@127.0.0.1:4000"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NodeAddr.parse(NODE_ID + "@127.0.0.1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NodeAddr.parse(NODE_ID + "@127.0.0.1:port"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NodeAddr.parse(NODE_ID + "@"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
