package fr.lapetina.xplorer.transport.p2p;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeIdentityTest {

    private static final byte[] MESSAGE = "app-xplorer/1:challenge".getBytes(StandardCharsets.UTF_8);

    @Test
    @DisplayName("should derive 64 lowercase hex node id")
    void shouldDeriveNodeId() {
        NodeIdentity identity = NodeIdentity.generate();

        assertThat(identity.nodeId()).hasSize(64).matches("[0-9a-f]+");
        assertThat(NodeIdentity.isValidNodeId(identity.nodeId())).isTrue();
    }

    @Test
    @DisplayName("should rebuild the same identity from its secret key")
    void shouldRebuildFromSecretKey() {
        NodeIdentity identity = NodeIdentity.generate();

        NodeIdentity rebuilt = NodeIdentity.fromSecretKey(identity.secretKey());

        assertThat(rebuilt.nodeId()).isEqualTo(identity.nodeId());
        assertThat(rebuilt.secretKey()).isEqualTo(identity.secretKey());
    }

    @Test
    @DisplayName("should match the RFC 8032 Ed25519 test vector")
    void shouldMatchRfc8032Vector() {
        HexFormat hex = HexFormat.of();
        NodeIdentity identity = NodeIdentity.fromSecretKey(
                hex.parseHex("9d61b19deffd5a60ba844af492ec2cc44449c5697b326919703bac031cae7f60"));

        assertThat(identity.nodeId())
                .isEqualTo("d75a980182b10ab7d54bfed3c964073a0ee172f3daa62325af021a68f707511a");
        assertThat(hex.formatHex(identity.sign(new byte[0]))).isEqualTo(
                "e5564300c360ac729086e2cc806e828a84877f1eb8e5d974d873e065"
                        + "224901555fb8821590a33bacc61e39701cf9b46bd25bf5f0595bbe24655141438e7a100b");
    }

    @Test
    @DisplayName("should produce different identities for different keys")
    void shouldDiffer() {
        assertThat(NodeIdentity.generate().nodeId()).isNotEqualTo(NodeIdentity.generate().nodeId());
    }

    @Test
    @DisplayName("should verify own signature only")
    void shouldVerifySignature() {
        NodeIdentity identity = NodeIdentity.generate();
        NodeIdentity other = NodeIdentity.generate();
        byte[] signature = identity.sign(MESSAGE);

        assertThat(NodeIdentity.verify(identity.nodeId(), MESSAGE, signature)).isTrue();
        assertThat(NodeIdentity.verify(other.nodeId(), MESSAGE, signature)).isFalse();
        assertThat(NodeIdentity.verify(identity.nodeId(), "tampered".getBytes(StandardCharsets.UTF_8), signature))
                .isFalse();
        assertThat(NodeIdentity.verify(identity.nodeId(), MESSAGE, new byte[3])).isFalse();
        assertThat(NodeIdentity.verify(identity.nodeId(), MESSAGE, null)).isFalse();
    }

    @Test
    @DisplayName("should reject secret key of wrong size")
    void shouldRejectWrongKeySize() {
        assertThatThrownBy(() -> NodeIdentity.fromSecretKey(new byte[31])).isInstanceOf(IdentityException.class);
        assertThatThrownBy(() -> NodeIdentity.fromSecretKey(null)).isInstanceOf(IdentityException.class);
    }

    @Test
    @DisplayName("should not expose the secret key array")
    void shouldCopySecretKey() {
        NodeIdentity identity = NodeIdentity.generate();
        byte[] copy = identity.secretKey();
        copy[0] ^= 1;

        assertThat(identity.secretKey()).isNotEqualTo(copy);
    }

    @Test
    @DisplayName("should validate node id format")
    void shouldValidateNodeId() {
        assertThat(NodeIdentity.isValidNodeId(null)).isFalse();
        assertThat(NodeIdentity.isValidNodeId("abc")).isFalse();
        assertThat(NodeIdentity.isValidNodeId("A".repeat(64))).isFalse();
        assertThat(NodeIdentity.isValidNodeId("0".repeat(64))).isTrue();
    }
}
