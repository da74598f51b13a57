package fr.lapetina.xplorer.transport.p2p;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentityStoreTest {

    @TempDir
    Path tempDir;

    private IdentityStore store;

    @BeforeEach
    void setUp() {
        store = new IdentityStore(tempDir.resolve("agent"));
    }

    @Test
    @DisplayName("should create and persist identity on first load")
    void shouldCreateOnFirstLoad() {
        assertThat(store.exists()).isFalse();

        NodeIdentity identity = store.loadOrCreate(false);

        assertThat(store.exists()).isTrue();
        assertThat(store.keyFile().getFileName().toString()).isEqualTo(IdentityStore.KEY_FILE_NAME);
        assertThat(store.read()).hasValueSatisfying(key -> assertThat(key).isEqualTo(identity.secretKey()));
    }

    @Test
    @DisplayName("should reload the same identity")
    void shouldReloadSameIdentity() {
        NodeIdentity first = store.loadOrCreate(false);

        NodeIdentity second = new IdentityStore(tempDir.resolve("agent")).loadOrCreate(false);

        assertThat(second.nodeId()).isEqualTo(first.nodeId());
    }

    @Test
    @DisplayName("should replace identity when forced")
    void shouldReplaceWhenForced() {
        NodeIdentity first = store.loadOrCreate(false);

        NodeIdentity forced = store.loadOrCreate(true);

        assertThat(forced.nodeId()).isNotEqualTo(first.nodeId());
        assertThat(store.loadOrCreate(false).nodeId()).isEqualTo(forced.nodeId());
    }

    @Test
    @DisplayName("should regenerate when the key file is corrupt")
    void shouldRegenerateWhenCorrupt() throws Exception {
        Files.createDirectories(store.directory());
        Files.write(store.keyFile(), new byte[]{1, 2, 3});

        assertThat(store.read()).isEmpty();
        NodeIdentity identity = store.loadOrCreate(false);

        assertThat(Files.size(store.keyFile())).isEqualTo(NodeIdentity.SECRET_KEY_LENGTH);
        assertThat(store.loadOrCreate(false).nodeId()).isEqualTo(identity.nodeId());
    }

    @Test
    @DisplayName("should delete key file")
    void shouldDelete() {
        store.loadOrCreate(false);

        assertThat(store.delete()).isTrue();
        assertThat(store.delete()).isFalse();
        assertThat(store.exists()).isFalse();
    }

    @Test
    @DisplayName("should refuse to write key of wrong size")
    void shouldRefuseWrongSize() {
        assertThatThrownBy(() -> store.write(new byte[16])).isInstanceOf(IdentityException.class);
    }
}
