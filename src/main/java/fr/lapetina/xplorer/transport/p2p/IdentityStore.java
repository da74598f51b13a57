package fr.lapetina.xplorer.transport.p2p;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;

/**
 * Persists a node's secret key in {@value #KEY_FILE_NAME} inside a storage directory.
 * <p>
 * A key file of the wrong size is treated as absent and replaced by a fresh key.
 * Writes go through a temporary file and an atomic move, readable by the owner only
 * where the file system supports POSIX permissions.
 */
public final class IdentityStore {

    private static final Logger log = LoggerFactory.getLogger(IdentityStore.class);

    public static final String KEY_FILE_NAME = "xplorer-identity.key";

    private final Path directory;
    private final Path keyFile;

    public IdentityStore(Path directory) {
        this.directory = directory;
        this.keyFile = directory.resolve(KEY_FILE_NAME);
    }

    public Path directory() {
        return directory;
    }

    public Path keyFile() {
        return keyFile;
    }

    public boolean exists() {
        return Files.isRegularFile(keyFile);
    }

    /**
     * Returns the stored key, or empty when the file is missing, unreadable or corrupt.
     */
    public Optional<byte[]> read() {
        if (!exists()) {
            return Optional.empty();
        }
        try {
            byte[] key = Files.readAllBytes(keyFile);
            if (key.length != NodeIdentity.SECRET_KEY_LENGTH) {
                log.warn("Ignoring corrupt identity file {}: {} bytes instead of {}",
                        keyFile, key.length, NodeIdentity.SECRET_KEY_LENGTH);
                return Optional.empty();
            }
            return Optional.of(key);
        } catch (IOException e) {
            log.warn("Ignoring unreadable identity file {}", keyFile, e);
            return Optional.empty();
        }
    }

    /**
     * Replaces the stored key.
     *
     * @throws IdentityException if the key has the wrong size or cannot be written
     */
    public void write(byte[] secretKey) {
        if (secretKey == null || secretKey.length != NodeIdentity.SECRET_KEY_LENGTH) {
            throw new IdentityException("Secret key must be " + NodeIdentity.SECRET_KEY_LENGTH + " bytes");
        }
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, KEY_FILE_NAME, ".tmp");
            try {
                restrictToOwner(temp);
                Files.write(temp, secretKey);
                try {
                    Files.move(temp, keyFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, keyFile, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new IdentityException("Failed to write identity file " + keyFile, e);
        }
        log.debug("Identity written to {}", keyFile);
    }

    /**
     * @return whether a key file was deleted
     */
    public boolean delete() {
        try {
            return Files.deleteIfExists(keyFile);
        } catch (IOException e) {
            throw new IdentityException("Failed to delete identity file " + keyFile, e);
        }
    }

    /**
     * Loads the stored identity, or generates and persists a new one when none is
     * stored, the stored one is corrupt, or {@code forceNew} is set.
     */
    public NodeIdentity loadOrCreate(boolean forceNew) {
        if (!forceNew) {
            Optional<byte[]> stored = read();
            if (stored.isPresent()) {
                NodeIdentity identity = NodeIdentity.fromSecretKey(stored.get());
                log.info("Loaded node identity {} from {}", identity.nodeId(), keyFile);
                return identity;
            }
        }
        NodeIdentity identity = NodeIdentity.generate();
        write(identity.secretKey());
        log.info("Created {}node identity {} in {}", forceNew ? "forced new " : "", identity.nodeId(), keyFile);
        return identity;
    }

    private static void restrictToOwner(Path file) throws IOException {
        if (file.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        }
    }
}
