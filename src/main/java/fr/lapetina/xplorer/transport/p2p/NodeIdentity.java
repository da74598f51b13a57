package fr.lapetina.xplorer.transport.p2p;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.spec.NamedParameterSpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Ed25519 node identity: a 32-byte secret key and the node id derived from it.
 * <p>
 * The node id is the lowercase hex form of the 32-byte public key. Peers prove
 * their identity by signing a challenge, see {@link #sign(byte[])} and
 * {@link #verify(String, byte[], byte[])}.
 */
public final class NodeIdentity {

    private static final Logger log = LoggerFactory.getLogger(NodeIdentity.class);

    public static final int SECRET_KEY_LENGTH = 32;
    public static final int PUBLIC_KEY_LENGTH = 32;

    private static final String ALGORITHM = "Ed25519";
    private static final HexFormat HEX = HexFormat.of();
    // DER header of an X.509 SubjectPublicKeyInfo holding a raw Ed25519 key
    private static final byte[] X509_PREFIX = HEX.parseHex("302a300506032b6570032100");

    private final byte[] secretKey;
    private final PrivateKey privateKey;
    private final String nodeId;

    private NodeIdentity(byte[] secretKey, PrivateKey privateKey, byte[] publicKey) {
        this.secretKey = secretKey;
        this.privateKey = privateKey;
        this.nodeId = HEX.formatHex(publicKey);
    }

    public static NodeIdentity generate(SecureRandom random) {
        byte[] seed = new byte[SECRET_KEY_LENGTH];
        random.nextBytes(seed);
        return fromSecretKey(seed);
    }

    public static NodeIdentity generate() {
        return generate(new SecureRandom());
    }

    /**
     * Rebuilds an identity from its secret key.
     *
     * @throws IdentityException if the key is not exactly {@value #SECRET_KEY_LENGTH} bytes
     */
    public static NodeIdentity fromSecretKey(byte[] secretKey) {
        if (secretKey == null || secretKey.length != SECRET_KEY_LENGTH) {
            throw new IdentityException("Secret key must be " + SECRET_KEY_LENGTH + " bytes, got "
                    + (secretKey == null ? "none" : secretKey.length));
        }
        byte[] seed = secretKey.clone();
        try {
            // The JDK generator draws the private key from the random source, so a
            // source replaying the seed yields the key pair of that seed.
            KeyPairGenerator generator = KeyPairGenerator.getInstance(ALGORITHM);
            generator.initialize(NamedParameterSpec.ED25519, new SeedRandom(seed));
            KeyPair pair = generator.generateKeyPair();
            byte[] encoded = pair.getPublic().getEncoded();
            byte[] publicKey = Arrays.copyOfRange(encoded, encoded.length - PUBLIC_KEY_LENGTH, encoded.length);
            return new NodeIdentity(seed, pair.getPrivate(), publicKey);
        } catch (GeneralSecurityException e) {
            throw new IdentityException("Ed25519 is not available", e);
        }
    }

    public String nodeId() {
        return nodeId;
    }

    /**
     * Returns a copy of the secret key.
     */
    public byte[] secretKey() {
        return secretKey.clone();
    }

    public byte[] sign(byte[] data) {
        try {
            Signature signature = Signature.getInstance(ALGORITHM);
            signature.initSign(privateKey);
            signature.update(data);
            return signature.sign();
        } catch (GeneralSecurityException e) {
            throw new IdentityException("Failed to sign with node identity", e);
        }
    }

    /**
     * Checks that {@code signature} was produced over {@code data} by the owner of {@code nodeId}.
     * Malformed node ids and signatures do not verify.
     */
    public static boolean verify(String nodeId, byte[] data, byte[] signature) {
        if (!isValidNodeId(nodeId) || signature == null) {
            return false;
        }
        byte[] der = new byte[X509_PREFIX.length + PUBLIC_KEY_LENGTH];
        System.arraycopy(X509_PREFIX, 0, der, 0, X509_PREFIX.length);
        System.arraycopy(HEX.parseHex(nodeId), 0, der, X509_PREFIX.length, PUBLIC_KEY_LENGTH);
        try {
            PublicKey publicKey = KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(der));
            Signature verifier = Signature.getInstance(ALGORITHM);
            verifier.initVerify(publicKey);
            verifier.update(data);
            return verifier.verify(signature);
        } catch (GeneralSecurityException e) {
            log.debug("Signature rejected for node {}: {}", nodeId, e.getMessage());
            return false;
        }
    }

    public static boolean isValidNodeId(String nodeId) {
        if (nodeId == null || nodeId.length() != PUBLIC_KEY_LENGTH * 2) {
            return false;
        }
        for (int i = 0; i < nodeId.length(); i++) {
            char c = nodeId.charAt(i);
            if (!(c >= '0' && c <= '9') && !(c >= 'a' && c <= 'f')) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "NodeIdentity[nodeId=" + nodeId + "]";
    }

    /**
     * Random source that hands out a fixed seed.
     */
    private static final class SeedRandom extends SecureRandom {
        private static final long serialVersionUID = 1L;

        private final byte[] seed;

        SeedRandom(byte[] seed) {
            this.seed = seed;
        }

        @Override
        public void nextBytes(byte[] bytes) {
            System.arraycopy(seed, 0, bytes, 0, Math.min(seed.length, bytes.length));
        }
    }
}
