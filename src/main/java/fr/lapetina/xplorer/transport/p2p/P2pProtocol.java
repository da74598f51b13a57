package fr.lapetina.xplorer.transport.p2p;

import java.nio.charset.StandardCharsets;

/**
 * Constants of the stream protocol shared by adapter and client.
 */
final class P2pProtocol {

    static final String PROTOCOL_ID = "app-xplorer/1";
    static final String PROTOCOL_PATH = "/" + PROTOCOL_ID;

    static final String NODE_ID_HEADER = "xplorer-node-id";
    static final String CHALLENGE_HEADER = "xplorer-challenge";
    static final String SIGNATURE_HEADER = "xplorer-signature";

    static final int CHALLENGE_LENGTH = 32;

    private P2pProtocol() {
    }

    /**
     * Bytes a node signs to answer {@code challenge}, prefixed with the protocol id.
     */
    static byte[] challengeMessage(String challenge) {
        return (PROTOCOL_ID + ":" + challenge).getBytes(StandardCharsets.UTF_8);
    }
}
