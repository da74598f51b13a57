/**
 * Peer-to-peer transport over HTTP/2 with Ed25519 node identities.
 *
 * <p>Each node is addressed by a ticket {@code nodeId@host:port[,host:port...]}, where the
 * node id is the hex form of its Ed25519 public key. A client opens one long-lived
 * connection and one stream per request.
 *
 * <h2>Stream Protocol</h2>
 * <ul>
 *   <li>Request HEADERS carry {@code :path /app-xplorer/1} and a random {@code xplorer-challenge}</li>
 *   <li>Both directions carry a single frame: a 4-byte big-endian length followed by a JSON document</li>
 *   <li>Response HEADERS carry {@code xplorer-node-id} and the signature of {@code app-xplorer/1:<challenge>}</li>
 *   <li>Invalid frames and documents reset only their own stream</li>
 * </ul>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.xplorer.transport.p2p.P2pTransportAdapter} - Listener, identity and lifecycle</li>
 *   <li>{@link fr.lapetina.xplorer.transport.p2p.P2pClient} - Dials a ticket and verifies each response</li>
 *   <li>{@link fr.lapetina.xplorer.transport.p2p.IdentityStore} - Persistent secret key file</li>
 *   <li>{@link fr.lapetina.xplorer.transport.p2p.StreamFrame} - Length-prefixed framing</li>
 *   <li>{@link fr.lapetina.xplorer.transport.p2p.WireCodec} - JSON request and response documents</li>
 * </ul>
 */
package fr.lapetina.xplorer.transport.p2p;
