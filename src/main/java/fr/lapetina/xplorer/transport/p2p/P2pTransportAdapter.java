package fr.lapetina.xplorer.transport.p2p;

import fr.lapetina.xplorer.domain.model.Request;
import fr.lapetina.xplorer.domain.model.Response;
import fr.lapetina.xplorer.infrastructure.config.XplorerConfig;
import fr.lapetina.xplorer.infrastructure.metrics.XplorerMetrics;
import fr.lapetina.xplorer.routing.Router;
import fr.lapetina.xplorer.transport.AbstractTransportAdapter;
import fr.lapetina.xplorer.transport.TransportStartException;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http2.Http2FrameCodecBuilder;
import io.netty.handler.codec.http2.Http2MultiplexHandler;
import io.netty.handler.codec.http2.Http2StreamChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Peer-to-peer transport: persistent Ed25519 node identity, one long-lived HTTP/2
 * connection per peer and one stream per request.
 *
 * IDENTITY:
 *
 * With a storage path the secret key lives in {@value IdentityStore#KEY_FILE_NAME};
 * it is loaded on start, or generated and persisted when absent, corrupt, or when a
 * new identity is forced. Without a storage path the identity is ephemeral: a fresh
 * key per start, discarded on stop.
 *
 * START/STOP BRIDGING:
 *
 * Bringing the node online runs on its own single-thread executor; {@link #start()}
 * blocks on the resulting future and rethrows any failure as a
 * {@link TransportStartException}. {@link #stop()} first waits for a pending start,
 * then closes the listener, every connection and the event loops, waiting on each
 * close future before returning.
 *
 * LOCKING:
 *
 * Identity, listener, event loops, running flag and the pending start are read and
 * written under {@link #lock} only. Blocking waits happen outside of it.
 */
public final class P2pTransportAdapter extends AbstractTransportAdapter {

    private static final Logger log = LoggerFactory.getLogger(P2pTransportAdapter.class);

    public static final String NAME = "p2p";

    private static final long SHUTDOWN_TIMEOUT_MS = 5_000;

    private final IdentityStore store;
    private final String host;
    private final int port;
    private final long startupTimeoutMs;

    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private boolean forceNextStart;
    private byte[] importedEphemeralKey;
    private NodeIdentity identity;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup ioGroup;
    private ExecutorService handlerPool;
    private ConnectionTracker connections;
    private CompletableFuture<Void> startup;
    private boolean running;

    /**
     * @param storagePath      directory of the key file, {@code null} for an ephemeral identity
     * @param forceNewIdentity replace the stored key on the first start of this adapter
     * @param host             bind address
     * @param port             bind port, 0 for an ephemeral port
     * @param startupTimeoutMs maximum time {@link #start()} waits for the node to come online
     */
    public P2pTransportAdapter(Path storagePath, boolean forceNewIdentity, String host, int port,
                               long startupTimeoutMs) {
        this.store = storagePath != null ? new IdentityStore(storagePath) : null;
        this.forceNextStart = forceNewIdentity;
        this.host = host;
        this.port = port;
        this.startupTimeoutMs = startupTimeoutMs;
    }

    public P2pTransportAdapter(Path storagePath, boolean forceNewIdentity) {
        this(storagePath, forceNewIdentity, "127.0.0.1", 0, 30_000);
    }

    public P2pTransportAdapter(XplorerConfig.P2pConfig config) {
        this(config.getStoragePath() != null && !config.getStoragePath().isBlank()
                        ? Paths.get(config.getStoragePath())
                        : null,
                config.isForceNewIdentity(), config.getHost(), config.getPort(), config.getStartupTimeoutMs());
    }

    @Override
    public String name() {
        return NAME;
    }

    // ==================== LIFECYCLE ====================

    @Override
    public void start() throws TransportStartException {
        requireRouter();

        CompletableFuture<Void> attempt;
        lock.lock();
        try {
            if (running) {
                return;
            }
            if (startup != null) {
                attempt = startup;
            } else {
                attempt = new CompletableFuture<>();
                startup = attempt;
                launch(attempt, forceNextStart);
            }
        } finally {
            lock.unlock();
        }

        try {
            attempt.get(startupTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TransportStartException tse) {
                throw tse;
            }
            throw new TransportStartException("P2P transport failed to start: " + cause, cause);
        } catch (TimeoutException e) {
            abandon(attempt);
            throw new TransportStartException("P2P transport did not come online within " + startupTimeoutMs + "ms");
        } catch (InterruptedException e) {
            abandon(attempt);
            Thread.currentThread().interrupt();
            throw new TransportStartException("Interrupted while starting P2P transport", e);
        }
    }

    private void launch(CompletableFuture<Void> attempt, boolean force) {
        ExecutorService starter = Executors.newSingleThreadExecutor(new NamedThreadFactory("xplorer-p2p-start"));
        starter.execute(() -> {
            try {
                bringOnline(attempt, force);
                attempt.complete(null);
            } catch (Throwable t) {
                abandon(attempt);
                attempt.completeExceptionally(t);
            }
        });
        starter.shutdown();
    }

    /**
     * Resolves the identity, binds the listener and publishes the running state.
     * Runs on the start executor.
     */
    private void bringOnline(CompletableFuture<Void> attempt, boolean force) throws TransportStartException {
        NodeIdentity resolved = resolveIdentity(force);
        XplorerMetrics metrics = metrics();

        EventLoopGroup boss = new NioEventLoopGroup(1, new NamedThreadFactory("xplorer-p2p-boss"));
        EventLoopGroup io = new NioEventLoopGroup(0, new NamedThreadFactory("xplorer-p2p-io"));
        ExecutorService handlers = Executors.newCachedThreadPool(new NamedThreadFactory("xplorer-p2p-handler"));
        ConnectionTracker tracker = new ConnectionTracker(metrics);

        Channel channel;
        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(boss, io)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            tracker.register(ch);
                            ch.pipeline().addLast(Http2FrameCodecBuilder.forServer().build());
                            ch.pipeline().addLast(new Http2MultiplexHandler(new ChannelInitializer<Http2StreamChannel>() {
                                @Override
                                protected void initChannel(Http2StreamChannel stream) {
                                    stream.pipeline().addLast(
                                            new P2pStreamHandler(P2pTransportAdapter.this, resolved, handlers, metrics));
                                }
                            }));
                            ch.pipeline().addLast(tracker.errorHandler());
                        }
                    })
                    .option(ChannelOption.SO_BACKLOG, 128)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childOption(ChannelOption.TCP_NODELAY, true);

            // The node is online once the listener is bound
            channel = bootstrap.bind(new InetSocketAddress(host, port)).sync().channel();
        } catch (Exception e) {
            release(null, tracker, boss, io, handlers);
            throw new TransportStartException("Failed to bind P2P transport on " + host + ":" + port, e);
        }

        boolean abandoned = false;
        lock.lock();
        try {
            // start() may have given up on this attempt
            abandoned = startup != attempt;
            if (abandoned) {
                return;
            }
            this.identity = resolved;
            this.serverChannel = channel;
            this.bossGroup = boss;
            this.ioGroup = io;
            this.handlerPool = handlers;
            this.connections = tracker;
            this.forceNextStart = false;
            this.importedEphemeralKey = null;
            this.startup = null;
            this.running = true;
        } finally {
            lock.unlock();
            if (abandoned) {
                release(channel, tracker, boss, io, handlers);
            }
        }
        log.info("P2P transport online: nodeId={}, address={}", resolved.nodeId(), channel.localAddress());
    }

    private NodeIdentity resolveIdentity(boolean force) {
        if (store != null) {
            return store.loadOrCreate(force);
        }
        byte[] imported;
        lock.lock();
        try {
            imported = importedEphemeralKey;
        } finally {
            lock.unlock();
        }
        if (imported != null && !force) {
            return NodeIdentity.fromSecretKey(imported);
        }
        NodeIdentity generated = NodeIdentity.generate();
        log.info("Using ephemeral node identity {}", generated.nodeId());
        return generated;
    }

    private void abandon(CompletableFuture<Void> attempt) {
        lock.lock();
        try {
            if (startup == attempt) {
                startup = null;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns whether a start attempt is in flight.
     */
    boolean isStarting() {
        lock.lock();
        try {
            return startup != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void stop() {
        CompletableFuture<Void> pending;
        lock.lock();
        try {
            pending = startup;
        } finally {
            lock.unlock();
        }
        if (pending != null) {
            awaitPendingStart(pending);
        }

        Channel channel;
        ConnectionTracker tracker;
        EventLoopGroup boss;
        EventLoopGroup io;
        ExecutorService handlers;
        lock.lock();
        try {
            if (!running) {
                return;
            }
            running = false;
            channel = serverChannel;
            tracker = connections;
            boss = bossGroup;
            io = ioGroup;
            handlers = handlerPool;
            identity = null;
            serverChannel = null;
            connections = null;
            bossGroup = null;
            ioGroup = null;
            handlerPool = null;
        } finally {
            lock.unlock();
        }

        release(channel, tracker, boss, io, handlers);
        log.info("P2P transport stopped");
    }

    private void awaitPendingStart(CompletableFuture<Void> pending) {
        try {
            pending.get(startupTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            log.debug("Pending P2P start failed, nothing to stop: {}", e.getCause().toString());
        } catch (TimeoutException e) {
            log.warn("Pending P2P start still running after {}ms, abandoning it", startupTimeoutMs);
            abandon(pending);
        } catch (InterruptedException e) {
            abandon(pending);
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Closes listener, connections, event loops and handler pool, waiting on each.
     * Failures are logged.
     */
    private static void release(Channel channel, ConnectionTracker tracker, EventLoopGroup boss,
                                EventLoopGroup io, ExecutorService handlers) {
        if (channel != null && !channel.close().awaitUninterruptibly(SHUTDOWN_TIMEOUT_MS)) {
            log.warn("P2P listener did not close within {}ms", SHUTDOWN_TIMEOUT_MS);
        }
        if (tracker != null && !tracker.closeAll().awaitUninterruptibly(SHUTDOWN_TIMEOUT_MS)) {
            log.warn("{} P2P connections did not close within {}ms", tracker.size(), SHUTDOWN_TIMEOUT_MS);
        }
        shutdownGroup(boss);
        shutdownGroup(io);
        handlers.shutdown();
        try {
            if (!handlers.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("P2P handlers still running, interrupting");
                handlers.shutdownNow();
            }
        } catch (InterruptedException e) {
            handlers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static void shutdownGroup(EventLoopGroup group) {
        if (!group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly(SHUTDOWN_TIMEOUT_MS)) {
            log.warn("P2P event loop did not terminate within {}ms", SHUTDOWN_TIMEOUT_MS);
        }
    }

    @Override
    public boolean isRunning() {
        lock.lock();
        try {
            return running;
        } finally {
            lock.unlock();
        }
    }

    // ==================== REQUESTS ====================

    /**
     * Routes a request received on a stream; empty when no router is bound.
     */
    Optional<Response> route(Request request) {
        Optional<Router> router = router();
        return router.map(r -> dispatch(r, request));
    }

    // ==================== IDENTITY ====================

    /**
     * Node id of the running node.
     */
    public Optional<String> nodeId() {
        lock.lock();
        try {
            return Optional.ofNullable(identity).map(NodeIdentity::nodeId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Address peers dial to reach the running node.
     */
    public Optional<NodeAddr> nodeAddr() {
        String id;
        InetSocketAddress local;
        lock.lock();
        try {
            if (!running) {
                return Optional.empty();
            }
            id = identity.nodeId();
            local = (InetSocketAddress) serverChannel.localAddress();
        } finally {
            lock.unlock();
        }
        return Optional.of(new NodeAddr(id, directAddresses(local)));
    }

    /**
     * Storage directory of the key file, empty for an ephemeral identity.
     */
    public Optional<Path> storagePath() {
        return Optional.ofNullable(store).map(IdentityStore::directory);
    }

    /**
     * Secret key of the running node, else the stored or imported one.
     */
    public Optional<byte[]> exportSecretKey() {
        lock.lock();
        try {
            if (running) {
                return Optional.of(identity.secretKey());
            }
            if (store != null) {
                return store.read();
            }
            return Optional.ofNullable(importedEphemeralKey).map(byte[]::clone);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the identity used by the next start.
     *
     * @throws IdentityException if the adapter is running or starting, or the key is invalid
     */
    public void importSecretKey(byte[] secretKey) {
        NodeIdentity imported = NodeIdentity.fromSecretKey(secretKey);
        lock.lock();
        try {
            checkIdle("import a secret key");
            if (store != null) {
                store.write(imported.secretKey());
            } else {
                importedEphemeralKey = imported.secretKey();
            }
            forceNextStart = false;
        } finally {
            lock.unlock();
        }
        log.info("Imported node identity {}", imported.nodeId());
    }

    /**
     * Generates a fresh identity for the next start, overwriting the stored key.
     *
     * @return the new node id
     * @throws IdentityException if the adapter is running or starting
     */
    public String resetIdentity() {
        NodeIdentity fresh = NodeIdentity.generate();
        lock.lock();
        try {
            checkIdle("reset the identity");
            if (store != null) {
                store.write(fresh.secretKey());
            } else {
                importedEphemeralKey = fresh.secretKey();
            }
            forceNextStart = false;
        } finally {
            lock.unlock();
        }
        log.info("Node identity reset, next start uses {}", fresh.nodeId());
        return fresh.nodeId();
    }

    private void checkIdle(String operation) {
        if (running || startup != null) {
            throw new IdentityException("Cannot " + operation + " while the P2P transport is running");
        }
    }

    private static List<InetSocketAddress> directAddresses(InetSocketAddress local) {
        if (!local.getAddress().isAnyLocalAddress()) {
            return List.of(local);
        }
        List<InetSocketAddress> addresses = new ArrayList<>();
        addresses.add(new InetSocketAddress(InetAddress.getLoopbackAddress(), local.getPort()));
        try {
            for (NetworkInterface nif : Collections.list(NetworkInterface.getNetworkInterfaces())) {
                if (!nif.isUp() || nif.isLoopback()) {
                    continue;
                }
                for (InetAddress address : Collections.list(nif.getInetAddresses())) {
                    if (address instanceof Inet4Address) {
                        addresses.add(new InetSocketAddress(address, local.getPort()));
                    }
                }
            }
        } catch (SocketException e) {
            log.debug("Cannot list network interfaces, advertising loopback only: {}", e.getMessage());
        }
        return addresses;
    }

    /**
     * Thread factory naming threads {@code prefix-N}.
     */
    private static final class NamedThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        NamedThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
