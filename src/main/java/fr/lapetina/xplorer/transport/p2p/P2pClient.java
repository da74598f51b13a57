package fr.lapetina.xplorer.transport.p2p;

import fr.lapetina.xplorer.domain.model.Request;
import fr.lapetina.xplorer.domain.model.Response;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http2.DefaultHttp2DataFrame;
import io.netty.handler.codec.http2.DefaultHttp2Headers;
import io.netty.handler.codec.http2.DefaultHttp2HeadersFrame;
import io.netty.handler.codec.http2.Http2DataFrame;
import io.netty.handler.codec.http2.Http2FrameCodecBuilder;
import io.netty.handler.codec.http2.Http2Headers;
import io.netty.handler.codec.http2.Http2HeadersFrame;
import io.netty.handler.codec.http2.Http2MultiplexHandler;
import io.netty.handler.codec.http2.Http2ResetFrame;
import io.netty.handler.codec.http2.Http2StreamChannel;
import io.netty.handler.codec.http2.Http2StreamChannelBootstrap;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Client side of the P2P transport.
 * <p>
 * Keeps one connection to a node and opens one stream per request. Every response
 * must come from the dialed node id and carry a valid signature over the random
 * challenge sent with the request.
 *
 * <pre>{@code
 * try (P2pClient client = P2pClient.connect(NodeAddr.parse(ticket))) {
 *     Response response = client.send(Request.of("/echo", Map.of("name", "Kyle")));
 * }
 * }</pre>
 */
public final class P2pClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(P2pClient.class);

    public static final long DEFAULT_TIMEOUT_MS = 30_000;

    private final NodeAddr target;
    private final EventLoopGroup group;
    private final Channel connection;
    private final long timeoutMs;
    private final SecureRandom random = new SecureRandom();

    private P2pClient(NodeAddr target, EventLoopGroup group, Channel connection, long timeoutMs) {
        this.target = target;
        this.group = group;
        this.connection = connection;
        this.timeoutMs = timeoutMs;
    }

    public static P2pClient connect(NodeAddr target) {
        return connect(target, DEFAULT_TIMEOUT_MS);
    }

    /**
     * Dials the node's direct addresses in order until one accepts.
     *
     * @throws P2pClientException if no address accepts the connection
     */
    public static P2pClient connect(NodeAddr target, long timeoutMs) {
        EventLoopGroup group = new NioEventLoopGroup(1);
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeoutMs, Integer.MAX_VALUE))
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(Http2FrameCodecBuilder.forClient().build());
                        // Nodes never open streams towards clients
                        ch.pipeline().addLast(new Http2MultiplexHandler(new RejectPushHandler()));
                    }
                });

        Throwable lastFailure = null;
        for (InetSocketAddress address : target.directAddresses()) {
            ChannelFuture future = bootstrap.connect(address).awaitUninterruptibly();
            if (future.isSuccess()) {
                log.debug("Connected to node {} at {}", target.nodeId(), address);
                return new P2pClient(target, group, future.channel(), timeoutMs);
            }
            lastFailure = future.cause();
            log.debug("Cannot reach node {} at {}: {}", target.nodeId(), address, String.valueOf(lastFailure));
        }
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        throw new P2pClientException("Cannot connect to node " + target.nodeId(), lastFailure);
    }

    public NodeAddr target() {
        return target;
    }

    public boolean isConnected() {
        return connection.isActive();
    }

    /**
     * Sends a request on a new stream and waits for the response.
     *
     * @throws P2pClientException on timeout, stream reset, or an unverified peer
     */
    public Response send(Request request) {
        return await(sendAsync(request));
    }

    public CompletableFuture<Response> sendAsync(Request request) {
        return sendRaw(StreamFrame.encode(WireCodec.encodeRequest(request)));
    }

    /**
     * Sends {@code bytes} verbatim as the stream body, without adding a length prefix.
     */
    public CompletableFuture<Response> sendRaw(byte[] bytes) {
        CompletableFuture<Response> result = new CompletableFuture<>();
        byte[] challengeBytes = new byte[P2pProtocol.CHALLENGE_LENGTH];
        random.nextBytes(challengeBytes);
        String challenge = Base64.getEncoder().encodeToString(challengeBytes);

        new Http2StreamChannelBootstrap(connection)
                .handler(new ResponseHandler(result, challenge))
                .open()
                .addListener(f -> {
                    if (!f.isSuccess()) {
                        result.completeExceptionally(new P2pClientException("Cannot open stream", f.cause()));
                        return;
                    }
                    Http2StreamChannel stream = (Http2StreamChannel) f.getNow();
                    Http2Headers headers = new DefaultHttp2Headers()
                            .method("POST")
                            .scheme("http")
                            .authority(target.nodeId())
                            .path(P2pProtocol.PROTOCOL_PATH)
                            .set(P2pProtocol.CHALLENGE_HEADER, challenge);
                    stream.write(new DefaultHttp2HeadersFrame(headers));
                    stream.writeAndFlush(new DefaultHttp2DataFrame(Unpooled.wrappedBuffer(bytes), true))
                            .addListener(w -> {
                                if (!w.isSuccess()) {
                                    result.completeExceptionally(
                                            new P2pClientException("Failed to send request", w.cause()));
                                }
                            });
                    result.whenComplete((r, t) -> {
                        if (t != null) {
                            stream.close();
                        }
                    });
                });

        return result.orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    private Response await(CompletableFuture<Response> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof P2pClientException pce) {
                throw pce;
            }
            if (cause instanceof TimeoutException) {
                throw new P2pClientException("No response within " + timeoutMs + "ms", cause);
            }
            throw new P2pClientException("P2P request failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new P2pClientException("Interrupted while waiting for response", e);
        }
    }

    @Override
    public void close() {
        connection.close().awaitUninterruptibly(5, TimeUnit.SECONDS);
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly(5, TimeUnit.SECONDS);
    }

    /**
     * Reads the response of one stream and checks who sent it.
     */
    private final class ResponseHandler extends ChannelInboundHandlerAdapter {
        private final CompletableFuture<Response> result;
        private final String challenge;
        private final FrameAccumulator accumulator = new FrameAccumulator();
        private boolean verified;

        ResponseHandler(CompletableFuture<Response> result, String challenge) {
            this.result = result;
            this.challenge = challenge;
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) {
            try {
                if (result.isDone()) {
                    return;
                }
                if (msg instanceof Http2HeadersFrame headersFrame) {
                    verify(headersFrame.headers());
                    if (headersFrame.isEndStream()) {
                        fail(ctx, new P2pClientException("Stream finished without a response"));
                    }
                } else if (msg instanceof Http2DataFrame dataFrame) {
                    if (!verified) {
                        throw new P2pClientException("Response data before headers");
                    }
                    accumulator.feed(dataFrame.content());
                    if (dataFrame.isEndStream()) {
                        result.complete(WireCodec.decodeResponse(accumulator.finish()));
                    }
                }
            } catch (P2pClientException e) {
                fail(ctx, e);
            } catch (ProtocolException e) {
                fail(ctx, new P2pClientException("Malformed response: " + e.getMessage(), e));
            } finally {
                ReferenceCountUtil.release(msg);
            }
        }

        private void verify(Http2Headers headers) {
            CharSequence status = headers.status();
            if (status == null || !"200".contentEquals(status)) {
                throw new P2pClientException("Unexpected stream status " + status);
            }
            CharSequence nodeId = headers.get(P2pProtocol.NODE_ID_HEADER);
            if (nodeId == null || !target.nodeId().contentEquals(nodeId)) {
                throw new P2pClientException("Expected node " + target.nodeId() + " but reached " + nodeId);
            }
            CharSequence signature = headers.get(P2pProtocol.SIGNATURE_HEADER);
            byte[] signatureBytes;
            try {
                signatureBytes = signature != null ? Base64.getDecoder().decode(signature.toString()) : null;
            } catch (IllegalArgumentException e) {
                throw new P2pClientException("Malformed signature from node " + nodeId, e);
            }
            if (!NodeIdentity.verify(target.nodeId(), P2pProtocol.challengeMessage(challenge), signatureBytes)) {
                throw new P2pClientException("Node " + nodeId + " failed to prove its identity");
            }
            verified = true;
        }

        private void fail(ChannelHandlerContext ctx, P2pClientException e) {
            result.completeExceptionally(e);
            ctx.close();
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) {
            if (evt instanceof Http2ResetFrame resetFrame) {
                result.completeExceptionally(new P2pClientException(
                        "Stream reset by node, error code " + resetFrame.errorCode()));
                return;
            }
            ctx.fireUserEventTriggered(evt);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            result.completeExceptionally(new P2pClientException("Stream closed before a response"));
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            fail(ctx, new P2pClientException("Stream failed", cause));
        }
    }

    /**
     * Resets any stream a node tries to open towards the client.
     */
    @ChannelHandler.Sharable
    private static final class RejectPushHandler extends ChannelInboundHandlerAdapter {

        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            ctx.close();
        }
    }
}
