package fr.lapetina.xplorer.transport.p2p;

import fr.lapetina.xplorer.domain.model.Request;
import fr.lapetina.xplorer.domain.model.Response;
import fr.lapetina.xplorer.infrastructure.metrics.XplorerMetrics;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http2.DefaultHttp2DataFrame;
import io.netty.handler.codec.http2.DefaultHttp2Headers;
import io.netty.handler.codec.http2.DefaultHttp2HeadersFrame;
import io.netty.handler.codec.http2.DefaultHttp2ResetFrame;
import io.netty.handler.codec.http2.Http2DataFrame;
import io.netty.handler.codec.http2.Http2Error;
import io.netty.handler.codec.http2.Http2Headers;
import io.netty.handler.codec.http2.Http2HeadersFrame;
import io.netty.handler.codec.http2.Http2ResetFrame;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Base64;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Serves exactly one request on one inbound stream.
 *
 * STREAM LIFECYCLE:
 *
 * 1. HEADERS must address {@link P2pProtocol#PROTOCOL_PATH}; anything else resets the stream.
 * 2. DATA is fed into a {@link FrameAccumulator}; an invalid prefix resets the stream at once.
 * 3. A complete frame is decoded and routed on the handler pool, never on the event loop.
 * 4. The response goes out as HEADERS carrying the node id and challenge signature,
 *    then one framed DATA with END_STREAM.
 *
 * Protocol violations reset the stream without a response; a response that cannot be
 * encoded or signed resets it with INTERNAL_ERROR. Nothing here touches the
 * parent connection, so other streams keep flowing.
 */
final class P2pStreamHandler extends ChannelInboundHandlerAdapter {

    private static final Logger log = LoggerFactory.getLogger(P2pStreamHandler.class);

    private final P2pTransportAdapter adapter;
    private final NodeIdentity identity;
    private final Executor handlerPool;
    private final XplorerMetrics metrics;
    private final FrameAccumulator accumulator = new FrameAccumulator();

    private String challenge;
    private boolean headersReceived;
    private boolean finished;

    P2pStreamHandler(P2pTransportAdapter adapter, NodeIdentity identity, Executor handlerPool, XplorerMetrics metrics) {
        this.adapter = adapter;
        this.identity = identity;
        this.handlerPool = handlerPool;
        this.metrics = metrics;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        try {
            if (finished) {
                return;
            }
            if (msg instanceof Http2HeadersFrame headersFrame) {
                onHeaders(ctx, headersFrame);
            } else if (msg instanceof Http2DataFrame dataFrame) {
                onData(ctx, dataFrame);
            }
        } catch (ProtocolException e) {
            reset(ctx, e.getMessage());
        } finally {
            ReferenceCountUtil.release(msg);
        }
    }

    private void onHeaders(ChannelHandlerContext ctx, Http2HeadersFrame frame) {
        if (headersReceived) {
            throw new ProtocolException("Unexpected trailing headers");
        }
        headersReceived = true;

        Http2Headers headers = frame.headers();
        CharSequence path = headers.path();
        if (path == null || !P2pProtocol.PROTOCOL_PATH.contentEquals(path)) {
            throw new ProtocolException("Unsupported protocol: " + path);
        }
        CharSequence challengeHeader = headers.get(P2pProtocol.CHALLENGE_HEADER);
        challenge = challengeHeader != null ? challengeHeader.toString() : null;

        if (frame.isEndStream()) {
            accumulator.finish();
        }
    }

    private void onData(ChannelHandlerContext ctx, Http2DataFrame frame) {
        if (!headersReceived) {
            throw new ProtocolException("DATA before HEADERS");
        }
        boolean complete = accumulator.feed(frame.content());
        if (complete) {
            finished = true;
            route(ctx.channel(), accumulator.finish());
        } else if (frame.isEndStream()) {
            accumulator.finish();
        }
    }

    private void route(Channel stream, byte[] payload) {
        Request request = WireCodec.decodeRequest(payload)
                .withMetadata("transport", P2pTransportAdapter.NAME)
                .withMetadata("peer", String.valueOf(stream.parent().remoteAddress()));

        try {
            handlerPool.execute(() -> respond(stream, request));
        } catch (RejectedExecutionException e) {
            log.warn("P2P handler pool rejected request for {}: adapter stopping", request.path());
            metrics.incrementStreamCount("dropped");
            stream.writeAndFlush(new DefaultHttp2ResetFrame(Http2Error.REFUSED_STREAM))
                    .addListener(ChannelFutureListener.CLOSE);
        }
    }

    private void respond(Channel stream, Request request) {
        try {
            writeResponse(stream, request);
        } catch (RuntimeException e) {
            log.error("Failed to answer P2P request for {}, resetting stream", request.path(), e);
            metrics.incrementStreamCount("internal_error");
            stream.writeAndFlush(new DefaultHttp2ResetFrame(Http2Error.INTERNAL_ERROR))
                    .addListener(ChannelFutureListener.CLOSE);
        }
    }

    /**
     * Encodes and signs before anything is written, so a failure leaves the stream
     * untouched and resettable.
     */
    private void writeResponse(Channel stream, Request request) {
        Optional<Response> response = adapter.route(request);
        if (response.isEmpty()) {
            log.error("No router bound, dropping P2P request for {}", request.path());
            metrics.incrementStreamCount("dropped");
            stream.writeAndFlush(new DefaultHttp2ResetFrame(Http2Error.REFUSED_STREAM))
                    .addListener(ChannelFutureListener.CLOSE);
            return;
        }

        Http2Headers headers = new DefaultHttp2Headers()
                .status("200")
                .set(P2pProtocol.NODE_ID_HEADER, identity.nodeId());
        if (challenge != null) {
            byte[] signature = identity.sign(P2pProtocol.challengeMessage(challenge));
            headers.set(P2pProtocol.SIGNATURE_HEADER, Base64.getEncoder().encodeToString(signature));
        }

        byte[] frame = StreamFrame.encode(WireCodec.encodeResponse(response.get()));
        stream.write(new DefaultHttp2HeadersFrame(headers));
        stream.writeAndFlush(new DefaultHttp2DataFrame(Unpooled.wrappedBuffer(frame), true))
                .addListener(f -> {
                    if (f.isSuccess()) {
                        metrics.incrementStreamCount("ok");
                        log.debug("P2P response sent: path={}, status={}", request.path(), response.get().status());
                    } else {
                        metrics.incrementStreamCount("io_error");
                        log.debug("Failed to write P2P response for {}: {}", request.path(), f.cause().toString());
                    }
                });
    }

    private void reset(ChannelHandlerContext ctx, String reason) {
        finished = true;
        log.warn("Resetting P2P stream from {}: {}", ctx.channel().parent().remoteAddress(), reason);
        metrics.incrementStreamCount("protocol_error");
        ctx.writeAndFlush(new DefaultHttp2ResetFrame(Http2Error.CANCEL))
                .addListener(ChannelFutureListener.CLOSE);
    }

    /**
     * Resets arrive as user events, outside of flow control.
     */
    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) {
        if (evt instanceof Http2ResetFrame resetFrame) {
            if (!finished) {
                metrics.incrementStreamCount("reset_by_peer");
            }
            finished = true;
            log.debug("Stream reset by peer: errorCode={}", resetFrame.errorCode());
            return;
        }
        ctx.fireUserEventTriggered(evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("P2P stream failed: {}", cause.toString());
        if (!finished) {
            metrics.incrementStreamCount("io_error");
        }
        finished = true;
        ctx.close();
    }
}
