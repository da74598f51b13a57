package fr.lapetina.xplorer.transport.p2p;

import fr.lapetina.xplorer.infrastructure.metrics.XplorerMetrics;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.ChannelGroupFuture;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live peer connections of one adapter run. Closed connections leave the group
 * on their own; {@link #closeAll()} closes the rest on stop.
 */
public final class ConnectionTracker {

    private static final Logger log = LoggerFactory.getLogger(ConnectionTracker.class);

    private final ChannelGroup connections = new DefaultChannelGroup("xplorer-p2p-connections",
            GlobalEventExecutor.INSTANCE);
    private final XplorerMetrics metrics;
    private final ChannelHandler errorHandler = new ConnectionErrorHandler();

    public ConnectionTracker(XplorerMetrics metrics) {
        this.metrics = metrics;
    }

    public void register(Channel connection) {
        connections.add(connection);
        metrics.connectionOpened();
        log.debug("Peer connected: {}", connection.remoteAddress());
        connection.closeFuture().addListener(f -> {
            metrics.connectionClosed();
            log.debug("Peer disconnected: {}", connection.remoteAddress());
        });
    }

    public int size() {
        return connections.size();
    }

    public ChannelGroupFuture closeAll() {
        return connections.close();
    }

    /**
     * Last handler of every connection pipeline: a connection-level failure closes that connection only.
     */
    public ChannelHandler errorHandler() {
        return errorHandler;
    }

    @ChannelHandler.Sharable
    private static final class ConnectionErrorHandler extends ChannelInboundHandlerAdapter {

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.warn("Closing peer connection {} after error: {}", ctx.channel().remoteAddress(), cause.toString());
            ctx.close();
        }
    }
}
