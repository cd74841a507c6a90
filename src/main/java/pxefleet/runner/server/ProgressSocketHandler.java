package pxefleet.runner.server;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pxefleet.runner.events.ChannelGroupBroadcaster;

/**
 * Joins a channel to the progress broadcast once its WebSocket handshake
 * completes. Progress is push-only; inbound frames are ignored.
 */
class ProgressSocketHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private static final Logger log = LoggerFactory.getLogger(ProgressSocketHandler.class);

    private final ChannelGroupBroadcaster broadcaster;

    ProgressSocketHandler(ChannelGroupBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            broadcaster.register(ctx.channel());
        } else {
            super.userEventTriggered(ctx, evt);
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (frame instanceof TextWebSocketFrame text) {
            log.debug("Ignoring message from progress subscriber {}: {}", ctx.channel().remoteAddress(),
                    text.text());
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("Progress subscriber {} dropped: {}", ctx.channel().remoteAddress(), cause.getMessage());
        ctx.close();
    }
}
