package pxefleet.runner.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.Channel;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pushes events as JSON text frames to every connected WebSocket client.
 * Closed channels leave the group automatically.
 */
public final class ChannelGroupBroadcaster implements ProgressBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(ChannelGroupBroadcaster.class);

    private final ChannelGroup clients = new DefaultChannelGroup("progress-clients", GlobalEventExecutor.INSTANCE);
    private final ObjectMapper mapper;

    public ChannelGroupBroadcaster(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void register(Channel channel) {
        clients.add(channel);
        log.debug("Progress subscriber connected: {} ({} total)", channel.remoteAddress(), clients.size());
    }

    public int subscriberCount() {
        return clients.size();
    }

    @Override
    public void publish(ProgressEvent event) {
        if (clients.isEmpty()) {
            return;
        }
        String json;
        try {
            json = mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialize event {}: {}", event.type(), e.getMessage());
            return;
        }
        clients.writeAndFlush(new TextWebSocketFrame(json));
    }

    public void close() {
        clients.close().awaitUninterruptibly();
    }
}
