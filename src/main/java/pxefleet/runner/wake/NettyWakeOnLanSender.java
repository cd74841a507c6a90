package pxefleet.runner.wake;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pxefleet.runner.config.RunnerConfig;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Netty UDP implementation of {@link WakeOnLanSender}. Binds one broadcast
 * socket on an ephemeral port and reuses it for every send; writes and
 * repeats run on the socket's event loop.
 */
public final class NettyWakeOnLanSender implements WakeOnLanSender {

    private static final Logger log = LoggerFactory.getLogger(NettyWakeOnLanSender.class);

    private final InetSocketAddress target;
    private final int packetCount;
    private final Duration packetInterval;

    private final EventLoopGroup group;
    private final Channel channel;

    public NettyWakeOnLanSender(RunnerConfig config) {
        this(new InetSocketAddress(config.wakeBroadcastAddress(), config.wakePort()),
                config.wakePacketCount(), config.wakePacketInterval());
    }

    public NettyWakeOnLanSender(InetSocketAddress target, int packetCount, Duration packetInterval) {
        this.target = target;
        this.packetCount = packetCount;
        this.packetInterval = packetInterval;

        this.group = new NioEventLoopGroup(1);
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, true)
                .handler(new ChannelInboundHandlerAdapter());

        this.channel = bootstrap.bind(0).syncUninterruptibly().channel();
        log.info("Wake-on-LAN sender bound, target {}", target);
    }

    /**
     * Queue the first packet at once and schedule the repeats on the event
     * loop. Returns without waiting for any write.
     */
    @Override
    public void send(String macAddress) throws IOException {
        if (!channel.isActive()) {
            throw new IOException("Wake-on-LAN socket is closed");
        }
        byte[] packet = MagicPacket.create(macAddress);

        write(macAddress, packet);
        for (int i = 1; i < packetCount; i++) {
            channel.eventLoop().schedule(() -> write(macAddress, packet),
                    packetInterval.toMillis() * i, TimeUnit.MILLISECONDS);
        }
    }

    private void write(String macAddress, byte[] packet) {
        channel.writeAndFlush(new DatagramPacket(Unpooled.wrappedBuffer(packet), target))
                .addListener(f -> {
                    if (!f.isSuccess()) {
                        log.warn("Magic packet for {} not sent: {}", macAddress, f.cause().getMessage());
                    }
                });
    }

    @Override
    public void close() {
        channel.close().awaitUninterruptibly();
        group.shutdownGracefully();
        log.info("Wake-on-LAN sender closed");
    }
}
