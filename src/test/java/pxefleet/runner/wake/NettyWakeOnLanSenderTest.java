package pxefleet.runner.wake;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NettyWakeOnLanSenderTest {

    private DatagramSocket receiver;
    private NettyWakeOnLanSender sender;

    @BeforeEach
    void setUp() throws Exception {
        receiver = new DatagramSocket(0, InetAddress.getLoopbackAddress());
        receiver.setSoTimeout(5000);
        sender = new NettyWakeOnLanSender(
                new InetSocketAddress(InetAddress.getLoopbackAddress(), receiver.getLocalPort()),
                3, Duration.ofMillis(300));
    }

    @AfterEach
    void tearDown() {
        sender.close();
        receiver.close();
    }

    @Test
    @DisplayName("Waking a batch returns before the repeat packets go out")
    void sendDoesNotWaitForRepeats() throws Exception {
        List<String> macs = List.of("aa:bb:cc:dd:ee:01", "aa:bb:cc:dd:ee:02", "aa:bb:cc:dd:ee:03",
                "aa:bb:cc:dd:ee:04", "aa:bb:cc:dd:ee:05");

        long start = System.nanoTime();
        for (String mac : macs) {
            sender.send(mac);
        }
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertTrue(elapsedMs < 300, "send blocked for " + elapsedMs + "ms");

        // three packets per MAC still arrive
        for (int i = 0; i < macs.size() * 3; i++) {
            DatagramPacket packet = new DatagramPacket(new byte[256], 256);
            receiver.receive(packet);
            assertEquals(MagicPacket.LENGTH, packet.getLength());
        }
    }

    @Test
    void sendAfterCloseFails() {
        sender.close();

        assertThrows(IOException.class, () -> sender.send("aa:bb:cc:dd:ee:01"));
    }
}
