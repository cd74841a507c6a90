package pxefleet.runner.wake;

import org.junit.jupiter.api.Test;
import pxefleet.runner.fakes.FakeWakeOnLanSender;
import pxefleet.runner.model.Host;
import pxefleet.runner.model.ValidationException;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MagicPacketTest {

    @Test
    void packetIsSyncStreamFollowedBySixteenAddresses() {
        byte[] packet = MagicPacket.create("AA:BB:CC:DD:EE:0F");

        assertEquals(MagicPacket.LENGTH, packet.length);
        for (int i = 0; i < 6; i++) {
            assertEquals((byte) 0xff, packet[i]);
        }
        for (int rep = 0; rep < 16; rep++) {
            int base = 6 + rep * 6;
            assertEquals((byte) 0xaa, packet[base]);
            assertEquals((byte) 0x0f, packet[base + 5]);
        }
    }

    @Test
    void acceptsCommonMacNotations() {
        assertTrue(MagicPacket.isValidMac("aa:bb:cc:dd:ee:ff"));
        assertTrue(MagicPacket.isValidMac("AA-BB-CC-DD-EE-FF"));
        assertTrue(MagicPacket.isValidMac("aabbccddeeff"));
        assertFalse(MagicPacket.isValidMac("aa:bb:cc:dd:ee"));
        assertFalse(MagicPacket.isValidMac("zz:bb:cc:dd:ee:ff"));
        assertFalse(MagicPacket.isValidMac(null));

        assertEquals("aa:bb:cc:dd:ee:ff", MagicPacket.normalize("AA-BB-CC-DD-EE-FF"));
        assertThrows(ValidationException.class, () -> MagicPacket.create("nope"));
    }

    @Test
    void stagerSkipsHostsWithoutUsableMac() {
        FakeWakeOnLanSender sender = new FakeWakeOnLanSender();
        WakeStager stager = new WakeStager(sender);

        WakeResult result = stager.wake(List.of(
                new Host("h1", "pc01", "aa:bb:cc:dd:ee:01", "10.0.0.1", "r1", "g1"),
                new Host("h2", "pc02", null, "10.0.0.2", "r1", "g1"),
                new Host("h3", "pc03", "aa:bb:cc:dd:ee:03", "10.0.0.3", "r1", "g1")));

        assertEquals(2, result.sent());
        assertEquals(List.of("pc02"), result.failedHosts());
        assertEquals(List.of("aa:bb:cc:dd:ee:01", "aa:bb:cc:dd:ee:03"), sender.sent());
    }

    @Test
    void stagerReportsSendFailures() {
        WakeStager stager = new WakeStager(new FakeWakeOnLanSender().failing());

        WakeResult result = stager.wake(List.of(new Host("h1", "pc01", "aa:bb:cc:dd:ee:01", null, null, null)));

        assertEquals(0, result.sent());
        assertEquals(1, result.failed());
    }

    @Test
    void readyAtAddsDelay() {
        WakeStager stager = new WakeStager(new FakeWakeOnLanSender());
        Instant now = Instant.parse("2024-01-01T10:00:00Z");

        assertEquals(Instant.parse("2024-01-01T10:01:00Z"), stager.readyAt(now, 60));
        assertEquals(now, stager.readyAt(now, -5));
    }
}
