package pxefleet.runner.wake;

import pxefleet.runner.model.ValidationException;

import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Wake-on-LAN magic packet: six 0xFF bytes followed by the target MAC address
 * repeated sixteen times.
 */
public final class MagicPacket {

    public static final int LENGTH = 102;

    private static final Pattern MAC = Pattern.compile(
            "^([0-9a-fA-F]{2}[:-]){5}[0-9a-fA-F]{2}$|^[0-9a-fA-F]{12}$");

    private MagicPacket() {
    }

    public static boolean isValidMac(String mac) {
        return mac != null && MAC.matcher(mac.trim()).matches();
    }

    /** Lower-case colon-separated form, e.g. {@code aa:bb:cc:dd:ee:ff}. */
    public static String normalize(String mac) {
        byte[] bytes = macBytes(mac);
        return HexFormat.ofDelimiter(":").formatHex(bytes);
    }

    public static byte[] create(String mac) {
        byte[] address = macBytes(mac);
        byte[] packet = new byte[LENGTH];
        for (int i = 0; i < 6; i++) {
            packet[i] = (byte) 0xff;
        }
        for (int i = 6; i < LENGTH; i += address.length) {
            System.arraycopy(address, 0, packet, i, address.length);
        }
        return packet;
    }

    private static byte[] macBytes(String mac) {
        if (!isValidMac(mac)) {
            throw new ValidationException("Invalid MAC address: " + mac);
        }
        String hex = mac.trim().replace(":", "").replace("-", "").toLowerCase(Locale.ROOT);
        return HexFormat.of().parseHex(hex);
    }
}
