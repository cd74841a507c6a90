package pxefleet.runner.command;

import java.util.Locale;
import java.util.Optional;

/**
 * Transfer method accepted by {@code initcache}.
 */
public enum CacheDownloadType {
    RSYNC,
    MULTICAST,
    TORRENT;

    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<CacheDownloadType> fromToken(String token) {
        for (CacheDownloadType type : values()) {
            if (type.token().equalsIgnoreCase(token)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
