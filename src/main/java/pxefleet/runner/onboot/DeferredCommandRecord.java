package pxefleet.runner.onboot;

import java.time.Instant;

/**
 * A host's pending onboot command set.
 *
 * @param hostname   host the record belongs to
 * @param rawContent exact content the client reads at boot
 * @param updatedAt  last write time
 */
public record DeferredCommandRecord(String hostname, String rawContent, Instant updatedAt) {
}
