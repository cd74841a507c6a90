package pxefleet.runner.onboot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pxefleet.runner.command.CommandName;
import pxefleet.runner.command.CommandParser;
import pxefleet.runner.command.CommandPlan;
import pxefleet.runner.events.EventType;
import pxefleet.runner.events.ProgressBroadcaster;
import pxefleet.runner.events.ProgressEvent;
import pxefleet.runner.model.Host;
import pxefleet.runner.model.ValidationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Deferred dispatch: one {@code <hostname>.cmd} file per host, consumed and
 * deleted by the client at its next boot.
 *
 * <p>
 * A new schedule replaces the file atomically (temp file plus rename), so a
 * booting client never sees a partial record and at most one record exists
 * per host. Cancelling a missing record is not an error.
 */
public class OnbootScheduler {

    private static final Logger log = LoggerFactory.getLogger(OnbootScheduler.class);

    static final String SUFFIX = ".cmd";
    private static final Pattern HOSTNAME = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]{0,252}$");

    private final Path directory;
    private final ProgressBroadcaster broadcaster;

    public OnbootScheduler(Path directory, ProgressBroadcaster broadcaster) {
        this.directory = directory;
        this.broadcaster = broadcaster;
    }

    public Path directory() {
        return directory;
    }

    /**
     * Replace the host's record with the given plan.
     *
     * @throws ValidationException if the hostname is not usable as a file name
     */
    public DeferredCommandRecord schedule(String hostname, CommandPlan plan) {
        String content = plan.format();
        Path target = recordPath(hostname);

        try {
            writeAtomically(target, content);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write onboot record for " + hostname, e);
        }

        log.info("Onboot command scheduled for {}: {}", hostname, content);
        broadcaster.publish(ProgressEvent.of(EventType.ONBOOT_SCHEDULED,
                Map.of("hostname", hostname, "commands", content)));
        return new DeferredCommandRecord(hostname, content, Instant.now());
    }

    /** Parse then schedule; the parse error propagates unchanged. */
    public DeferredCommandRecord schedule(String hostname, String commands) {
        return schedule(hostname, CommandParser.parse(commands));
    }

    /**
     * Schedule the same commands for several hosts. The command string is
     * validated once up front; write failures are collected per host.
     */
    public OnbootResult scheduleAll(List<Host> hosts, String commands, OnbootOptions options) {
        CommandPlan plan = withOptions(CommandParser.parse(commands), options);

        List<String> created = new ArrayList<>();
        List<OnbootResult.Failure> failed = new ArrayList<>();

        for (Host host : hosts) {
            try {
                schedule(host.hostname(), plan);
                created.add(host.hostname());
            } catch (RuntimeException e) {
                String reason = e.getCause() != null ? e.getCause().toString() : e.getMessage();
                log.warn("Onboot schedule for {} failed: {}", host.hostname(), reason);
                failed.add(new OnbootResult.Failure(host.hostname(), reason));
            }
        }

        return new OnbootResult(plan.format(), created, failed);
    }

    /** All pending records, ordered by hostname. */
    public List<DeferredCommandRecord> listScheduled() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }

        List<DeferredCommandRecord> records = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                readRecord(file).ifPresent(records::add);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list onboot records in " + directory, e);
        }

        records.sort(Comparator.comparing(DeferredCommandRecord::hostname));
        return records;
    }

    public Optional<DeferredCommandRecord> find(String hostname) {
        return readRecord(recordPath(hostname));
    }

    /**
     * Delete the host's record.
     *
     * @return true if a record existed
     */
    public boolean cancel(String hostname) {
        Path target = recordPath(hostname);
        boolean deleted;
        try {
            deleted = Files.deleteIfExists(target);
        } catch (IOException e) {
            throw new RuntimeException("Failed to delete onboot record for " + hostname, e);
        }

        if (deleted) {
            log.info("Onboot command cancelled for {}", hostname);
            broadcaster.publish(ProgressEvent.of(EventType.ONBOOT_CANCELLED, Map.of("hostname", hostname)));
        } else {
            log.debug("No onboot record for {}", hostname);
        }
        return deleted;
    }

    static CommandPlan withOptions(CommandPlan plan, OnbootOptions options) {
        CommandPlan result = plan;
        // prepended in reverse so noauto ends up first
        if (options.disablegui()) {
            result = result.withLeadingFlag(CommandName.DISABLEGUI);
        }
        if (options.noauto()) {
            result = result.withLeadingFlag(CommandName.NOAUTO);
        }
        return result;
    }

    private Path recordPath(String hostname) {
        if (hostname == null || !HOSTNAME.matcher(hostname).matches()) {
            throw new ValidationException("Invalid hostname: " + hostname);
        }
        return directory.resolve(hostname + SUFFIX);
    }

    private Optional<DeferredCommandRecord> readRecord(Path file) {
        String name = file.getFileName().toString();
        String hostname = name.substring(0, name.length() - SUFFIX.length());
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8).trim();
            Instant modified = Files.getLastModifiedTime(file).toInstant();
            return Optional.of(new DeferredCommandRecord(hostname, content, modified));
        } catch (NoSuchFileException e) {
            // consumed by the client meanwhile
            return Optional.empty();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read onboot record " + file, e);
        }
    }

    private void writeAtomically(Path target, String content) throws IOException {
        Files.createDirectories(directory);
        Path tmp = Files.createTempFile(directory, "." + target.getFileName(), ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            setGroupReadable(tmp);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static void setGroupReadable(Path file) {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-rw----"));
        } catch (UnsupportedOperationException | IOException e) {
            log.debug("Cannot set permissions on {}: {}", file, e.getMessage());
        }
    }
}
