package pxefleet.runner.onboot;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pxefleet.runner.command.CommandParser;
import pxefleet.runner.command.InvalidCommandSyntaxException;
import pxefleet.runner.events.EventType;
import pxefleet.runner.fakes.RecordingBroadcaster;
import pxefleet.runner.model.Host;
import pxefleet.runner.model.ValidationException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OnbootSchedulerTest {

    @TempDir
    Path dir;

    private RecordingBroadcaster events;
    private OnbootScheduler onboot;

    @BeforeEach
    void setUp() {
        events = new RecordingBroadcaster();
        onboot = new OnbootScheduler(dir.resolve("linbocmd"), events);
    }

    @Test
    @DisplayName("A second schedule replaces the first")
    void overwriteKeepsOnlyLatestRecord() throws Exception {
        onboot.schedule("pc01", "sync:1,start:1");
        onboot.schedule("pc01", "reboot");

        List<DeferredCommandRecord> records = onboot.listScheduled();
        assertEquals(1, records.size());
        assertEquals("pc01", records.get(0).hostname());
        assertEquals("reboot", records.get(0).rawContent());

        assertEquals("reboot", Files.readString(dir.resolve("linbocmd/pc01.cmd"), StandardCharsets.UTF_8));
        try (var files = Files.list(dir.resolve("linbocmd"))) {
            assertEquals(1, files.count(), "no temp files left behind");
        }
    }

    @Test
    void cancelMissingRecordIsNotAnError() {
        assertFalse(onboot.cancel("pc01"));
        assertTrue(events.ofType(EventType.ONBOOT_CANCELLED).isEmpty());
    }

    @Test
    void cancelDeletesRecord() {
        onboot.schedule("pc01", "sync:1");

        assertTrue(onboot.cancel("pc01"));
        assertTrue(onboot.listScheduled().isEmpty());
        assertTrue(onboot.find("pc01").isEmpty());
        assertEquals(1, events.ofType(EventType.ONBOOT_CANCELLED).size());
    }

    @Test
    void listIsEmptyWithoutDirectory() {
        assertTrue(onboot.listScheduled().isEmpty());
    }

    @Test
    void listIsSortedAndIgnoresOtherFiles() throws Exception {
        onboot.schedule("pc02", "sync:1");
        onboot.schedule("pc01", "start:1");
        Files.writeString(dir.resolve("linbocmd/readme.txt"), "not a record");

        List<DeferredCommandRecord> records = onboot.listScheduled();
        assertEquals(List.of("pc01", "pc02"), records.stream().map(DeferredCommandRecord::hostname).toList());
    }

    @Test
    void storesCanonicalForm() {
        DeferredCommandRecord record = onboot.schedule("pc01", " SYNC:1 ,start:1");

        assertEquals("sync:1,start:1", record.rawContent());
        assertEquals(1, events.ofType(EventType.ONBOOT_SCHEDULED).size());
    }

    @Test
    void invalidCommandsWriteNothing() {
        assertThrows(InvalidCommandSyntaxException.class, () -> onboot.schedule("pc01", "bogus"));
        assertTrue(onboot.listScheduled().isEmpty());
    }

    @Test
    void rejectsHostnamesThatAreNotFileNames() {
        assertThrows(ValidationException.class, () -> onboot.schedule("../etc/passwd", "sync:1"));
        assertThrows(ValidationException.class, () -> onboot.cancel("a/b"));
    }

    @Test
    void optionsPrependFlagsNoautoFirst() {
        OnbootResult result = onboot.scheduleAll(
                List.of(host("pc01"), host("pc02")), "sync:1,start:1", new OnbootOptions(true, true));

        assertEquals("noauto,disablegui,sync:1,start:1", result.commands());
        assertEquals(List.of("pc01", "pc02"), result.created());
        assertTrue(result.failed().isEmpty());
        assertEquals("noauto,disablegui,sync:1,start:1", onboot.find("pc02").orElseThrow().rawContent());
    }

    @Test
    void optionsDoNotDuplicateFlags() {
        assertEquals("noauto,sync:1",
                OnbootScheduler.withOptions(CommandParser.parse("noauto,sync:1"), new OnbootOptions(true, false))
                        .format());
        assertEquals("sync:1",
                OnbootScheduler.withOptions(CommandParser.parse("sync:1"), OnbootOptions.none()).format());
    }

    @Test
    void bulkScheduleReportsPerHostFailures() {
        OnbootResult result = onboot.scheduleAll(List.of(host("pc01"), host("bad name")), "reboot",
                OnbootOptions.none());

        assertEquals(List.of("pc01"), result.created());
        assertEquals(1, result.failed().size());
        assertEquals("bad name", result.failed().get(0).hostname());
    }

    private static Host host(String hostname) {
        return new Host("id-" + hostname, hostname, null, null, null, null);
    }
}
