package pxefleet.runner.onboot;

import java.util.List;

/**
 * Per-host outcome of a bulk onboot schedule.
 */
public record OnbootResult(String commands, List<String> created, List<Failure> failed) {

    public OnbootResult {
        created = List.copyOf(created);
        failed = List.copyOf(failed);
    }

    public record Failure(String hostname, String error) {
    }
}
