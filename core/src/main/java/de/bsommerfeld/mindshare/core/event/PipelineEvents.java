package de.bsommerfeld.mindshare.core.event;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Events posted by the aggregation run, in the order they occur.
 */
public class PipelineEvents {

    /**
     * The two independent places a snapshot is written to.
     */
    public enum Target {
        STORE,
        CSV
    }

    public record WindowResolvedEvent(Instant windowStart, Instant windowEnd) {
    }

    public record SnapshotPersistedEvent(Target target, String name, int entryCount) {
    }

    /**
     * Posted when one write fails. If {@code target} is {@link Target#CSV} the
     * store copy may already exist without its tabular counterpart.
     */
    public record SnapshotWriteFailedEvent(Target target, String name, Throwable cause) {
    }

    public record RunCompletedEvent(String snapshotName, Path csvFile, int entryCount) {
    }
}
