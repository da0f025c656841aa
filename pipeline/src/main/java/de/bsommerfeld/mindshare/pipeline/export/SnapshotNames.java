package de.bsommerfeld.mindshare.pipeline.export;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

/**
 * Derives the run name shared by the snapshot table and the CSV file:
 * {@code <prefix>_yyyy_MM_dd_HHmm}, e.g.
 * {@code AggregatedYapScores_2024_01_12_1430}.
 *
 * <p>
 * The name is a pure function of the supplied local timestamp; two runs in the
 * same minute get the same name and the later one replaces the earlier.
 */
public final class SnapshotNames {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy_MM_dd_HHmm");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private SnapshotNames() {
    }

    public static String forTimestamp(String prefix, LocalDateTime timestamp) {
        if (prefix == null || !IDENTIFIER.matcher(prefix).matches()) {
            throw new IllegalArgumentException("Snapshot prefix must be a plain identifier: " + prefix);
        }
        return prefix + "_" + STAMP.format(timestamp);
    }
}
