package de.bsommerfeld.mindshare.pipeline;

import de.bsommerfeld.mindshare.core.domain.LeaderboardSnapshot;

import java.nio.file.Path;

/**
 * Outcome of a successful run: the shared output name, the CSV file and the
 * snapshot both outputs were written from.
 */
public record RunReport(String snapshotName, Path csvFile, LeaderboardSnapshot snapshot) {
}
