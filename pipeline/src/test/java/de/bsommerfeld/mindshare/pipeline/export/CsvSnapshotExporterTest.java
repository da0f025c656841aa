package de.bsommerfeld.mindshare.pipeline.export;

import de.bsommerfeld.mindshare.core.domain.AggregatedAuthorScore;
import de.bsommerfeld.mindshare.core.domain.AuthorAggregate;
import de.bsommerfeld.mindshare.core.domain.EngagementCounters;
import de.bsommerfeld.mindshare.core.domain.LeaderboardSnapshot;
import de.bsommerfeld.mindshare.core.domain.LeaderboardStats;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvSnapshotExporterTest {

    private static final Instant CREATED = Instant.parse("2024-06-03T08:00:00Z");
    private static final Instant START = Instant.parse("2024-06-02T22:00:00Z");
    private static final Instant END = Instant.parse("2024-06-05T12:30:00Z");

    private static final String HEADER = "rank,authorId,username,contentScore_sum,multiplierFactor,compositeScore,"
            + "mindShare(%),normalizedMindShare(%),all,24h,48h,7d,30d,3m,6m,12m,tweetRefs_count,tweetRefs,"
            + "createdAt,generatedAt,windowStart,windowEnd";

    @TempDir
    Path tempDir;

    @Test
    void export_shouldWriteHeaderOnlyForEmptySnapshot() throws IOException {
        Path file = new CsvSnapshotExporter(tempDir).export("Empty_2024_06_05_1230", snapshot());

        assertEquals(tempDir.resolve("Empty_2024_06_05_1230.csv"), file);
        assertEquals(List.of(HEADER), Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    @Test
    void export_shouldCreateMissingDirectory() throws IOException {
        Path dir = tempDir.resolve("nested/csvs");

        Path file = new CsvSnapshotExporter(dir).export("Snap", snapshot());

        assertTrue(Files.isRegularFile(file));
    }

    @Test
    void export_shouldFlattenAndRoundEntries() throws IOException {
        AggregatedAuthorScore entry = entry("author-1", "yapper", 12.5, 1.04, 13.000000000000002, 1.0 / 3, 1.0,
                List.of("t1", "t2"));

        Path file = new CsvSnapshotExporter(tempDir).export("Snap", snapshot(entry));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertEquals("1,author-1,yapper,12.5,1.04,13,33.3333,100,1,2,3,4,5,6,7,8,2,t1|t2,"
                + "2024-06-03T08:00:00Z,2024-06-05T12:30:00Z,2024-06-02T22:00:00Z,2024-06-05T12:30:00Z",
                lines.get(1));
    }

    @Test
    void export_shouldQuoteFieldsContainingSeparators() throws IOException {
        AggregatedAuthorScore entry = entry("author-1", "yap, \"the\" man", 1, 1, 1, 1, 1, List.of("a,b", "c"));

        Path file = new CsvSnapshotExporter(tempDir).export("Snap", snapshot(entry));

        String row = Files.readAllLines(file, StandardCharsets.UTF_8).get(1);
        assertTrue(row.startsWith("1,author-1,\"yap, \"\"the\"\" man\",1,"), row);
        assertTrue(row.contains(",2,\"a,b|c\","), row);
    }

    @Test
    void export_shouldNumberRanksInSnapshotOrder() throws IOException {
        Path file = new CsvSnapshotExporter(tempDir).export("Snap", snapshot(
                entry("b", "b", 2, 1, 2, 0.5, 0.5, List.of()),
                entry("a", "a", 1, 1, 1, 0.25, 0.25, List.of()),
                entry("c", "c", 1, 1, 1, 0.25, 0.25, List.of())));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertTrue(lines.get(1).startsWith("1,b,"));
        assertTrue(lines.get(2).startsWith("2,a,"));
        assertTrue(lines.get(3).startsWith("3,c,"));
    }

    @Test
    void export_shouldOverwriteExistingFile() throws IOException {
        CsvSnapshotExporter exporter = new CsvSnapshotExporter(tempDir);
        exporter.export("Snap", snapshot(entry("a", "a", 1, 1, 1, 1, 1, List.of())));

        Path file = exporter.export("Snap", snapshot());

        assertEquals(List.of(HEADER), Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    private static AggregatedAuthorScore entry(String id, String username, double content, double multiplier,
            double composite, double share, double normalized, List<String> tweets) {
        AuthorAggregate aggregate = new AuthorAggregate(id, username, content,
                EngagementCounters.of(1, 2, 3, 4, 5, 6, 7, 8), tweets, CREATED);
        return new AggregatedAuthorScore(aggregate, multiplier, composite, share, normalized);
    }

    private static LeaderboardSnapshot snapshot(AggregatedAuthorScore... entries) {
        return new LeaderboardSnapshot(List.of(entries), START, END, END, LeaderboardStats.empty());
    }
}
