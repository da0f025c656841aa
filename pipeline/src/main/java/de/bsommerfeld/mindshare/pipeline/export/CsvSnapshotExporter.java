package de.bsommerfeld.mindshare.pipeline.export;

import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.mindshare.core.config.ExportConfig;
import de.bsommerfeld.mindshare.core.domain.AggregatedAuthorScore;
import de.bsommerfeld.mindshare.core.domain.EngagementWindow;
import de.bsommerfeld.mindshare.core.domain.LeaderboardSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a {@link LeaderboardSnapshot} as a CSV file named after the run.
 *
 * <h3>Format</h3>
 * <ul>
 * <li>Header row always present, so an empty leaderboard yields a header-only
 * file</li>
 * <li>{@code ,} separates fields; tweet references are joined with
 * {@code |}</li>
 * <li>Fields are quoted only when they contain a separator, quote or line
 * break</li>
 * <li>{@code multiplierFactor} 4 dp, {@code compositeScore} 2 dp, mindshare
 * columns as percentages with 4 dp, raw values unrounded</li>
 * <li>Timestamps as ISO-8601 instants</li>
 * </ul>
 *
 * The {@code rank} column exists only here; the store copy relies on row
 * order.
 */
@Singleton
public class CsvSnapshotExporter {

    private static final Logger LOG = LoggerFactory.getLogger(CsvSnapshotExporter.class);

    static final String TWEET_DELIMITER = "|";

    private static final List<String> HEADER = buildHeader();

    private final CsvMapper mapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();
    private final Path directory;

    @Inject
    public CsvSnapshotExporter(ExportConfig config) {
        this(Path.of(config.getCsvDirectory()));
    }

    public CsvSnapshotExporter(Path directory) {
        this.directory = directory;
    }

    /**
     * Writes {@code <directory>/<name>.csv}, replacing any file of that name.
     *
     * @return the written file
     */
    public Path export(String name, LeaderboardSnapshot snapshot) throws IOException {
        if (!Files.isDirectory(directory)) {
            Files.createDirectories(directory);
            LOG.info("Created CSV directory {}", directory.toAbsolutePath());
        }

        Path file = directory.resolve(name + ".csv");
        ObjectWriter writer = mapper.writerFor(List.class).with(CsvSchema.emptySchema());
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                SequenceWriter rows = writer.writeValues(out)) {
            rows.write(HEADER);
            int rank = 1;
            for (AggregatedAuthorScore entry : snapshot.entries()) {
                rows.write(toRow(rank++, entry, snapshot));
            }
        }

        LOG.info("Saved CSV file: {} ({} records)", file.getFileName(), snapshot.size());
        return file;
    }

    static List<String> toRow(int rank, AggregatedAuthorScore entry, LeaderboardSnapshot snapshot) {
        List<String> row = new ArrayList<>(HEADER.size());
        row.add(Integer.toString(rank));
        row.add(entry.authorId());
        row.add(entry.username() == null ? "" : entry.username());
        row.add(NumberFormats.plain(entry.contentScore()));
        row.add(NumberFormats.fixed(entry.multiplierFactor(), 4));
        row.add(NumberFormats.fixed(entry.compositeScore(), 2));
        row.add(NumberFormats.percent(entry.mindShare(), 4));
        row.add(NumberFormats.percent(entry.normalizedMindShare(), 4));
        for (EngagementWindow window : EngagementWindow.values()) {
            row.add(NumberFormats.plain(entry.counter(window)));
        }
        row.add(Integer.toString(entry.tweetRefs().size()));
        row.add(String.join(TWEET_DELIMITER, entry.tweetRefs()));
        row.add(entry.createdAt().toString());
        row.add(snapshot.generatedAt().toString());
        row.add(snapshot.windowStart().toString());
        row.add(snapshot.windowEnd().toString());
        return row;
    }

    static List<String> header() {
        return HEADER;
    }

    private static List<String> buildHeader() {
        List<String> header = new ArrayList<>(List.of("rank", "authorId", "username", "contentScore_sum",
                "multiplierFactor", "compositeScore", "mindShare(%)", "normalizedMindShare(%)"));
        for (EngagementWindow window : EngagementWindow.values()) {
            header.add(window.label());
        }
        header.addAll(List.of("tweetRefs_count", "tweetRefs", "createdAt", "generatedAt", "windowStart",
                "windowEnd"));
        return List.copyOf(header);
    }
}
