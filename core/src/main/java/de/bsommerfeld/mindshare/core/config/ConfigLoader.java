package de.bsommerfeld.mindshare.core.config;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads {@code config.toml} into a {@link GlobalConfig} and validates it.
 *
 * <h3>Resolution</h3>
 * The file path comes from the {@code mindshare.config} system property, then
 * the {@code MINDSHARE_CONFIG} environment variable, then {@code config.toml}
 * in the working directory. {@code MINDSHARE_DB_URL}, when set, replaces
 * {@code database.url} so credentials can stay out of the file.
 *
 * <h3>Strictness</h3>
 * Unknown keys are rejected.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String PATH_PROPERTY = "mindshare.config";
    public static final String PATH_ENV = "MINDSHARE_CONFIG";
    public static final String DB_URL_ENV = "MINDSHARE_DB_URL";
    public static final String DEFAULT_FILE = "config.toml";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final TomlMapper MAPPER = new TomlMapper();

    private ConfigLoader() {
    }

    /**
     * Returns the config file location from property, environment or the
     * working-directory default. The file is not guaranteed to exist.
     */
    public static Path resolvePath() {
        String path = System.getProperty(PATH_PROPERTY);
        if (path == null || path.isEmpty()) {
            path = System.getenv(PATH_ENV);
        }
        if (path == null || path.isEmpty()) {
            path = DEFAULT_FILE;
        }
        return Paths.get(path).toAbsolutePath();
    }

    public static GlobalConfig load(Path path, ApplicationMode mode) throws ConfigurationException {
        return load(path, mode, System.getenv());
    }

    static GlobalConfig load(Path path, ApplicationMode mode, Map<String, String> env)
            throws ConfigurationException {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }

        GlobalConfig config;
        try {
            config = MAPPER.readValue(path.toFile(), GlobalConfig.class);
        } catch (JacksonException e) {
            throw new ConfigurationException("Malformed configuration in " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration " + path, e);
        }
        if (config == null) {
            config = new GlobalConfig();
        }

        String urlOverride = env.get(DB_URL_ENV);
        if (urlOverride != null && !urlOverride.isBlank()) {
            LOG.info("Database URL taken from {}", DB_URL_ENV);
            config.getDatabase().setUrl(urlOverride.trim());
        }

        validate(config, mode);
        return config;
    }

    /**
     * Checks every value the job relies on. The table prefix ends up inside
     * DDL, so it must be a plain identifier.
     */
    static void validate(GlobalConfig config, ApplicationMode mode) throws ConfigurationException {
        String url = config.getDatabase().getUrl();
        if (!mode.isTest()) {
            if (url == null || url.isBlank()) {
                throw new ConfigurationException("database.url is required");
            }
            if (!url.startsWith("jdbc:sqlite:")) {
                throw new ConfigurationException("database.url must be a jdbc:sqlite: URL, got: " + url);
            }
        }

        ExportConfig export = config.getExport();
        if (export.getTablePrefix() == null || !IDENTIFIER.matcher(export.getTablePrefix()).matches()) {
            throw new ConfigurationException("export.table-prefix must be a plain identifier, got: "
                    + export.getTablePrefix());
        }
        if (export.getCsvDirectory() == null || export.getCsvDirectory().isBlank()) {
            throw new ConfigurationException("export.csv-directory must not be empty");
        }

        RankingConfig ranking = config.getRanking();
        if (ranking.getMindSharePool() <= 0 || ranking.getNormalizedPool() <= 0) {
            throw new ConfigurationException("ranking pools must be positive");
        }
        if (ranking.getSummarySize() < 0) {
            throw new ConfigurationException("ranking.summary-size must not be negative");
        }
    }

    /**
     * A minimal working configuration, printed when loading fails.
     */
    public static String exampleConfig() {
        return """
                debug-mode = false

                [database]
                url = "jdbc:sqlite:/var/lib/mindshare/engagement.db"

                [export]
                table-prefix = "AggregatedYapScores"
                csv-directory = "csvs"

                [ranking]
                mind-share-pool = 100
                normalized-pool = 25
                summary-size = 10
                """;
    }
}
