package de.bsommerfeld.mindshare.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Top-level keys live here, everything else is
 * grouped into one section per concern.
 */
public class GlobalConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    @JsonProperty("export")
    private ExportConfig export = new ExportConfig();

    @JsonProperty("ranking")
    private RankingConfig ranking = new RankingConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public DatabaseConfig getDatabase() {
        return database;
    }

    public ExportConfig getExport() {
        return export;
    }

    public RankingConfig getRanking() {
        return ranking;
    }
}
