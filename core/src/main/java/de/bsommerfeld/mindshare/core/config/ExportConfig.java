package de.bsommerfeld.mindshare.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Naming and placement of the two snapshot outputs.
 */
public class ExportConfig {

    @JsonProperty("table-prefix")
    private String tablePrefix = "AggregatedYapScores";

    @JsonProperty("csv-directory")
    private String csvDirectory = "csvs";

    public String getTablePrefix() {
        return tablePrefix;
    }

    public String getCsvDirectory() {
        return csvDirectory;
    }

    public void setCsvDirectory(String csvDirectory) {
        this.csvDirectory = csvDirectory;
    }
}
