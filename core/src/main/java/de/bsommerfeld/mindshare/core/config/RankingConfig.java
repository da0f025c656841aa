package de.bsommerfeld.mindshare.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pool sizes for the two mindshare denominators and the length of the logged
 * summary.
 */
public class RankingConfig {

    @JsonProperty("mind-share-pool")
    private int mindSharePool = 100;

    @JsonProperty("normalized-pool")
    private int normalizedPool = 25;

    @JsonProperty("summary-size")
    private int summarySize = 10;

    public int getMindSharePool() {
        return mindSharePool;
    }

    public int getNormalizedPool() {
        return normalizedPool;
    }

    public int getSummarySize() {
        return summarySize;
    }
}
