package de.bsommerfeld.mindshare.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Backing store connection settings. There is no default URL: a PROD run
 * without one is a configuration error.
 */
public class DatabaseConfig {

    @JsonProperty("url")
    private String url;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }
}
