package com.williamcallahan.statuteindex.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Validated
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    private Legislation legislation = new Legislation();
    @Valid
    private Ingestion ingestion = new Ingestion();
    @Valid
    private Search search = new Search();

    public Legislation getLegislation() {
        return legislation;
    }

    public void setLegislation(Legislation legislation) {
        this.legislation = legislation;
    }

    public Ingestion getIngestion() {
        return ingestion;
    }

    public void setIngestion(Ingestion ingestion) {
        this.ingestion = ingestion;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    /**
     * Upstream legislation host and outbound request behavior.
     */
    public static class Legislation {
        @NotBlank
        private String baseUrl = "https://www.legislation.gov.uk";
        @NotBlank
        private String collection = "ukpga";
        @NotBlank
        private String userAgent = "statute-index/1.0";
        private Duration minRequestDelay = Duration.ofMillis(250);
        @Min(0)
        private int maxRetries = 3;
        private Duration requestTimeout = Duration.ofSeconds(30);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getCollection() { return collection; }
        public void setCollection(String collection) { this.collection = collection; }

        public String getUserAgent() { return userAgent; }
        public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

        public Duration getMinRequestDelay() { return minRequestDelay; }
        public void setMinRequestDelay(Duration minRequestDelay) { this.minRequestDelay = minRequestDelay; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    }

    /**
     * Where the batch pipeline keeps the catalog index and per-document seeds.
     */
    public static class Ingestion {
        @NotBlank
        private String sourceDir = "data/source";
        @NotBlank
        private String seedDir = "data/seed";
        @Min(value = 1, message = "discoveryPageLimit must be at least 1")
        private int discoveryPageLimit = 1000;
        @Min(value = 1, message = "updateCheckPageLimit must be at least 1")
        private int updateCheckPageLimit = 3;

        public String getSourceDir() { return sourceDir; }
        public void setSourceDir(String sourceDir) { this.sourceDir = sourceDir; }

        public String getSeedDir() { return seedDir; }
        public void setSeedDir(String seedDir) { this.seedDir = seedDir; }

        public int getDiscoveryPageLimit() { return discoveryPageLimit; }
        public void setDiscoveryPageLimit(int discoveryPageLimit) { this.discoveryPageLimit = discoveryPageLimit; }

        public int getUpdateCheckPageLimit() { return updateCheckPageLimit; }
        public void setUpdateCheckPageLimit(int updateCheckPageLimit) { this.updateCheckPageLimit = updateCheckPageLimit; }
    }

    public static class Search {
        @Min(1)
        private int defaultLimit = 10;
        @Min(1)
        private int maxLimit = 50;

        public int getDefaultLimit() { return defaultLimit; }
        public void setDefaultLimit(int defaultLimit) { this.defaultLimit = defaultLimit; }

        public int getMaxLimit() { return maxLimit; }
        public void setMaxLimit(int maxLimit) { this.maxLimit = maxLimit; }
    }
}
