package com.williamcallahan.omnibus_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Strongly typed configuration for omnibus detection, extraction and the extracted-work cache.
 */
@Component
@ConfigurationProperties(prefix = "app.omnibus")
public class OmnibusConfigurationProperties {

    private final Cache cache = new Cache();
    private final Extraction extraction = new Extraction();
    private final Detection detection = new Detection();

    public Cache getCache() {
        return cache;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public Detection getDetection() {
        return detection;
    }

    public static class Cache {

        /**
         * Directory holding extracted works. Owned by this service instance.
         */
        private Path dir = Path.of(System.getProperty("java.io.tmpdir"), "omnibus-cache");

        /**
         * Extracted files at least this old are removed by the scheduled cleanup.
         */
        private long maxAgeHours = 24;

        /**
         * Delay between scheduled cleanup runs.
         */
        private Duration cleanupInterval = Duration.ofHours(6);

        /**
         * Whether the scheduled cleanup runs at all.
         */
        private boolean cleanupEnabled = true;

        /**
         * Re-extract a cached work when the omnibus file is newer than the cached file.
         */
        private boolean invalidateOnSourceChange = true;

        public Path getDir() {
            return dir;
        }

        public void setDir(Path dir) {
            this.dir = dir;
        }

        public long getMaxAgeHours() {
            return maxAgeHours;
        }

        public void setMaxAgeHours(long maxAgeHours) {
            this.maxAgeHours = maxAgeHours;
        }

        public Duration getCleanupInterval() {
            return cleanupInterval;
        }

        public void setCleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
        }

        public boolean isCleanupEnabled() {
            return cleanupEnabled;
        }

        public void setCleanupEnabled(boolean cleanupEnabled) {
            this.cleanupEnabled = cleanupEnabled;
        }

        public boolean isInvalidateOnSourceChange() {
            return invalidateOnSourceChange;
        }

        public void setInvalidateOnSourceChange(boolean invalidateOnSourceChange) {
            this.invalidateOnSourceChange = invalidateOnSourceChange;
        }
    }

    public static class Extraction {

        /**
         * How long a content request waits for a work to be sliced.
         */
        private Duration timeout = Duration.ofSeconds(60);

        /**
         * Worker threads for slicing. Zero or less means one per available processor.
         */
        private int poolSize = 0;

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }

    public static class Detection {

        /**
         * Regular expressions matched against the lower-cased publisher. A full match marks a Delphi Classics omnibus.
         */
        private List<String> delphiPublisherPatterns = new ArrayList<>(List.of(
                ".*delphi.*classics.*",
                ".*delphi.*publishing.*"));

        /**
         * Regular expressions searched for in the lower-cased title. Any hit marks a generic omnibus.
         */
        private List<String> omnibusTitlePatterns = new ArrayList<>(List.of(
                "^collected",
                "^complete",
                "omnibus",
                "collection",
                "anthology",
                "complete works",
                "collected works"));

        /**
         * Play names whose presence among the top-level TOC entries marks a Shakespeare collection.
         */
        private List<String> shakespeareKeywords = new ArrayList<>(List.of(
                "hamlet", "macbeth", "romeo", "juliet", "lear", "othello"));

        public List<String> getDelphiPublisherPatterns() {
            return delphiPublisherPatterns;
        }

        public void setDelphiPublisherPatterns(List<String> delphiPublisherPatterns) {
            this.delphiPublisherPatterns = delphiPublisherPatterns;
        }

        public List<String> getOmnibusTitlePatterns() {
            return omnibusTitlePatterns;
        }

        public void setOmnibusTitlePatterns(List<String> omnibusTitlePatterns) {
            this.omnibusTitlePatterns = omnibusTitlePatterns;
        }

        public List<String> getShakespeareKeywords() {
            return shakespeareKeywords;
        }

        public void setShakespeareKeywords(List<String> shakespeareKeywords) {
            this.shakespeareKeywords = shakespeareKeywords;
        }
    }
}
