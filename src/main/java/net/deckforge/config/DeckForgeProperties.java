package net.deckforge.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Typed configuration for build layout, asset materialization and retry behavior.
 */
@Component
@ConfigurationProperties(prefix = "deckforge")
public class DeckForgeProperties {

    private String buildRoot = "build";
    private String assetDirectory = "assets_generated";
    private String templateDir;
    private int workerCount = 4;
    private Duration downloadTimeout = Duration.ofSeconds(30);
    private Retry generation = new Retry(3, Duration.ofSeconds(5));
    private Retry download = new Retry(3, Duration.ofSeconds(2));

    /**
     * Returns the root directory under which project build directories are created.
     */
    public String getBuildRoot() {
        return buildRoot;
    }

    public void setBuildRoot(String buildRoot) {
        this.buildRoot = buildRoot;
    }

    /**
     * Returns the name of the per-build subdirectory holding materialized images.
     */
    public String getAssetDirectory() {
        return assetDirectory;
    }

    public void setAssetDirectory(String assetDirectory) {
        this.assetDirectory = assetDirectory;
    }

    /**
     * Returns the directory holding viewer templates, or {@code null} when none is configured.
     */
    public String getTemplateDir() {
        return templateDir;
    }

    public void setTemplateDir(String templateDir) {
        this.templateDir = templateDir;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = workerCount;
    }

    public Duration getDownloadTimeout() {
        return downloadTimeout;
    }

    public void setDownloadTimeout(Duration downloadTimeout) {
        this.downloadTimeout = downloadTimeout;
    }

    /**
     * Retry bounds for image generator calls.
     */
    public Retry getGeneration() {
        return generation;
    }

    public void setGeneration(Retry generation) {
        this.generation = generation;
    }

    /**
     * Retry bounds for image downloads.
     */
    public Retry getDownload() {
        return download;
    }

    public void setDownload(Retry download) {
        this.download = download;
    }

    /**
     * Attempt bound and linear backoff step for one retried operation.
     */
    public static class Retry {

        private int maxAttempts;
        private Duration backoff;

        public Retry() {
            this(3, Duration.ofSeconds(1));
        }

        public Retry(int maxAttempts, Duration backoff) {
            this.maxAttempts = maxAttempts;
            this.backoff = backoff;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBackoff() {
            return backoff;
        }

        public void setBackoff(Duration backoff) {
            this.backoff = backoff;
        }
    }
}
