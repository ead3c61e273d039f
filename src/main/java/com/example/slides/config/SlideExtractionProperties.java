package com.example.slides.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Settings for both extraction passes, the job runner and export.
 * Bound from the {@code slides.*} properties and injected where needed.
 */
@Configuration
@ConfigurationProperties(prefix = "slides")
public class SlideExtractionProperties {

    private Ffmpeg ffmpeg = new Ffmpeg();
    private Scene scene = new Scene();
    private Dedup dedup = new Dedup();
    private Jobs jobs = new Jobs();
    private Export export = new Export();

    public Ffmpeg getFfmpeg() { return ffmpeg; }
    public void setFfmpeg(Ffmpeg ffmpeg) { this.ffmpeg = ffmpeg; }

    public Scene getScene() { return scene; }
    public void setScene(Scene scene) { this.scene = scene; }

    public Dedup getDedup() { return dedup; }
    public void setDedup(Dedup dedup) { this.dedup = dedup; }

    public Jobs getJobs() { return jobs; }
    public void setJobs(Jobs jobs) { this.jobs = jobs; }

    public Export getExport() { return export; }
    public void setExport(Export export) { this.export = export; }

    public static class Ffmpeg {
        /**
         * FFmpeg executable, resolved on PATH when not absolute
         */
        private String path = "ffmpeg";

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
    }

    public static class Scene {
        private double defaultThreshold = 0.25;

        public double getDefaultThreshold() { return defaultThreshold; }
        public void setDefaultThreshold(double defaultThreshold) { this.defaultThreshold = defaultThreshold; }
    }

    public static class Dedup {
        /**
         * Fingerprint grid size S; fingerprints have S*S bits
         */
        private int hashSize = 16;
        private double defaultSimilarity = 0.92;
        /**
         * Worker threads used to fingerprint frames; 1 keeps the pass sequential
         */
        private int parallelism = 1;

        public int getHashSize() { return hashSize; }
        public void setHashSize(int hashSize) { this.hashSize = hashSize; }

        public double getDefaultSimilarity() { return defaultSimilarity; }
        public void setDefaultSimilarity(double defaultSimilarity) { this.defaultSimilarity = defaultSimilarity; }

        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }
    }

    public static class Jobs {
        /**
         * Parent of the per-job temp directories; system temp when empty
         */
        private String workDir;
        private int threads = 2;
        /**
         * Only videos inside this directory can be submitted
         */
        private String inputRoot = "videos";
        /**
         * Finished jobs kept at most; the oldest are evicted with their frames
         */
        private int maxRetained = 20;
        /**
         * Finished jobs older than this are evicted; 0 disables expiry
         */
        private long ttlMinutes = 360;

        public String getWorkDir() { return workDir; }
        public void setWorkDir(String workDir) { this.workDir = workDir; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }

        public String getInputRoot() { return inputRoot; }
        public void setInputRoot(String inputRoot) { this.inputRoot = inputRoot; }

        public int getMaxRetained() { return maxRetained; }
        public void setMaxRetained(int maxRetained) { this.maxRetained = maxRetained; }

        public long getTtlMinutes() { return ttlMinutes; }
        public void setTtlMinutes(long ttlMinutes) { this.ttlMinutes = ttlMinutes; }
    }

    public static class Export {
        /**
         * Page margin in PDF points
         */
        private float pdfMargin = 20f;
        /**
         * PDFs and image folders can only be written inside this directory
         */
        private String root = "exports";

        public float getPdfMargin() { return pdfMargin; }
        public void setPdfMargin(float pdfMargin) { this.pdfMargin = pdfMargin; }

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
    }
}
