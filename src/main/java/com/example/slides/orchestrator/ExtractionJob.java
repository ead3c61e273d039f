package com.example.slides.orchestrator;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * State of one background extraction. Written by the worker thread, read by
 * request threads polling for status.
 */
public class ExtractionJob {

    private static final AtomicLong FINISH_ORDER = new AtomicLong();

    private final String id;
    private final Path videoPath;
    private final Path workDir;
    private final double sceneThreshold;
    private final double similarityThreshold;
    private final Instant createdAt;
    private final List<String> progress = new CopyOnWriteArrayList<>();

    private volatile JobStatus status = JobStatus.PENDING;
    private volatile ExtractionOutcome outcome;
    private volatile Instant finishedAt;
    private volatile long finishOrder;
    private volatile boolean deleted;

    public ExtractionJob(String id, Path videoPath, Path workDir, double sceneThreshold, double similarityThreshold) {
        this.id = id;
        this.videoPath = videoPath;
        this.workDir = workDir;
        this.sceneThreshold = sceneThreshold;
        this.similarityThreshold = similarityThreshold;
        this.createdAt = Instant.now();
    }

    void markRunning() {
        status = JobStatus.RUNNING;
    }

    void addProgress(String message) {
        progress.add(message);
    }

    void markDeleted() {
        deleted = true;
    }

    boolean isDeleted() {
        return deleted;
    }

    /**
     * Position among all finished jobs, increasing with every finish
     */
    long getFinishOrder() {
        return finishOrder;
    }

    boolean isDone() {
        return status == JobStatus.COMPLETED || status == JobStatus.FAILED;
    }

    void finish(ExtractionOutcome outcome) {
        this.outcome = outcome;
        this.finishedAt = Instant.now();
        this.finishOrder = FINISH_ORDER.incrementAndGet();
        this.status = outcome.isSuccess() ? JobStatus.COMPLETED : JobStatus.FAILED;
    }

    public String getId() { return id; }
    public Path getVideoPath() { return videoPath; }
    public Path getWorkDir() { return workDir; }
    public double getSceneThreshold() { return sceneThreshold; }
    public double getSimilarityThreshold() { return similarityThreshold; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public JobStatus getStatus() { return status; }
    public ExtractionOutcome getOutcome() { return outcome; }

    public List<String> getProgress() {
        return new ArrayList<>(progress);
    }

    /**
     * @return Last progress message, or null before the job started
     */
    public String getLatestProgress() {
        List<String> snapshot = getProgress();
        return snapshot.isEmpty() ? null : snapshot.get(snapshot.size() - 1);
    }
}
