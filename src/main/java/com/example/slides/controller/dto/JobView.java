package com.example.slides.controller.dto;

import com.example.slides.orchestrator.ExtractionJob;
import com.example.slides.orchestrator.ExtractionOutcome;
import com.example.slides.orchestrator.JobStatus;
import com.example.slides.orchestrator.ThresholdDescriptions;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * JSON view of an extraction job for status polling
 */
public class JobView {

    private String id;
    private JobStatus status;
    private String videoPath;
    private double sceneThreshold;
    private String sceneThresholdDescription;
    private double similarityThreshold;
    private String similarityThresholdDescription;
    private List<String> progress;
    private List<String> slides;
    private Integer rawFrameCount;
    private Integer skippedFrameCount;
    private String error;
    private Instant createdAt;
    private Instant finishedAt;

    public static JobView from(ExtractionJob job) {
        JobView view = new JobView();
        view.id = job.getId();
        view.status = job.getStatus();
        view.videoPath = job.getVideoPath().toString();
        view.sceneThreshold = job.getSceneThreshold();
        view.sceneThresholdDescription = ThresholdDescriptions.describeSceneThreshold(job.getSceneThreshold());
        view.similarityThreshold = job.getSimilarityThreshold();
        view.similarityThresholdDescription =
            ThresholdDescriptions.describeSimilarityThreshold(job.getSimilarityThreshold());
        view.progress = job.getProgress();
        view.createdAt = job.getCreatedAt();
        view.finishedAt = job.getFinishedAt();

        ExtractionOutcome outcome = job.getOutcome();
        if (outcome != null) {
            view.slides = outcome.getSlides().stream().map(Path::toString).collect(Collectors.toList());
            view.rawFrameCount = outcome.getRawFrameCount();
            view.skippedFrameCount = outcome.getSkippedFrameCount();
            view.error = outcome.getError();
        }
        return view;
    }

    public String getId() { return id; }
    public JobStatus getStatus() { return status; }
    public String getVideoPath() { return videoPath; }
    public double getSceneThreshold() { return sceneThreshold; }
    public String getSceneThresholdDescription() { return sceneThresholdDescription; }
    public double getSimilarityThreshold() { return similarityThreshold; }
    public String getSimilarityThresholdDescription() { return similarityThresholdDescription; }
    public List<String> getProgress() { return progress; }
    public List<String> getSlides() { return slides; }
    public Integer getRawFrameCount() { return rawFrameCount; }
    public Integer getSkippedFrameCount() { return skippedFrameCount; }
    public String getError() { return error; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getFinishedAt() { return finishedAt; }
}
