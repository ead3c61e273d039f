package com.example.slides.orchestrator;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;

/**
 * Input of one extraction run. Thresholds left null fall back to the configured defaults.
 */
public class ExtractionRequest {

    @NotBlank
    private String videoPath;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double sceneThreshold;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double similarityThreshold;

    public ExtractionRequest() {
    }

    public ExtractionRequest(String videoPath, Double sceneThreshold, Double similarityThreshold) {
        this.videoPath = videoPath;
        this.sceneThreshold = sceneThreshold;
        this.similarityThreshold = similarityThreshold;
    }

    public String getVideoPath() { return videoPath; }
    public void setVideoPath(String videoPath) { this.videoPath = videoPath; }

    public Double getSceneThreshold() { return sceneThreshold; }
    public void setSceneThreshold(Double sceneThreshold) { this.sceneThreshold = sceneThreshold; }

    public Double getSimilarityThreshold() { return similarityThreshold; }
    public void setSimilarityThreshold(Double similarityThreshold) { this.similarityThreshold = similarityThreshold; }
}
