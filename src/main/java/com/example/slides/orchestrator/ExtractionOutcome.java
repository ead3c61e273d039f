package com.example.slides.orchestrator;

import com.example.slides.dedup.DeduplicationResult;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Result of running both passes: either the unique slides or a user-facing error.
 */
public class ExtractionOutcome {

    private final List<Path> slides;
    private final int rawFrameCount;
    private final int skippedFrameCount;
    private final String error;

    private ExtractionOutcome(List<Path> slides, int rawFrameCount, int skippedFrameCount, String error) {
        this.slides = Collections.unmodifiableList(slides);
        this.rawFrameCount = rawFrameCount;
        this.skippedFrameCount = skippedFrameCount;
        this.error = error;
    }

    public static ExtractionOutcome success(List<Path> slides, DeduplicationResult dedup) {
        return new ExtractionOutcome(slides, dedup.getCandidateCount(), dedup.getSkippedCount(), null);
    }

    public static ExtractionOutcome failure(String error) {
        return new ExtractionOutcome(List.of(), 0, 0, error);
    }

    public boolean isSuccess() { return error == null; }
    public List<Path> getSlides() { return slides; }
    public int getRawFrameCount() { return rawFrameCount; }
    public int getSkippedFrameCount() { return skippedFrameCount; }
    public String getError() { return error; }
}
