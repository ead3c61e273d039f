package com.example.slides.orchestrator;

import com.example.slides.config.SlideExtractionProperties;
import com.example.slides.dedup.CandidateFrame;
import com.example.slides.dedup.DeduplicationProgressListener;
import com.example.slides.dedup.DeduplicationResult;
import com.example.slides.dedup.InvalidConfigurationException;
import com.example.slides.dedup.SimilarityThreshold;
import com.example.slides.dedup.SlideDeduplicator;
import com.example.slides.extraction.FrameExtractionException;
import com.example.slides.extraction.SceneFrameExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the two passes in sequence:
 * 1. FFmpeg scene-change detection writes candidate frames to the work directory
 * 2. Perceptual-hash deduplication keeps one frame per distinct slide
 *
 * Failures of either pass come back as a failed {@link ExtractionOutcome};
 * only invalid thresholds are thrown, before pass 1 starts.
 */
@Service
public class SlideExtractionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SlideExtractionOrchestrator.class);

    static final String NO_FRAMES_MESSAGE =
        "FFmpeg produced no frames.\nTry lowering the scene detection threshold.";

    private final SceneFrameExtractor frameExtractor;
    private final SlideDeduplicator deduplicator;
    private final SlideExtractionProperties properties;

    public SlideExtractionOrchestrator(SceneFrameExtractor frameExtractor,
                                       SlideDeduplicator deduplicator,
                                       SlideExtractionProperties properties) {
        this.frameExtractor = frameExtractor;
        this.deduplicator = deduplicator;
        this.properties = properties;
    }

    public double resolveSceneThreshold(Double requested) {
        double value = requested != null ? requested : properties.getScene().getDefaultThreshold();
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidConfigurationException(
                String.format("Scene threshold must be between 0.0 and 1.0, got %s", value));
        }
        return value;
    }

    public double resolveSimilarityThreshold(Double requested) {
        double value = requested != null ? requested : properties.getDedup().getDefaultSimilarity();
        return SimilarityThreshold.of(value).getValue();
    }

    /**
     * @param video Video to process
     * @param workDir Directory receiving the raw frames; retained slides point into it
     * @param sceneThreshold Scene-change sensitivity, 0.0-1.0
     * @param similarityThreshold Dedup similarity, 0.0-1.0
     * @param progress Receives one message per stage
     * @throws InvalidConfigurationException if a threshold is out of range
     */
    public ExtractionOutcome extract(Path video, Path workDir, double sceneThreshold,
                                     double similarityThreshold, ExtractionProgressListener progress) {
        resolveSceneThreshold(sceneThreshold);
        resolveSimilarityThreshold(similarityThreshold);

        try {
            progress.onProgress("Pass 1/2 - Running FFmpeg scene detection ...");
            List<Path> rawFrames;
            try {
                rawFrames = frameExtractor.extractFrames(video, workDir, sceneThreshold);
            } catch (FrameExtractionException e) {
                log.error("Frame extraction failed for {}: {}", video, e.getMessage());
                return ExtractionOutcome.failure(failureMessage(e));
            }

            if (rawFrames.isEmpty()) {
                log.warn("No frames extracted from {}", video);
                return ExtractionOutcome.failure(NO_FRAMES_MESSAGE);
            }

            List<CandidateFrame> candidates = rawFrames.stream()
                .map(CandidateFrame::ofPath)
                .collect(Collectors.toList());

            DeduplicationResult result = deduplicator.reduce(candidates, similarityThreshold,
                new DeduplicationProgressListener() {
                    @Override
                    public void onStarted(int candidateCount, int maxDistance) {
                        progress.onProgress("Pass 2/2 - Deduplicating " + candidateCount + " frames ...");
                    }

                    @Override
                    public void onFinished(DeduplicationResult finished) {
                        progress.onProgress("Done - " + finished.getRetainedCount() + " unique slide(s) detected.");
                    }
                });

            List<Path> slides = result.getRetained().stream()
                .map(frame -> frame.getPath().orElseThrow())
                .collect(Collectors.toList());
            return ExtractionOutcome.success(slides, result);

        } catch (InvalidConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected extraction error for {}", video, e);
            return ExtractionOutcome.failure(e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }

    private static String failureMessage(FrameExtractionException e) {
        String output = e.getProcessOutput();
        if (output == null || output.isEmpty()) {
            return "FFmpeg failed:\n" + e.getMessage();
        }
        return "FFmpeg failed:\n" + output;
    }
}
