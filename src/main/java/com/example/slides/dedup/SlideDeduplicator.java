package com.example.slides.dedup;

import java.util.List;

public interface SlideDeduplicator {
    /**
     * Collapse consecutive near-identical candidates into one slide each
     * @param candidates Frames in playback order
     * @param similarityThreshold 0.0-1.0, higher keeps more frames
     * @return Retained candidates in their original order, with diagnostics
     * @throws InvalidConfigurationException if the threshold is out of range
     */
    default DeduplicationResult reduce(List<CandidateFrame> candidates, double similarityThreshold) {
        return reduce(candidates, similarityThreshold, DeduplicationProgressListener.NONE);
    }

    /**
     * Same as {@link #reduce(List, double)}, reporting start and finish to the listener
     */
    DeduplicationResult reduce(List<CandidateFrame> candidates, double similarityThreshold,
                               DeduplicationProgressListener listener);
}
