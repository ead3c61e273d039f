package com.example.slides.dedup;

/**
 * Notification sink for the two checkpoints of a deduplication run.
 */
public interface DeduplicationProgressListener {

    DeduplicationProgressListener NONE = new DeduplicationProgressListener() { };

    default void onStarted(int candidateCount, int maxDistance) {
    }

    default void onFinished(DeduplicationResult result) {
    }
}
