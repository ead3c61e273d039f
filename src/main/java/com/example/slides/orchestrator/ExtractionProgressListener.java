package com.example.slides.orchestrator;

/**
 * Receives human-readable progress messages from an extraction run.
 * Called on the thread running the extraction.
 */
@FunctionalInterface
public interface ExtractionProgressListener {

    void onProgress(String message);
}
