package com.example.slides.dedup;

/**
 * Raised before any processing starts when a run is configured with values
 * outside their allowed range.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
