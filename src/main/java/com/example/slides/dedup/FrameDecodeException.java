package com.example.slides.dedup;

/**
 * A candidate frame's image could not be opened or decoded.
 */
public class FrameDecodeException extends Exception {

    private final String frameId;

    public FrameDecodeException(String frameId, String message) {
        super(message);
        this.frameId = frameId;
    }

    public FrameDecodeException(String frameId, String message, Throwable cause) {
        super(message, cause);
        this.frameId = frameId;
    }

    public String getFrameId() {
        return frameId;
    }
}
