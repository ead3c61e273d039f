package com.example.slides.extraction;

/**
 * The scene-change pass could not produce frames: missing input, the FFmpeg
 * binary could not start, or it exited with an error.
 */
public class FrameExtractionException extends RuntimeException {

    private final int exitCode;
    private final String processOutput;

    public FrameExtractionException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
        this.processOutput = "";
    }

    public FrameExtractionException(String message) {
        this(message, -1, "");
    }

    public FrameExtractionException(String message, int exitCode, String processOutput) {
        super(message);
        this.exitCode = exitCode;
        this.processOutput = processOutput;
    }

    /**
     * @return FFmpeg exit code, or -1 when the process never ran
     */
    public int getExitCode() { return exitCode; }

    /**
     * @return Tail of FFmpeg's stderr, empty when the process never ran
     */
    public String getProcessOutput() { return processOutput; }
}
