package com.example.slides.export;

/**
 * Writing the selected slides to their destination failed.
 */
public class SlideExportException extends RuntimeException {

    public SlideExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
