package com.example.slides.extraction;

import java.nio.file.Path;
import java.util.List;

public interface SceneFrameExtractor {
    /**
     * Write one image per detected scene change into the output directory
     * @param video Video file to scan
     * @param outputDir Existing directory that receives the frames
     * @param sceneThreshold Scene-change sensitivity 0.0-1.0, lower emits more frames
     * @return Frame files in playback order, possibly empty
     * @throws FrameExtractionException if the extractor cannot run or fails
     */
    List<Path> extractFrames(Path video, Path outputDir, double sceneThreshold);
}
