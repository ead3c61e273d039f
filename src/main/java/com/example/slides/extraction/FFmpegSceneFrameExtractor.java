package com.example.slides.extraction;

import com.example.slides.config.SlideExtractionProperties;
import com.example.slides.dedup.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Scene-change frame extraction with FFmpeg's {@code select} filter.
 * The first frame is always emitted, then one frame per scene score above the threshold.
 */
@Service
public class FFmpegSceneFrameExtractor implements SceneFrameExtractor {

    private static final Logger log = LoggerFactory.getLogger(FFmpegSceneFrameExtractor.class);

    static final String FRAME_PATTERN = "slide_%06d.png";
    private static final Pattern FRAME_NAME = Pattern.compile("slide_\\d+\\.png");
    private static final int OUTPUT_TAIL_CHARS = 2000;

    private final String ffmpegPath;

    @Autowired
    public FFmpegSceneFrameExtractor(SlideExtractionProperties properties) {
        this(properties.getFfmpeg().getPath());
    }

    FFmpegSceneFrameExtractor(String ffmpegPath) {
        this.ffmpegPath = ffmpegPath;
    }

    @Override
    public List<Path> extractFrames(Path video, Path outputDir, double sceneThreshold) {
        if (Double.isNaN(sceneThreshold) || sceneThreshold < 0.0 || sceneThreshold > 1.0) {
            throw new InvalidConfigurationException(
                String.format("Scene threshold must be between 0.0 and 1.0, got %s", sceneThreshold));
        }
        if (!Files.isRegularFile(video)) {
            throw new FrameExtractionException("Video file does not exist: " + video);
        }

        List<String> command = buildCommand(video, outputDir, sceneThreshold);
        log.info("Video: {} | scene_threshold={}", video, String.format(Locale.ROOT, "%.2f", sceneThreshold));
        log.debug("Running FFmpeg command: {}", String.join(" ", command));

        Process process;
        try {
            Files.createDirectories(outputDir);
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            process = pb.start();
        } catch (IOException e) {
            throw new FrameExtractionException("Could not start FFmpeg (" + ffmpegPath + "): " + e.getMessage(), e);
        }

        String output;
        int exitCode;
        try {
            output = drain(process);
            exitCode = process.waitFor();
        } catch (IOException e) {
            process.destroyForcibly();
            throw new FrameExtractionException("Failed reading FFmpeg output: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new FrameExtractionException("Interrupted while waiting for FFmpeg", e);
        }

        if (exitCode != 0) {
            log.error("FFmpeg failed (code {})", exitCode);
            throw new FrameExtractionException("FFmpeg exited with code " + exitCode, exitCode, output);
        }

        List<Path> frames = collectFrames(outputDir);
        log.info("FFmpeg produced {} raw frames", frames.size());
        return frames;
    }

    List<String> buildCommand(Path video, Path outputDir, double sceneThreshold) {
        String filter = String.format(Locale.ROOT,
            "select=eq(n\\,0)+gt(scene\\,%s),setpts=N/FRAME_RATE/TB", sceneThreshold);
        List<String> command = new ArrayList<>();
        command.add(ffmpegPath);
        command.add("-i");
        command.add(video.toString());
        command.add("-vf");
        command.add(filter);
        command.add("-vsync");
        command.add("vfr");
        command.add("-q:v");
        command.add("2");
        command.add(outputDir.resolve(FRAME_PATTERN).toString());
        return command;
    }

    /**
     * Frame files in the directory, ordered by name. Names are zero-padded so
     * lexicographic order is playback order.
     */
    static List<Path> collectFrames(Path outputDir) {
        if (!Files.isDirectory(outputDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(outputDir)) {
            return files
                .filter(p -> FRAME_NAME.matcher(p.getFileName().toString()).matches())
                .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new FrameExtractionException("Could not list frames in " + outputDir + ": " + e.getMessage(), e);
        }
    }

    /**
     * Read combined FFmpeg output to the end, keeping only the tail.
     */
    private static String drain(Process process) throws IOException {
        StringBuilder tail = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.contains("Error") || line.contains("error")) {
                    log.debug("FFmpeg: {}", line);
                }
                tail.append(line).append('\n');
                if (tail.length() > OUTPUT_TAIL_CHARS * 2) {
                    tail.delete(0, tail.length() - OUTPUT_TAIL_CHARS);
                }
            }
        }
        return tail.length() > OUTPUT_TAIL_CHARS
            ? tail.substring(tail.length() - OUTPUT_TAIL_CHARS)
            : tail.toString();
    }
}
