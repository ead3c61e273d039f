package com.example.slides.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Confines client-supplied paths to the configured input and export roots.
 * Relative paths resolve against the root; absolute ones must already lie
 * inside it. Symlinks pointing out of a root are rejected as well.
 */
@Component
public class StorageRoots {

    private final Path inputRoot;
    private final Path exportRoot;

    @Autowired
    public StorageRoots(SlideExtractionProperties properties) {
        this(Paths.get(properties.getJobs().getInputRoot()), Paths.get(properties.getExport().getRoot()));
    }

    public StorageRoots(Path inputRoot, Path exportRoot) {
        this.inputRoot = inputRoot.toAbsolutePath().normalize();
        this.exportRoot = exportRoot.toAbsolutePath().normalize();
    }

    public Path getInputRoot() { return inputRoot; }
    public Path getExportRoot() { return exportRoot; }

    /**
     * @return The video as a real path inside the input root
     * @throws IllegalArgumentException if the path escapes the root or is not a regular file
     */
    public Path resolveInput(String requested) {
        Path video = confine(inputRoot, requested, "Video path");
        if (!Files.isRegularFile(video)) {
            throw new IllegalArgumentException("Video file does not exist: " + requested);
        }
        try {
            Path real = video.toRealPath();
            if (!real.startsWith(inputRoot.toRealPath())) {
                throw outside("Video path", requested, inputRoot);
            }
            return real;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not resolve video path " + requested, e);
        }
    }

    /**
     * @return The export destination inside the export root; it may not exist yet
     * @throws IllegalArgumentException if the path escapes the root
     */
    public Path resolveExport(String requested) {
        Path destination = confine(exportRoot, requested, "Destination");
        try {
            Files.createDirectories(exportRoot);
            Path existing = destination;
            while (existing != null && !Files.exists(existing)) {
                existing = existing.getParent();
            }
            if (existing == null || !existing.toRealPath().startsWith(exportRoot.toRealPath())) {
                throw outside("Destination", requested, exportRoot);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not resolve destination " + requested, e);
        }
        return destination;
    }

    private static Path confine(Path root, String requested, String what) {
        if (requested == null || requested.isBlank()) {
            throw new IllegalArgumentException(what + " is required");
        }
        Path resolved;
        try {
            resolved = root.resolve(requested).normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException(what + " is not a valid path: " + requested, e);
        }
        if (!resolved.startsWith(root)) {
            throw outside(what, requested, root);
        }
        return resolved;
    }

    private static IllegalArgumentException outside(String what, String requested, Path root) {
        return new IllegalArgumentException(what + " must be inside " + root + ": " + requested);
    }
}
