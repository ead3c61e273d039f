package com.example.slides.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Copies the selected slides into a folder as slide_001.png, slide_002.png, ...
 */
@Service
public class ImageFolderExporter {

    private static final Logger log = LoggerFactory.getLogger(ImageFolderExporter.class);

    /**
     * @param images Slide images in output order
     * @param destination Folder to copy into, created when missing; existing files with the same names are replaced
     * @return The written files, in order
     * @throws IllegalArgumentException if no images are given
     * @throws SlideExportException if a copy fails
     */
    public List<Path> export(List<Path> images, Path destination) {
        if (images == null || images.isEmpty()) {
            throw new IllegalArgumentException("No images selected.");
        }
        log.info("Exporting {} images -> {}", images.size(), destination);

        List<Path> written = new ArrayList<>(images.size());
        try {
            Files.createDirectories(destination);
            for (int i = 0; i < images.size(); i++) {
                Path source = images.get(i);
                Path target = destination.resolve(String.format("slide_%03d%s", i + 1, extensionOf(source)));
                Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                written.add(target);
            }
        } catch (IOException e) {
            throw new SlideExportException("Failed to export images to " + destination + ": " + e.getMessage(), e);
        }

        log.info("Image export complete");
        return written;
    }

    static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return ".png";
        }
        return name.substring(dot);
    }
}
