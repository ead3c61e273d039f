package com.example.slides.dedup;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * One element of the ordered candidate sequence: an identifier plus the means
 * to read the image it refers to. Images are loaded lazily and not cached.
 * <p>
 * The id identifies the candidate: two candidates with the same id are equal
 * whatever their images, so ids must be unique within one deduplication run.
 */
public final class CandidateFrame {

    /**
     * Supplies the decoded image for a candidate.
     */
    @FunctionalInterface
    public interface ImageSource {
        BufferedImage load() throws FrameDecodeException;
    }

    private final String id;
    private final Path path;
    private final ImageSource source;

    private CandidateFrame(String id, Path path, ImageSource source) {
        this.id = Objects.requireNonNull(id, "id");
        this.path = path;
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Candidate backed by an image file, identified by its path.
     */
    public static CandidateFrame ofPath(Path path) {
        String id = path.toString();
        return new CandidateFrame(id, path, () -> readImage(id, path));
    }

    /**
     * Candidate whose image is already decoded in memory.
     */
    public static CandidateFrame ofImage(String id, BufferedImage image) {
        Objects.requireNonNull(image, "image");
        return new CandidateFrame(id, null, () -> image);
    }

    public static CandidateFrame of(String id, ImageSource source) {
        return new CandidateFrame(id, null, source);
    }

    public BufferedImage loadImage() throws FrameDecodeException {
        return source.load();
    }

    public String getId() { return id; }

    /**
     * @return Backing file, when the candidate was created from one
     */
    public Optional<Path> getPath() { return Optional.ofNullable(path); }

    private static BufferedImage readImage(String id, Path path) throws FrameDecodeException {
        if (!Files.isRegularFile(path)) {
            throw new FrameDecodeException(id, "Frame file does not exist: " + path);
        }
        try {
            BufferedImage image = ImageIO.read(path.toFile());
            if (image == null) {
                throw new FrameDecodeException(id, "No image decoder understands " + path);
            }
            return image;
        } catch (IOException | RuntimeException e) {
            // ImageIO reports some corrupt streams as runtime exceptions
            throw new FrameDecodeException(id, "Failed to decode " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CandidateFrame)) return false;
        return id.equals(((CandidateFrame) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id;
    }
}
