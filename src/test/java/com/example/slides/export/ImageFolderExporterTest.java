package com.example.slides.export;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ImageFolderExporterTest {

    @TempDir
    Path tempDir;

    private final ImageFolderExporter exporter = new ImageFolderExporter();

    @Test
    void testFilesAreRenumberedInSelectionOrder() throws Exception {
        Path first = Files.writeString(tempDir.resolve("slide_000007.png"), "seven");
        Path second = Files.writeString(tempDir.resolve("slide_000003.jpg"), "three");
        Path dest = tempDir.resolve("export/deck");

        List<Path> written = exporter.export(List.of(first, second), dest);

        assertEquals(List.of(dest.resolve("slide_001.png"), dest.resolve("slide_002.jpg")), written);
        assertEquals("seven", Files.readString(written.get(0)));
        assertEquals("three", Files.readString(written.get(1)));
        assertTrue(Files.exists(first), "sources stay in place");
    }

    @Test
    void testExistingFilesAreReplaced() throws Exception {
        Path dest = Files.createDirectories(tempDir.resolve("dest"));
        Files.writeString(dest.resolve("slide_001.png"), "old");
        Path source = Files.writeString(tempDir.resolve("frame.png"), "new");

        exporter.export(List.of(source), dest);

        assertEquals("new", Files.readString(dest.resolve("slide_001.png")));
    }

    @Test
    void testEmptySelectionIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> exporter.export(List.of(), tempDir));
    }

    @Test
    void testMissingSourceFailsExport() {
        assertThrows(SlideExportException.class,
            () -> exporter.export(List.of(tempDir.resolve("gone.png")), tempDir.resolve("dest")));
    }

    @Test
    void testExtensionDefaultsToPng() {
        assertEquals(".png", ImageFolderExporter.extensionOf(Path.of("frame")));
        assertEquals(".png", ImageFolderExporter.extensionOf(Path.of("frame.")));
        assertEquals(".png", ImageFolderExporter.extensionOf(Path.of(".hidden")));
        assertEquals(".jpeg", ImageFolderExporter.extensionOf(Path.of("dir/frame.jpeg")));
    }
}
