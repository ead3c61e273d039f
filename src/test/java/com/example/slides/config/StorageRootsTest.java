package com.example.slides.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class StorageRootsTest {

    @TempDir
    Path tempDir;

    private Path inputRoot;
    private Path exportRoot;
    private StorageRoots roots;

    @BeforeEach
    void setUp() throws Exception {
        inputRoot = Files.createDirectories(tempDir.resolve("input"));
        exportRoot = tempDir.resolve("export");
        roots = new StorageRoots(inputRoot, exportRoot);
    }

    @Test
    public void testResolveInput_RelativeAndAbsoluteInsideRoot() throws Exception {
        Path video = Files.writeString(inputRoot.resolve("lecture.mp4"), "video");

        assertEquals(video.toRealPath(), roots.resolveInput("lecture.mp4"));
        assertEquals(video.toRealPath(), roots.resolveInput(video.toString()));
    }

    @Test
    public void testResolveInput_EscapesAreRejected() throws Exception {
        Files.writeString(tempDir.resolve("secret.txt"), "secret");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> roots.resolveInput("../secret.txt"));
        assertTrue(e.getMessage().contains("must be inside"));
        assertThrows(IllegalArgumentException.class,
            () -> roots.resolveInput(tempDir.resolve("secret.txt").toString()));
    }

    @Test
    public void testResolveInput_MissingOrBlankIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> roots.resolveInput("missing.mp4"));
        assertTrue(e.getMessage().startsWith("Video file does not exist"));
        assertThrows(IllegalArgumentException.class, () -> roots.resolveInput(" "));
        assertThrows(IllegalArgumentException.class, () -> roots.resolveInput(null));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    public void testResolveInput_SymlinkOutOfRootIsRejected() throws Exception {
        Path outside = Files.writeString(tempDir.resolve("outside.mp4"), "video");
        Files.createSymbolicLink(inputRoot.resolve("link.mp4"), outside);

        assertThrows(IllegalArgumentException.class, () -> roots.resolveInput("link.mp4"));
    }

    @Test
    public void testResolveExport_NewPathInsideRoot() {
        Path pdf = roots.resolveExport("decks/week1/slides.pdf");

        assertEquals(exportRoot.toAbsolutePath().normalize().resolve("decks/week1/slides.pdf"), pdf);
        assertTrue(Files.isDirectory(exportRoot));
    }

    @Test
    public void testResolveExport_EscapesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> roots.resolveExport("../evil.pdf"));
        assertThrows(IllegalArgumentException.class, () -> roots.resolveExport("decks/../../evil"));
        assertThrows(IllegalArgumentException.class,
            () -> roots.resolveExport(tempDir.resolve("evil.pdf").toString()));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    public void testResolveExport_SymlinkedDirectoryOutOfRootIsRejected() throws Exception {
        Files.createDirectories(exportRoot);
        Path elsewhere = Files.createDirectories(tempDir.resolve("elsewhere"));
        Files.createSymbolicLink(exportRoot.resolve("out"), elsewhere);

        assertThrows(IllegalArgumentException.class, () -> roots.resolveExport("out/slides.pdf"));
    }
}
