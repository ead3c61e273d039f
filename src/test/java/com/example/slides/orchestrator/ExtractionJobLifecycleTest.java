package com.example.slides.orchestrator;

import com.example.slides.config.SlideExtractionProperties;
import com.example.slides.config.StorageRoots;
import com.example.slides.dedup.DifferenceHashFingerprintEngine;
import com.example.slides.dedup.SlideDeduplicatorImpl;
import com.example.slides.extraction.SceneFrameExtractor;
import com.example.slides.testsupport.FakeFrameExtraction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Deletion and eviction of jobs, driven through executors the test controls.
 */
public class ExtractionJobLifecycleTest {

    @TempDir
    Path tempDir;

    private SceneFrameExtractor extractor;
    private SlideExtractionProperties properties;
    private SlideExtractionOrchestrator orchestrator;
    private StorageRoots storageRoots;
    private List<Runnable> queued;

    @BeforeEach
    void setUp() throws Exception {
        extractor = mock(SceneFrameExtractor.class);
        properties = new SlideExtractionProperties();
        properties.getJobs().setWorkDir(tempDir.resolve("work").toString());
        orchestrator = new SlideExtractionOrchestrator(extractor,
            new SlideDeduplicatorImpl(new DifferenceHashFingerprintEngine()), properties);
        Path inputRoot = Files.createDirectories(tempDir.resolve("input"));
        Files.writeString(inputRoot.resolve("lecture.mp4"), "video");
        storageRoots = new StorageRoots(inputRoot, tempDir.resolve("export"));
        queued = new ArrayList<>();
    }

    @Test
    public void testDeleteQueuedJob_NeverRunsAndLeavesNoFrames() throws Exception {
        // Given
        when(extractor.extractFrames(any(), any(), anyDouble()))
            .thenAnswer(FakeFrameExtraction.writesFrames(0, 200));
        ExtractionJobService service = service(queued::add);
        ExtractionJob job = service.submit(request());
        assertEquals(1, queued.size());

        // When
        service.delete(job.getId());
        queued.forEach(Runnable::run);
        service.cleanup();

        // Then
        assertFalse(Files.exists(job.getWorkDir()));
        assertEquals(JobStatus.PENDING, job.getStatus());
        verifyNoInteractions(extractor);
    }

    @Test
    public void testDeleteRunningJob_RemovesFramesOnceWorkerFinishes() throws Exception {
        // Given
        ExtractionJobService service = service(queued::add);
        AtomicReference<String> jobId = new AtomicReference<>();
        when(extractor.extractFrames(any(), any(), anyDouble())).thenAnswer(invocation -> {
            service.delete(jobId.get());
            return FakeFrameExtraction.writesFrames(0, 200).answer(invocation);
        });
        ExtractionJob job = service.submit(request());
        jobId.set(job.getId());

        // When
        queued.forEach(Runnable::run);

        // Then
        verify(extractor).extractFrames(any(), eq(job.getWorkDir()), anyDouble());
        assertFalse(Files.exists(job.getWorkDir()));
        assertThrows(NoSuchElementException.class, () -> service.get(job.getId()));
    }

    @Test
    public void testCleanup_RemovesFramesOfDeletedJobStillQueued() throws Exception {
        ExtractionJobService service = service(queued::add);
        ExtractionJob job = service.submit(request());
        service.delete(job.getId());
        assertTrue(Files.isDirectory(job.getWorkDir()));

        service.cleanup();

        assertFalse(Files.exists(job.getWorkDir()));
    }

    @Test
    public void testSubmit_EvictsOldestFinishedJobsBeyondLimit() throws Exception {
        // Given
        properties.getJobs().setMaxRetained(2);
        when(extractor.extractFrames(any(), any(), anyDouble()))
            .thenAnswer(FakeFrameExtraction.writesFrames(0, 200));
        ExtractionJobService service = service(Runnable::run);

        // When
        ExtractionJob first = service.submit(request());
        ExtractionJob second = service.submit(request());
        ExtractionJob third = service.submit(request());

        // Then
        assertEquals(JobStatus.COMPLETED, third.getStatus());
        assertThrows(NoSuchElementException.class, () -> service.get(first.getId()));
        assertFalse(Files.exists(first.getWorkDir()));
        assertSame(second, service.get(second.getId()));
        assertSame(third, service.get(third.getId()));
        assertEquals(2, service.list().size());
    }

    @Test
    public void testLimit_NeverEvictsUnfinishedJobs() throws Exception {
        properties.getJobs().setMaxRetained(0);
        ExtractionJobService service = service(queued::add);

        ExtractionJob pending = service.submit(request());

        assertEquals(0, service.evictBeyondLimit());
        assertSame(pending, service.get(pending.getId()));
        assertTrue(Files.isDirectory(pending.getWorkDir()));
    }

    @Test
    public void testEvictExpired_RemovesFinishedJobsPastTtl() throws Exception {
        // Given
        properties.getJobs().setTtlMinutes(60);
        when(extractor.extractFrames(any(), any(), anyDouble()))
            .thenAnswer(FakeFrameExtraction.writesFrames(0));
        ExtractionJobService service = service(Runnable::run);
        ExtractionJob finished = service.submit(request());
        ExtractionJobService queuedService = service(queued::add);
        ExtractionJob pending = queuedService.submit(request());

        // When / Then
        assertEquals(0, service.evictExpired(Instant.now().plus(Duration.ofMinutes(30))));
        assertSame(finished, service.get(finished.getId()));

        Instant later = Instant.now().plus(Duration.ofMinutes(61));
        assertEquals(1, service.evictExpired(later));
        assertThrows(NoSuchElementException.class, () -> service.get(finished.getId()));
        assertFalse(Files.exists(finished.getWorkDir()));

        assertEquals(0, queuedService.evictExpired(later));
        assertSame(pending, queuedService.get(pending.getId()));
    }

    @Test
    public void testEvictExpired_ZeroTtlKeepsJobs() throws Exception {
        properties.getJobs().setTtlMinutes(0);
        when(extractor.extractFrames(any(), any(), anyDouble()))
            .thenAnswer(FakeFrameExtraction.writesFrames(0));
        ExtractionJobService service = service(Runnable::run);
        ExtractionJob job = service.submit(request());

        assertEquals(0, service.evictExpired(Instant.now().plus(Duration.ofDays(365))));
        assertSame(job, service.get(job.getId()));
    }

    @Test
    public void testSubmit_VideoOutsideInputRoot_IsRejected() throws Exception {
        Files.writeString(tempDir.resolve("private.mp4"), "video");
        ExtractionJobService service = service(queued::add);

        assertThrows(IllegalArgumentException.class,
            () -> service.submit(new ExtractionRequest("../private.mp4", null, null)));
        assertThrows(IllegalArgumentException.class,
            () -> service.submit(new ExtractionRequest(tempDir.resolve("private.mp4").toString(), null, null)));
        assertTrue(queued.isEmpty());
        assertTrue(service.list().isEmpty());
    }

    private ExtractionJobService service(Executor executor) {
        return new ExtractionJobService(orchestrator, executor, properties, storageRoots);
    }

    private static ExtractionRequest request() {
        return new ExtractionRequest("lecture.mp4", null, null);
    }
}
