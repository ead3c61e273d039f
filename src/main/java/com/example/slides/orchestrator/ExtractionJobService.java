package com.example.slides.orchestrator;

import com.example.slides.config.SlideExtractionProperties;
import com.example.slides.config.StorageRoots;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs extractions in the background and keeps their state for polling.
 * Every job owns a temp directory holding its frames. The directory is removed
 * when the job is deleted or evicted, or when the application shuts down.
 * Finished jobs are evicted once more than {@code slides.jobs.max-retained} of
 * them exist or once they are older than {@code slides.jobs.ttl-minutes}.
 */
@Service
public class ExtractionJobService {

    private static final Logger log = LoggerFactory.getLogger(ExtractionJobService.class);

    private final SlideExtractionOrchestrator orchestrator;
    private final Executor extractionExecutor;
    private final SlideExtractionProperties properties;
    private final StorageRoots storageRoots;

    private final Map<String, ExtractionJob> jobs = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> running = new ConcurrentHashMap<>();
    // Work dirs of deleted jobs whose worker has not finished yet
    private final Set<Path> orphanedWorkDirs = ConcurrentHashMap.newKeySet();

    public ExtractionJobService(SlideExtractionOrchestrator orchestrator,
                                @Qualifier("extractionExecutor") Executor extractionExecutor,
                                SlideExtractionProperties properties,
                                StorageRoots storageRoots) {
        this.orchestrator = orchestrator;
        this.extractionExecutor = extractionExecutor;
        this.properties = properties;
        this.storageRoots = storageRoots;
    }

    /**
     * Validate the request and start the extraction in the background.
     * @throws IllegalArgumentException if the video does not exist, lies outside the
     *         input root or a threshold is out of range
     */
    public ExtractionJob submit(ExtractionRequest request) {
        Path video = storageRoots.resolveInput(request.getVideoPath());
        double sceneThreshold = orchestrator.resolveSceneThreshold(request.getSceneThreshold());
        double similarityThreshold = orchestrator.resolveSimilarityThreshold(request.getSimilarityThreshold());

        String id = UUID.randomUUID().toString();
        Path workDir = createWorkDir(id);
        ExtractionJob job = new ExtractionJob(id, video, workDir, sceneThreshold, similarityThreshold);
        jobs.put(id, job);
        log.info("Submitted extraction job {} for {} (scene={}, similarity={})",
                id, video, sceneThreshold, similarityThreshold);

        try {
            CompletableFuture<Void> future = CompletableFuture.runAsync(() -> run(job), extractionExecutor);
            running.put(id, future);
            future.whenComplete((ignored, error) -> running.remove(id));
        } catch (RejectedExecutionException e) {
            log.error("Extraction executor rejected job {}", id, e);
            job.finish(ExtractionOutcome.failure("Server is busy, try again later."));
        }
        evictBeyondLimit();
        return job;
    }

    private void run(ExtractionJob job) {
        if (job.isDeleted()) {
            log.info("Job {} was deleted before it started, skipping", job.getId());
            return;
        }
        job.markRunning();
        try {
            ExtractionOutcome outcome = orchestrator.extract(
                job.getVideoPath(), job.getWorkDir(),
                job.getSceneThreshold(), job.getSimilarityThreshold(),
                message -> {
                    log.info("Job {}: {}", job.getId(), message);
                    job.addProgress(message);
                });
            job.finish(outcome);
            if (outcome.isSuccess()) {
                log.info("Job {} completed with {} slide(s)", job.getId(), outcome.getSlides().size());
            } else {
                log.warn("Job {} failed: {}", job.getId(), outcome.getError());
            }
        } catch (RuntimeException e) {
            log.error("Job {} crashed", job.getId(), e);
            job.finish(ExtractionOutcome.failure(e.getMessage() != null ? e.getMessage() : e.toString()));
        }
    }

    /**
     * @throws NoSuchElementException if no job has the given id
     */
    public ExtractionJob get(String id) {
        ExtractionJob job = jobs.get(id);
        if (job == null) {
            throw new NoSuchElementException("Extraction job not found: " + id);
        }
        return job;
    }

    public List<ExtractionJob> list() {
        return new ArrayList<>(jobs.values());
    }

    /**
     * Block until the job finishes or the timeout elapses.
     * @return The job, finished unless the wait timed out
     */
    public ExtractionJob await(String id, Duration timeout) throws InterruptedException {
        ExtractionJob job = get(id);
        CompletableFuture<Void> future = running.get(id);
        if (future != null) {
            try {
                future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                log.warn("Job {} ended exceptionally: {}", id, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            } catch (TimeoutException e) {
                log.debug("Timed out waiting for job {}", id);
            }
        }
        return job;
    }

    /**
     * Retained slides of a completed job, optionally narrowed to the given
     * indices (in the order given).
     * @throws IllegalStateException if the job has not completed successfully
     * @throws NoSuchElementException if an index is out of range
     */
    public List<Path> selectSlides(String id, List<Integer> indices) {
        ExtractionJob job = get(id);
        if (job.getStatus() != JobStatus.COMPLETED) {
            throw new IllegalStateException("Extraction job " + id + " is " + job.getStatus() + ", slides are not available");
        }
        List<Path> slides = job.getOutcome().getSlides();
        if (indices == null) {
            return slides;
        }
        List<Path> selected = new ArrayList<>(indices.size());
        for (Integer index : indices) {
            if (index == null || index < 0 || index >= slides.size()) {
                throw new NoSuchElementException("Slide index out of range: " + index);
            }
            selected.add(slides.get(index));
        }
        return selected;
    }

    public Path slide(String id, int index) {
        return selectSlides(id, List.of(index)).get(0);
    }

    /**
     * Forget the job and delete its frames. A queued job never starts; a
     * running one keeps going until FFmpeg exits and its directory is removed
     * once the worker is done with it.
     */
    public void delete(String id) {
        ExtractionJob job = jobs.remove(id);
        if (job == null) {
            throw new NoSuchElementException("Extraction job not found: " + id);
        }
        discard(job);
        log.info("Deleted extraction job {}", id);
    }

    /**
     * Evict finished jobs past their time to live.
     * @return Number of jobs evicted
     */
    @Scheduled(fixedDelayString = "${slides.jobs.eviction-interval-ms:600000}")
    public int evictExpired() {
        int evicted = evictExpired(Instant.now()) + evictBeyondLimit();
        if (evicted > 0) {
            log.info("Evicted {} finished extraction job(s)", evicted);
        }
        return evicted;
    }

    int evictExpired(Instant now) {
        long ttlMinutes = properties.getJobs().getTtlMinutes();
        if (ttlMinutes <= 0) {
            return 0;
        }
        Instant cutoff = now.minus(Duration.ofMinutes(ttlMinutes));
        int evicted = 0;
        for (ExtractionJob job : jobs.values()) {
            if (job.isDone() && job.getFinishedAt().isBefore(cutoff) && jobs.remove(job.getId(), job)) {
                discard(job);
                evicted++;
            }
        }
        return evicted;
    }

    /**
     * Drop the oldest finished jobs until at most {@code max-retained} remain.
     */
    int evictBeyondLimit() {
        int maxRetained = Math.max(0, properties.getJobs().getMaxRetained());
        List<ExtractionJob> finished = jobs.values().stream()
            .filter(ExtractionJob::isDone)
            .sorted(Comparator.comparingLong(ExtractionJob::getFinishOrder))
            .collect(Collectors.toList());
        int evicted = 0;
        for (int i = 0; i < finished.size() - maxRetained; i++) {
            ExtractionJob job = finished.get(i);
            if (jobs.remove(job.getId(), job)) {
                log.debug("Evicting job {} finished at {}", job.getId(), job.getFinishedAt());
                discard(job);
                evicted++;
            }
        }
        return evicted;
    }

    private void discard(ExtractionJob job) {
        job.markDeleted();
        Path workDir = job.getWorkDir();
        CompletableFuture<Void> future = running.get(job.getId());
        if (future != null && !future.isDone()) {
            orphanedWorkDirs.add(workDir);
            future.whenComplete((ignored, error) -> {
                deleteRecursively(workDir);
                orphanedWorkDirs.remove(workDir);
            });
        } else {
            deleteRecursively(workDir);
        }
    }

    @PreDestroy
    public void cleanup() {
        for (ExtractionJob job : jobs.values()) {
            job.markDeleted();
            deleteRecursively(job.getWorkDir());
        }
        jobs.clear();
        for (Path workDir : orphanedWorkDirs) {
            deleteRecursively(workDir);
        }
        orphanedWorkDirs.clear();
    }

    private Path createWorkDir(String id) {
        try {
            String parent = properties.getJobs().getWorkDir();
            if (parent == null || parent.isBlank()) {
                return Files.createTempDirectory("slides_" + id + "_");
            }
            Path parentDir = Files.createDirectories(Paths.get(parent));
            return Files.createTempDirectory(parentDir, "slides_" + id + "_");
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create work directory for job " + id, e);
        }
    }

    private static void deleteRecursively(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Could not delete {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean up {}: {}", dir, e.getMessage());
        }
    }
}
