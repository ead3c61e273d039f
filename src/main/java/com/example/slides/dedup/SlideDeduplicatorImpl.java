package com.example.slides.dedup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Single forward pass over the candidates, comparing each one against the
 * fingerprint of the most recently retained frame only.
 *
 * Fingerprints can be computed on a worker pool when parallelism is above 1;
 * retain/discard decisions are always made on the calling thread in input order.
 */
@Service
public class SlideDeduplicatorImpl implements SlideDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(SlideDeduplicatorImpl.class);

    private final FingerprintEngine fingerprintEngine;
    private final Executor fingerprintExecutor;
    private final int parallelism;

    public SlideDeduplicatorImpl(FingerprintEngine fingerprintEngine) {
        this(fingerprintEngine, Runnable::run, 1);
    }

    @Autowired
    public SlideDeduplicatorImpl(FingerprintEngine fingerprintEngine,
                                 @Qualifier("fingerprintExecutor") Executor fingerprintExecutor,
                                 @Value("${slides.dedup.parallelism:1}") int parallelism) {
        this.fingerprintEngine = fingerprintEngine;
        this.fingerprintExecutor = fingerprintExecutor;
        this.parallelism = Math.max(1, parallelism);
    }

    @Override
    public DeduplicationResult reduce(List<CandidateFrame> candidates, double similarityThreshold,
                                      DeduplicationProgressListener listener) {
        if (candidates == null) {
            throw new InvalidConfigurationException("Candidate list must not be null");
        }
        SimilarityThreshold threshold = SimilarityThreshold.of(similarityThreshold);
        Set<String> ids = new HashSet<>();
        for (CandidateFrame candidate : candidates) {
            if (!ids.add(candidate.getId())) {
                throw new InvalidConfigurationException("Duplicate candidate id: " + candidate.getId());
            }
        }
        int maxDistance = threshold.maxDistance(fingerprintEngine.getBitLength());

        log.info("Deduplication: {} frames in | hamming cutoff={} (similarity={})",
                candidates.size(), maxDistance, threshold);
        notifyStarted(listener, candidates.size(), maxDistance);

        List<CandidateFrame> retained = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        Fingerprint lastKept = null;

        List<CompletableFuture<FingerprintAttempt>> pending = parallelism > 1 ? submitAll(candidates) : null;

        for (int i = 0; i < candidates.size(); i++) {
            CandidateFrame candidate = candidates.get(i);
            FingerprintAttempt attempt = pending != null ? pending.get(i).join() : attempt(candidate);

            if (attempt.fingerprint == null) {
                log.warn("Skipping unreadable frame {}: {}", candidate.getId(), attempt.failure.getMessage());
                skipped.add(candidate.getId());
                continue;
            }

            if (lastKept == null) {
                retained.add(candidate);
                lastKept = attempt.fingerprint;
                log.debug("Keeping {} (first readable frame)", candidate.getId());
                continue;
            }

            int distance = attempt.fingerprint.hammingDistance(lastKept);
            if (distance > maxDistance) {
                retained.add(candidate);
                lastKept = attempt.fingerprint;
                log.debug("Keeping {} (distance {} > {})", candidate.getId(), distance, maxDistance);
            } else {
                log.debug("Dropping {} (distance {} <= {})", candidate.getId(), distance, maxDistance);
            }
        }

        DeduplicationResult result = new DeduplicationResult(retained, skipped, candidates.size(), maxDistance);
        if (result.getSkippedCount() > 0) {
            log.warn("Deduplication: {} of {} frames were unreadable and skipped",
                    result.getSkippedCount(), result.getCandidateCount());
        }
        log.info("Deduplication: {} unique slides kept", result.getRetainedCount());
        notifyFinished(listener, result);
        return result;
    }

    private List<CompletableFuture<FingerprintAttempt>> submitAll(List<CandidateFrame> candidates) {
        List<CompletableFuture<FingerprintAttempt>> futures = new ArrayList<>(candidates.size());
        for (CandidateFrame candidate : candidates) {
            futures.add(CompletableFuture.supplyAsync(() -> attempt(candidate), fingerprintExecutor));
        }
        return futures;
    }

    private FingerprintAttempt attempt(CandidateFrame candidate) {
        try {
            return FingerprintAttempt.success(fingerprintEngine.fingerprint(candidate));
        } catch (FrameDecodeException e) {
            return FingerprintAttempt.failure(e);
        } catch (RuntimeException e) {
            return FingerprintAttempt.failure(
                new FrameDecodeException(candidate.getId(), e.getMessage() != null ? e.getMessage() : e.toString(), e));
        }
    }

    private void notifyStarted(DeduplicationProgressListener listener, int candidateCount, int maxDistance) {
        try {
            listener.onStarted(candidateCount, maxDistance);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed on start: {}", e.getMessage(), e);
        }
    }

    private void notifyFinished(DeduplicationProgressListener listener, DeduplicationResult result) {
        try {
            listener.onFinished(result);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed on finish: {}", e.getMessage(), e);
        }
    }

    public int getParallelism() {
        return parallelism;
    }

    private static final class FingerprintAttempt {
        final Fingerprint fingerprint;
        final FrameDecodeException failure;

        private FingerprintAttempt(Fingerprint fingerprint, FrameDecodeException failure) {
            this.fingerprint = fingerprint;
            this.failure = failure;
        }

        static FingerprintAttempt success(Fingerprint fingerprint) {
            return new FingerprintAttempt(fingerprint, null);
        }

        static FingerprintAttempt failure(FrameDecodeException failure) {
            return new FingerprintAttempt(null, failure);
        }
    }
}
