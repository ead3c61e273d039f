package com.example.slides.dedup;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of one deduplication run: the retained candidates in input order
 * plus counters for diagnostics.
 */
public class DeduplicationResult {

    private final List<CandidateFrame> retained;
    private final List<String> skippedIds;
    private final int candidateCount;
    private final int maxDistance;

    public DeduplicationResult(List<CandidateFrame> retained, List<String> skippedIds,
                               int candidateCount, int maxDistance) {
        this.retained = List.copyOf(retained);
        this.skippedIds = List.copyOf(skippedIds);
        this.candidateCount = candidateCount;
        this.maxDistance = maxDistance;
    }

    public static DeduplicationResult empty(int maxDistance) {
        return new DeduplicationResult(List.of(), List.of(), 0, maxDistance);
    }

    public List<CandidateFrame> getRetained() { return retained; }

    public List<String> getRetainedIds() {
        return retained.stream().map(CandidateFrame::getId).collect(Collectors.toList());
    }

    public int getRetainedCount() { return retained.size(); }

    /**
     * Candidates that could not be read and were left out of the comparison.
     */
    public List<String> getSkippedIds() { return skippedIds; }

    public int getSkippedCount() { return skippedIds.size(); }

    public int getCandidateCount() { return candidateCount; }

    /**
     * Readable candidates dropped as near-duplicates of the last retained frame.
     */
    public int getDiscardedCount() {
        return candidateCount - skippedIds.size() - retained.size();
    }

    public int getMaxDistance() { return maxDistance; }

    @Override
    public String toString() {
        return String.format("DeduplicationResult{candidates=%d, retained=%d, discarded=%d, skipped=%d, maxDistance=%d}",
                candidateCount, getRetainedCount(), getDiscardedCount(), getSkippedCount(), maxDistance);
    }
}
