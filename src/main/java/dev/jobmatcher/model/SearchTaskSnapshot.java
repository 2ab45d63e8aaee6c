package dev.jobmatcher.model;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of a {@link SearchTask} handed to pollers.
 */
public record SearchTaskSnapshot(
        String taskId,
        SearchStatus status,
        String statusMessage,
        int progress,
        int totalJobs,
        int processedJobs,
        boolean completed,
        boolean atsAnalyzed,
        List<ScoredJob> jobs,
        String error,
        String errorCode,
        NoJobsGuidance noJobsGuidance,
        Instant startedAt,
        Instant lastUpdate) {
}
