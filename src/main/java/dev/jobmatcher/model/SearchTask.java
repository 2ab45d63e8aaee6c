package dev.jobmatcher.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Mutable state of one background search.
 * <p>
 * Only the pipeline that owns the task mutates it; pollers call {@link #snapshot()}. Every
 * transition publishes {@code completed} last, so a reader that sees {@code completed == true}
 * also sees the final status, jobs and error. Timestamps come from the same {@link Clock} that
 * drives task expiry.
 */
@Getter
public class SearchTask {

    private final String taskId;
    private final Instant startedAt;
    @Getter(AccessLevel.NONE)
    private final Clock clock;

    private volatile SearchStatus status = SearchStatus.SEARCHING;
    private volatile String statusMessage = "Searching jobs...";
    private volatile int progress;
    private volatile int totalJobs;
    private volatile int processedJobs;
    private volatile List<ScoredJob> jobs = List.of();
    private volatile boolean atsAnalyzed;
    private volatile NoJobsGuidance noJobsGuidance;
    private volatile String error;
    private volatile String errorCode;
    private volatile Instant lastUpdate;
    private volatile Instant completedAt;
    private volatile boolean completed;

    public SearchTask(String taskId, Clock clock) {
        this.taskId = taskId;
        this.clock = clock;
        this.startedAt = Instant.now(clock);
        this.lastUpdate = startedAt;
    }

    public void markAnalyzing(int jobsFound) {
        this.totalJobs = jobsFound;
        this.statusMessage = "Found " + jobsFound + " jobs";
        this.status = SearchStatus.ANALYZING;
        touch();
    }

    /**
     * Set the number of jobs that will actually be scored (after capping).
     */
    public void startScoring(int jobsToScore) {
        this.totalJobs = jobsToScore;
        this.statusMessage = "Analyzing " + jobsToScore + " jobs";
        touch();
    }

    public void appendBatch(List<ScoredJob> batch) {
        List<ScoredJob> updated = new ArrayList<>(jobs);
        updated.addAll(batch);
        this.jobs = List.copyOf(updated);
        this.processedJobs = updated.size();
        this.progress = percentOf(processedJobs, totalJobs);
        this.statusMessage = "Analyzed " + processedJobs + "/" + totalJobs + " jobs";
        touch();
    }

    /**
     * Finish a scored run: results sorted by score descending, missing scores ranked as 0.
     */
    public void completeScored() {
        List<ScoredJob> sorted = new ArrayList<>(jobs);
        sorted.sort(Comparator.comparingDouble(ScoredJob::scoreOrZero).reversed());
        this.jobs = List.copyOf(sorted);
        this.atsAnalyzed = true;
        finish(SearchStatus.COMPLETED, "Analysis complete");
    }

    public void completeUnscored(List<JobPosting> postings) {
        this.jobs = postings.stream().map(ScoredJob::unscored).toList();
        this.totalJobs = postings.size();
        this.processedJobs = postings.size();
        this.atsAnalyzed = false;
        finish(SearchStatus.COMPLETED, "Found " + postings.size() + " jobs");
    }

    public void completeWithoutResults(NoJobsGuidance guidance) {
        this.jobs = List.of();
        this.totalJobs = 0;
        this.processedJobs = 0;
        this.noJobsGuidance = guidance;
        finish(SearchStatus.COMPLETED, guidance.title());
    }

    public void fail(String message, String code) {
        this.error = message;
        this.errorCode = code;
        finish(SearchStatus.FAILED, "Search failed");
    }

    public boolean isTerminal() {
        return completed;
    }

    public SearchTaskSnapshot snapshot() {
        // Read the publication flag first, see class comment
        boolean done = completed;
        return new SearchTaskSnapshot(
                taskId,
                status,
                statusMessage,
                progress,
                totalJobs,
                processedJobs,
                done,
                atsAnalyzed,
                jobs,
                error,
                errorCode,
                noJobsGuidance,
                startedAt,
                lastUpdate);
    }

    private void finish(SearchStatus finalStatus, String message) {
        if (finalStatus == SearchStatus.COMPLETED) {
            this.progress = 100;
        }
        this.statusMessage = message;
        this.status = finalStatus;
        Instant now = Instant.now(clock);
        this.lastUpdate = now;
        this.completedAt = now;
        this.completed = true;
    }

    private void touch() {
        this.lastUpdate = Instant.now(clock);
    }

    private static int percentOf(int processed, int total) {
        if (total <= 0) {
            return 100;
        }
        return (int) Math.round(processed * 100.0 / total);
    }
}
