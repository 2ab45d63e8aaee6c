package dev.jobmatcher.model;

import java.util.List;

/**
 * Quick scores for a list of jobs, sorted by score descending.
 */
public record BatchScoreResult(int totalJobs, int scoredJobs, List<Item> scores) {

    /**
     * One scored job. On failure {@code quickScore} is null, {@code error} is set and the item
     * ranks as score 0.
     */
    public record Item(
            int jobIndex,
            String jobId,
            String jobTitle,
            String company,
            QuickScore quickScore,
            String error) {

        public double score() {
            return quickScore != null ? quickScore.score() : 0;
        }
    }
}
