package dev.jobmatcher.model;

/**
 * A posting together with its analysis. {@code score} and {@code analysis} are null when the
 * job was not scored (no resume) or scoring failed ({@code error} set).
 */
public record ScoredJob(JobPosting job, Double score, AnalysisResult analysis, String error) {

    public static ScoredJob scored(JobPosting job, AnalysisResult analysis) {
        return new ScoredJob(job, analysis.overallMatchPercentage(), analysis, null);
    }

    public static ScoredJob unscored(JobPosting job) {
        return new ScoredJob(job, null, null, null);
    }

    public static ScoredJob failed(JobPosting job, String error) {
        return new ScoredJob(job, null, null, error);
    }

    public double scoreOrZero() {
        return score != null ? score : 0;
    }
}
