package dev.jobmatcher.model;

public record RelevanceScore(
        double skillsScore,
        double experienceScore,
        double projectsScore,
        double keywordsScore,
        double summaryScore,
        double educationScore,
        double weightedTotal,
        ScoringWeights weightsUsed) {
}
