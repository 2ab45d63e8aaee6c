package dev.jobmatcher.model;

import java.time.Instant;
import java.util.List;

/**
 * Full analysis of one (resume, job) pair. {@code relevanceScore} is null when the hard
 * filters failed, in which case {@code overallMatchPercentage} is 0.
 */
public record AnalysisResult(
        HardFilterResult hardFilters,
        RelevanceScore relevanceScore,
        double overallMatchPercentage,
        List<String> matchedSkills,
        List<String> missingSkills,
        SkillAnalysis skillAnalysis,
        String feedback,
        List<String> recommendations,
        Instant analyzedAt,
        String roleType) {
}
