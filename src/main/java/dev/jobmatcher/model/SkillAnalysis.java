package dev.jobmatcher.model;

import java.util.List;

public record SkillAnalysis(
        List<String> matchedRequired,
        List<String> matchedPreferred,
        List<String> missingRequired,
        List<String> missingPreferred,
        double requiredMatchPercentage,
        double preferredMatchPercentage,
        double overallSkillScore,
        int totalMatched,
        int totalMissing) {
}
