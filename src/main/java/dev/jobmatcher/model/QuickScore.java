package dev.jobmatcher.model;

import java.util.List;

public record QuickScore(
        double score,
        List<String> matchedSkills,
        List<String> missingSkills,
        double skillMatchPercentage,
        double keywordMatchPercentage) {
}
