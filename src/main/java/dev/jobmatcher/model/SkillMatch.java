package dev.jobmatcher.model;

import java.util.List;

/**
 * Result of matching one skill list against a resume, at canonical-skill level.
 *
 * @param matched  canonical job skills found on the resume
 * @param missing  canonical job skills not found on the resume
 * @param matchPct matched / total, in [0, 1]
 */
public record SkillMatch(List<String> matched, List<String> missing, double matchPct) {
}
