package dev.jobmatcher.model;

/**
 * Weights applied to the six relevance sub-scores. Role tables sum to 1.0.
 */
public record ScoringWeights(
        double skills,
        double experience,
        double projects,
        double keywords,
        double summary,
        double education) {

    public double sum() {
        return skills + experience + projects + keywords + summary + education;
    }
}
