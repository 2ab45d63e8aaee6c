package dev.jobmatcher.model;

import lombok.Builder;
import lombok.Value;

/**
 * A job search to run in the background. {@code resume} and {@code customWeights} are
 * optional; without a resume the postings are returned unscored.
 */
@Value
@Builder
public class SearchRequest {
    String keyword;
    String location;
    String company;
    String platform;
    Integer experienceLevel;
    ResumeProfile resume;
    ScoringWeights customWeights;
}
