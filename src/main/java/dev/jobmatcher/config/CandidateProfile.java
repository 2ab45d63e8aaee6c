package dev.jobmatcher.config;

import dev.jobmatcher.model.ResumeProfile;
import dev.jobmatcher.model.ScoringWeights;
import lombok.Data;

/**
 * Candidate profile read from profile.json: search preferences, the resume to score against
 * and optional custom relevance weights.
 */
@Data
public class CandidateProfile {
  private String name = "Default User";
  private SearchPreferences search = new SearchPreferences();
  private ResumeProfile resume;
  private ScoringWeights weights;

  @Data
  public static class SearchPreferences {
    private String keyword;
    private String location;
    private String company;
    private String platform;
    private Integer experienceLevel;
  }
}
