package dev.jobmatcher.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * A normalized job posting. Immutable; use {@code toBuilder()} to derive a prepared copy.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class JobPosting {
    String id;
    String title;
    String company;
    String location;
    String description;

    @Builder.Default
    List<String> requiredSkills = List.of();
    @Builder.Default
    List<String> preferredSkills = List.of();

    double minExperience;
    Double maxExperience;
    String requiredEducation;
    String roleType;

    // Provider metadata (optional)
    String source;
    String employmentType;
    boolean remote;
    Instant postedAt;
    String applyLink;
    String publisher;
    SalaryRange salary;
    ExperienceFit experienceFit;
}
