package dev.jobmatcher.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Snapshot of a candidate's resume, as handed to a scoring run.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ResumeProfile {
    String fullName;
    String location;
    String summary;

    @Builder.Default
    List<String> skills = List.of();

    // One free-text entry per position / project / degree
    @Builder.Default
    List<String> workExperience = List.of();
    @Builder.Default
    List<String> projects = List.of();
    @Builder.Default
    List<String> education = List.of();
    @Builder.Default
    List<String> certifications = List.of();

    double yearsOfExperience;
    String highestDegree;
    String workAuthorization;
}
