package dev.jobmatcher.model;

import java.util.List;

/**
 * Outcome of the stage-one eligibility gates. {@code passed} is the AND of the four checks.
 */
public record HardFilterResult(
        boolean passed,
        boolean locationMatch,
        boolean workAuthorizationMatch,
        boolean experienceMatch,
        boolean educationMatch,
        List<String> failureReasons) {

    public static HardFilterResult of(boolean locationMatch,
                                      boolean workAuthorizationMatch,
                                      boolean experienceMatch,
                                      boolean educationMatch,
                                      List<String> failureReasons) {
        boolean passed = locationMatch && workAuthorizationMatch && experienceMatch && educationMatch;
        return new HardFilterResult(passed, locationMatch, workAuthorizationMatch,
                experienceMatch, educationMatch, List.copyOf(failureReasons));
    }
}
