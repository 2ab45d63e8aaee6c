package dev.jobmatcher.model;

import java.util.List;

/**
 * Returned in place of scores when a search found no postings.
 */
public record NoJobsGuidance(String title, String message, List<String> suggestions, String wishMessage) {
}
