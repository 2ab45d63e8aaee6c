package dev.jobmatcher.model;

/**
 * How the requester's experience compares to the range a posting asks for.
 */
public enum ExperienceFit {
    PERFECT,
    GOOD,
    UNDERQUALIFIED,
    OVERQUALIFIED,
    UNKNOWN
}
