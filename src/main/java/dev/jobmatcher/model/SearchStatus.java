package dev.jobmatcher.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SearchStatus {
    SEARCHING,
    ANALYZING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
