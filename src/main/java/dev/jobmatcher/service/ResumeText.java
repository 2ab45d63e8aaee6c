package dev.jobmatcher.service;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Null-tolerant helpers for assembling resume text blocks.
 */
final class ResumeText {

    private ResumeText() {
    }

    static List<String> orEmpty(List<String> values) {
        return values != null ? values : List.of();
    }

    static String join(List<String> values) {
        return orEmpty(values).stream()
                .filter(Objects::nonNull)
                .collect(Collectors.joining(" "));
    }

    /**
     * Space-joined concatenation of the given blocks; null blocks count as empty.
     */
    static String combine(String... blocks) {
        return Arrays.stream(blocks)
                .map(block -> block != null ? block : "")
                .collect(Collectors.joining(" "));
    }
}
