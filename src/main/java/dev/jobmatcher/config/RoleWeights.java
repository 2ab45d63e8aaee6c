package dev.jobmatcher.config;

import dev.jobmatcher.model.ScoringWeights;

import java.util.Locale;
import java.util.Map;

/**
 * Relevance weight tables per role archetype. Each table sums to 1.0.
 */
public final class RoleWeights {

    public static final ScoringWeights SOFTWARE_ENGINEER =
            new ScoringWeights(0.35, 0.30, 0.15, 0.10, 0.05, 0.05);

    public static final ScoringWeights FRESHER_INTERN =
            new ScoringWeights(0.30, 0.05, 0.25, 0.10, 0.10, 0.20);

    public static final ScoringWeights MANAGER_LEAD =
            new ScoringWeights(0.20, 0.40, 0.00, 0.20, 0.10, 0.10);

    public static final ScoringWeights DEFAULT = SOFTWARE_ENGINEER;

    private static final Map<String, ScoringWeights> BY_ROLE = Map.of(
            "software_engineer", SOFTWARE_ENGINEER,
            "developer", SOFTWARE_ENGINEER,
            "engineer", SOFTWARE_ENGINEER,
            "senior", SOFTWARE_ENGINEER,
            "fresher", FRESHER_INTERN,
            "intern", FRESHER_INTERN,
            "entry_level", FRESHER_INTERN,
            "manager", MANAGER_LEAD,
            "lead", MANAGER_LEAD,
            "default", DEFAULT);

    private RoleWeights() {
    }

    /**
     * Case-insensitive lookup; unknown or missing role tags get {@link #DEFAULT}.
     */
    public static ScoringWeights forRole(String roleType) {
        if (roleType == null) {
            return DEFAULT;
        }
        return BY_ROLE.getOrDefault(roleType.trim().toLowerCase(Locale.ROOT), DEFAULT);
    }
}
