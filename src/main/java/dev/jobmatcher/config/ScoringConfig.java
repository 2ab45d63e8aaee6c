package dev.jobmatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hard-filter thresholds and the degree ranking table.
 * Loaded from application.yml under 'scoring' prefix; the defaults below are the reference values.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scoring")
public class ScoringConfig {

    private double minExperienceMatchRatio = 0.8;

    // Postings asking for this many years or fewer skip the experience gate
    private double entryLevelMaxExperience = 1.0;

    // Reserved for the location gate, which always passes while disabled; nothing reads it yet
    private List<String> locationFlexibleKeywords = new ArrayList<>(List.of(
            "remote", "anywhere", "flexible", "hybrid", "work from home", "wfh"));

    private List<String> workAuthKeywords = new ArrayList<>(List.of(
            "citizen", "authorized", "visa", "green card",
            "work permit", "eligible to work", "authorized to work"));

    /**
     * Degree name fragment to ordinal level. Iteration order is significant: the first
     * fragment contained in a job's requirement decides its level.
     */
    private Map<String, Integer> degreeLevels = defaultDegreeLevels();

    private static Map<String, Integer> defaultDegreeLevels() {
        Map<String, Integer> levels = new LinkedHashMap<>();
        levels.put("high school", 1);
        levels.put("diploma", 2);
        levels.put("associate", 2);
        levels.put("bachelor", 3);
        levels.put("bachelors", 3);
        levels.put("b.tech", 3);
        levels.put("b.e", 3);
        levels.put("bsc", 3);
        levels.put("bca", 3);
        levels.put("master", 4);
        levels.put("masters", 4);
        levels.put("m.tech", 4);
        levels.put("msc", 4);
        levels.put("mca", 4);
        levels.put("mba", 4);
        levels.put("phd", 5);
        levels.put("doctorate", 5);
        return levels;
    }
}
