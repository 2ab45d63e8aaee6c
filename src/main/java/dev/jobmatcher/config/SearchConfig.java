package dev.jobmatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for background job searches.
 * Loaded from application.yml under 'search' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "search")
public class SearchConfig {

    private int batchSize = 3;
    private int maxJobsToAnalyze = 20;
    private int pageCount = 1;
    private int maxBatchScoreJobs = 50;
    private String defaultLocation = "India";

    // Finished tasks stay pollable this long
    private Duration taskRetention = Duration.ofMinutes(5);

    // Background searches running at once
    private int maxConcurrentSearches = 10;

    private Duration pollInterval = Duration.ofSeconds(2);
    private Duration pollTimeout = Duration.ofMinutes(3);
}
