package dev.jobmatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the JSearch (RapidAPI) job provider.
 * Loaded from application.yml under 'provider.jsearch' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "provider.jsearch")
public class ProviderConfig {

    private String baseUrl = "https://jsearch.p.rapidapi.com";
    private String host = "jsearch.p.rapidapi.com";
    private String apiKey = "";
    private String datePosted = "all";
    private Duration timeout = Duration.ofSeconds(30);
}
