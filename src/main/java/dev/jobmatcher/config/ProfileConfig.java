package dev.jobmatcher.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;
import java.io.IOException;

/**
 * Configuration for loading the CandidateProfile from profile.json.
 */
@Slf4j
@Configuration
public class ProfileConfig {

  @Bean
  public CandidateProfile candidateProfile(ObjectMapper objectMapper,
      @Value("${matcher.profile-file:profile.json}") String profileFile) {
    File file = new File(profileFile);
    if (!file.exists()) {
      log.warn("{} not found. Using default empty profile.", profileFile);
      return new CandidateProfile();
    }

    try {
      CandidateProfile profile = objectMapper.readValue(file, CandidateProfile.class);
      log.info("Loaded candidate profile for: {}", profile.getName());
      return profile;
    } catch (IOException e) {
      log.error("Failed to load {}. Ensure it matches the required structure.", profileFile, e);
      throw new IllegalStateException("Could not load candidate profile", e);
    }
  }
}
