package dev.jobmatcher;

import dev.jobmatcher.config.CandidateProfile;
import dev.jobmatcher.config.SearchConfig;
import dev.jobmatcher.model.ScoredJob;
import dev.jobmatcher.model.SearchRequest;
import dev.jobmatcher.model.SearchStatus;
import dev.jobmatcher.model.SearchTaskSnapshot;
import dev.jobmatcher.service.JobSearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.Optional;

/**
 * Runs one search for the candidate in profile.json, waits for it to finish and logs the
 * ranked results.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

  private static final String SEPARATOR = "========================================";

  private final JobSearchService jobSearchService;
  private final CandidateProfile candidateProfile;
  private final SearchConfig searchConfig;

  @Value("${matcher.metrics-wait-seconds:0}")
  private int metricsWaitSeconds;

  /**
   * Start the search and block until the task is terminal.
   *
   * @return Number of jobs that received a score
   */
  public int execute() {
    log.info(SEPARATOR);
    log.info("Job Matcher Starting for {}", candidateProfile.getName());
    log.info(SEPARATOR);

    try {
      String taskId = jobSearchService.startSearch(toRequest(candidateProfile));
      SearchTaskSnapshot result = awaitCompletion(taskId);

      if (result.status() == SearchStatus.FAILED) {
        throw new IllegalStateException("Search failed [" + result.errorCode() + "]: " + result.error());
      }

      logResults(result);
      int scored = (int) result.jobs().stream().filter(job -> job.score() != null).count();

      log.info(SEPARATOR);
      log.info("Job Matcher Completed Successfully");
      log.info("Jobs found: {}, scored: {}", result.jobs().size(), scored);
      log.info(SEPARATOR);

      handleMetricsWait();

      return scored;
    } catch (Exception e) {
      log.error("Job Matcher failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Pipeline execution failed", e);
    }
  }

  private SearchTaskSnapshot awaitCompletion(String taskId) {
    Optional<SearchTaskSnapshot> last = Flux.interval(Duration.ZERO, searchConfig.getPollInterval())
        .map(tick -> jobSearchService.poll(taskId))
        .doOnNext(snapshot -> snapshot.ifPresent(s ->
            log.info("[{}] {} ({}%)", s.status().wireName(), s.statusMessage(), s.progress())))
        .takeUntil(snapshot -> snapshot.isEmpty() || snapshot.get().completed())
        .last()
        .timeout(searchConfig.getPollTimeout())
        .block();

    if (last == null || last.isEmpty()) {
      throw new IllegalStateException("Search task " + taskId + " not found or expired");
    }
    return last.get();
  }

  private void logResults(SearchTaskSnapshot result) {
    if (result.noJobsGuidance() != null) {
      log.info("{}: {}", result.noJobsGuidance().title(), result.noJobsGuidance().message());
      result.noJobsGuidance().suggestions().forEach(suggestion -> log.info("  - {}", suggestion));
      return;
    }

    int rank = 1;
    for (ScoredJob scored : result.jobs()) {
      log.info("{}. [{}] {} @ {} ({})", rank++,
          scored.score() != null ? scored.score() : "-",
          scored.job().getTitle(), scored.job().getCompany(), scored.job().getLocation());
      if (scored.analysis() != null) {
        log.info("    {}", scored.analysis().feedback());
      }
    }
  }

  static SearchRequest toRequest(CandidateProfile profile) {
    CandidateProfile.SearchPreferences search = profile.getSearch() != null
        ? profile.getSearch()
        : new CandidateProfile.SearchPreferences();
    return SearchRequest.builder()
        .keyword(search.getKeyword())
        .location(search.getLocation())
        .company(search.getCompany())
        .platform(search.getPlatform())
        .experienceLevel(search.getExperienceLevel())
        .resume(profile.getResume())
        .customWeights(profile.getWeights())
        .build();
  }

  private void handleMetricsWait() {
    if (metricsWaitSeconds > 0) {
      log.info("Keeping alive for {} seconds (metrics scrape)...", metricsWaitSeconds);
      try {
        Thread.sleep(metricsWaitSeconds * 1000L);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        log.warn("Metrics wait interrupted");
      }
    }
  }
}
