package dev.jobmatcher;

import dev.jobmatcher.config.CandidateProfile;
import dev.jobmatcher.config.SearchConfig;
import dev.jobmatcher.model.JobPosting;
import dev.jobmatcher.model.NoJobsGuidance;
import dev.jobmatcher.model.ResumeProfile;
import dev.jobmatcher.model.ScoredJob;
import dev.jobmatcher.model.ScoringWeights;
import dev.jobmatcher.model.SearchRequest;
import dev.jobmatcher.model.SearchStatus;
import dev.jobmatcher.model.SearchTaskSnapshot;
import dev.jobmatcher.service.JobSearchService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineRunnerTest {

  private static final String TASK_ID = "task-1";

  @Mock
  private JobSearchService jobSearchService;

  private CandidateProfile candidateProfile;
  private PipelineRunner pipelineRunner;

  @BeforeEach
  void setUp() {
    candidateProfile = new CandidateProfile();
    candidateProfile.getSearch().setKeyword("java developer");
    candidateProfile.setResume(ResumeProfile.builder().skills(List.of("java")).build());

    SearchConfig searchConfig = new SearchConfig();
    searchConfig.setPollInterval(Duration.ofMillis(10));
    searchConfig.setPollTimeout(Duration.ofSeconds(5));

    pipelineRunner = new PipelineRunner(jobSearchService, candidateProfile, searchConfig);
    ReflectionTestUtils.setField(pipelineRunner, "metricsWaitSeconds", 0);
  }

  private SearchTaskSnapshot snapshot(SearchStatus status, boolean completed, List<ScoredJob> jobs,
                                      NoJobsGuidance guidance) {
    return new SearchTaskSnapshot(TASK_ID, status, "status", completed ? 100 : 40, jobs.size(), jobs.size(),
        completed, true, jobs, null, null, guidance, Instant.now(), Instant.now());
  }

  private ScoredJob unscored(String title) {
    return ScoredJob.unscored(JobPosting.builder().title(title).company("Acme").build());
  }

  @Test
  void execute_completedSearch_returnsScoredCount() {
    ScoredJob scored = new ScoredJob(JobPosting.builder().title("Java Dev").build(), 72.5, null, null);
    ScoredJob failed = ScoredJob.failed(JobPosting.builder().title("Broken").build(), "boom");
    when(jobSearchService.startSearch(any())).thenReturn(TASK_ID);
    when(jobSearchService.poll(TASK_ID)).thenReturn(
        Optional.of(snapshot(SearchStatus.ANALYZING, false, List.of(), null)),
        Optional.of(snapshot(SearchStatus.COMPLETED, true, List.of(scored, failed), null)));

    int result = pipelineRunner.execute();

    assertEquals(1, result);
  }

  @Test
  void execute_noJobsFound_returnsZero() {
    NoJobsGuidance guidance = new NoJobsGuidance("No Job Vacancies Found", "none",
        List.of("Use different keywords or job titles"), "Best wishes");
    when(jobSearchService.startSearch(any())).thenReturn(TASK_ID);
    when(jobSearchService.poll(TASK_ID)).thenReturn(
        Optional.of(snapshot(SearchStatus.COMPLETED, true, List.of(), guidance)));

    assertEquals(0, pipelineRunner.execute());
  }

  @Test
  void execute_unscoredResults_returnsZero() {
    when(jobSearchService.startSearch(any())).thenReturn(TASK_ID);
    when(jobSearchService.poll(TASK_ID)).thenReturn(
        Optional.of(snapshot(SearchStatus.COMPLETED, true, List.of(unscored("A"), unscored("B")), null)));

    assertEquals(0, pipelineRunner.execute());
  }

  @Test
  void execute_failedSearch_throwsException() {
    SearchTaskSnapshot failed = new SearchTaskSnapshot(TASK_ID, SearchStatus.FAILED, "Search failed", 0, 0, 0,
        true, false, List.of(), "Rate limit exceeded", "RATE_LIMITED", null, Instant.now(), Instant.now());
    when(jobSearchService.startSearch(any())).thenReturn(TASK_ID);
    when(jobSearchService.poll(TASK_ID)).thenReturn(Optional.of(failed));

    IllegalStateException error = assertThrows(IllegalStateException.class, () -> pipelineRunner.execute());
    assertThat(error.getCause()).hasMessageContaining("RATE_LIMITED");
  }

  @Test
  void execute_taskExpired_throwsException() {
    when(jobSearchService.startSearch(any())).thenReturn(TASK_ID);
    when(jobSearchService.poll(TASK_ID)).thenReturn(Optional.empty());

    assertThrows(IllegalStateException.class, () -> pipelineRunner.execute());
  }

  @Test
  void execute_passesProfileAsRequest() {
    when(jobSearchService.startSearch(any())).thenReturn(TASK_ID);
    when(jobSearchService.poll(TASK_ID)).thenReturn(
        Optional.of(snapshot(SearchStatus.COMPLETED, true, List.of(), null)));

    pipelineRunner.execute();

    ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
    verify(jobSearchService).startSearch(captor.capture());
    assertThat(captor.getValue().getKeyword()).isEqualTo("java developer");
    assertThat(captor.getValue().getResume().getSkills()).containsExactly("java");
  }

  @Test
  void toRequest_copiesSearchPreferencesAndWeights() {
    ScoringWeights weights = new ScoringWeights(0.5, 0.1, 0.1, 0.1, 0.1, 0.1);
    candidateProfile.getSearch().setLocation("Pune");
    candidateProfile.getSearch().setCompany("Acme");
    candidateProfile.getSearch().setPlatform("linkedin");
    candidateProfile.getSearch().setExperienceLevel(4);
    candidateProfile.setWeights(weights);

    SearchRequest request = PipelineRunner.toRequest(candidateProfile);

    assertThat(request.getLocation()).isEqualTo("Pune");
    assertThat(request.getCompany()).isEqualTo("Acme");
    assertThat(request.getPlatform()).isEqualTo("linkedin");
    assertThat(request.getExperienceLevel()).isEqualTo(4);
    assertThat(request.getCustomWeights()).isEqualTo(weights);
  }

  @Test
  void toRequest_withoutSearchSection_hasNoKeyword() {
    candidateProfile.setSearch(null);

    assertThat(PipelineRunner.toRequest(candidateProfile).getKeyword()).isNull();
  }
}
