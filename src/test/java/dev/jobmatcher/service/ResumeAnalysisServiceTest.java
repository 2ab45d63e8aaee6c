package dev.jobmatcher.service;

import dev.jobmatcher.config.ScoringConfig;
import dev.jobmatcher.config.SearchConfig;
import dev.jobmatcher.exception.InvalidRequestException;
import dev.jobmatcher.model.AnalysisResult;
import dev.jobmatcher.model.BatchScoreResult;
import dev.jobmatcher.model.JobPosting;
import dev.jobmatcher.model.QuickScore;
import dev.jobmatcher.model.ResumeProfile;
import dev.jobmatcher.model.ScoringWeights;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResumeAnalysisServiceTest {

    private ResumeAnalysisService resumeAnalysisService;
    private SearchConfig searchConfig;

    @BeforeEach
    void setUp() {
        TextAnalysisService textAnalysisService = new TextAnalysisService();
        HardFilterService hardFilterService = new HardFilterService(new ScoringConfig());
        searchConfig = new SearchConfig();
        resumeAnalysisService = new ResumeAnalysisService(
                hardFilterService,
                new RelevanceScoringService(textAnalysisService, hardFilterService),
                new SkillMatchingService(textAnalysisService),
                textAnalysisService,
                new FeedbackService(),
                searchConfig);
    }

    private ResumeProfile resume() {
        return ResumeProfile.builder()
                .fullName("Asha Rao")
                .summary("Java backend developer working with Docker and Kafka")
                .skills(List.of("java", "docker", "kafka"))
                .workExperience(List.of("Backend developer at Acme building Java services"))
                .yearsOfExperience(4)
                .build();
    }

    private JobPosting job(String id, String description) {
        return JobPosting.builder()
                .id(id)
                .title("Java Developer")
                .company("Acme")
                .description(description)
                .build();
    }

    @Nested
    @DisplayName("Full analysis")
    class AnalyzeTests {

        @Test
        @DisplayName("Failed hard filters give no relevance score and a 0 match")
        void shouldSkipRelevanceWhenFiltersFail() {
            JobPosting senior = job("1", "Senior Java role").toBuilder().minExperience(10).build();

            AnalysisResult result = resumeAnalysisService.analyze(resume(), senior);

            assertThat(result.hardFilters().passed()).isFalse();
            assertThat(result.relevanceScore()).isNull();
            assertThat(result.overallMatchPercentage()).isZero();
            assertThat(result.feedback()).startsWith("Resume did not pass initial screening.");
        }

        @Test
        @DisplayName("Passing pairs take the weighted total as overall match")
        void shouldUseWeightedTotal() {
            JobPosting posting = job("1", "Java developer with Docker").toBuilder()
                    .requiredSkills(List.of("java", "docker", "kubernetes"))
                    .build();

            AnalysisResult result = resumeAnalysisService.analyze(resume(), posting);

            assertThat(result.hardFilters().passed()).isTrue();
            assertThat(result.overallMatchPercentage()).isEqualTo(result.relevanceScore().weightedTotal());
            assertThat(result.matchedSkills()).containsExactly("java", "docker");
            assertThat(result.missingSkills()).containsExactly("kubernetes");
            assertThat(result.roleType()).isEqualTo("default");
        }

        @Test
        @DisplayName("Analysis is repeatable apart from its timestamp")
        void shouldBeIdempotent() {
            JobPosting posting = job("1", "Java developer with Docker").toBuilder()
                    .requiredSkills(List.of("java", "docker"))
                    .build();

            AnalysisResult first = resumeAnalysisService.analyze(resume(), posting);
            AnalysisResult second = resumeAnalysisService.analyze(resume(), posting);

            assertThat(second).usingRecursiveComparison().ignoringFields("analyzedAt").isEqualTo(first);
        }

        @Test
        @DisplayName("Should reject missing inputs and invalid weights")
        void shouldRejectInvalidInput() {
            ScoringWeights unbalanced = new ScoringWeights(0.5, 0.5, 0.5, 0, 0, 0);

            assertThatThrownBy(() -> resumeAnalysisService.analyze(null, job("1", "x")))
                    .isInstanceOf(InvalidRequestException.class);
            assertThatThrownBy(() -> resumeAnalysisService.analyze(resume(), null))
                    .isInstanceOf(InvalidRequestException.class);
            assertThatThrownBy(() -> resumeAnalysisService.analyze(resume(), job("1", "x"), unbalanced))
                    .isInstanceOf(InvalidRequestException.class)
                    .hasMessageContaining("sum to 1.0");
        }

        @Test
        @DisplayName("Should reject negative years of experience before scoring")
        void shouldRejectNegativeExperience() {
            ResumeProfile negative = ResumeProfile.builder()
                    .skills(List.of("java"))
                    .yearsOfExperience(-5)
                    .build();
            JobPosting posting = job("1", "Java backend");

            assertThatThrownBy(() -> resumeAnalysisService.analyze(negative, posting))
                    .isInstanceOf(InvalidRequestException.class)
                    .hasMessage("Years of experience must not be negative, got -5.0");
            assertThatThrownBy(() -> resumeAnalysisService.quickScore(negative, posting))
                    .isInstanceOf(InvalidRequestException.class);
        }
    }

    @Test
    @DisplayName("Quick score extracts skills from the description when none are listed")
    void shouldQuickScoreFromDescription() {
        QuickScore score = resumeAnalysisService.quickScore(resume(),
                job("1", "Looking for Java and Kubernetes engineers with Docker."));

        assertThat(score.matchedSkills()).containsExactlyInAnyOrder("java", "docker");
        assertThat(score.missingSkills()).containsExactly("kubernetes");
        assertThat(score.skillMatchPercentage()).isEqualTo(66.67);
        assertThat(score.score()).isBetween(0.0, 100.0);
    }

    @Nested
    @DisplayName("Batch scoring")
    class BatchTests {

        @Test
        @DisplayName("Should cap the batch and sort by score")
        void shouldCapAndSort() {
            List<JobPosting> jobs = IntStream.range(0, 60)
                    .mapToObj(i -> job("job-" + i, i % 2 == 0 ? "Java and Docker with Kafka" : "Cobol mainframe work"))
                    .toList();

            BatchScoreResult result = resumeAnalysisService.batchScore(resume(), jobs);

            assertThat(result.totalJobs()).isEqualTo(60);
            assertThat(result.scoredJobs()).isEqualTo(searchConfig.getMaxBatchScoreJobs());
            assertThat(result.scores())
                    .isSortedAccordingTo(Comparator.comparingDouble(BatchScoreResult.Item::score).reversed());
        }

        @Test
        @DisplayName("A failing job is reported without stopping the others")
        void shouldIsolateFailures() {
            List<JobPosting> jobs = new ArrayList<>(Arrays.asList(
                    job("a", "Java and Docker"), null, job("b", "Kafka and Java")));

            BatchScoreResult result = resumeAnalysisService.batchScore(resume(), jobs);

            assertThat(result.scores()).hasSize(3);
            assertThat(result.scores()).filteredOn(item -> item.error() != null)
                    .singleElement()
                    .satisfies(item -> {
                        assertThat(item.jobIndex()).isEqualTo(1);
                        assertThat(item.quickScore()).isNull();
                        assertThat(item.score()).isZero();
                    });
            assertThat(result.scores().get(2).error()).isNotNull();
        }
    }

    @Test
    @DisplayName("Skill utilities validate their input")
    void shouldValidateSkillUtilities() {
        assertThatThrownBy(() -> resumeAnalysisService.extractSkills(" "))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> resumeAnalysisService.matchSkills(null, List.of("java"), null))
                .isInstanceOf(InvalidRequestException.class);
        assertThat(resumeAnalysisService.matchSkills(List.of("js"), List.of("javascript"), null).overallSkillScore())
                .isEqualTo(70.0);
    }
}
