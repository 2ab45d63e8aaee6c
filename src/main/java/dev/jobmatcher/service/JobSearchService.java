package dev.jobmatcher.service;

import dev.jobmatcher.config.SearchConfig;
import dev.jobmatcher.exception.InvalidRequestException;
import dev.jobmatcher.exception.JobProviderException;
import dev.jobmatcher.metrics.MatcherMetrics;
import dev.jobmatcher.model.JobPosting;
import dev.jobmatcher.model.NoJobsGuidance;
import dev.jobmatcher.model.ProviderStatus;
import dev.jobmatcher.model.ResumeProfile;
import dev.jobmatcher.model.SalaryEstimate;
import dev.jobmatcher.model.ScoredJob;
import dev.jobmatcher.model.ScoringWeights;
import dev.jobmatcher.model.SearchRequest;
import dev.jobmatcher.model.SearchTask;
import dev.jobmatcher.model.SearchTaskSnapshot;
import dev.jobmatcher.repository.SearchTaskStore;
import dev.jobmatcher.source.JobProvider;
import dev.jobmatcher.source.JobSearchQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs job searches in the background: fetch postings, score them against the resume in
 * small batches and publish progress on a pollable task.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobSearchService {

    private static final String SEPARATOR = "========================================";

    private final JobProvider jobProvider;
    private final ResumeAnalysisService resumeAnalysisService;
    private final SkillMatchingService skillMatchingService;
    private final SearchTaskStore taskStore;
    private final SearchConfig searchConfig;
    private final MatcherMetrics metrics;
    private final Scheduler searchScheduler;
    private final Clock clock;

    /**
     * Validate the request, register a task and start the search in the background.
     *
     * @param request The search request
     * @return id to poll with {@link #poll(String)}
     * @throws InvalidRequestException if no keyword is given, or the resume or custom weights are invalid
     */
    public String startSearch(SearchRequest request) {
        if (request == null || request.getKeyword() == null || request.getKeyword().isBlank()) {
            throw new InvalidRequestException("Either role or designation is required");
        }
        if (request.getResume() != null) {
            resumeAnalysisService.validateResume(request.getResume());
        }
        if (request.getCustomWeights() != null) {
            resumeAnalysisService.validateWeights(request.getCustomWeights());
        }

        String location = locationOf(request);
        JobSearchQuery query = new JobSearchQuery(
                request.getKeyword().trim(),
                location,
                request.getExperienceLevel(),
                1,
                searchConfig.getPageCount(),
                request.getCompany(),
                request.getPlatform());

        SearchTask task = new SearchTask(UUID.randomUUID().toString(), clock);
        taskStore.save(task);
        metrics.recordSearchStarted();
        log.info("Search {} started: '{}' in {}", task.getTaskId(), query.keyword(), location);

        executeSearch(task, request, query)
                .subscribeOn(searchScheduler)
                .subscribe();
        return task.getTaskId();
    }

    /**
     * Current state of a task. Unknown and expired ids give an empty result.
     */
    public Optional<SearchTaskSnapshot> poll(String taskId) {
        return taskStore.findById(taskId).map(SearchTask::snapshot);
    }

    /**
     * Full details of one posting, prepared the same way as search results.
     *
     * @throws InvalidRequestException if no job id is given
     */
    public Mono<JobPosting> jobDetails(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new InvalidRequestException("Job ID is required");
        }
        return jobProvider.findById(jobId.trim())
                .map(this::prepare);
    }

    /**
     * @throws InvalidRequestException if title or location is missing
     */
    public Mono<SalaryEstimate> estimateSalary(String jobTitle, String location) {
        if (jobTitle == null || jobTitle.isBlank() || location == null || location.isBlank()) {
            throw new InvalidRequestException("Job title and location are required");
        }
        return jobProvider.estimateSalary(jobTitle.trim(), location.trim());
    }

    public Mono<ProviderStatus> providerStatus() {
        return jobProvider.status()
                .doOnNext(status -> log.info("Provider {} available: {}, requests remaining: {}",
                        jobProvider.getName(), status.available(), status.requestsRemaining()));
    }

    /**
     * The whole background unit of work for one task. Never completes with an error: any
     * failure is recorded on the task.
     */
    Mono<Void> executeSearch(SearchTask task, SearchRequest request, JobSearchQuery query) {
        return jobProvider.search(query)
                .collectList()
                .flatMap(postings -> handlePostings(task, request, postings))
                .onErrorResume(error -> {
                    failTask(task, error);
                    return Mono.empty();
                });
    }

    private Mono<Void> handlePostings(SearchTask task, SearchRequest request, List<JobPosting> postings) {
        log.info("Search {}: provider {} returned {} postings", task.getTaskId(), jobProvider.getName(), postings.size());
        metrics.recordJobsFetched(postings.size());
        task.markAnalyzing(postings.size());

        if (postings.isEmpty()) {
            task.completeWithoutResults(noJobsGuidance(request.getKeyword(), locationOf(request), request));
            metrics.recordSearchCompleted();
            log.info("Search {}: no postings found", task.getTaskId());
            return Mono.empty();
        }

        ResumeProfile resume = request.getResume();
        if (resume == null) {
            task.completeUnscored(postings);
            metrics.recordSearchCompleted();
            log.info("Search {}: no resume given, returning {} unscored postings", task.getTaskId(), postings.size());
            return Mono.empty();
        }

        List<JobPosting> toAnalyze = postings.stream()
                .limit(searchConfig.getMaxJobsToAnalyze())
                .toList();
        int batchSize = Math.max(1, searchConfig.getBatchSize());
        task.startScoring(toAnalyze.size());
        log.info("Search {}: analyzing {} postings in batches of {}", task.getTaskId(), toAnalyze.size(), batchSize);

        return Flux.fromIterable(toAnalyze)
                .buffer(batchSize)
                .concatMap(batch -> Flux.fromIterable(batch)
                        .flatMapSequential(job -> scoreJob(job, resume, request.getCustomWeights()), batchSize)
                        .collectList()
                        .doOnNext(scored -> {
                            task.appendBatch(scored);
                            log.debug("Search {}: {}/{} analyzed", task.getTaskId(),
                                    task.getProcessedJobs(), task.getTotalJobs());
                        }))
                .then(Mono.<Void>fromRunnable(() -> {
                    task.completeScored();
                    metrics.recordSearchCompleted();
                    logSummary(task);
                }));
    }

    /**
     * Prepare and analyze one posting. Failures are isolated into a {@link ScoredJob} with no
     * score.
     */
    private Mono<ScoredJob> scoreJob(JobPosting job, ResumeProfile resume, ScoringWeights customWeights) {
        return Mono.fromCallable(() -> ScoredJob.scored(job,
                        resumeAnalysisService.analyze(resume, prepare(job), customWeights)))
                .subscribeOn(searchScheduler)
                .doOnNext(scored -> metrics.recordJobScored())
                .onErrorResume(error -> {
                    log.warn("Analysis failed for job '{}': {}", job.getTitle(), error.getMessage());
                    metrics.recordScoringFailure();
                    return Mono.just(ScoredJob.failed(job, messageOf(error)));
                });
    }

    /**
     * Fill in skills inferred from the description and a role type when the provider left
     * them out.
     */
    JobPosting prepare(JobPosting job) {
        JobPosting.JobPostingBuilder prepared = job.toBuilder();
        if (job.getRequiredSkills() == null || job.getRequiredSkills().isEmpty()) {
            prepared.requiredSkills(skillMatchingService.extractSkillsFromText(job.getDescription()));
        }
        if (job.getRoleType() == null || job.getRoleType().isBlank()) {
            prepared.roleType(determineRoleType(job.getTitle(), job.getMinExperience()));
        }
        return prepared.build();
    }

    static String determineRoleType(String title, double minExperience) {
        String lower = title != null ? title.toLowerCase(Locale.ROOT) : "";

        if (lower.contains("intern")) {
            return "intern";
        }
        if (minExperience == 0 || lower.contains("fresher") || lower.contains("junior")) {
            return "fresher";
        }
        if (lower.contains("manager") || minExperience > 8) {
            return "manager";
        }
        if (lower.contains("lead") || lower.contains("senior") || minExperience > 5) {
            return "lead";
        }
        return "software_engineer";
    }

    NoJobsGuidance noJobsGuidance(String keyword, String location, SearchRequest request) {
        String company = request.getCompany();
        boolean companySearch = company != null && !company.isBlank();

        String message = companySearch
                ? "Unfortunately, there are no current openings for \"" + keyword + "\" at " + company + " in " + location + "."
                : "Unfortunately, there are no current openings for \"" + keyword + "\" in " + location + ".";

        List<String> suggestions = new ArrayList<>();
        if (companySearch) {
            suggestions.add("Try a general search instead of a company-specific search for better results");
        }
        suggestions.add("Consider expanding your location or trying the \"remote\" option");
        suggestions.add("Use different keywords or job titles");
        String platform = request.getPlatform();
        if (platform != null && !platform.isBlank() && !"all".equalsIgnoreCase(platform)) {
            suggestions.add("Search all platforms instead of only " + platform);
        }

        return new NoJobsGuidance(
                "No Job Vacancies Found",
                message,
                List.copyOf(suggestions),
                "Best wishes for your job search! Try again with different criteria.");
    }

    private void failTask(SearchTask task, Throwable error) {
        String code = error instanceof JobProviderException providerError
                ? providerError.getReason().name()
                : error.getClass().getSimpleName();
        log.error("Search {} failed ({}): {}", task.getTaskId(), code, error.getMessage(), error);
        task.fail(messageOf(error), code);
        metrics.recordSearchFailed();
    }

    private void logSummary(SearchTask task) {
        log.info(SEPARATOR);
        log.info("Search {} complete: {} postings analyzed", task.getTaskId(), task.getJobs().size());
        task.getJobs().stream()
                .limit(3)
                .forEach(scored -> log.info("  - {} @ {} (score: {})", scored.job().getTitle(),
                        scored.job().getCompany(), scored.score()));
        log.info(SEPARATOR);
    }

    private String locationOf(SearchRequest request) {
        return request.getLocation() != null && !request.getLocation().isBlank()
                ? request.getLocation()
                : searchConfig.getDefaultLocation();
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
