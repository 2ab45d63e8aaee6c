package dev.jobmatcher.source.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.jobmatcher.config.ProviderConfig;
import dev.jobmatcher.exception.JobProviderException;
import dev.jobmatcher.exception.JobProviderException.Reason;
import dev.jobmatcher.metrics.MatcherMetrics;
import dev.jobmatcher.model.ExperienceFit;
import dev.jobmatcher.model.JobPosting;
import dev.jobmatcher.model.ProviderStatus;
import dev.jobmatcher.model.SalaryEstimate;
import dev.jobmatcher.model.SalaryRange;
import dev.jobmatcher.source.JobProvider;
import dev.jobmatcher.source.JobSearchQuery;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Job provider backed by the JSearch API on RapidAPI.
 */
@Slf4j
@Component
public class JSearchJobProvider implements JobProvider {

    static final String SOURCE = "jsearch";
    private static final int MAX_PAGES_PER_REQUEST = 10;
    private static final int OPEN_ENDED_SPAN = 10;

    private static final String MALFORMED_POSTING = "MALFORMED_POSTING";
    private static final ParameterizedTypeReference<ApiResponse<JSearchJob>> JOBS_RESPONSE =
            new ParameterizedTypeReference<>() {
            };
    private static final ParameterizedTypeReference<ApiResponse<SalaryData>> SALARY_RESPONSE =
            new ParameterizedTypeReference<>() {
            };

    private static final Pattern RANGE_YEARS = Pattern.compile("\\b(\\d{1,2})\\+?\\s*(?:to|-)\\s*(\\d{1,2})\\s*years?");
    private static final Pattern PLUS_YEARS = Pattern.compile("\\b(\\d{1,2})\\+\\s*years?");
    private static final Pattern PLAIN_YEARS = Pattern.compile("\\b(\\d{1,2})\\s*years?");

    private final WebClient webClient;
    private final ProviderConfig providerConfig;
    private final MatcherMetrics metrics;
    private final ObjectMapper objectMapper;

    public JSearchJobProvider(WebClient.Builder webClientBuilder, ProviderConfig providerConfig,
                              MatcherMetrics metrics, ObjectMapper objectMapper) {
        this.providerConfig = providerConfig;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.webClient = webClientBuilder
                .baseUrl(providerConfig.getBaseUrl())
                .codecs(config -> config.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .defaultHeader("X-RapidAPI-Key", providerConfig.getApiKey())
                .defaultHeader("X-RapidAPI-Host", providerConfig.getHost())
                .defaultHeader("Accept", "application/json")
                .build();

        if (providerConfig.getApiKey() == null || providerConfig.getApiKey().isBlank()) {
            log.warn("provider.jsearch.api-key is not set, JSearch requests will be rejected");
        }
    }

    @Override
    public String getName() {
        return "JSearch";
    }

    @Override
    public Flux<JobPosting> search(JobSearchQuery query) {
        String queryText = buildQuery(query);
        int pages = Math.min(Math.max(query.pageCount(), 1), MAX_PAGES_PER_REQUEST);
        log.info("JSearch query '{}' (page {}, {} pages)", queryText, query.page(), pages);

        return fetch(builder -> builder.path("/search")
                        .queryParam("query", queryText)
                        .queryParam("page", query.page())
                        .queryParam("num_pages", pages)
                        .queryParam("date_posted", providerConfig.getDatePosted())
                        .build(),
                JOBS_RESPONSE)
                .flatMapMany(response -> Flux.fromIterable(dataOf(response)))
                .mapNotNull(job -> toPostingOrSkip(job, query.experienceHint()));
    }

    @Override
    public Mono<JobPosting> findById(String jobId) {
        log.info("JSearch job details for {}", jobId);
        return fetch(builder -> builder.path("/job-details")
                        .queryParam("job_id", jobId)
                        .build(),
                JOBS_RESPONSE)
                .flatMap(response -> Mono.justOrEmpty(dataOf(response).stream().findFirst()))
                .mapNotNull(job -> toPostingOrSkip(job, null));
    }

    @Override
    public Mono<SalaryEstimate> estimateSalary(String jobTitle, String location) {
        log.info("JSearch salary estimate for '{}' in {}", jobTitle, location);
        return fetch(builder -> builder.path("/estimated-salary")
                        .queryParam("job_title", jobTitle)
                        .queryParam("location", location)
                        .build(),
                SALARY_RESPONSE)
                .flatMap(response -> Mono.justOrEmpty(dataOf(response).stream().findFirst()))
                .map(salary -> new SalaryEstimate(
                        salary.getJobTitle(),
                        salary.getLocation(),
                        salary.getMinSalary(),
                        salary.getMaxSalary(),
                        salary.getMedianSalary(),
                        hasText(salary.getSalaryCurrency()) ? salary.getSalaryCurrency() : "USD",
                        hasText(salary.getSalaryPeriod()) ? salary.getSalaryPeriod() : "YEAR",
                        salary.getPublisherName()));
    }

    /**
     * Minimal one-page search; the quota comes from the RapidAPI rate-limit headers.
     */
    @Override
    public Mono<ProviderStatus> status() {
        return webClient.get()
                .uri(builder -> builder.path("/search")
                        .queryParam("query", "test")
                        .queryParam("page", 1)
                        .queryParam("num_pages", 1)
                        .build())
                .retrieve()
                .toBodilessEntity()
                .timeout(providerConfig.getTimeout())
                .map(response -> ProviderStatus.available(
                        response.getHeaders().getFirst("x-ratelimit-requests-limit"),
                        response.getHeaders().getFirst("x-ratelimit-requests-remaining"),
                        response.getHeaders().getFirst("x-ratelimit-requests-reset")))
                .onErrorResume(error -> {
                    JobProviderException providerError = toProviderException(error);
                    log.warn("JSearch status check failed ({}): {}", providerError.getReason(), providerError.getMessage());
                    return Mono.just(ProviderStatus.unavailable(providerError.getMessage()));
                });
    }

    private <T> Mono<ApiResponse<T>> fetch(Function<UriBuilder, URI> uri,
                                           ParameterizedTypeReference<ApiResponse<T>> type) {
        long start = System.currentTimeMillis();
        return webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(type)
                .timeout(providerConfig.getTimeout())
                .doOnTerminate(() -> metrics.recordFetchLatency(getName(), System.currentTimeMillis() - start))
                .flatMap(this::checkStatus)
                .onErrorMap(e -> !(e instanceof JobProviderException), this::toProviderException)
                .doOnError(JobProviderException.class, e -> {
                    log.warn("JSearch request failed ({}): {}", e.getReason(), e.getMessage());
                    metrics.recordProviderError(getName(), e.getReason().name());
                });
    }

    /**
     * One bad entry must not fail the whole response; it is logged and dropped.
     */
    private JobPosting toPostingOrSkip(JSearchJob job, Integer experienceHint) {
        try {
            return toPosting(job, experienceHint);
        } catch (RuntimeException e) {
            log.warn("Skipping malformed JSearch posting {}: {}", job.getJobId(), e.toString());
            metrics.recordProviderError(getName(), MALFORMED_POSTING);
            return null;
        }
    }

    private static <T> List<T> dataOf(ApiResponse<T> response) {
        if (response.getData() == null) {
            return List.of();
        }
        return response.getData().stream()
                .filter(Objects::nonNull)
                .toList();
    }

    /**
     * "keyword [at company] [in location] [via platform]"; platform "all" is ignored.
     */
    String buildQuery(JobSearchQuery query) {
        StringBuilder text = new StringBuilder(query.keyword());
        if (hasText(query.company())) {
            text.append(" at ").append(query.company());
        }
        if (hasText(query.location())) {
            text.append(" in ").append(query.location());
        }
        if (hasText(query.platform()) && !"all".equalsIgnoreCase(query.platform())) {
            text.append(" via ").append(query.platform());
        }
        return text.toString();
    }

    private <T> Mono<ApiResponse<T>> checkStatus(ApiResponse<T> response) {
        if ("ERROR".equalsIgnoreCase(response.getStatus())) {
            String message = response.getError() != null && hasText(response.getError().getMessage())
                    ? response.getError().getMessage()
                    : "JSearch API returned error";
            return Mono.error(new JobProviderException(Reason.UNAVAILABLE, message));
        }
        return Mono.just(response);
    }

    private JobProviderException toProviderException(Throwable error) {
        if (error instanceof WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 429) {
                String reset = e.getHeaders().getFirst("x-ratelimit-requests-reset");
                return new JobProviderException(Reason.RATE_LIMITED,
                        "Rate limit exceeded. Try again in " + (reset != null ? reset : "a few") + " seconds", e);
            }
            if (status == 401 || status == 403) {
                return new JobProviderException(Reason.AUTHENTICATION, "JSearch API authentication failed", e);
            }
            if (status == 400) {
                return new JobProviderException(Reason.BAD_REQUEST, badRequestMessage(e), e);
            }
            return new JobProviderException(Reason.UNAVAILABLE, "JSearch API returned HTTP " + status, e);
        }
        return new JobProviderException(Reason.UNAVAILABLE, "JSearch API unavailable: " + error.getMessage(), error);
    }

    private String badRequestMessage(WebClientResponseException e) {
        String body = e.getResponseBodyAsString();
        if (hasText(body)) {
            try {
                JsonNode message = objectMapper.readTree(body).path("message");
                if (message.isTextual() && hasText(message.asText())) {
                    return message.asText();
                }
            } catch (JsonProcessingException parseError) {
                log.debug("JSearch 400 body is not JSON: {}", parseError.getMessage());
            }
        }
        return "Invalid request parameters";
    }

    JobPosting toPosting(JSearchJob job, Integer experienceHint) {
        String description = stripHtml(job.getJobDescription());
        ExperienceRange experience = extractExperience(description);

        return JobPosting.builder()
                .id(job.getJobId())
                .title(job.getJobTitle())
                .company(job.getEmployerName())
                .location(formatLocation(job))
                .description(description)
                .requiredSkills(nonBlank(job.getJobRequiredSkills()))
                .minExperience(experience.min())
                .maxExperience(experience.openEnded() || experience.isUnknown() ? null : (double) experience.max())
                .requiredEducation(requiredEducation(job.getJobRequiredEducation()))
                .source(SOURCE)
                .employmentType(job.getJobEmploymentType())
                .remote(Boolean.TRUE.equals(job.getJobIsRemote()))
                .postedAt(parseInstant(job.getJobPostedAtDatetimeUtc()))
                .applyLink(job.getJobApplyLink())
                .publisher(job.getJobPublisher())
                .salary(salary(job))
                .experienceFit(experienceFit(experienceHint != null ? experienceHint : 0, experience))
                .build();
    }

    /**
     * First match wins: "3-5 years" / "3 to 5 years", then "3+ years", then "3 years".
     */
    static ExperienceRange extractExperience(String description) {
        if (description == null || description.isBlank()) {
            return ExperienceRange.UNKNOWN;
        }
        String text = description.toLowerCase(Locale.ROOT);

        Matcher range = RANGE_YEARS.matcher(text);
        if (range.find()) {
            return new ExperienceRange(Integer.parseInt(range.group(1)), Integer.parseInt(range.group(2)), false);
        }
        Matcher plus = PLUS_YEARS.matcher(text);
        if (plus.find()) {
            int min = Integer.parseInt(plus.group(1));
            return new ExperienceRange(min, min + OPEN_ENDED_SPAN, true);
        }
        Matcher plain = PLAIN_YEARS.matcher(text);
        if (plain.find()) {
            int years = Integer.parseInt(plain.group(1));
            return new ExperienceRange(years, years, false);
        }
        return ExperienceRange.UNKNOWN;
    }

    static ExperienceFit experienceFit(double candidateYears, ExperienceRange required) {
        if (required.isUnknown()) {
            return ExperienceFit.UNKNOWN;
        }
        if (candidateYears >= required.min() && candidateYears <= required.max()) {
            return ExperienceFit.PERFECT;
        }
        if (candidateYears >= required.min() - 1 && candidateYears <= required.max() + 1) {
            return ExperienceFit.GOOD;
        }
        if (candidateYears < required.min()) {
            return ExperienceFit.UNDERQUALIFIED;
        }
        return ExperienceFit.OVERQUALIFIED;
    }

    /**
     * Only a required (not merely preferred) degree becomes a requirement.
     */
    static String requiredEducation(EducationFlags flags) {
        if (flags == null || !Boolean.TRUE.equals(flags.getDegreeMentioned())
                || Boolean.TRUE.equals(flags.getDegreePreferred())) {
            return null;
        }
        if (Boolean.TRUE.equals(flags.getPostgraduateDegree())) {
            return "Master's degree";
        }
        if (Boolean.TRUE.equals(flags.getBachelorsDegree())) {
            return "Bachelor's degree";
        }
        if (Boolean.TRUE.equals(flags.getAssociatesDegree())) {
            return "Associate degree";
        }
        if (Boolean.TRUE.equals(flags.getHighSchool())) {
            return "High school diploma";
        }
        return null;
    }

    private static String formatLocation(JSearchJob job) {
        if (hasText(job.getJobCity()) && hasText(job.getJobState())) {
            return job.getJobCity() + ", " + job.getJobState() + ", " + job.getJobCountry();
        }
        return job.getJobCountry();
    }

    private static SalaryRange salary(JSearchJob job) {
        if (job.getJobMinSalary() == null && job.getJobMaxSalary() == null) {
            return null;
        }
        return new SalaryRange(
                job.getJobMinSalary(),
                job.getJobMaxSalary(),
                hasText(job.getJobSalaryCurrency()) ? job.getJobSalaryCurrency() : "USD",
                hasText(job.getJobSalaryPeriod()) ? job.getJobSalaryPeriod() : "YEAR");
    }

    private static Instant parseInstant(String value) {
        if (!hasText(value)) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable posting date '{}'", value);
            return null;
        }
    }

    private static String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text();
    }

    private static List<String> nonBlank(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(JSearchJobProvider::hasText)
                .toList();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    record ExperienceRange(int min, int max, boolean openEnded) {
        static final ExperienceRange UNKNOWN = new ExperienceRange(0, 0, false);

        boolean isUnknown() {
            return min == 0 && max == 0;
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ApiResponse<T> {
        private String status;
        private ErrorBody error;
        private List<T> data;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ErrorBody {
        private String message;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class JSearchJob {
        private String jobId;
        private String jobTitle;
        private String employerName;
        private String jobDescription;
        private String jobCity;
        private String jobState;
        private String jobCountry;
        private String jobEmploymentType;
        private Boolean jobIsRemote;
        private String jobPostedAtDatetimeUtc;
        private String jobApplyLink;
        private String jobPublisher;
        private List<String> jobRequiredSkills;
        private EducationFlags jobRequiredEducation;
        private Double jobMinSalary;
        private Double jobMaxSalary;
        private String jobSalaryCurrency;
        private String jobSalaryPeriod;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class EducationFlags {
        private Boolean postgraduateDegree;
        private Boolean bachelorsDegree;
        private Boolean associatesDegree;
        private Boolean highSchool;
        private Boolean degreeMentioned;
        private Boolean degreePreferred;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class SalaryData {
        private String jobTitle;
        private String location;
        private String publisherName;
        private Double minSalary;
        private Double maxSalary;
        private Double medianSalary;
        private String salaryCurrency;
        private String salaryPeriod;
    }
}
