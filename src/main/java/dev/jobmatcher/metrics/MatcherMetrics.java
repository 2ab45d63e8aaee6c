package dev.jobmatcher.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for job searches and scoring.
 */
@Component
public class MatcherMetrics {

    private static final String TAG_PROVIDER = "provider";
    private final MeterRegistry registry;

    private final Counter searchesStartedCounter;
    private final Counter searchesCompletedCounter;
    private final Counter searchesFailedCounter;
    private final Counter jobsFetchedCounter;
    private final Counter jobsScoredCounter;
    private final Counter scoringFailuresCounter;

    private final ConcurrentHashMap<String, Timer> providerTimers = new ConcurrentHashMap<>();

    private final AtomicInteger activeSearches = new AtomicInteger(0);

    public MatcherMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.searchesStartedCounter = Counter.builder("job_matcher_searches_started_total")
                .description("Total background searches started")
                .register(registry);

        this.searchesCompletedCounter = Counter.builder("job_matcher_searches_completed_total")
                .description("Total searches that reached COMPLETED")
                .register(registry);

        this.searchesFailedCounter = Counter.builder("job_matcher_searches_failed_total")
                .description("Total searches that reached FAILED")
                .register(registry);

        this.jobsFetchedCounter = Counter.builder("job_matcher_jobs_fetched_total")
                .description("Total postings returned by job providers")
                .register(registry);

        this.jobsScoredCounter = Counter.builder("job_matcher_jobs_scored_total")
                .description("Total postings analyzed against a resume")
                .register(registry);

        this.scoringFailuresCounter = Counter.builder("job_matcher_scoring_failures_total")
                .description("Total postings whose analysis failed")
                .register(registry);

        Gauge.builder("job_matcher_active_searches", activeSearches, AtomicInteger::get)
                .description("Searches currently running")
                .register(registry);
    }

    public Timer getProviderTimer(String providerName) {
        return providerTimers.computeIfAbsent(providerName, name ->
                Timer.builder("job_matcher_provider_fetch_duration")
                        .description("Time to fetch postings from a provider")
                        .tag(TAG_PROVIDER, name)
                        .register(registry)
        );
    }

    public void recordSearchStarted() {
        searchesStartedCounter.increment();
        activeSearches.incrementAndGet();
    }

    public void recordSearchCompleted() {
        searchesCompletedCounter.increment();
        activeSearches.decrementAndGet();
    }

    public void recordSearchFailed() {
        searchesFailedCounter.increment();
        activeSearches.decrementAndGet();
    }

    public void recordJobsFetched(int count) {
        jobsFetchedCounter.increment(count);
    }

    public void recordJobScored() {
        jobsScoredCounter.increment();
    }

    public void recordScoringFailure() {
        scoringFailuresCounter.increment();
    }

    /**
     * Record a provider error, tagged by provider and failure reason.
     */
    public void recordProviderError(String provider, String reason) {
        Counter.builder("job_matcher_provider_errors_total")
                .tag(TAG_PROVIDER, provider)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordFetchLatency(String provider, long latencyMs) {
        getProviderTimer(provider).record(Duration.ofMillis(latencyMs));
    }

    public int getActiveSearches() {
        return activeSearches.get();
    }
}
