package dev.jobmatcher.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MatcherMetricsTest {

    private MeterRegistry meterRegistry;
    private MatcherMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new MatcherMetrics(meterRegistry);
    }

    @Nested
    @DisplayName("Search lifecycle")
    class SearchLifecycleTests {

        @Test
        @DisplayName("Should count searches and track active ones")
        void shouldTrackActiveSearches() {
            metrics.recordSearchStarted();
            metrics.recordSearchStarted();
            metrics.recordSearchStarted();
            metrics.recordSearchCompleted();
            metrics.recordSearchFailed();

            assertThat(meterRegistry.counter("job_matcher_searches_started_total").count()).isEqualTo(3.0);
            assertThat(meterRegistry.counter("job_matcher_searches_completed_total").count()).isEqualTo(1.0);
            assertThat(meterRegistry.counter("job_matcher_searches_failed_total").count()).isEqualTo(1.0);
            assertThat(metrics.getActiveSearches()).isEqualTo(1);
            assertThat(meterRegistry.get("job_matcher_active_searches").gauge().value()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Job counters")
    class JobCounterTests {

        @Test
        @DisplayName("Should record fetched, scored and failed jobs")
        void shouldRecordJobs() {
            metrics.recordJobsFetched(7);
            metrics.recordJobScored();
            metrics.recordJobScored();
            metrics.recordScoringFailure();

            assertThat(meterRegistry.counter("job_matcher_jobs_fetched_total").count()).isEqualTo(7.0);
            assertThat(meterRegistry.counter("job_matcher_jobs_scored_total").count()).isEqualTo(2.0);
            assertThat(meterRegistry.counter("job_matcher_scoring_failures_total").count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Provider metrics")
    class ProviderTests {

        @Test
        @DisplayName("Should reuse the timer per provider")
        void shouldReuseTimer() {
            Timer first = metrics.getProviderTimer("JSearch");
            Timer second = metrics.getProviderTimer("JSearch");

            assertThat(first).isSameAs(second);
        }

        @Test
        @DisplayName("Should record fetch latency")
        void shouldRecordLatency() {
            metrics.recordFetchLatency("JSearch", 250);

            Timer timer = meterRegistry.get("job_matcher_provider_fetch_duration").tag("provider", "JSearch").timer();
            assertThat(timer.count()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should tag provider errors by reason")
        void shouldTagErrors() {
            metrics.recordProviderError("JSearch", "RATE_LIMITED");
            metrics.recordProviderError("JSearch", "RATE_LIMITED");
            metrics.recordProviderError("JSearch", "AUTHENTICATION");

            assertThat(meterRegistry.counter("job_matcher_provider_errors_total",
                    "provider", "JSearch", "reason", "RATE_LIMITED").count()).isEqualTo(2.0);
            assertThat(meterRegistry.counter("job_matcher_provider_errors_total",
                    "provider", "JSearch", "reason", "AUTHENTICATION").count()).isEqualTo(1.0);
        }
    }
}
