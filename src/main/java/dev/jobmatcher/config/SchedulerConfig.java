package dev.jobmatcher.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Worker pool for background searches and the scheduled task-expiry sweep.
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    @Bean(destroyMethod = "dispose")
    public Scheduler searchScheduler(SearchConfig searchConfig) {
        // Each search scores at most batchSize jobs at once
        int threads = searchConfig.getMaxConcurrentSearches() * Math.max(1, searchConfig.getBatchSize());
        return Schedulers.newBoundedElastic(threads, Integer.MAX_VALUE, "job-search");
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
