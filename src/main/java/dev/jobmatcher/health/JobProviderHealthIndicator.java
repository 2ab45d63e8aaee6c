package dev.jobmatcher.health;

import dev.jobmatcher.model.ProviderStatus;
import dev.jobmatcher.service.JobSearchService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Reports the job provider under /actuator/health, with the remaining request quota. Each
 * check costs one provider request.
 */
@Component
@RequiredArgsConstructor
public class JobProviderHealthIndicator implements ReactiveHealthIndicator {

    private final JobSearchService jobSearchService;

    @Override
    public Mono<Health> health() {
        return jobSearchService.providerStatus()
                .map(JobProviderHealthIndicator::toHealth);
    }

    static Health toHealth(ProviderStatus status) {
        if (!status.available()) {
            return Health.down()
                    .withDetail("error", status.error() != null ? status.error() : "unknown")
                    .build();
        }
        Health.Builder builder = Health.up();
        if (status.requestsLimit() != null) {
            builder.withDetail("requestsLimit", status.requestsLimit());
        }
        if (status.requestsRemaining() != null) {
            builder.withDetail("requestsRemaining", status.requestsRemaining());
        }
        if (status.requestsReset() != null) {
            builder.withDetail("requestsReset", status.requestsReset());
        }
        return builder.build();
    }
}
