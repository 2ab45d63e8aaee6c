package dev.jobmatcher.health;

import dev.jobmatcher.model.ProviderStatus;
import dev.jobmatcher.service.JobSearchService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobProviderHealthIndicatorTest {

    @Mock
    private JobSearchService jobSearchService;

    @InjectMocks
    private JobProviderHealthIndicator healthIndicator;

    @Test
    void shouldReportUpWithQuota() {
        when(jobSearchService.providerStatus()).thenReturn(Mono.just(ProviderStatus.available("200", "187", "86400")));

        StepVerifier.create(healthIndicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("requestsLimit", "200")
                            .containsEntry("requestsRemaining", "187")
                            .containsEntry("requestsReset", "86400");
                })
                .verifyComplete();
    }

    @Test
    void shouldReportDownWithError() {
        when(jobSearchService.providerStatus())
                .thenReturn(Mono.just(ProviderStatus.unavailable("JSearch API authentication failed")));

        StepVerifier.create(healthIndicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("error", "JSearch API authentication failed");
                })
                .verifyComplete();
    }

    @Test
    void shouldLeaveOutMissingQuotaHeaders() {
        assertThat(JobProviderHealthIndicator.toHealth(ProviderStatus.available(null, null, null)).getDetails())
                .isEmpty();
    }
}
