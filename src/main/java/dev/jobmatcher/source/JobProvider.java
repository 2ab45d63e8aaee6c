package dev.jobmatcher.source;

import dev.jobmatcher.model.JobPosting;
import dev.jobmatcher.model.ProviderStatus;
import dev.jobmatcher.model.SalaryEstimate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * External source of job postings.
 */
public interface JobProvider {

    /**
     * Name used in logs and metric tags.
     */
    String getName();

    /**
     * Run one search. Errors surface as {@link dev.jobmatcher.exception.JobProviderException}.
     * Malformed postings are skipped.
     */
    Flux<JobPosting> search(JobSearchQuery query);

    /**
     * A single posting by provider id; empty when the provider does not know it.
     */
    Mono<JobPosting> findById(String jobId);

    /**
     * Salary estimate for a title in a location; empty when the provider has no data.
     */
    Mono<SalaryEstimate> estimateSalary(String jobTitle, String location);

    /**
     * Reachability and remaining quota. Never completes with an error.
     */
    Mono<ProviderStatus> status();
}
