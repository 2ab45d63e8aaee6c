package dev.jobmatcher.repository;

import dev.jobmatcher.model.SearchTask;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage for background search tasks, keyed by task id.
 */
public interface SearchTaskStore {

    Optional<SearchTask> findById(String taskId);

    void save(SearchTask task);

    void deleteById(String taskId);

    /**
     * Remove every finished task completed before {@code cutoff}.
     *
     * @return number of tasks removed
     */
    int expireCompletedBefore(Instant cutoff);

    int count();
}
