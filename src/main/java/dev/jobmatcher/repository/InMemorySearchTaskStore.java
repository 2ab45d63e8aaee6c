package dev.jobmatcher.repository;

import dev.jobmatcher.model.SearchTask;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local task store. Tasks do not survive a restart.
 */
@Repository
public class InMemorySearchTaskStore implements SearchTaskStore {

    private final Map<String, SearchTask> tasks = new ConcurrentHashMap<>();

    @Override
    public Optional<SearchTask> findById(String taskId) {
        if (taskId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public void save(SearchTask task) {
        tasks.put(task.getTaskId(), task);
    }

    @Override
    public void deleteById(String taskId) {
        tasks.remove(taskId);
    }

    @Override
    public int expireCompletedBefore(Instant cutoff) {
        int before = tasks.size();
        tasks.values().removeIf(task -> task.isTerminal()
                && task.getCompletedAt() != null
                && task.getCompletedAt().isBefore(cutoff));
        return before - tasks.size();
    }

    @Override
    public int count() {
        return tasks.size();
    }
}
