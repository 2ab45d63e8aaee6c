package dev.jobmatcher.repository;

import dev.jobmatcher.model.NoJobsGuidance;
import dev.jobmatcher.model.SearchTask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySearchTaskStoreTest {

    private InMemorySearchTaskStore store;

    @BeforeEach
    void setUp() {
        store = new InMemorySearchTaskStore();
    }

    private SearchTask finishedTask(String id) {
        SearchTask task = new SearchTask(id, Clock.systemUTC());
        task.completeWithoutResults(new NoJobsGuidance("No Job Vacancies Found", "none", List.of(), "Good luck"));
        return task;
    }

    @Test
    @DisplayName("Should save, find and delete tasks")
    void shouldSaveFindAndDelete() {
        SearchTask task = new SearchTask("task-1", Clock.systemUTC());
        store.save(task);

        assertThat(store.findById("task-1")).containsSame(task);
        assertThat(store.count()).isEqualTo(1);

        store.deleteById("task-1");
        assertThat(store.findById("task-1")).isEmpty();
        assertThat(store.count()).isZero();
    }

    @Test
    @DisplayName("Unknown and null ids are not found")
    void shouldNotFindUnknown() {
        assertThat(store.findById("missing")).isEmpty();
        assertThat(store.findById(null)).isEmpty();
    }

    @Test
    @DisplayName("Expiry only removes finished tasks completed before the cutoff")
    void shouldExpireOnlyFinishedTasks() {
        SearchTask running = new SearchTask("running", Clock.systemUTC());
        SearchTask finished = finishedTask("finished");
        store.save(running);
        store.save(finished);

        assertThat(store.expireCompletedBefore(finished.getCompletedAt())).isZero();

        int removed = store.expireCompletedBefore(finished.getCompletedAt().plusSeconds(1));

        assertThat(removed).isEqualTo(1);
        assertThat(store.findById("finished")).isEmpty();
        assertThat(store.findById("running")).isPresent();
    }
}
