package dev.jobmatcher.worker;

import dev.jobmatcher.config.SearchConfig;
import dev.jobmatcher.repository.SearchTaskStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Purges finished search tasks once their retention window has passed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskExpiryWorker {

    private final SearchTaskStore taskStore;
    private final SearchConfig searchConfig;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${search.cleanup-interval-ms:60000}")
    public void purgeExpired() {
        Instant cutoff = Instant.now(clock).minus(searchConfig.getTaskRetention());
        int removed = taskStore.expireCompletedBefore(cutoff);
        if (removed > 0) {
            log.info("Expired {} finished search tasks, {} remaining", removed, taskStore.count());
        }
    }
}
