package com.boundgen.infrastructure.scheduling;

import com.boundgen.domain.execution.repository.ExecutionStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

@Component
@RequiredArgsConstructor
@Slf4j
public class ExecutionCleanupScheduler {

    private final ExecutionStateStore stateStore;

    @Value("${execution.retention-minutes:1440}")
    private long retentionMinutes;

    @Scheduled(fixedRate = 3600000)
    public void evictExpiredExecutions() {
        int removed = stateStore.deleteUpdatedBefore(Instant.now().minus(Duration.ofMinutes(retentionMinutes)));
        log.debug("Evicted {} executions older than {} minutes", removed, retentionMinutes);
    }
}
