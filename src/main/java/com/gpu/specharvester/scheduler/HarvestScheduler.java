package com.gpu.specharvester.scheduler;

import com.gpu.specharvester.dto.RunStartResult;
import com.gpu.specharvester.service.RunMode;
import com.gpu.specharvester.service.RunSupervisor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Nightly incremental review update
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "harvester.scheduler.enabled", havingValue = "true")
public class HarvestScheduler {

    private final RunSupervisor supervisor;

    @Scheduled(cron = "${harvester.scheduler.incremental-cron:0 0 3 * * *}")
    public void scheduledIncrementalUpdate() {
        log.info("=== Starting scheduled incremental update ===");
        RunStartResult result = supervisor.start(RunMode.INCREMENTAL, null);
        if (!result.accepted()) {
            log.warn("=== Scheduled incremental update skipped: {} ===", result.message());
        }
    }
}
