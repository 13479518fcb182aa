package com.sandkev.tradevol.volume;

import com.sandkev.tradevol.domain.BackfillResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/** Periodic refresh of the 24h aggregate and the nightly trailing backfill. Off unless {@code volume.jobs.enabled}. */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "volume.jobs", name = "enabled", havingValue = "true")
public class VolumeJobs {

    private final VolumeAggregationService volumes;

    @Scheduled(fixedDelayString = "${volume.jobs.refresh-delay:PT5M}", initialDelayString = "${volume.jobs.initial-delay:PT10S}")
    public void refreshCurrent() {
        volumes.refreshCurrentAggregate();
    }

    @Scheduled(cron = "${volume.jobs.backfill-cron:0 0 1 * * *}", zone = "UTC")
    public void backfillTrailingWindow() {
        List<BackfillResult> results = volumes.fetchAndStoreTrailingWindow();
        long failed = results.stream().filter(r -> r.status() != BackfillResult.Status.SUCCESS).count();
        if (failed > 0) {
            log.warn("Nightly backfill finished with {} of {} platforms incomplete", failed, results.size());
        }
    }
}
