package com.jay.mfses.scheduler;

import com.jay.mfses.layer3_composite.BatchScoringService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scoring Scheduler — runs the watchlist after the US close (default 16:30 New York,
 * weekdays), and optionally once at startup.
 * Only active with {@code mfses.schedule.enabled=true}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "mfses.schedule.enabled", havingValue = "true")
public class ScoringScheduler {

    private final BatchScoringService batchScoringService;

    @Value("${mfses.schedule.run-on-startup:false}")
    private boolean runOnStartup;

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (runOnStartup) {
            log.info("=== STARTUP RUN — scoring watchlist ===");
            runSafely();
        }
    }

    @Scheduled(cron = "${mfses.schedule.cron:0 30 16 * * MON-FRI}",
               zone = "${mfses.schedule.zone:America/New_York}")
    public void afterClose() {
        log.info("=== AFTER CLOSE — scoring watchlist ===");
        runSafely();
    }

    private void runSafely() {
        try {
            batchScoringService.runWatchlist();
        } catch (Exception e) {
            log.error("Scheduled scoring run failed: {}", e.getMessage(), e);
        }
    }
}
