package org.gc.contentscheduler.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "content-scheduler.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class ScheduleReconciler {

    private final ScheduleTimerService timerService;

    /**
     * Restores timers for all active schedules once the application is up.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void rehydrateOnStartup() {
        try {
            timerService.rehydrate();
        } catch (RuntimeException e) {
            log.error("Timer rehydration failed, the next reconcile pass will retry: {}", e.getMessage(), e);
        }
    }

    /**
     * Re-registers timers that went missing, e.g. after a rejected registration.
     */
    @Scheduled(fixedRateString = "${content-scheduler.scheduler.reconcile-interval-ms:300000}",
            initialDelayString = "${content-scheduler.scheduler.reconcile-interval-ms:300000}")
    public void reconcileTimers() {
        log.debug("Running schedule timer reconcile check");
        try {
            int repaired = timerService.reconcile();
            if (repaired > 0) {
                log.info("Reconcile repaired {} schedule timer(s)", repaired);
            }
        } catch (RuntimeException e) {
            log.error("Error in schedule timer reconcile: {}", e.getMessage());
        }
    }
}
