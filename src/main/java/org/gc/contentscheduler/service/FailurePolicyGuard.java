package org.gc.contentscheduler.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.contentscheduler.domain.BlogSchedule;
import org.gc.contentscheduler.domain.ErrorCategory;
import org.gc.contentscheduler.domain.ExecutionRecord;
import org.gc.contentscheduler.properties.SchedulerProperties;
import org.gc.contentscheduler.repository.BlogScheduleRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Applies the consecutive-failure policy to a schedule once an execution's
 * outcome is known.
 * <p>
 * Each update starts from the stored schedule and changes only the fields the
 * engine owns, so a deactivate issued during the run is never undone.
 * <p>
 * Only generation and publish failures count. Skipped and precondition-blocked
 * runs leave {@code retryCount} alone. Transient and permanent categories count
 * the same; the category only shapes the notification text.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FailurePolicyGuard {

    private final BlogScheduleRepository scheduleRepository;
    private final NotificationService notificationService;
    private final SchedulerProperties properties;
    private final Clock clock;

    public void onSuccess(BlogSchedule schedule) {
        reload(schedule).ifPresent(stored -> {
            Instant now = clock.instant();
            if (stored.getRetryCount() > 0) {
                log.info("Schedule '{}' recovered after {} consecutive failure(s)", stored.getName(), stored.getRetryCount());
            }
            stored.setRetryCount(0);
            stored.setLastRun(now);
            stored.setUpdatedAtUtc(now);
            scheduleRepository.save(stored);
        });
    }

    /**
     * Counts a failed execution against the schedule.
     *
     * @return true when this failure paused the schedule; the caller must not
     *         register another timer for it
     */
    public boolean onFailure(BlogSchedule schedule, ExecutionRecord execution,
                             ErrorCategory category, String errorMessage) {
        Optional<BlogSchedule> current = reload(schedule);
        if (current.isEmpty()) {
            notificationService.notifyExecutionFailure(schedule, execution, category, errorMessage);
            return false;
        }

        BlogSchedule stored = current.get();
        Instant now = clock.instant();
        int failures = stored.getRetryCount() + 1;

        stored.setRetryCount(failures);
        stored.setLastRun(now);
        stored.setUpdatedAtUtc(now);

        notificationService.notifyExecutionFailure(stored, execution, category, errorMessage);

        boolean paused = false;
        if (failures >= properties.getMaxConsecutiveFailures() && stored.isActive()) {
            stored.setActive(false);
            stored.setNextRun(null);
            paused = true;
            log.warn("Schedule '{}' (id={}) auto-paused after {} consecutive failures",
                    stored.getName(), stored.getId(), failures);
            notificationService.notifySchedulePaused(stored, failures);
        } else {
            log.info("Schedule '{}' failure {} of {} ({})", stored.getName(), failures,
                    properties.getMaxConsecutiveFailures(), category.getKey());
        }

        scheduleRepository.save(stored);
        return paused;
    }

    /**
     * A billing precondition stopped the run before any generation happened.
     * The schedule is deactivated without touching the failure counter.
     */
    public void onPreconditionBlocked(BlogSchedule schedule) {
        log.warn("Subscription inactive for owner {}, deactivating schedule '{}'", schedule.getOwnerId(), schedule.getName());
        reload(schedule).ifPresent(stored -> {
            stored.setActive(false);
            stored.setNextRun(null);
            stored.setUpdatedAtUtc(clock.instant());
            scheduleRepository.save(stored);
        });
        notificationService.notifySubscriptionExpired(schedule);
    }

    /**
     * Re-reads the schedule; the copy the run started with may be stale.
     */
    private Optional<BlogSchedule> reload(BlogSchedule schedule) {
        Optional<BlogSchedule> stored = scheduleRepository.findById(schedule.getId());
        if (stored.isEmpty()) {
            log.info("Schedule '{}' (id={}) was deleted during its run, leaving it alone", schedule.getName(), schedule.getId());
        }
        return stored;
    }
}
