package org.gc.contentscheduler.service;

import jakarta.annotation.PreDestroy;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.gc.contentscheduler.domain.BlogSchedule;
import org.gc.contentscheduler.domain.ExecutionRecord;
import org.gc.contentscheduler.domain.dto.ExecutionResult;
import org.gc.contentscheduler.domain.dto.SchedulerStatusResponse;
import org.gc.contentscheduler.exception.GenerationException;
import org.gc.contentscheduler.exception.ScheduleNotFoundException;
import org.gc.contentscheduler.repository.BlogScheduleRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.stream.Collectors;

/**
 * Keeps one pending one-shot timer per active schedule and re-arms it after
 * every run.
 * <p>
 * The registry lives in memory only. The persisted {@code nextRun} of each
 * schedule is the source of truth, so timers are rebuilt from storage on
 * startup and a lost registration is repaired by {@link #reconcile()}.
 */
@Slf4j
@Service
public class ScheduleTimerService {

    private final BlogScheduleRepository scheduleRepository;
    private final ScheduleExecutionService executionService;
    private final NextRunCalculator nextRunCalculator;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final Map<String, PendingTimer> timers = new ConcurrentHashMap<>();
    private final Set<String> firing = ConcurrentHashMap.newKeySet();
    private volatile boolean running = true;

    @Value
    private static class PendingTimer {
        Instant fireTime;
        ScheduledFuture<?> future;
    }

    public ScheduleTimerService(BlogScheduleRepository scheduleRepository,
                                ScheduleExecutionService executionService,
                                NextRunCalculator nextRunCalculator,
                                @Qualifier("scheduleTimerExecutor") TaskScheduler taskScheduler,
                                Clock clock) {
        this.scheduleRepository = scheduleRepository;
        this.executionService = executionService;
        this.nextRunCalculator = nextRunCalculator;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    /**
     * Turns a schedule on. Manual reactivation clears the failure counter.
     */
    public BlogSchedule activate(String scheduleId) {
        BlogSchedule schedule = load(scheduleId);
        Instant now = clock.instant();
        Instant nextRun = nextRunCalculator.calculateNextRun(schedule, now);

        schedule.setActive(true);
        schedule.setRetryCount(0);
        schedule.setNextRun(nextRun);
        schedule.setUpdatedAtUtc(now);
        BlogSchedule saved = scheduleRepository.save(schedule);

        log.info("Activated schedule '{}' (id={}), next run at {}", saved.getName(), scheduleId, nextRun);
        register(scheduleId, nextRun);
        return saved;
    }

    public BlogSchedule deactivate(String scheduleId) {
        cancel(scheduleId);
        BlogSchedule schedule = load(scheduleId);
        schedule.setActive(false);
        schedule.setNextRun(null);
        schedule.setUpdatedAtUtc(clock.instant());
        BlogSchedule saved = scheduleRepository.save(schedule);

        log.info("Deactivated schedule '{}' (id={})", saved.getName(), scheduleId);
        return saved;
    }

    /**
     * Registers a timer for every active schedule. Schedules without a stored
     * next run get one computed; a next run in the past fires once right away.
     *
     * @return number of timers registered
     */
    public int rehydrate() {
        List<BlogSchedule> activeSchedules = scheduleRepository.findByActiveTrue();
        log.info("Rehydrating timers for {} active schedule(s)", activeSchedules.size());

        int registered = 0;
        for (BlogSchedule schedule : activeSchedules) {
            try {
                if (arm(schedule)) {
                    registered++;
                }
            } catch (RuntimeException e) {
                log.error("Could not restore timer for schedule '{}' (id={}): {}",
                        schedule.getName(), schedule.getId(), e.getMessage());
            }
        }
        log.info("Rehydrated {} schedule timer(s)", registered);
        return registered;
    }

    /**
     * Registers timers for active schedules that lost theirs and drops timers of
     * schedules that are no longer active.
     *
     * @return number of timers repaired
     */
    public int reconcile() {
        List<BlogSchedule> activeSchedules = scheduleRepository.findByActiveTrue();
        Set<String> activeIds = ConcurrentHashMap.newKeySet();

        int repaired = 0;
        for (BlogSchedule schedule : activeSchedules) {
            activeIds.add(schedule.getId());
            if (timers.containsKey(schedule.getId()) || firing.contains(schedule.getId())) {
                continue;
            }
            try {
                if (arm(schedule)) {
                    repaired++;
                    log.warn("Schedule '{}' (id={}) had no pending timer, re-registered for {}",
                            schedule.getName(), schedule.getId(), schedule.getNextRun());
                }
            } catch (RuntimeException e) {
                log.error("Could not repair timer for schedule '{}' (id={}): {}",
                        schedule.getName(), schedule.getId(), e.getMessage());
            }
        }

        timers.keySet().stream()
                .filter(id -> !activeIds.contains(id))
                .collect(Collectors.toList())
                .forEach(id -> {
                    log.info("Dropping timer of inactive or deleted schedule {}", id);
                    cancel(id);
                });
        return repaired;
    }

    /**
     * Runs the pipeline right away for an operator. Never moves the schedule's
     * next run; if the run paused the schedule its pending timer is cancelled.
     */
    public Mono<ExecutionResult> runNow(String scheduleId, Duration timeout) {
        log.info("Manual run requested for schedule {}", scheduleId);
        return executionService.execute(scheduleId, ExecutionRecord.Kind.MANUAL)
                .timeout(timeout, Mono.error(() ->
                        new GenerationException("Manual run timed out after " + timeout.toSeconds() + "s")))
                .doOnNext(result -> {
                    if (result.isSchedulePaused()) {
                        cancel(scheduleId);
                    }
                });
    }

    public SchedulerStatusResponse status() {
        List<SchedulerStatusResponse.PendingTimer> pending = timers.entrySet().stream()
                .map(entry -> new SchedulerStatusResponse.PendingTimer(entry.getKey(), entry.getValue().getFireTime()))
                .sorted(Comparator.comparing(SchedulerStatusResponse.PendingTimer::getFireTime))
                .collect(Collectors.toList());
        return SchedulerStatusResponse.builder()
                .running(running)
                .timerCount(pending.size())
                .timers(pending)
                .build();
    }

    /**
     * Runs a scheduled tick and re-arms the timer from whatever state the run
     * left the schedule in. Errors end here; the next tick is the retry.
     */
    Mono<Void> fire(String scheduleId, Instant firedAt) {
        // mark before unregistering so reconcile never sees the schedule in neither set
        firing.add(scheduleId);
        timers.computeIfPresent(scheduleId, (id, pending) -> pending.getFireTime().equals(firedAt) ? null : pending);

        return executionService.execute(scheduleId, ExecutionRecord.Kind.SCHEDULED)
                .doOnNext(result -> log.info("Scheduled run of {} finished: {}", scheduleId, result.getOutcome()))
                .onErrorResume(e -> {
                    log.error("Scheduled run of {} failed: {}", scheduleId, e.getMessage(), e);
                    return Mono.empty();
                })
                .then(Mono.fromCallable(() -> rearm(scheduleId, firedAt)).subscribeOn(Schedulers.boundedElastic()))
                .onErrorResume(e -> {
                    log.error("Could not re-arm schedule {}: {}", scheduleId, e.getMessage(), e);
                    return Mono.just(false);
                })
                .doFinally(signal -> firing.remove(scheduleId))
                .then();
    }

    private boolean rearm(String scheduleId, Instant firedAt) {
        BlogSchedule schedule = scheduleRepository.findById(scheduleId).orElse(null);
        if (schedule == null) {
            log.info("Schedule {} was deleted while running, not re-arming", scheduleId);
            return false;
        }
        if (!schedule.isActive()) {
            log.info("Schedule '{}' (id={}) is no longer active, not re-arming", schedule.getName(), scheduleId);
            return false;
        }

        Instant now = clock.instant();
        Instant from = now.isAfter(firedAt) ? now : firedAt;
        Instant nextRun = nextRunCalculator.calculateNextRun(schedule, from);
        schedule.setNextRun(nextRun);
        schedule.setUpdatedAtUtc(now);
        scheduleRepository.save(schedule);

        register(scheduleId, nextRun);
        return true;
    }

    private boolean arm(BlogSchedule schedule) {
        if (schedule.getNextRun() == null) {
            schedule.setNextRun(nextRunCalculator.calculateNextRun(schedule, clock.instant()));
            schedule.setUpdatedAtUtc(clock.instant());
            scheduleRepository.save(schedule);
        }
        return register(schedule.getId(), schedule.getNextRun());
    }

    private boolean register(String scheduleId, Instant fireTime) {
        cancel(scheduleId);
        if (!running) {
            log.warn("Scheduler is shut down, not registering timer for schedule {}", scheduleId);
            return false;
        }

        try {
            ScheduledFuture<?> future = taskScheduler.schedule(
                    () -> fire(scheduleId, fireTime).subscribe(),
                    fireTime);
            timers.put(scheduleId, new PendingTimer(fireTime, future));
            log.debug("Registered timer for schedule {} at {}", scheduleId, fireTime);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to register timer for schedule {} at {}: {}", scheduleId, fireTime, e.getMessage());
            return false;
        }
    }

    private void cancel(String scheduleId) {
        PendingTimer pending = timers.remove(scheduleId);
        if (pending != null) {
            pending.getFuture().cancel(false);
            log.debug("Cancelled timer for schedule {} (was due at {})", scheduleId, pending.getFireTime());
        }
    }

    private BlogSchedule load(String scheduleId) {
        return scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down schedule timers, dropping {} pending timer(s)", timers.size());
        running = false;
        timers.values().forEach(pending -> pending.getFuture().cancel(false));
        timers.clear();
    }
}
