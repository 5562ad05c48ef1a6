package org.gc.contentscheduler.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.contentscheduler.domain.BlogSchedule;
import org.gc.contentscheduler.domain.ExecutionRecord;
import org.gc.contentscheduler.domain.dto.ExecutionResult;
import org.gc.contentscheduler.domain.dto.RunNowRequest;
import org.gc.contentscheduler.domain.dto.SchedulerStatusResponse;
import org.gc.contentscheduler.domain.dto.StatusResponse;
import org.gc.contentscheduler.exception.InvalidScheduleException;
import org.gc.contentscheduler.exception.ScheduleNotFoundException;
import org.gc.contentscheduler.properties.SchedulerProperties;
import org.gc.contentscheduler.repository.BlogScheduleRepository;
import org.gc.contentscheduler.repository.ExecutionRecordRepository;
import org.gc.contentscheduler.service.ScheduleTimerService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/schedules")
@RequiredArgsConstructor
public class ScheduleController {

    private final ScheduleTimerService timerService;
    private final BlogScheduleRepository scheduleRepository;
    private final ExecutionRecordRepository executionRecordRepository;
    private final SchedulerProperties properties;

    /**
     * Turns a schedule on and registers its timer.
     * <p>
     * Example: {@code POST /schedules/6f1c.../activate}
     */
    @PostMapping("/{id}/activate")
    public Mono<ResponseEntity<StatusResponse>> activate(@PathVariable("id") String id) {
        log.info("Received request to activate schedule {}", id);

        return Mono.fromCallable(() -> timerService.activate(id))
                .subscribeOn(Schedulers.boundedElastic())
                .map(schedule -> ResponseEntity.ok(StatusResponse.success(
                        "Schedule activated.", scheduleDetails(schedule))))
                .onErrorResume(error -> Mono.just(errorResponse("activate schedule " + id, error)));
    }

    @PostMapping("/{id}/deactivate")
    public Mono<ResponseEntity<StatusResponse>> deactivate(@PathVariable("id") String id) {
        log.info("Received request to deactivate schedule {}", id);

        return Mono.fromCallable(() -> timerService.deactivate(id))
                .subscribeOn(Schedulers.boundedElastic())
                .map(schedule -> ResponseEntity.ok(StatusResponse.success(
                        "Schedule deactivated.", scheduleDetails(schedule))))
                .onErrorResume(error -> Mono.just(errorResponse("deactivate schedule " + id, error)));
    }

    /**
     * Runs the schedule immediately. The body is optional:
     * <pre>
     * POST /schedules/{id}/run-now
     * { "timeoutSeconds": 300 }
     * </pre>
     * A run that fails still answers 200; the failure is in the details.
     */
    @PostMapping("/{id}/run-now")
    public Mono<ResponseEntity<StatusResponse>> runNow(@PathVariable("id") String id,
                                                       @Valid @RequestBody(required = false) RunNowRequest request) {
        Duration timeout = request != null && request.getTimeoutSeconds() != null
                ? Duration.ofSeconds(request.getTimeoutSeconds())
                : properties.getTimeouts().getManualRun();
        log.info("Received manual run request for schedule {} (timeout {}s)", id, timeout.toSeconds());

        return timerService.runNow(id, timeout)
                .map(result -> ResponseEntity.ok(result.isSuccess()
                        ? StatusResponse.success("Run completed.", resultDetails(result))
                        : StatusResponse.builder()
                                .success(false)
                                .message("Run did not produce a post: " + result.getOutcome())
                                .details(resultDetails(result))
                                .build()))
                .onErrorResume(error -> Mono.just(errorResponse("run schedule " + id, error)));
    }

    @GetMapping("/{id}/executions")
    public Mono<ResponseEntity<List<ExecutionRecord>>> executions(@PathVariable("id") String id) {
        return Mono.fromCallable(() -> {
                    if (!scheduleRepository.existsById(id)) {
                        return ResponseEntity.notFound().<List<ExecutionRecord>>build();
                    }
                    return ResponseEntity.ok(executionRecordRepository.findTop50ByScheduleIdOrderByStartedAtUtcDesc(id));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/scheduler/status")
    public ResponseEntity<SchedulerStatusResponse> schedulerStatus() {
        return ResponseEntity.ok(timerService.status());
    }

    private static ResponseEntity<StatusResponse> errorResponse(String action, Throwable error) {
        HttpStatus status;
        if (error instanceof ScheduleNotFoundException) {
            status = HttpStatus.NOT_FOUND;
        } else if (error instanceof InvalidScheduleException) {
            status = HttpStatus.BAD_REQUEST;
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }

        if (status.is5xxServerError()) {
            log.error("Failed to {}: {}", action, error.getMessage(), error);
        } else {
            log.warn("Failed to {}: {}", action, error.getMessage());
        }
        return ResponseEntity.status(status).body(StatusResponse.failure("Failed to " + action + ": " + error.getMessage()));
    }

    private static Map<String, Object> scheduleDetails(BlogSchedule schedule) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("schedule_id", schedule.getId());
        details.put("name", schedule.getName());
        details.put("active", schedule.isActive());
        details.put("next_run", schedule.getNextRun() != null ? schedule.getNextRun().toString() : null);
        return details;
    }

    private static Map<String, Object> resultDetails(ExecutionResult result) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("execution_id", result.getExecutionId());
        details.put("outcome", result.getOutcome());
        details.put("post_id", result.getPostId());
        details.put("title", result.getTitle());
        details.put("post_status", result.getPostStatus());
        details.put("published_url", result.getPublishedUrl());
        details.put("error_message", result.getErrorMessage());
        details.put("error_category", result.getErrorCategory());
        details.put("duration_ms", result.getDurationMs());
        details.put("schedule_paused", result.isSchedulePaused());
        return details;
    }
}
