package org.gc.contentscheduler.service;

import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.gc.contentscheduler.domain.BlogPost;
import org.gc.contentscheduler.domain.BlogSchedule;
import org.gc.contentscheduler.domain.ErrorCategory;
import org.gc.contentscheduler.domain.ExecutionRecord;
import org.gc.contentscheduler.domain.PromptTemplate;
import org.gc.contentscheduler.domain.PublishingSite;
import org.gc.contentscheduler.domain.dto.ExecutionResult;
import org.gc.contentscheduler.exception.GenerationException;
import org.gc.contentscheduler.exception.InvalidScheduleException;
import org.gc.contentscheduler.exception.PublishException;
import org.gc.contentscheduler.exception.ScheduleNotFoundException;
import org.gc.contentscheduler.properties.SchedulerProperties;
import org.gc.contentscheduler.repository.BlogPostRepository;
import org.gc.contentscheduler.repository.BlogScheduleRepository;
import org.gc.contentscheduler.repository.ExecutionRecordRepository;
import org.gc.contentscheduler.repository.PromptTemplateRepository;
import org.gc.contentscheduler.repository.PublishingSiteRepository;
import org.gc.contentscheduler.service.external.ContentGenerator;
import org.gc.contentscheduler.service.external.GeneratedText;
import org.gc.contentscheduler.service.external.ImageGenerator;
import org.gc.contentscheduler.service.external.PostPublisher;
import org.gc.contentscheduler.service.external.SubscriptionChecker;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

/**
 * Runs one content-generation attempt for a schedule: gates, topic, title,
 * body, optional image, post creation and, depending on the schedule's post
 * status policy, publishing.
 * <p>
 * Every attempt that finds its schedule writes exactly one
 * {@link ExecutionRecord}: it is saved as {@code RUNNING} up front and updated
 * once with the final outcome, whatever step failed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleExecutionService {

    static final String SITE_UNAVAILABLE = "Site is not active or missing";
    static final String TEMPLATE_MISSING = "Prompt template not found";

    private final BlogScheduleRepository scheduleRepository;
    private final ExecutionRecordRepository executionRecordRepository;
    private final BlogPostRepository blogPostRepository;
    private final PublishingSiteRepository siteRepository;
    private final PromptTemplateRepository templateRepository;
    private final ContentGenerator contentGenerator;
    private final ImageGenerator imageGenerator;
    private final PostPublisher postPublisher;
    private final SubscriptionChecker subscriptionChecker;
    private final ContentFormatter contentFormatter;
    private final ErrorClassifier errorClassifier;
    private final FailurePolicyGuard failurePolicyGuard;
    private final NotificationService notificationService;
    private final SchedulerProperties properties;
    private final Clock clock;

    private final Map<String, Integer> inFlight = new ConcurrentHashMap<>();

    @Value
    private static class Inputs {
        PublishingSite site;
        PromptTemplate template;
        List<String> existingTitles;
    }

    /**
     * What the generation and publish steps produced before anything is recorded.
     * {@code error} with a non-null {@code post} means publishing failed.
     */
    @Value
    private static class Attempt {
        BlogPost post;
        Throwable error;
        int promptTokens;
        int completionTokens;

        static Attempt failed(Throwable error) {
            return new Attempt(null, error, 0, 0);
        }

        Attempt published(BlogPost publishedPost) {
            return new Attempt(publishedPost, null, promptTokens, completionTokens);
        }

        Attempt failedWith(Throwable publishError) {
            return new Attempt(post, publishError, promptTokens, completionTokens);
        }
    }

    public Mono<ExecutionResult> execute(String scheduleId, ExecutionRecord.Kind kind) {
        return blocking(() -> scheduleRepository.findById(scheduleId)
                        .orElseThrow(() -> new ScheduleNotFoundException(scheduleId)))
                .flatMap(schedule -> {
                    trackStart(schedule);
                    ExecutionRecord record = ExecutionRecord.start(schedule, kind, clock.instant());
                    log.info("Starting {} execution {} for schedule '{}' (id={})",
                            kind, record.getId(), schedule.getName(), schedule.getId());
                    return blocking(() -> executionRecordRepository.save(record))
                            .then(run(schedule, record))
                            .doFinally(signal -> trackEnd(schedule.getId()));
                });
    }

    private Mono<ExecutionResult> run(BlogSchedule schedule, ExecutionRecord record) {
        return blocking(() -> gate(schedule, record.getKind()))
                .flatMap(outcome -> outcome.isPresent()
                        ? blocking(() -> finishWithoutRun(schedule, record, outcome.get()))
                        : attempt(schedule).flatMap(attempt -> blocking(() -> finish(schedule, record, attempt))))
                .onErrorResume(e -> record.getOutcome() == ExecutionRecord.Outcome.RUNNING,
                        e -> blocking(() -> finishUnexpected(schedule, record, e)));
    }

    /**
     * Checks the conditions under which a run does not happen at all.
     *
     * @return the non-run outcome, or empty when the pipeline should proceed
     */
    private Optional<ExecutionRecord.Outcome> gate(BlogSchedule schedule, ExecutionRecord.Kind kind) {
        if (properties.isMaintenanceMode()) {
            log.info("Maintenance mode on, skipping schedule '{}'", schedule.getName());
            return Optional.of(ExecutionRecord.Outcome.SKIPPED);
        }
        if (kind == ExecutionRecord.Kind.SCHEDULED && !schedule.isActive()) {
            log.info("Schedule '{}' is inactive, skipping scheduled run", schedule.getName());
            return Optional.of(ExecutionRecord.Outcome.SKIPPED);
        }
        if (isSkippedToday(schedule)) {
            log.info("Schedule '{}' is configured to skip today", schedule.getName());
            return Optional.of(ExecutionRecord.Outcome.SKIPPED);
        }
        if (!subscriptionChecker.hasActiveSubscription(schedule.getOwnerId())) {
            return Optional.of(ExecutionRecord.Outcome.BLOCKED);
        }
        return Optional.empty();
    }

    /**
     * Drops skip dates that are already in the past (in the schedule's zone) and
     * tells whether today is one of the remaining ones.
     */
    private boolean isSkippedToday(BlogSchedule schedule) {
        List<String> skippedDates = schedule.getSkippedDates();
        if (skippedDates == null || skippedDates.isEmpty()) {
            return false;
        }

        LocalDate today = LocalDate.now(clock.withZone(zoneOf(schedule)));
        List<String> upcoming = new ArrayList<>();
        for (String date : skippedDates) {
            try {
                if (!LocalDate.parse(date.trim()).isBefore(today)) {
                    upcoming.add(date.trim());
                }
            } catch (DateTimeException e) {
                log.warn("Dropping unparseable skip date '{}' from schedule '{}'", date, schedule.getName());
            }
        }

        if (upcoming.size() != skippedDates.size()) {
            schedule.setSkippedDates(upcoming);
            scheduleRepository.findById(schedule.getId()).ifPresent(stored -> {
                stored.setSkippedDates(upcoming);
                scheduleRepository.save(stored);
            });
        }
        return upcoming.contains(today.toString());
    }

    private Mono<Attempt> attempt(BlogSchedule schedule) {
        return blocking(() -> loadInputs(schedule))
                .flatMap(inputs -> generatePost(schedule, inputs)
                        .flatMap(generated -> deliver(schedule, inputs.getSite(), generated)))
                .onErrorResume(e -> Mono.just(Attempt.failed(e)));
    }

    private Inputs loadInputs(BlogSchedule schedule) {
        PublishingSite site = Optional.ofNullable(schedule.getSiteId())
                .flatMap(siteRepository::findById)
                .filter(PublishingSite::isActive)
                .orElseThrow(() -> new InvalidScheduleException(SITE_UNAVAILABLE));
        PromptTemplate template = Optional.ofNullable(schedule.getTemplateId())
                .flatMap(templateRepository::findById)
                .orElseThrow(() -> new InvalidScheduleException(TEMPLATE_MISSING));

        List<String> existingTitles = blogPostRepository.findTop20ByScheduleIdOrderByCreatedAtUtcDesc(schedule.getId())
                .stream()
                .map(BlogPost::getTitle)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        return new Inputs(site, template, existingTitles);
    }

    private Mono<Attempt> generatePost(BlogSchedule schedule, Inputs inputs) {
        String topic = pickTopic(schedule);
        PromptTemplate template = inputs.getTemplate();
        int wordCount = schedule.getWordCount() != null ? schedule.getWordCount()
                : Optional.ofNullable(template.getDefaultWordCount()).orElse(0);
        String tone = schedule.getTone() != null ? schedule.getTone() : template.getDefaultTone();
        SchedulerProperties.Timeouts timeouts = properties.getTimeouts();

        log.info("Generating post for schedule '{}' on topic '{}'", schedule.getName(), topic);

        return contentGenerator.generateTitle(topic, template, inputs.getExistingTitles())
                .timeout(timeouts.getTitle(), Mono.error(() ->
                        new GenerationException("Title generation timed out after " + seconds(timeouts.getTitle()))))
                .flatMap(titleText -> {
                    String title = contentFormatter.cleanTitle(titleText.getText());
                    return contentGenerator.generateContent(title, template, wordCount, tone)
                            .timeout(timeouts.getContent(), Mono.error(() ->
                                    new GenerationException("Content generation timed out after " + seconds(timeouts.getContent()))))
                            .flatMap(body -> findImage(schedule, topic, title)
                                    .flatMap(image -> blocking(() -> new Attempt(
                                            createPost(schedule, inputs, topic, title, titleText, body, image.orElse(null)),
                                            null,
                                            titleText.getPromptTokens() + body.getPromptTokens(),
                                            titleText.getCompletionTokens() + body.getCompletionTokens()))));
                });
    }

    private Mono<Optional<String>> findImage(BlogSchedule schedule, String topic, String title) {
        if (!schedule.isIncludeImages()) {
            return Mono.just(Optional.empty());
        }
        return imageGenerator.findImage(topic, title)
                .timeout(properties.getTimeouts().getImage())
                .map(Optional::of)
                .onErrorResume(e -> {
                    log.warn("Image lookup for '{}' failed, continuing without image: {}", title, e.getMessage());
                    return Mono.empty();
                })
                .defaultIfEmpty(Optional.empty());
    }

    private BlogPost createPost(BlogSchedule schedule, Inputs inputs, String topic, String title,
                                GeneratedText titleText, GeneratedText body, String imageUrl) {
        String content = contentFormatter.formatBody(body.getText());
        BlogPost.Status status = schedule.getPostStatus() == BlogSchedule.PostStatusPolicy.PENDING_REVIEW
                ? BlogPost.Status.PENDING_REVIEW
                : BlogPost.Status.DRAFT;

        BlogPost post = BlogPost.builder()
                .id(UUID.randomUUID().toString())
                .ownerId(schedule.getOwnerId())
                .siteId(inputs.getSite().getId())
                .scheduleId(schedule.getId())
                .templateId(inputs.getTemplate().getId())
                .topic(topic)
                .title(title)
                .content(content)
                .excerpt(contentFormatter.extractExcerpt(content))
                .featuredImageUrl(imageUrl)
                .status(status)
                .titlePromptUsed(titleText.getPromptUsed())
                .contentPromptUsed(body.getPromptUsed())
                .createdAtUtc(clock.instant())
                .build();
        return blogPostRepository.save(post);
    }

    private Mono<Attempt> deliver(BlogSchedule schedule, PublishingSite site, Attempt generated) {
        if (schedule.getPostStatus() != BlogSchedule.PostStatusPolicy.PUBLISH) {
            return Mono.just(generated);
        }

        BlogPost post = generated.getPost();
        Duration publishTimeout = properties.getTimeouts().getPublish();
        return postPublisher.publish(post, site)
                .timeout(publishTimeout, Mono.error(() ->
                        new PublishException("Publishing timeout after " + seconds(publishTimeout))))
                .switchIfEmpty(Mono.error(() -> new PublishException("Publishing failed: no response from site")))
                .flatMap(published -> blocking(() -> {
                    post.setStatus(BlogPost.Status.PUBLISHED);
                    post.setPlatformPostId(published.getPlatformPostId());
                    post.setPublishedUrl(published.getPublishedUrl());
                    post.setPublishedAtUtc(clock.instant());
                    return generated.published(blogPostRepository.save(post));
                }))
                .onErrorResume(e -> {
                    log.warn("Publishing post {} for schedule '{}' failed: {}", post.getId(), schedule.getName(), e.getMessage());
                    return Mono.just(generated.failedWith(e));
                });
    }

    private ExecutionResult finish(BlogSchedule schedule, ExecutionRecord record, Attempt attempt) {
        BlogPost post = attempt.getPost();
        record.setPostId(post != null ? post.getId() : null);
        record.setDurationMs(elapsedMillis(record));

        if (attempt.getError() == null) {
            recordUsage(record, attempt);
            record.setOutcome(ExecutionRecord.Outcome.SUCCEEDED);
            record.setSuccess(true);
            executionRecordRepository.save(record);
            failurePolicyGuard.onSuccess(schedule);

            log.info("Execution {} for schedule '{}' succeeded in {} ms, post {} ({})", record.getId(),
                    schedule.getName(), record.getDurationMs(), post.getId(), post.getStatus());
            ExecutionResult result = ExecutionResult.from(record);
            result.setTitle(post.getTitle());
            result.setPostStatus(post.getStatus());
            result.setPublishedUrl(post.getPublishedUrl());
            return result;
        }

        String errorMessage = describe(attempt.getError());
        ErrorCategory category = errorClassifier.classify(errorMessage);
        record.setOutcome(ExecutionRecord.Outcome.FAILED);
        record.setSuccess(false);
        record.setErrorMessage(errorMessage);
        record.setErrorCategory(category);
        executionRecordRepository.save(record);

        if (post != null) {
            notificationService.notifyPublishFailure(schedule, post, errorMessage);
        }
        boolean paused = failurePolicyGuard.onFailure(schedule, record, category, errorMessage);

        log.error("Execution {} for schedule '{}' failed ({}): {}", record.getId(), schedule.getName(),
                category.getKey(), errorMessage);
        ExecutionResult result = ExecutionResult.from(record);
        if (post != null) {
            result.setTitle(post.getTitle());
            result.setPostStatus(post.getStatus());
        }
        result.setSchedulePaused(paused);
        return result;
    }

    private ExecutionResult finishWithoutRun(BlogSchedule schedule, ExecutionRecord record,
                                             ExecutionRecord.Outcome outcome) {
        record.setOutcome(outcome);
        record.setSuccess(false);
        record.setDurationMs(elapsedMillis(record));
        record.setErrorMessage(outcome == ExecutionRecord.Outcome.BLOCKED
                ? "No active subscription" : "Run skipped");
        executionRecordRepository.save(record);

        boolean deactivated = false;
        if (outcome == ExecutionRecord.Outcome.BLOCKED) {
            failurePolicyGuard.onPreconditionBlocked(schedule);
            deactivated = true;
        }

        ExecutionResult result = ExecutionResult.from(record);
        result.setSchedulePaused(deactivated);
        return result;
    }

    /**
     * Records a failure that escaped the pipeline's own error handling, such as
     * a collaborator throwing inside a gate. The failure counter is left alone.
     */
    private ExecutionResult finishUnexpected(BlogSchedule schedule, ExecutionRecord record, Throwable error) {
        String errorMessage = describe(error);
        ErrorCategory category = errorClassifier.classify(errorMessage);
        record.setOutcome(ExecutionRecord.Outcome.FAILED);
        record.setSuccess(false);
        record.setDurationMs(elapsedMillis(record));
        record.setErrorMessage(errorMessage);
        record.setErrorCategory(category);
        executionRecordRepository.save(record);

        log.error("Execution {} for schedule '{}' failed unexpectedly ({}): {}", record.getId(),
                schedule.getName(), category.getKey(), errorMessage, error);
        return ExecutionResult.from(record);
    }

    private void recordUsage(ExecutionRecord record, Attempt attempt) {
        SchedulerProperties.Pricing pricing = properties.getPricing();
        double cost = attempt.getPromptTokens() * pricing.getInputPerMillionTokens() / 1_000_000
                + attempt.getCompletionTokens() * pricing.getOutputPerMillionTokens() / 1_000_000;
        record.setPromptTokens(attempt.getPromptTokens());
        record.setCompletionTokens(attempt.getCompletionTokens());
        record.setTotalTokens(attempt.getPromptTokens() + attempt.getCompletionTokens());
        record.setEstimatedCostUsd(Math.round(cost * 1_000_000d) / 1_000_000d);
    }

    String pickTopic(BlogSchedule schedule) {
        List<String> topics = Optional.ofNullable(schedule.getTopics()).orElse(List.of()).stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(topic -> !topic.isEmpty())
                .collect(Collectors.toList());
        if (topics.isEmpty()) {
            return properties.getFallbackTopic();
        }
        return topics.get(ThreadLocalRandom.current().nextInt(topics.size()));
    }

    private ZoneId zoneOf(BlogSchedule schedule) {
        try {
            return NextRunCalculator.zoneOf(schedule);
        } catch (InvalidScheduleException e) {
            log.warn("{} on schedule '{}', using UTC", e.getMessage(), schedule.getName());
            return ZoneId.of("UTC");
        }
    }

    private void trackStart(BlogSchedule schedule) {
        int running = inFlight.merge(schedule.getId(), 1, Integer::sum);
        if (running > 1) {
            log.warn("Schedule '{}' (id={}) already has a run in progress; {} runs now overlap",
                    schedule.getName(), schedule.getId(), running);
        }
    }

    private void trackEnd(String scheduleId) {
        inFlight.computeIfPresent(scheduleId, (id, running) -> running > 1 ? running - 1 : null);
    }

    private long elapsedMillis(ExecutionRecord record) {
        return Math.max(0L, clock.millis() - record.getStartedAtUtc().toEpochMilli());
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static String seconds(Duration duration) {
        return duration.toSeconds() + "s";
    }

    private static <T> Mono<T> blocking(Callable<T> callable) {
        return Mono.fromCallable(callable).subscribeOn(Schedulers.boundedElastic());
    }
}
