package org.gc.contentscheduler.service;

import org.gc.contentscheduler.domain.BlogPost;
import org.gc.contentscheduler.domain.BlogSchedule;
import org.gc.contentscheduler.domain.ErrorCategory;
import org.gc.contentscheduler.domain.ExecutionRecord;
import org.gc.contentscheduler.domain.PromptTemplate;
import org.gc.contentscheduler.domain.PublishingSite;
import org.gc.contentscheduler.exception.GenerationException;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ScheduleExecutionServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-10T09:00:00Z");

    @Mock
    private BlogScheduleRepository scheduleRepository;
    @Mock
    private ExecutionRecordRepository executionRecordRepository;
    @Mock
    private BlogPostRepository blogPostRepository;
    @Mock
    private PublishingSiteRepository siteRepository;
    @Mock
    private PromptTemplateRepository templateRepository;
    @Mock
    private ContentGenerator contentGenerator;
    @Mock
    private ImageGenerator imageGenerator;
    @Mock
    private PostPublisher postPublisher;
    @Mock
    private SubscriptionChecker subscriptionChecker;
    @Mock
    private FailurePolicyGuard failurePolicyGuard;
    @Mock
    private NotificationService notificationService;

    private SchedulerProperties properties;
    private ScheduleExecutionService executionService;
    private BlogSchedule schedule;
    private PublishingSite site;

    @BeforeEach
    void setUp() {
        properties = new SchedulerProperties();
        executionService = new ScheduleExecutionService(scheduleRepository, executionRecordRepository,
                blogPostRepository, siteRepository, templateRepository, contentGenerator, imageGenerator,
                postPublisher, subscriptionChecker, new ContentFormatter(), new ErrorClassifier(),
                failurePolicyGuard, notificationService, properties, Clock.fixed(NOW, ZoneOffset.UTC));

        schedule = BlogSchedule.create("owner-1", "Tech Weekly", BlogSchedule.Frequency.DAILY, "09:00");
        schedule.setActive(true);
        schedule.setSiteId("site-1");
        schedule.setTemplateId("template-1");
        schedule.setTopics(new ArrayList<>(List.of("observability")));

        site = PublishingSite.builder().id("site-1").ownerId("owner-1").baseUrl("https://blog.example.com")
                .username("admin").appPassword("secret").active(true).build();
        PromptTemplate template = PromptTemplate.builder().id("template-1").ownerId("owner-1")
                .systemPrompt("You write for engineers.").defaultWordCount(800).build();

        when(scheduleRepository.findById(schedule.getId())).thenReturn(Optional.of(schedule));
        when(executionRecordRepository.save(any(ExecutionRecord.class))).thenAnswer(inv -> inv.getArgument(0));
        when(blogPostRepository.save(any(BlogPost.class))).thenAnswer(inv -> inv.getArgument(0));
        when(blogPostRepository.findTop20ByScheduleIdOrderByCreatedAtUtcDesc(schedule.getId())).thenReturn(List.of());
        when(siteRepository.findById("site-1")).thenReturn(Optional.of(site));
        when(templateRepository.findById("template-1")).thenReturn(Optional.of(template));
        when(subscriptionChecker.hasActiveSubscription("owner-1")).thenReturn(true);
        when(contentGenerator.generateTitle(anyString(), any(), anyList()))
                .thenReturn(Mono.just(new GeneratedText("\"Tracing Without Tears.\"", "title prompt")));
        when(contentGenerator.generateContent(anyString(), any(), anyInt(), any()))
                .thenReturn(Mono.just(new GeneratedText("# Tracing Without Tears\n\nSpans tell the story.", "content prompt")));
        when(imageGenerator.findImage(anyString(), anyString())).thenReturn(Mono.empty());
    }

    private ExecutionRecord finalRecord() {
        ArgumentCaptor<ExecutionRecord> captor = ArgumentCaptor.forClass(ExecutionRecord.class);
        // one insert, one final update
        verify(executionRecordRepository, times(2)).save(captor.capture());
        return captor.getAllValues().get(1);
    }

    @Nested
    @DisplayName("successful runs")
    class SuccessTests {

        @Test
        @DisplayName("should create a draft post and record success")
        void draftPolicy_shouldSaveDraftWithoutPublishing() {
            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .assertNext(result -> {
                        assertThat(result.isSuccess()).isTrue();
                        assertThat(result.getOutcome()).isEqualTo(ExecutionRecord.Outcome.SUCCEEDED);
                        assertThat(result.getTitle()).isEqualTo("Tracing Without Tears");
                        assertThat(result.getPostStatus()).isEqualTo(BlogPost.Status.DRAFT);
                        assertThat(result.isSchedulePaused()).isFalse();
                    })
                    .verifyComplete();

            ArgumentCaptor<BlogPost> post = ArgumentCaptor.forClass(BlogPost.class);
            verify(blogPostRepository).save(post.capture());
            assertThat(post.getValue().getContent()).isEqualTo("Spans tell the story.");
            assertThat(post.getValue().getExcerpt()).isEqualTo("Spans tell the story.");
            assertThat(post.getValue().getTopic()).isEqualTo("observability");
            assertThat(post.getValue().getScheduleId()).isEqualTo(schedule.getId());

            ExecutionRecord record = finalRecord();
            assertThat(record.getOutcome()).isEqualTo(ExecutionRecord.Outcome.SUCCEEDED);
            assertThat(record.isSuccess()).isTrue();
            assertThat(record.getPostId()).isEqualTo(post.getValue().getId());
            verify(failurePolicyGuard).onSuccess(schedule);
            verifyNoInteractions(postPublisher);
        }

        @Test
        @DisplayName("should publish and mark the post published under the publish policy")
        void publishPolicy_shouldPublish() {
            schedule.setPostStatus(BlogSchedule.PostStatusPolicy.PUBLISH);
            when(postPublisher.publish(any(BlogPost.class), eq(site)))
                    .thenReturn(Mono.just(new PostPublisher.PublishResult("42", "https://blog.example.com/tracing")));

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .assertNext(result -> {
                        assertThat(result.isSuccess()).isTrue();
                        assertThat(result.getPostStatus()).isEqualTo(BlogPost.Status.PUBLISHED);
                        assertThat(result.getPublishedUrl()).isEqualTo("https://blog.example.com/tracing");
                    })
                    .verifyComplete();

            ArgumentCaptor<BlogPost> post = ArgumentCaptor.forClass(BlogPost.class);
            verify(blogPostRepository, times(2)).save(post.capture());
            assertThat(post.getValue().getPlatformPostId()).isEqualTo("42");
            assertThat(post.getValue().getPublishedAtUtc()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("should store token usage and a cost estimate on the record")
        void success_shouldRecordTokenUsage() {
            when(contentGenerator.generateTitle(anyString(), any(), anyList()))
                    .thenReturn(Mono.just(new GeneratedText("Tracing Without Tears", "title prompt", 100, 10)));
            when(contentGenerator.generateContent(anyString(), any(), anyInt(), any()))
                    .thenReturn(Mono.just(new GeneratedText("Spans tell the story.", "content prompt", 200, 1000)));

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .expectNextCount(1)
                    .verifyComplete();

            ExecutionRecord record = finalRecord();
            assertThat(record.getPromptTokens()).isEqualTo(300);
            assertThat(record.getCompletionTokens()).isEqualTo(1010);
            assertThat(record.getTotalTokens()).isEqualTo(1310);
            // 300 * 2.50 / 1M + 1010 * 10.00 / 1M
            assertThat(record.getEstimatedCostUsd()).isEqualTo(0.01085);
        }

        @Test
        @DisplayName("should hold the post for review without publishing")
        void pendingReviewPolicy_shouldNotPublish() {
            schedule.setPostStatus(BlogSchedule.PostStatusPolicy.PENDING_REVIEW);

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .assertNext(result -> assertThat(result.getPostStatus()).isEqualTo(BlogPost.Status.PENDING_REVIEW))
                    .verifyComplete();

            verifyNoInteractions(postPublisher);
        }

        @Test
        @DisplayName("should pass recent titles for de-duplication")
        void recentTitles_shouldReachTitleGenerator() {
            BlogPost previous = BlogPost.builder().id("p-1").title("Logs Are Not Enough").build();
            when(blogPostRepository.findTop20ByScheduleIdOrderByCreatedAtUtcDesc(schedule.getId()))
                    .thenReturn(List.of(previous));

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .expectNextCount(1)
                    .verifyComplete();

            verify(contentGenerator).generateTitle(eq("observability"), any(), eq(List.of("Logs Are Not Enough")));
        }

        @Test
        @DisplayName("should fall back to the default topic when none are configured")
        void noTopics_shouldUseFallbackTopic() {
            schedule.setTopics(new ArrayList<>());

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .expectNextCount(1)
                    .verifyComplete();

            verify(contentGenerator).generateTitle(eq("content creation"), any(), anyList());
        }

        @Test
        @DisplayName("should continue without an image when the lookup fails")
        void imageFailure_shouldNotFailTheRun() {
            schedule.setIncludeImages(true);
            when(imageGenerator.findImage(anyString(), anyString()))
                    .thenReturn(Mono.error(new IllegalStateException("Unsplash returned 500")));

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .assertNext(result -> assertThat(result.isSuccess()).isTrue())
                    .verifyComplete();

            ArgumentCaptor<BlogPost> post = ArgumentCaptor.forClass(BlogPost.class);
            verify(blogPostRepository).save(post.capture());
            assertThat(post.getValue().getFeaturedImageUrl()).isNull();
        }

        @Test
        @DisplayName("should attach the image when one is found")
        void imageFound_shouldBeStoredOnPost() {
            schedule.setIncludeImages(true);
            when(imageGenerator.findImage(anyString(), anyString())).thenReturn(Mono.just("https://images.example.com/1.jpg"));

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .expectNextCount(1)
                    .verifyComplete();

            ArgumentCaptor<BlogPost> post = ArgumentCaptor.forClass(BlogPost.class);
            verify(blogPostRepository).save(post.capture());
            assertThat(post.getValue().getFeaturedImageUrl()).isEqualTo("https://images.example.com/1.jpg");
        }
    }

    @Nested
    @DisplayName("failures")
    class FailureTests {

        @Test
        @DisplayName("a title timeout should produce exactly one failed record and no post")
        void titleTimeout_shouldRecordApiTimeout() {
            properties.getTimeouts().setTitle(Duration.ofSeconds(1));
            when(contentGenerator.generateTitle(anyString(), any(), anyList())).thenReturn(Mono.never());

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .assertNext(result -> {
                        assertThat(result.isSuccess()).isFalse();
                        assertThat(result.getErrorCategory()).isEqualTo(ErrorCategory.API_TIMEOUT);
                        assertThat(result.getErrorMessage()).isEqualTo("Title generation timed out after 1s");
                    })
                    .verifyComplete();

            ExecutionRecord record = finalRecord();
            assertThat(record.getOutcome()).isEqualTo(ExecutionRecord.Outcome.FAILED);
            assertThat(record.getPostId()).isNull();
            verify(blogPostRepository, never()).save(any());
            verify(failurePolicyGuard).onFailure(eq(schedule), eq(record), eq(ErrorCategory.API_TIMEOUT),
                    eq("Title generation timed out after 1s"));
        }

        @Test
        @DisplayName("a generation error should be recorded with its raw text")
        void generationError_shouldRecordContentError() {
            when(contentGenerator.generateContent(anyString(), any(), anyInt(), any()))
                    .thenReturn(Mono.error(new GenerationException("Content generation failed: model returned no text")));

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .assertNext(result -> {
                        assertThat(result.getErrorCategory()).isEqualTo(ErrorCategory.CONTENT_ERROR);
                        assertThat(result.getErrorMessage()).isEqualTo("Content generation failed: model returned no text");
                    })
                    .verifyComplete();

            verify(blogPostRepository, never()).save(any());
            verify(notificationService, never()).notifyPublishFailure(any(), any(), any());
        }

        @Test
        @DisplayName("a publish failure should keep the draft and reference it from the record")
        void publishFailure_shouldKeepDraft() {
            schedule.setPostStatus(BlogSchedule.PostStatusPolicy.PUBLISH);
            when(postPublisher.publish(any(BlogPost.class), eq(site)))
                    .thenReturn(Mono.error(new PublishException("Publishing failed: HTTP 401 from https://blog.example.com")));

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .assertNext(result -> {
                        assertThat(result.isSuccess()).isFalse();
                        assertThat(result.getPostId()).isNotNull();
                        assertThat(result.getPostStatus()).isEqualTo(BlogPost.Status.DRAFT);
                        assertThat(result.getErrorCategory()).isEqualTo(ErrorCategory.PUBLISH_AUTH);
                    })
                    .verifyComplete();

            ExecutionRecord record = finalRecord();
            assertThat(record.getPostId()).isNotNull();
            verify(blogPostRepository, times(1)).save(any());
            verify(notificationService).notifyPublishFailure(eq(schedule), any(BlogPost.class),
                    eq("Publishing failed: HTTP 401 from https://blog.example.com"));
            verify(failurePolicyGuard).onFailure(eq(schedule), any(), eq(ErrorCategory.PUBLISH_AUTH), anyString());
        }

        @Test
        @DisplayName("a hanging publisher should surface as a publishing timeout")
        void publishTimeout_shouldRecordPublishTimeout() {
            schedule.setPostStatus(BlogSchedule.PostStatusPolicy.PUBLISH);
            properties.getTimeouts().setPublish(Duration.ofSeconds(1));
            when(postPublisher.publish(any(BlogPost.class), eq(site))).thenReturn(Mono.never());

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .assertNext(result -> {
                        assertThat(result.getErrorMessage()).isEqualTo("Publishing timeout after 1s");
                        assertThat(result.getErrorCategory()).isEqualTo(ErrorCategory.PUBLISH_TIMEOUT);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("a missing template should fail before any generation")
        void missingTemplate_shouldFailWithConfigError() {
            when(templateRepository.findById("template-1")).thenReturn(Optional.empty());

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .assertNext(result -> {
                        assertThat(result.getErrorMessage()).isEqualTo("Prompt template not found");
                        assertThat(result.getErrorCategory()).isEqualTo(ErrorCategory.CONFIG_ERROR);
                    })
                    .verifyComplete();

            verifyNoInteractions(contentGenerator);
            assertThat(finalRecord().getOutcome()).isEqualTo(ExecutionRecord.Outcome.FAILED);
        }

        @Test
        @DisplayName("an inactive site should fail before any generation")
        void inactiveSite_shouldFail() {
            site.setActive(false);

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .assertNext(result -> {
                        assertThat(result.getErrorMessage()).isEqualTo("Site is not active or missing");
                        assertThat(result.getErrorCategory()).isEqualTo(ErrorCategory.PUBLISH_CONNECTION);
                    })
                    .verifyComplete();

            verifyNoInteractions(contentGenerator);
        }

        @Test
        @DisplayName("the guard's pause decision should reach the caller")
        void pausingFailure_shouldFlagResult() {
            when(contentGenerator.generateTitle(anyString(), any(), anyList()))
                    .thenReturn(Mono.error(new GenerationException("Status code 429, Too Many Requests")));
            when(failurePolicyGuard.onFailure(any(), any(), any(), any())).thenReturn(true);

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .assertNext(result -> {
                        assertThat(result.getErrorCategory()).isEqualTo(ErrorCategory.API_RATE_LIMIT);
                        assertThat(result.isSchedulePaused()).isTrue();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("a throwing subscription check should still close the record as failed")
        void subscriptionCheckError_shouldRecordFailure() {
            when(subscriptionChecker.hasActiveSubscription("owner-1"))
                    .thenThrow(new IllegalStateException("Subscription lookup failed: connection reset"));

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .assertNext(result -> {
                        assertThat(result.getOutcome()).isEqualTo(ExecutionRecord.Outcome.FAILED);
                        assertThat(result.getErrorMessage()).isEqualTo("Subscription lookup failed: connection reset");
                        assertThat(result.getErrorCategory()).isEqualTo(ErrorCategory.UNKNOWN);
                        assertThat(result.isSchedulePaused()).isFalse();
                    })
                    .verifyComplete();

            ExecutionRecord record = finalRecord();
            assertThat(record.getOutcome()).isEqualTo(ExecutionRecord.Outcome.FAILED);
            assertThat(record.getDurationMs()).isNotNull();
            verifyNoInteractions(contentGenerator, failurePolicyGuard);
        }

        @Test
        @DisplayName("a failing skip-date save should still close the record as failed")
        void skipDatePruneError_shouldRecordFailure() {
            schedule.setSkippedDates(new ArrayList<>(List.of("2024-01-09")));
            when(scheduleRepository.save(any(BlogSchedule.class)))
                    .thenThrow(new IllegalStateException("index blog_schedules is read-only"));

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .assertNext(result -> assertThat(result.getOutcome()).isEqualTo(ExecutionRecord.Outcome.FAILED))
                    .verifyComplete();

            assertThat(finalRecord().getErrorMessage()).isEqualTo("index blog_schedules is read-only");
            verifyNoInteractions(contentGenerator);
        }

        @Test
        @DisplayName("a guard error after the final update should not write the record again")
        void guardErrorAfterRecord_shouldNotRewriteRecord() {
            doThrow(new IllegalStateException("index blog_schedules is read-only"))
                    .when(failurePolicyGuard).onSuccess(any());

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .expectErrorMessage("index blog_schedules is read-only")
                    .verify();

            assertThat(finalRecord().getOutcome()).isEqualTo(ExecutionRecord.Outcome.SUCCEEDED);
        }

        @Test
        @DisplayName("an unknown schedule should error without writing a record")
        void unknownSchedule_shouldError() {
            when(scheduleRepository.findById("missing")).thenReturn(Optional.empty());

            StepVerifier.create(executionService.execute("missing", ExecutionRecord.Kind.MANUAL))
                    .expectError(ScheduleNotFoundException.class)
                    .verify();

            verifyNoInteractions(executionRecordRepository);
        }
    }

    @Nested
    @DisplayName("gates")
    class GateTests {

        @Test
        @DisplayName("maintenance mode should skip without touching the failure counter")
        void maintenanceMode_shouldSkip() {
            properties.setMaintenanceMode(true);

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .assertNext(result -> assertThat(result.getOutcome()).isEqualTo(ExecutionRecord.Outcome.SKIPPED))
                    .verifyComplete();

            assertThat(finalRecord().getOutcome()).isEqualTo(ExecutionRecord.Outcome.SKIPPED);
            verifyNoInteractions(contentGenerator, failurePolicyGuard);
        }

        @Test
        @DisplayName("a scheduled tick on an inactive schedule should skip")
        void inactiveScheduled_shouldSkip() {
            schedule.setActive(false);

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .assertNext(result -> assertThat(result.getOutcome()).isEqualTo(ExecutionRecord.Outcome.SKIPPED))
                    .verifyComplete();

            verifyNoInteractions(contentGenerator);
        }

        @Test
        @DisplayName("a manual run should work on an inactive schedule")
        void inactiveManual_shouldRun() {
            schedule.setActive(false);

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.MANUAL))
                    .assertNext(result -> {
                        assertThat(result.isSuccess()).isTrue();
                        assertThat(result.getKind()).isEqualTo(ExecutionRecord.Kind.MANUAL);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("today's skip date should skip and past skip dates should be pruned")
        void skippedDate_shouldSkipAndPrune() {
            schedule.setSkippedDates(new ArrayList<>(List.of("2024-01-09", "2024-01-10", "2024-02-01")));

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .assertNext(result -> assertThat(result.getOutcome()).isEqualTo(ExecutionRecord.Outcome.SKIPPED))
                    .verifyComplete();

            assertThat(schedule.getSkippedDates()).containsExactly("2024-01-10", "2024-02-01");
            verify(scheduleRepository).save(schedule);
            verifyNoInteractions(contentGenerator);
        }

        @Test
        @DisplayName("a future skip date should not block today's run")
        void futureSkipDate_shouldRun() {
            schedule.setSkippedDates(new ArrayList<>(List.of("2024-02-01")));

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .assertNext(result -> assertThat(result.isSuccess()).isTrue())
                    .verifyComplete();

            verify(scheduleRepository, never()).save(any());
        }

        @Test
        @DisplayName("an expired subscription should block and deactivate")
        void noSubscription_shouldBlock() {
            when(subscriptionChecker.hasActiveSubscription("owner-1")).thenReturn(false);

            StepVerifier.create(executionService.execute(schedule.getId(), ExecutionRecord.Kind.SCHEDULED))
                    .assertNext(result -> {
                        assertThat(result.getOutcome()).isEqualTo(ExecutionRecord.Outcome.BLOCKED);
                        assertThat(result.isSchedulePaused()).isTrue();
                    })
                    .verifyComplete();

            verify(failurePolicyGuard).onPreconditionBlocked(schedule);
            verify(failurePolicyGuard, never()).onFailure(any(), any(), any(), any());
            verifyNoInteractions(contentGenerator);
        }
    }
}
