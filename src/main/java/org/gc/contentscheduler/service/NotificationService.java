package org.gc.contentscheduler.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.contentscheduler.domain.BlogPost;
import org.gc.contentscheduler.domain.BlogSchedule;
import org.gc.contentscheduler.domain.ErrorCategory;
import org.gc.contentscheduler.domain.ExecutionRecord;
import org.gc.contentscheduler.domain.Notification;
import org.gc.contentscheduler.repository.NotificationRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Writes user-facing notifications for execution events. Writes are
 * fire-and-forget: a failed save is logged and never reaches the pipeline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    static final int ERROR_EXCERPT_LENGTH = 200;
    private static final int TITLE_EXCERPT_LENGTH = 100;
    private static final String EDIT_SCHEDULE_LABEL = "Edit Schedule";

    private final NotificationRepository notificationRepository;
    private final Clock clock;

    public void notifyExecutionFailure(BlogSchedule schedule, ExecutionRecord execution,
                                       ErrorCategory category, String errorMessage) {
        StringBuilder message = new StringBuilder(category.getUserGuidance());
        if (errorMessage != null && !errorMessage.isBlank()) {
            message.append("\n\nError: ").append(truncate(errorMessage, ERROR_EXCERPT_LENGTH));
        }

        Notification notification = base(schedule)
                .category(category.getKey())
                .title(category.getUserTitle() + " - " + schedule.getName())
                .message(message.toString())
                .actionUrl(editLink(schedule))
                .actionLabel(EDIT_SCHEDULE_LABEL)
                .executionId(execution != null ? execution.getId() : null)
                .build();

        save(notification);
        log.info("Created failure notification for schedule '{}' (category={})", schedule.getName(), category.getKey());
    }

    public void notifySchedulePaused(BlogSchedule schedule, int consecutiveFailures) {
        Notification notification = base(schedule)
                .category(ErrorCategory.CONFIG_ERROR.getKey())
                .title("Schedule Paused - " + schedule.getName())
                .message("Schedule '" + schedule.getName() + "' was automatically paused after "
                        + consecutiveFailures + " consecutive failures. Review the error log and fix the issue, "
                        + "then re-activate the schedule.")
                .actionUrl(editLink(schedule))
                .actionLabel(EDIT_SCHEDULE_LABEL)
                .build();

        save(notification);
        log.warn("Created pause notification for schedule '{}'", schedule.getName());
    }

    public void notifyPublishFailure(BlogSchedule schedule, BlogPost post, String errorMessage) {
        String title = post.getTitle() != null ? post.getTitle() : "Untitled";

        Notification notification = base(schedule)
                .category(ErrorCategory.PUBLISH_AUTH.getKey())
                .title("Publishing Failed - " + truncate(title, TITLE_EXCERPT_LENGTH))
                .message("Publishing failed for '" + title + "'. The post was saved as a draft and you can "
                        + "publish it manually.\n\nError: " + truncate(errorMessage, ERROR_EXCERPT_LENGTH))
                .actionUrl("/posts/" + post.getId())
                .actionLabel("View Post")
                .build();

        save(notification);
        log.info("Created publish failure notification for post '{}'", title);
    }

    public void notifySubscriptionExpired(BlogSchedule schedule) {
        Notification notification = base(schedule)
                .category(Notification.BILLING_CATEGORY)
                .title("Subscription Expired - " + schedule.getName())
                .message("Schedule '" + schedule.getName() + "' was paused because your account has no active "
                        + "subscription. Choose a plan to resume automatic posting.")
                .actionUrl("/billing")
                .actionLabel("View Plans")
                .build();

        save(notification);
        log.warn("Created subscription notification for schedule '{}'", schedule.getName());
    }

    static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() > maxLength ? text.substring(0, maxLength) + "..." : text;
    }

    private Notification.NotificationBuilder base(BlogSchedule schedule) {
        return Notification.builder()
                .id(UUID.randomUUID().toString())
                .ownerId(schedule.getOwnerId())
                .scheduleId(schedule.getId())
                .read(false)
                .createdAtUtc(clock.instant());
    }

    private static String editLink(BlogSchedule schedule) {
        return "/schedules/" + schedule.getId() + "/edit";
    }

    private void save(Notification notification) {
        try {
            notificationRepository.save(notification);
        } catch (RuntimeException e) {
            log.error("Failed to store notification '{}' for owner {}: {}",
                    notification.getTitle(), notification.getOwnerId(), e.getMessage(), e);
        }
    }
}
