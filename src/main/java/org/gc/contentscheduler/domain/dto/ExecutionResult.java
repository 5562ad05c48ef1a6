package org.gc.contentscheduler.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.gc.contentscheduler.domain.BlogPost;
import org.gc.contentscheduler.domain.ErrorCategory;
import org.gc.contentscheduler.domain.ExecutionRecord;

/**
 * What a single pipeline invocation produced. {@code schedulePaused} tells the
 * caller that no further timer may be registered for the schedule.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionResult {

    private String scheduleId;
    private String executionId;
    private ExecutionRecord.Kind kind;
    private ExecutionRecord.Outcome outcome;
    private boolean success;
    private String postId;
    private String title;
    private BlogPost.Status postStatus;
    private String publishedUrl;
    private String errorMessage;
    private ErrorCategory errorCategory;
    private long durationMs;
    private boolean schedulePaused;

    public static ExecutionResult from(ExecutionRecord record) {
        return ExecutionResult.builder()
                .scheduleId(record.getScheduleId())
                .executionId(record.getId())
                .kind(record.getKind())
                .outcome(record.getOutcome())
                .success(record.isSuccess())
                .postId(record.getPostId())
                .errorMessage(record.getErrorMessage())
                .errorCategory(record.getErrorCategory())
                .durationMs(record.getDurationMs() != null ? record.getDurationMs() : 0L)
                .build();
    }
}
