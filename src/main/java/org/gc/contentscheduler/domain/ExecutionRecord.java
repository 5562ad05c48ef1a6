package org.gc.contentscheduler.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.elasticsearch.annotations.Document;
import org.springframework.data.elasticsearch.annotations.Field;
import org.springframework.data.elasticsearch.annotations.FieldType;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit row for one pipeline attempt. Written as {@link Outcome#RUNNING} when the
 * attempt starts and updated in place once the outcome is known.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(indexName = "execution_records")
public class ExecutionRecord {

    @Id
    private String id;

    @Field(type = FieldType.Keyword)
    private String scheduleId;

    @Field(type = FieldType.Keyword)
    private String ownerId;

    @Field(type = FieldType.Keyword)
    private Kind kind;

    @Field(type = FieldType.Keyword)
    private Outcome outcome;

    @Field(type = FieldType.Date)
    private Instant startedAtUtc;

    @Field(type = FieldType.Long)
    private Long durationMs;

    @Field(type = FieldType.Boolean)
    private boolean success;

    @Field(type = FieldType.Text)
    private String errorMessage;

    @Field(type = FieldType.Keyword)
    private ErrorCategory errorCategory;

    @Field(type = FieldType.Keyword)
    private String postId;

    @Field(type = FieldType.Integer)
    private Integer promptTokens;

    @Field(type = FieldType.Integer)
    private Integer completionTokens;

    @Field(type = FieldType.Integer)
    private Integer totalTokens;

    @Field(type = FieldType.Double)
    private Double estimatedCostUsd;

    public enum Kind {
        SCHEDULED,
        MANUAL
    }

    public enum Outcome {
        RUNNING,
        SUCCEEDED,
        FAILED,
        SKIPPED,
        BLOCKED
    }

    public static ExecutionRecord start(BlogSchedule schedule, Kind kind, Instant startedAt) {
        return ExecutionRecord.builder()
                .id(UUID.randomUUID().toString())
                .scheduleId(schedule.getId())
                .ownerId(schedule.getOwnerId())
                .kind(kind)
                .outcome(Outcome.RUNNING)
                .startedAtUtc(startedAt)
                .success(false)
                .build();
    }
}
