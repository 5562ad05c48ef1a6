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
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A recurring content-generation job owned by a single user.
 * <p>
 * The API layer owns the definition fields; the engine only mutates
 * {@code lastRun}, {@code nextRun}, {@code retryCount}, {@code active} and
 * {@code skippedDates} (pruning).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(indexName = "blog_schedules")
public class BlogSchedule {

    @Id
    private String id;

    @Field(type = FieldType.Keyword)
    private String ownerId;

    @Field(type = FieldType.Text)
    private String name;

    @Field(type = FieldType.Keyword)
    private String siteId;

    @Field(type = FieldType.Keyword)
    private String templateId;

    @Field(type = FieldType.Keyword)
    private Frequency frequency;

    // HH:mm, interpreted in the schedule's timezone
    @Field(type = FieldType.Keyword)
    private String timeOfDay;

    @Field(type = FieldType.Keyword)
    private String timezone;

    // 0 = Monday ... 6 = Sunday
    @Field(type = FieldType.Integer)
    private Integer dayOfWeek;

    @Field(type = FieldType.Integer)
    private Integer dayOfMonth;

    @Field(type = FieldType.Keyword)
    private String customCron;

    @Builder.Default
    @Field(type = FieldType.Text)
    private List<String> topics = new ArrayList<>();

    // yyyy-MM-dd in the schedule's timezone
    @Builder.Default
    @Field(type = FieldType.Keyword)
    private List<String> skippedDates = new ArrayList<>();

    @Builder.Default
    @Field(type = FieldType.Keyword)
    private PostStatusPolicy postStatus = PostStatusPolicy.DRAFT;

    @Field(type = FieldType.Integer)
    private Integer wordCount;

    @Field(type = FieldType.Keyword)
    private String tone;

    @Field(type = FieldType.Boolean)
    private boolean includeImages;

    @Field(type = FieldType.Boolean)
    private boolean active;

    @Field(type = FieldType.Date)
    private Instant lastRun;

    @Field(type = FieldType.Date)
    private Instant nextRun;

    @Field(type = FieldType.Integer)
    private int retryCount;

    @Field(type = FieldType.Date)
    private Instant createdAtUtc;

    @Field(type = FieldType.Date)
    private Instant updatedAtUtc;

    public enum Frequency {
        DAILY,
        WEEKLY,
        MONTHLY,
        CUSTOM_CRON
    }

    public enum PostStatusPolicy {
        DRAFT,
        PENDING_REVIEW,
        PUBLISH
    }

    public static BlogSchedule create(String ownerId, String name, Frequency frequency, String timeOfDay) {
        Instant now = Instant.now();

        return BlogSchedule.builder()
                .id(UUID.randomUUID().toString())
                .ownerId(ownerId)
                .name(name)
                .frequency(frequency)
                .timeOfDay(timeOfDay)
                .timezone("UTC")
                .createdAtUtc(now)
                .updatedAtUtc(now)
                .build();
    }
}
