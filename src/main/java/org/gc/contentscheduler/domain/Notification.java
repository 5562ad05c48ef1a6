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

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(indexName = "notifications")
public class Notification {

    public static final String BILLING_CATEGORY = "billing";

    @Id
    private String id;

    @Field(type = FieldType.Keyword)
    private String ownerId;

    // an ErrorCategory key, or "billing"
    @Field(type = FieldType.Keyword)
    private String category;

    @Field(type = FieldType.Text)
    private String title;

    @Field(type = FieldType.Text)
    private String message;

    @Field(type = FieldType.Keyword)
    private String actionUrl;

    @Field(type = FieldType.Keyword)
    private String actionLabel;

    @Field(type = FieldType.Boolean)
    private boolean read;

    @Field(type = FieldType.Keyword)
    private String scheduleId;

    @Field(type = FieldType.Keyword)
    private String executionId;

    @Field(type = FieldType.Date)
    private Instant createdAtUtc;
}
