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
@Document(indexName = "blog_posts")
public class BlogPost {

    @Id
    private String id;

    @Field(type = FieldType.Keyword)
    private String ownerId;

    @Field(type = FieldType.Keyword)
    private String siteId;

    @Field(type = FieldType.Keyword)
    private String scheduleId;

    @Field(type = FieldType.Keyword)
    private String templateId;

    @Field(type = FieldType.Text)
    private String topic;

    @Field(type = FieldType.Text)
    private String title;

    // markdown body
    @Field(type = FieldType.Text)
    private String content;

    @Field(type = FieldType.Text)
    private String excerpt;

    @Field(type = FieldType.Keyword)
    private String featuredImageUrl;

    @Field(type = FieldType.Keyword)
    private Status status;

    @Field(type = FieldType.Keyword)
    private String platformPostId;

    @Field(type = FieldType.Keyword)
    private String publishedUrl;

    @Field(type = FieldType.Date)
    private Instant publishedAtUtc;

    @Field(type = FieldType.Text, index = false)
    private String titlePromptUsed;

    @Field(type = FieldType.Text, index = false)
    private String contentPromptUsed;

    @Field(type = FieldType.Date)
    private Instant createdAtUtc;

    public enum Status {
        DRAFT,
        PENDING_REVIEW,
        PUBLISHED
    }
}
