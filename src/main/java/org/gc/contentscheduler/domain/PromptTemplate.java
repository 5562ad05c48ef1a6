package org.gc.contentscheduler.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.elasticsearch.annotations.Document;
import org.springframework.data.elasticsearch.annotations.Field;
import org.springframework.data.elasticsearch.annotations.FieldType;

/**
 * Prompt settings the generation collaborator is driven by. Edited elsewhere,
 * read-only for the engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(indexName = "prompt_templates")
public class PromptTemplate {

    @Id
    private String id;

    @Field(type = FieldType.Keyword)
    private String ownerId;

    @Field(type = FieldType.Text)
    private String name;

    @Field(type = FieldType.Text, index = false)
    private String systemPrompt;

    @Field(type = FieldType.Text, index = false)
    private String titleInstructions;

    @Field(type = FieldType.Text, index = false)
    private String contentInstructions;

    @Field(type = FieldType.Integer)
    private Integer defaultWordCount;

    @Field(type = FieldType.Keyword)
    private String defaultTone;
}
