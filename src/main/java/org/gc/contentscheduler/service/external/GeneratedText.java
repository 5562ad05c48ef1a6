package org.gc.contentscheduler.service.external;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Model output plus the prompt that produced it, kept on the post for auditing.
 * Token counts are zero when the provider reported no usage.
 */
@Value
@AllArgsConstructor
public class GeneratedText {

    String text;
    String promptUsed;
    int promptTokens;
    int completionTokens;

    public GeneratedText(String text, String promptUsed) {
        this(text, promptUsed, 0, 0);
    }

    public int getTotalTokens() {
        return promptTokens + completionTokens;
    }
}
