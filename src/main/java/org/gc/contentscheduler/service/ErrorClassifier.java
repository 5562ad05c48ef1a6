package org.gc.contentscheduler.service;

import lombok.Value;
import org.gc.contentscheduler.domain.ErrorCategory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

import static org.gc.contentscheduler.domain.ErrorCategory.*;

/**
 * Maps raw failure text to an {@link ErrorCategory}.
 * <p>
 * Rules are scanned top to bottom against the lower-cased text and the first
 * match wins. Specific phrases ("publishing failed", "generation failed") sit
 * above the generic ones ("401", "timeout") they would otherwise lose to, so
 * new rules must be inserted with that ordering in mind.
 */
@Component
public class ErrorClassifier {

    @Value
    static class Rule {
        String pattern;
        ErrorCategory category;
    }

    static final List<Rule> RULES = List.of(
            new Rule("rate limit", API_RATE_LIMIT),
            new Rule("rate_limit", API_RATE_LIMIT),
            new Rule("429", API_RATE_LIMIT),

            new Rule("invalid api key", API_AUTH),
            new Rule("incorrect api key", API_AUTH),
            new Rule("authentication", API_AUTH),
            new Rule("api key", API_AUTH),

            new Rule("quota", API_QUOTA),
            new Rule("billing", API_QUOTA),
            new Rule("insufficient_quota", API_QUOTA),
            new Rule("exceeded your current quota", API_QUOTA),

            new Rule("publishing failed", PUBLISH_AUTH),
            new Rule("rest_forbidden", PUBLISH_AUTH),

            new Rule("content generation failed", CONTENT_ERROR),
            new Rule("generation failed", CONTENT_ERROR),

            new Rule("image generation", IMAGE_ERROR),
            new Rule("dall-e", IMAGE_ERROR),
            new Rule("unsplash", IMAGE_ERROR),

            new Rule("template not found", CONFIG_ERROR),
            new Rule("no topics configured", CONFIG_ERROR),
            new Rule("configuration", CONFIG_ERROR),
            new Rule("experience notes", CONFIG_ERROR),

            new Rule("connection refused", PUBLISH_CONNECTION),
            new Rule("connectionerror", PUBLISH_CONNECTION),
            new Rule("name or service not known", PUBLISH_CONNECTION),
            new Rule("could not connect", PUBLISH_CONNECTION),
            new Rule("site unreachable", PUBLISH_CONNECTION),
            new Rule("site is not active", PUBLISH_CONNECTION),

            new Rule("publishing timeout", PUBLISH_TIMEOUT),

            new Rule("401", PUBLISH_AUTH),
            new Rule("403", PUBLISH_AUTH),
            new Rule("unauthorized", PUBLISH_AUTH),
            new Rule("forbidden", PUBLISH_AUTH),
            new Rule("credentials", PUBLISH_AUTH),

            new Rule("timeout", API_TIMEOUT),
            new Rule("timed out", API_TIMEOUT),
            new Rule("read timeout", API_TIMEOUT)
    );

    public ErrorCategory classify(String errorText) {
        if (errorText == null || errorText.isBlank()) {
            return UNKNOWN;
        }

        String lower = errorText.toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            if (lower.contains(rule.getPattern())) {
                return rule.getCategory();
            }
        }
        return UNKNOWN;
    }
}
