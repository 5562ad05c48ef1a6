package org.gc.contentscheduler.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Failure categories surfaced to users. Each carries the copy used for
 * notifications and whether the failure is expected to clear on its own.
 * The transient flag is informational only; every category counts toward
 * auto-pause.
 */
public enum ErrorCategory {

    API_RATE_LIMIT("api_rate_limit", "OpenAI Rate Limited",
            "Your requests hit OpenAI's rate limit. This usually resolves within a minute. "
                    + "Check your OpenAI usage dashboard if it persists.", true),
    API_AUTH("api_auth", "OpenAI API Key Invalid",
            "The OpenAI API key is invalid or has been revoked. Verify the key in your environment configuration.",
            false),
    API_QUOTA("api_quota", "OpenAI Quota Exceeded",
            "Your OpenAI account has exceeded its spending limit. Add billing credits to your OpenAI account.",
            false),
    API_TIMEOUT("api_timeout", "OpenAI Timeout",
            "The request to OpenAI timed out. This is usually temporary and the next run should succeed.", true),
    PUBLISH_AUTH("publish_auth", "Site Credentials Rejected",
            "Your site rejected the login credentials. Update your username and app password in Sites.", false),
    PUBLISH_CONNECTION("publish_connection", "Site Unreachable",
            "Could not connect to your site. Verify the URL is correct and the site is online.", true),
    PUBLISH_TIMEOUT("publish_timeout", "Publishing Timeout",
            "Publishing timed out. The post was saved as a draft and you can publish it manually.", true),
    CONTENT_ERROR("content_error", "Content Generation Failed",
            "An error occurred during content generation. Check the error log for details.", true),
    IMAGE_ERROR("image_error", "Image Generation Failed",
            "Featured image generation failed. The article was created without an image and you can add one manually.",
            true),
    CONFIG_ERROR("config_error", "Configuration Missing",
            "The schedule or template is missing required configuration. Edit the schedule to fix.", false),
    UNKNOWN("unknown", "Unexpected Error",
            "An unexpected error occurred. Check the error log for details.", true);

    private final String key;
    private final String userTitle;
    private final String userGuidance;
    private final boolean transientFailure;

    ErrorCategory(String key, String userTitle, String userGuidance, boolean transientFailure) {
        this.key = key;
        this.userTitle = userTitle;
        this.userGuidance = userGuidance;
        this.transientFailure = transientFailure;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public String getUserTitle() {
        return userTitle;
    }

    public String getUserGuidance() {
        return userGuidance;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }

    public static ErrorCategory fromKey(String key) {
        for (ErrorCategory category : values()) {
            if (category.key.equals(key)) {
                return category;
            }
        }
        return UNKNOWN;
    }
}
