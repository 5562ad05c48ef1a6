package org.gc.contentscheduler.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "content-scheduler")
public class SchedulerProperties {

    /**
     * When true every invocation is recorded as skipped without generating anything.
     */
    private boolean maintenanceMode = false;

    private int maxConsecutiveFailures = 3;

    private String fallbackTopic = "content creation";

    private Timeouts timeouts = new Timeouts();

    private Scheduler scheduler = new Scheduler();

    private Pricing pricing = new Pricing();

    @Data
    public static class Timeouts {
        private Duration title = Duration.ofSeconds(30);
        private Duration content = Duration.ofSeconds(60);
        private Duration image = Duration.ofSeconds(30);
        private Duration publish = Duration.ofSeconds(60);
        private Duration manualRun = Duration.ofMinutes(5);
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private int poolSize = 4;
        private long reconcileIntervalMs = 300000;
    }

    /**
     * Model prices used for the per-execution cost estimate, in USD per million tokens.
     */
    @Data
    public static class Pricing {
        private double inputPerMillionTokens = 2.50;
        private double outputPerMillionTokens = 10.00;
    }
}
