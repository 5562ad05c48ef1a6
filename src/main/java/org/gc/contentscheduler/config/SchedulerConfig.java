package org.gc.contentscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.gc.contentscheduler.properties.SchedulerProperties;
import org.gc.contentscheduler.service.external.SubscriptionChecker;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Slf4j
@Configuration
public class SchedulerConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * One-shot schedule timers run here. Pending tasks are dropped on shutdown and
     * rebuilt from the stored next_run values on the next start.
     */
    @Bean(name = "scheduleTimerExecutor")
    public ThreadPoolTaskScheduler scheduleTimerExecutor(SchedulerProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getScheduler().getPoolSize());
        scheduler.setThreadNamePrefix("schedule-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(t -> log.error("Schedule timer task failed: {}", t.getMessage(), t));
        return scheduler;
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriptionChecker subscriptionChecker() {
        log.info("No subscription checker configured, all schedule owners are treated as subscribed");
        return ownerId -> true;
    }
}
