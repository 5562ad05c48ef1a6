package org.gc.contentscheduler.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStatusResponse {

    private boolean running;
    private int timerCount;
    private List<PendingTimer> timers;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PendingTimer {
        private String scheduleId;
        private Instant fireTime;
    }
}
