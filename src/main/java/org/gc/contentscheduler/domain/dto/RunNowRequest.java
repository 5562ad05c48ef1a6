package org.gc.contentscheduler.domain.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class RunNowRequest {

    @Min(value = 10, message = "Run timeout must be at least 10 seconds")
    @Max(value = 1800, message = "Run timeout must be at most 30 minutes")
    private Integer timeoutSeconds;
}
