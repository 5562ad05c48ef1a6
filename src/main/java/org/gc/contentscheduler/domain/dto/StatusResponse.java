package org.gc.contentscheduler.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusResponse {

    private boolean success;
    private String message;
    private Map<String, Object> details;

    public static StatusResponse success(String message, Map<String, Object> details) {
        return StatusResponse.builder()
                .success(true)
                .message(message)
                .details(details)
                .build();
    }

    public static StatusResponse failure(String message) {
        return StatusResponse.builder()
                .success(false)
                .message(message)
                .build();
    }
}
