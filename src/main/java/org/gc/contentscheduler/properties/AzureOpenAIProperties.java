package org.gc.contentscheduler.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "spring.ai.azure.openai")
public class AzureOpenAIProperties {

    /**
     * Name of the entry in {@link #clients} used for title and body generation.
     */
    private String generationClient = "default";

    private Map<String, Client> clients;

    @Data
    public static class Client {
        private String apiKey;
        private String endpoint;
        private String deploymentName;
        private int maxConcurrentRequests = 1;
        private Duration requestTimeout = Duration.ofSeconds(120);
    }
}
