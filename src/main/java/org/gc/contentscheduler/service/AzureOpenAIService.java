package org.gc.contentscheduler.service;

import com.azure.ai.openai.OpenAIAsyncClient;
import com.azure.ai.openai.OpenAIClientBuilder;
import com.azure.ai.openai.models.ChatChoice;
import com.azure.ai.openai.models.ChatCompletions;
import com.azure.ai.openai.models.ChatCompletionsOptions;
import com.azure.ai.openai.models.ChatRequestMessage;
import com.azure.ai.openai.models.ChatRequestSystemMessage;
import com.azure.ai.openai.models.ChatRequestUserMessage;
import com.azure.ai.openai.models.CompletionsUsage;
import com.azure.core.credential.AzureKeyCredential;
import com.azure.core.http.policy.HttpLogDetailLevel;
import com.azure.core.http.policy.HttpLogOptions;
import com.azure.core.http.policy.TimeoutPolicy;
import lombok.extern.slf4j.Slf4j;
import org.gc.contentscheduler.properties.AzureOpenAIProperties;
import org.gc.contentscheduler.service.external.GeneratedText;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;

/**
 * Chat completions against the configured Azure OpenAI deployments.
 * <p>
 * Each named client gets its own semaphore so a slow deployment cannot take
 * more than {@code maxConcurrentRequests} slots. Errors are passed through
 * unchanged; callers decide how to classify them.
 */
@Slf4j
@Service
public class AzureOpenAIService {

    private final Map<String, OpenAIAsyncClient> clients = new HashMap<>();
    private final Map<String, String> deploymentNames = new HashMap<>();
    private final Map<String, Semaphore> clientSemaphores = new HashMap<>();

    public AzureOpenAIService(AzureOpenAIProperties properties) {
        if (properties.getClients() == null || properties.getClients().isEmpty()) {
            log.warn("No Azure OpenAI clients configured. Content generation will fail until one is added.");
            return;
        }
        properties.getClients().forEach((name, clientProps) -> {
            if (clientProps.getApiKey() == null || clientProps.getApiKey().isBlank()) {
                log.warn("Azure OpenAI client '{}' has no API key, skipping it", name);
                return;
            }
            OpenAIAsyncClient client = new OpenAIClientBuilder()
                    .endpoint(clientProps.getEndpoint())
                    .credential(new AzureKeyCredential(clientProps.getApiKey()))
                    .addPolicy(new TimeoutPolicy(clientProps.getRequestTimeout()))
                    .httpLogOptions(new HttpLogOptions().setLogLevel(HttpLogDetailLevel.BASIC))
                    .buildAsyncClient();
            clients.put(name, client);
            deploymentNames.put(name, clientProps.getDeploymentName());
            clientSemaphores.put(name, new Semaphore(clientProps.getMaxConcurrentRequests()));

            log.info("Initialized Azure OpenAI client '{}' with endpoint: {} (max concurrent: {})",
                    name, clientProps.getEndpoint(), clientProps.getMaxConcurrentRequests());
        });
    }

    /**
     * Runs one chat completion. The reply carries the user prompt and the token
     * usage the deployment reported; an empty reply completes empty.
     */
    public Mono<GeneratedText> complete(String clientName, String systemPrompt, String userPrompt,
                                        int maxTokens, double temperature) {
        OpenAIAsyncClient client = clients.get(clientName);
        String deploymentName = deploymentNames.get(clientName);
        Semaphore semaphore = clientSemaphores.get(clientName);

        if (client == null || deploymentName == null || semaphore == null) {
            return Mono.error(new IllegalStateException(
                    "Azure OpenAI configuration missing for client '" + clientName + "'"));
        }

        List<ChatRequestMessage> prompts = List.of(
                new ChatRequestSystemMessage(systemPrompt),
                new ChatRequestUserMessage(userPrompt));

        ChatCompletionsOptions options = new ChatCompletionsOptions(prompts)
                .setMaxTokens(maxTokens)
                .setTemperature(temperature)
                .setTopP(0.95);

        Mono<Semaphore> permit = Mono.fromCallable(() -> {
                    semaphore.acquire();
                    log.debug("Acquired semaphore for client '{}' (available permits: {})",
                            clientName, semaphore.availablePermits());
                    return semaphore;
                })
                .subscribeOn(Schedulers.boundedElastic())
                // a permit acquired after the caller cancelled is handed back here
                .doOnDiscard(Semaphore.class, Semaphore::release);

        return Mono.usingWhen(permit,
                acquired -> client.getChatCompletions(deploymentName, options)
                        .flatMap(completions -> Mono.justOrEmpty(toGeneratedText(completions, userPrompt)))
                        .doOnError(e -> log.error("Chat completion failed for client '{}': {}", clientName, e.getMessage())),
                acquired -> Mono.fromRunnable(acquired::release));
    }

    private static Optional<GeneratedText> toGeneratedText(ChatCompletions completions, String userPrompt) {
        CompletionsUsage usage = completions.getUsage();
        int promptTokens = usage != null ? usage.getPromptTokens() : 0;
        int completionTokens = usage != null ? usage.getCompletionTokens() : 0;
        return completions.getChoices().stream()
                .map(ChatChoice::getMessage)
                .filter(Objects::nonNull)
                .map(message -> Objects.toString(message.getContent(), null))
                .filter(Objects::nonNull)
                .findFirst()
                .map(text -> new GeneratedText(text, userPrompt, promptTokens, completionTokens));
    }
}
