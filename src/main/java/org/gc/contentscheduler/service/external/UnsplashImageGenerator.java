package org.gc.contentscheduler.service.external;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Looks up a landscape stock photo for the post. Any failure degrades to "no image".
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UnsplashImageGenerator implements ImageGenerator {

    private final WebClient.Builder webClientBuilder;

    @Value("${unsplash.url:https://api.unsplash.com}")
    private String unsplashUrl;

    @Value("${unsplash.access-key:}")
    private String accessKey;

    @Override
    @SuppressWarnings("unchecked")
    public Mono<String> findImage(String topic, String title) {
        if (accessKey == null || accessKey.isBlank()) {
            log.debug("No Unsplash access key configured, skipping image for '{}'", title);
            return Mono.empty();
        }

        String query = topic != null && !topic.isBlank() ? topic : title;
        WebClient webClient = webClientBuilder
                .baseUrl(unsplashUrl)
                .defaultHeader("Authorization", "Client-ID " + accessKey)
                .build();

        return webClient.get()
                .uri(uri -> uri.path("/search/photos")
                        .queryParam("query", query)
                        .queryParam("per_page", 1)
                        .queryParam("orientation", "landscape")
                        .build())
                .retrieve()
                .bodyToMono(Map.class)
                .flatMap(response -> {
                    List<Map<String, Object>> results = (List<Map<String, Object>>) response.get("results");
                    if (results == null || results.isEmpty()) {
                        return Mono.empty();
                    }
                    Map<String, Object> urls = (Map<String, Object>) results.get(0).get("urls");
                    return Mono.justOrEmpty(urls != null ? (String) urls.get("regular") : null);
                })
                .onErrorResume(e -> {
                    log.warn("Unsplash lookup failed for '{}': {}", query, e.getMessage());
                    return Mono.empty();
                });
    }
}
