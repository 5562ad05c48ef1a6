package org.gc.contentscheduler.service.external;

import feign.FeignException;
import feign.RetryableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.contentscheduler.clients.WordPressClient;
import org.gc.contentscheduler.domain.BlogPost;
import org.gc.contentscheduler.domain.PublishingSite;
import org.gc.contentscheduler.exception.PublishException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

@Slf4j
@Component
@RequiredArgsConstructor
public class WordPressPublisher implements PostPublisher {

    private final WordPressClient wordPressClient;

    @Override
    public Mono<PublishResult> publish(BlogPost post, PublishingSite site) {
        return Mono.fromCallable(() -> doPublish(post, site))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private PublishResult doPublish(BlogPost post, PublishingSite site) {
        if (site.getBaseUrl() == null || site.getBaseUrl().isBlank()) {
            throw new PublishException("Publishing failed: site " + site.getId() + " has no base URL configuration");
        }

        Map<String, Object> body = new HashMap<>();
        body.put("title", post.getTitle());
        body.put("content", post.getContent());
        body.put("excerpt", post.getExcerpt() != null ? post.getExcerpt() : "");
        body.put("status", "publish");

        URI siteUri = URI.create(stripTrailingSlash(site.getBaseUrl()));
        log.info("Publishing post '{}' to {}", post.getTitle(), siteUri);

        Map<String, Object> response;
        try {
            response = wordPressClient.createPost(siteUri, basicAuth(site), body);
        } catch (RetryableException e) {
            throw new PublishException("Could not connect to site " + siteUri + ": " + e.getMessage(), e);
        } catch (FeignException e) {
            throw new PublishException("Publishing failed: HTTP " + e.status() + " from " + siteUri
                    + errorCode(e), e);
        }

        if (response == null || response.get("id") == null) {
            throw new PublishException("Publishing failed: " + siteUri + " returned no post id");
        }
        String platformPostId = String.valueOf(response.get("id"));
        String link = Objects.toString(response.get("link"), null);
        log.info("Published post {} as WordPress post {} ({})", post.getId(), platformPostId, link);
        return new PublishResult(platformPostId, link);
    }

    // WordPress puts e.g. "rest_forbidden" in the error body
    private static String errorCode(FeignException e) {
        String content = e.contentUTF8();
        if (content == null || content.isBlank()) {
            return "";
        }
        return " (" + (content.length() > 200 ? content.substring(0, 200) : content) + ")";
    }

    static String basicAuth(PublishingSite site) {
        String credentials = site.getUsername() + ":" + site.getAppPassword();
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
