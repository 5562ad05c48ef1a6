package org.gc.contentscheduler.service.external;

import lombok.Value;
import org.gc.contentscheduler.domain.BlogPost;
import org.gc.contentscheduler.domain.PublishingSite;
import reactor.core.publisher.Mono;

/**
 * Pushes a post to its target site. Fails with
 * {@link org.gc.contentscheduler.exception.PublishException}.
 */
public interface PostPublisher {

    Mono<PublishResult> publish(BlogPost post, PublishingSite site);

    @Value
    class PublishResult {
        String platformPostId;
        String publishedUrl;
    }
}
