package org.gc.contentscheduler.service.external;

import reactor.core.publisher.Mono;

/**
 * Optional featured-image lookup. Never errors: "no image" is an empty Mono.
 */
public interface ImageGenerator {

    Mono<String> findImage(String topic, String title);
}
