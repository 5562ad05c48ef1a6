package org.gc.contentscheduler.service.external;

import org.gc.contentscheduler.domain.PromptTemplate;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Text generation for the execution pipeline. Implementations signal failure
 * with {@link org.gc.contentscheduler.exception.GenerationException}; the
 * pipeline applies its own timeouts on top.
 */
public interface ContentGenerator {

    Mono<GeneratedText> generateTitle(String topic, PromptTemplate template, List<String> existingTitles);

    Mono<GeneratedText> generateContent(String title, PromptTemplate template, int wordCount, String tone);
}
