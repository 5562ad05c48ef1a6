package org.gc.contentscheduler.service.external;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.contentscheduler.domain.PromptTemplate;
import org.gc.contentscheduler.exception.GenerationException;
import org.gc.contentscheduler.properties.AzureOpenAIProperties;
import org.gc.contentscheduler.service.AzureOpenAIService;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class AzureOpenAIContentGenerator implements ContentGenerator {

    private static final String DEFAULT_SYSTEM_PROMPT =
            "You are an experienced blog writer. Write clear, accurate, engaging articles for a general audience.";
    private static final String TITLE_RULES =
            "Reply with exactly one headline for the topic. No quotes, no numbering, no explanation.";
    private static final int TITLE_MAX_TOKENS = 100;
    private static final int DEFAULT_WORD_COUNT = 1200;

    private final AzureOpenAIService azureOpenAIService;
    private final AzureOpenAIProperties properties;

    @Override
    public Mono<GeneratedText> generateTitle(String topic, PromptTemplate template, List<String> existingTitles) {
        String systemPrompt = systemPrompt(template) + "\n\n" + TITLE_RULES
                + instructions(template.getTitleInstructions());

        StringBuilder userPrompt = new StringBuilder("Topic: ").append(topic);
        if (existingTitles != null && !existingTitles.isEmpty()) {
            userPrompt.append("\n\nALREADY PUBLISHED (do NOT reuse or closely rephrase these titles):");
            existingTitles.forEach(title -> userPrompt.append("\n- ").append(title));
        }

        return call(systemPrompt, userPrompt.toString(), TITLE_MAX_TOKENS, 0.8, "Title");
    }

    @Override
    public Mono<GeneratedText> generateContent(String title, PromptTemplate template, int wordCount, String tone) {
        int words = wordCount > 0 ? wordCount : DEFAULT_WORD_COUNT;
        String systemPrompt = systemPrompt(template) + instructions(template.getContentInstructions());
        String userPrompt = "Write a blog post in markdown titled \"" + title + "\".\n"
                + "Length: about " + words + " words.\n"
                + (tone != null && !tone.isBlank() ? "Tone: " + tone + ".\n" : "")
                + "Do not repeat the title as a heading.";

        // roughly 1.5 tokens per word plus headroom for markdown
        int maxTokens = Math.min(16000, words * 2 + 500);
        return call(systemPrompt, userPrompt, maxTokens, 0.7, "Content");
    }

    private Mono<GeneratedText> call(String systemPrompt, String userPrompt, int maxTokens,
                                     double temperature, String step) {
        return azureOpenAIService.complete(properties.getGenerationClient(), systemPrompt, userPrompt,
                        maxTokens, temperature)
                .filter(reply -> !reply.getText().isBlank())
                .switchIfEmpty(Mono.error(() -> new GenerationException(
                        step + " generation failed: model returned no text")))
                .doOnNext(reply -> log.debug("{} generation used {} prompt and {} completion tokens",
                        step, reply.getPromptTokens(), reply.getCompletionTokens()))
                .onErrorMap(e -> !(e instanceof GenerationException),
                        e -> new GenerationException(describe(e), e));
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String systemPrompt(PromptTemplate template) {
        String prompt = template.getSystemPrompt();
        return prompt != null && !prompt.isBlank() ? prompt.strip() : DEFAULT_SYSTEM_PROMPT;
    }

    private static String instructions(String extra) {
        return extra != null && !extra.isBlank() ? "\n\n" + extra.strip() : "";
    }
}
