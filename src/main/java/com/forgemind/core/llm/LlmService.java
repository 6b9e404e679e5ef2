package com.forgemind.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * {@link LanguageModelClient} backed by Spring AI's {@link ChatClient}.
 * <p>
 * Every call goes through {@link CollaboratorRetry}; token usage is read from the
 * response metadata. {@link #structuredCall} uses {@link BeanOutputConverter} to append
 * format instructions and falls back to {@link LenientJson} when conversion fails.
 */
@Service
public class LlmService implements LanguageModelClient {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);
    private static final String COLLABORATOR = "language-model";

    private final ChatClient chatClient;
    private final CollaboratorRetry retry;

    public LlmService(ChatClient.Builder builder, LlmProperties properties,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        this.retry = properties.retry(COLLABORATOR);
        log.info("LlmService initialized, OpenAI base-url: {}", baseUrl);
    }

    @Override
    public Completion complete(String systemPrompt, String userPrompt) {
        return retry.call("completion", () -> {
            long start = System.currentTimeMillis();
            ChatResponse response = chatClient.prompt()
                    .system(systemPrompt)
                    .user(userPrompt)
                    .call()
                    .chatResponse();
            String text = response != null && response.getResult() != null
                    ? response.getResult().getOutput().getText()
                    : null;
            if (text == null || text.isBlank()) {
                throw new LlmEmptyResponseException(
                        "LLM returned empty content. Check that the model is running and reachable.");
            }
            long tokens = totalTokens(response);
            log.debug("LLM completion in {}ms, {} tokens", System.currentTimeMillis() - start, tokens);
            return new Completion(text, tokens);
        });
    }

    /**
     * Sends a system + user prompt to the LLM and returns the response
     * deserialized into the given {@code outputType}.
     *
     * @param systemPrompt instructions for the LLM's role
     * @param userPrompt   the request text
     * @param outputType   the record or POJO to deserialize into
     * @param <T>          target type
     * @return an instance of {@code T} populated from the LLM's JSON response
     */
    @Override
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        log.info("LLM call started → {}", outputType.getSimpleName());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String response = retry.call("structured call", () -> chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat())
                .call()
                .content());
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete → {} ({}s)", outputType.getSimpleName(), String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + outputType.getSimpleName()
                    + ". Check that the model is running and supports structured JSON output.");
        }
        try {
            return converter.convert(response);
        } catch (Exception e) {
            log.warn("BeanOutputConverter failed for {}, trying lenient parse: {}",
                    outputType.getSimpleName(), e.getMessage());
            return LenientJson.parse(response, outputType);
        }
    }

    private static long totalTokens(ChatResponse response) {
        if (response.getMetadata() == null) {
            return 0;
        }
        Usage usage = response.getMetadata().getUsage();
        if (usage == null || usage.getTotalTokens() == null) {
            return 0;
        }
        return usage.getTotalTokens();
    }
}
