package com.forgemind.core.llm;

/**
 * Narrow seam to the language model: transform or judge text.
 * <p>
 * Implementations retry transient failures and throw
 * {@link com.forgemind.core.error.CollaboratorUnavailableException} once retries are exhausted.
 */
public interface LanguageModelClient {

    Completion complete(String systemPrompt, String userPrompt);

    /**
     * Asks for JSON and maps it onto {@code outputType}. The default implementation
     * appends a plain JSON instruction and parses leniently.
     */
    default <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        Completion completion = complete(systemPrompt,
                userPrompt + "\n\nRespond with a single JSON object only.");
        return LenientJson.parse(completion.text(), outputType);
    }
}
