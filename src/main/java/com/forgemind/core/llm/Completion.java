package com.forgemind.core.llm;

/**
 * Text returned by the language model with the tokens it consumed.
 */
public record Completion(String text, long tokens) {
}
