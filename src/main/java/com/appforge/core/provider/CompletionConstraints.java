package com.appforge.core.provider;

/**
 * Per-call options passed to a provider.
 *
 * @param systemPrompt system instructions, may be null
 * @param temperature  sampling temperature, null for the provider default
 * @param maxTokens    output token limit, null for the provider default
 */
public record CompletionConstraints(String systemPrompt, Double temperature, Integer maxTokens) {

    public static CompletionConstraints withSystemPrompt(String systemPrompt) {
        return new CompletionConstraints(systemPrompt, null, null);
    }
}
