package com.appforge.core.provider;

import com.appforge.core.model.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;

/**
 * {@link LlmProvider} backed by a Spring AI {@link ChatClient}.
 */
public class ChatClientLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(ChatClientLlmProvider.class);

    private final String name;
    private final ChatClient chatClient;
    private final String model;
    private final Double defaultTemperature;
    private final Integer defaultMaxTokens;

    public ChatClientLlmProvider(String name, ChatClient chatClient, String model,
                                 Double defaultTemperature, Integer defaultMaxTokens) {
        this.name = name;
        this.chatClient = chatClient;
        this.model = model;
        this.defaultTemperature = defaultTemperature;
        this.defaultMaxTokens = defaultMaxTokens;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String complete(String prompt, CompletionConstraints constraints) {
        ChatOptions.Builder options = ChatOptions.builder()
                .temperature(constraints.temperature() != null ? constraints.temperature() : defaultTemperature)
                .maxTokens(constraints.maxTokens() != null ? constraints.maxTokens() : defaultMaxTokens);
        if (model != null && !model.isBlank()) {
            options.model(model);
        }

        var request = chatClient.prompt();
        if (constraints.systemPrompt() != null) {
            request = request.system(constraints.systemPrompt());
        }
        long start = System.currentTimeMillis();
        String content = request.user(prompt)
                .options(options.build())
                .call()
                .content();
        log.debug("Provider {} responded in {}ms", name, System.currentTimeMillis() - start);

        if (content == null || content.isBlank()) {
            throw new ProviderException(ErrorKind.INVALID_OUTPUT, name, "Provider returned empty content");
        }
        return content;
    }
}
