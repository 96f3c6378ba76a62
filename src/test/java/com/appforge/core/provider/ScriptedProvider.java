package com.appforge.core.provider;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Test provider whose answers come from a function of the prompt. The function may
 * throw to simulate provider failures.
 */
public class ScriptedProvider implements LlmProvider {

    private final String name;
    private final Function<String, String> responder;
    private final List<String> prompts = new CopyOnWriteArrayList<>();

    public ScriptedProvider(String name, Function<String, String> responder) {
        this.name = name;
        this.responder = responder;
    }

    public static ScriptedProvider answering(String name, String completion) {
        return new ScriptedProvider(name, prompt -> completion);
    }

    public static ScriptedProvider failing(String name, RuntimeException error) {
        return new ScriptedProvider(name, prompt -> {
            throw error;
        });
    }

    /** Answers after sleeping; an interrupt ends the call. */
    public static ScriptedProvider slow(String name, long millis, String completion) {
        return new ScriptedProvider(name, prompt -> {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
            return completion;
        });
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String complete(String prompt, CompletionConstraints constraints) {
        prompts.add(prompt);
        return responder.apply(prompt);
    }

    public int calls() {
        return prompts.size();
    }

    public List<String> prompts() {
        return List.copyOf(prompts);
    }
}
