package com.appforge.core.generator;

/**
 * Prompt pair sent to a provider for one attempt.
 */
public record GenerationPrompt(String system, String user) {}
