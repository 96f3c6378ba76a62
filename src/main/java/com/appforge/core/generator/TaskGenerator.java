package com.appforge.core.generator;

import com.appforge.core.model.Task;
import com.appforge.core.model.TaskKind;
import com.appforge.core.model.TaskResult;
import com.appforge.core.provider.ProviderException;

/**
 * Turns a task into a provider prompt and the provider's completion into a result.
 * Both steps depend only on their arguments, so a retried attempt overwrites the
 * previous output instead of adding to it.
 */
public interface TaskGenerator {

    TaskKind kind();

    GenerationPrompt prompt(Task task, GenerationContext context);

    /**
     * @throws ProviderException with kind INVALID_OUTPUT when the completion is unusable
     */
    TaskResult render(Task task, String provider, String completion);
}
