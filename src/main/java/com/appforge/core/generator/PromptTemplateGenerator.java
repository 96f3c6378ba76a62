package com.appforge.core.generator;

import com.appforge.core.model.ErrorKind;
import com.appforge.core.model.Task;
import com.appforge.core.model.TaskKind;
import com.appforge.core.model.TaskResult;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Generator that fills a kind-specific instruction into a shared prompt layout and
 * parses the JSON file map the provider returns.
 */
public class PromptTemplateGenerator implements TaskGenerator {

    static final String SYSTEM_PROMPT = """
            You are a senior software engineer generating one module of a larger application.
            Other modules are generated separately; only produce files for the module you are given.

            Respond with a single JSON object and nothing else:
            {"files": {"<relative/path>": "<file content>"}, "notes": "<short summary for the next modules>"}

            Rules:
            - Paths are relative and must not contain "..".
            - Every file is complete; no placeholders or elided sections.
            - Put interface details other modules need (endpoints, tables, env vars) in "notes".
            """;

    private final TaskKind kind;
    private final String instructions;
    private final GenerationOutputParser parser;
    private final Clock clock;

    public PromptTemplateGenerator(TaskKind kind, String instructions, GenerationOutputParser parser, Clock clock) {
        this.kind = kind;
        this.instructions = instructions;
        this.parser = parser;
        this.clock = clock;
    }

    @Override
    public TaskKind kind() {
        return kind;
    }

    @Override
    public GenerationPrompt prompt(Task task, GenerationContext context) {
        Map<String, Object> input = task.input();
        StringBuilder user = new StringBuilder();
        user.append("Task id: ").append(task.id()).append('\n');
        user.append("Module: ").append(kind.id()).append('\n');
        appendIfPresent(user, "Application", input.get("appName"));
        appendIfPresent(user, "Framework", input.get("framework"));
        user.append('\n').append("Requirement:\n").append(input.getOrDefault("requirement", "")).append('\n');

        if (input.get("features") instanceof List<?> features && !features.isEmpty()) {
            user.append("\nFeatures:\n");
            features.forEach(f -> user.append("- ").append(f).append('\n'));
        }

        user.append("\nInstructions:\n").append(instructions).append('\n');

        // sorted so the prompt does not depend on completion order of dependencies
        Map<String, TaskResult> deps = new TreeMap<>(context.dependencyResults());
        if (!deps.isEmpty()) {
            user.append("\nAlready generated modules:\n");
            deps.forEach((id, result) -> {
                user.append("## ").append(id).append('\n');
                user.append("Files: ").append(String.join(", ", result.paths())).append('\n');
                if (result.notes() != null && !result.notes().isBlank()) {
                    user.append("Notes: ").append(result.notes()).append('\n');
                }
            });
        }

        if (input.get("context") instanceof List<?> snippets && !snippets.isEmpty()) {
            user.append("\nReference material:\n");
            snippets.forEach(s -> user.append("---\n").append(s).append('\n'));
        }

        if (context.previousError() != null && context.previousError().kind() == ErrorKind.INVALID_OUTPUT) {
            user.append("\nYour previous answer was rejected: ").append(context.previousError().message())
                    .append("\nReturn only the JSON object described in the system prompt.\n");
        }
        return new GenerationPrompt(SYSTEM_PROMPT, user.toString());
    }

    @Override
    public TaskResult render(Task task, String provider, String completion) {
        GenerationOutputParser.ParsedOutput parsed = parser.parse(provider, completion);
        return new TaskResult(provider, parsed.files(), parsed.notes(), clock.instant());
    }

    private static void appendIfPresent(StringBuilder sb, String label, Object value) {
        if (value != null && !value.toString().isBlank()) {
            sb.append(label).append(": ").append(value).append('\n');
        }
    }
}
