package com.appforge.core.generator;

import com.appforge.core.model.TaskKind;

import java.time.Clock;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maps every task kind to the generator that handles it.
 */
public class GeneratorRegistry {

    private static final Map<TaskKind, String> INSTRUCTIONS = Map.of(
            TaskKind.FRONTEND, """
                    Build the user interface in the given framework: entry point, routing, pages \
                    and components for each feature, an API client that calls the backend endpoints \
                    listed in the backend notes, and the package manifest.""",
            TaskKind.BACKEND, """
                    Build the HTTP API in the given framework: application entry point, one router per \
                    resource, request and response models, data access through the database module's \
                    schema, configuration read from environment variables, and the dependency manifest.""",
            TaskKind.DATABASE, """
                    Define the persistence layer for the given database: schema or collection layout \
                    for every entity the features imply, migrations, indexes for the expected queries, \
                    and a seed script. List table and column names in the notes.""",
            TaskKind.AUTH, """
                    Implement authentication with the given mechanism: user registration and login, \
                    password hashing, token issue and verification, a middleware that protects \
                    routes, and the user table or collection it relies on.""",
            TaskKind.INTEGRATION, """
                    Wire the generated modules together: shared environment configuration, a compose \
                    file that starts every service, CORS and API base URLs, and an end-to-end smoke \
                    test that exercises one feature through the whole stack.""",
            TaskKind.DEPLOYMENT, """
                    Prepare deployment to the given target: a Dockerfile per service, the platform's \
                    service configuration, a CI workflow that builds and deploys, and a README section \
                    describing required secrets.""");

    private final Map<TaskKind, TaskGenerator> generators = new EnumMap<>(TaskKind.class);

    public GeneratorRegistry(Collection<TaskGenerator> generators) {
        for (TaskGenerator generator : generators) {
            this.generators.put(generator.kind(), generator);
        }
    }

    /**
     * Registry with a prompt-template generator for every kind.
     */
    public static GeneratorRegistry defaults(GenerationOutputParser parser, Clock clock) {
        return new GeneratorRegistry(INSTRUCTIONS.entrySet().stream()
                .map(e -> (TaskGenerator) new PromptTemplateGenerator(e.getKey(), e.getValue(), parser, clock))
                .toList());
    }

    public TaskGenerator forKind(TaskKind kind) {
        TaskGenerator generator = generators.get(kind);
        if (generator == null) {
            throw new IllegalStateException("No generator registered for " + kind);
        }
        return generator;
    }
}
