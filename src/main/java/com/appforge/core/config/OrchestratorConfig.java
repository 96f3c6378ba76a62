package com.appforge.core.config;

import com.appforge.core.engine.ExecutionEngine;
import com.appforge.core.engine.GenerationService;
import com.appforge.core.events.EventBus;
import com.appforge.core.generator.GenerationOutputParser;
import com.appforge.core.generator.GeneratorRegistry;
import com.appforge.core.metrics.AppforgeMetrics;
import com.appforge.core.model.ErrorKind;
import com.appforge.core.persistence.CheckpointStore;
import com.appforge.core.planning.ContextRetriever;
import com.appforge.core.planning.PlanningAgent;
import com.appforge.core.provider.ChatClientLlmProvider;
import com.appforge.core.provider.ProviderErrorClassifier;
import com.appforge.core.provider.ProviderGateway;
import com.appforge.core.provider.ProviderHealthRegistry;
import com.appforge.core.resilience.FallbackCoordinator;
import com.appforge.core.resilience.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the planning, provider, resilience and execution components from
 * {@link AppforgeProperties}.
 */
@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProviderHealthRegistry providerHealthRegistry(AppforgeProperties properties, Clock clock,
                                                         AppforgeMetrics metrics) {
        return new ProviderHealthRegistry(properties.getCircuit(), clock, metrics);
    }

    /**
     * One provider per {@code appforge.providers} entry, in the configured order. With no
     * entries, every Spring AI {@link ChatModel} bean becomes a provider named after its bean.
     */
    @Bean(destroyMethod = "close")
    public ProviderGateway providerGateway(ListableBeanFactory beanFactory, AppforgeProperties properties,
                                           ProviderHealthRegistry healthRegistry, AppforgeMetrics metrics) {
        Map<String, ChatModel> chatModels = beanFactory.getBeansOfType(ChatModel.class);
        List<ProviderGateway.ProviderRegistration> registrations = new ArrayList<>();

        if (properties.getProviders().isEmpty()) {
            chatModels.forEach((beanName, model) -> registrations.add(new ProviderGateway.ProviderRegistration(
                    new ChatClientLlmProvider(beanName.replace("ChatModel", ""), ChatClient.create(model),
                            null, null, null), 60)));
        } else {
            for (AppforgeProperties.Provider entry : properties.getProviders()) {
                ChatModel model = chatModels.get(entry.getChatModelBean());
                if (model == null) {
                    log.warn("Provider {} skipped: no ChatModel bean named '{}' (available: {})",
                            entry.getName(), entry.getChatModelBean(), chatModels.keySet());
                    continue;
                }
                registrations.add(new ProviderGateway.ProviderRegistration(
                        new ChatClientLlmProvider(entry.getName(), ChatClient.create(model), entry.getModel(),
                                entry.getTemperature(), entry.getMaxTokens()),
                        entry.getRequestsPerMinute(), entry.getTokensPerMinute()));
            }
        }
        if (registrations.isEmpty()) {
            log.warn("No LLM providers configured; every task will fail with provider_unavailable");
        }
        return new ProviderGateway(registrations, healthRegistry, new ProviderErrorClassifier(), metrics);
    }

    @Bean
    public RetryPolicy retryPolicy(AppforgeProperties properties) {
        return RetryPolicy.from(properties.getRetry());
    }

    @Bean
    public FallbackCoordinator fallbackCoordinator(ProviderHealthRegistry healthRegistry, RetryPolicy retryPolicy,
                                                   Clock clock) {
        return new FallbackCoordinator(healthRegistry, retryPolicy, clock);
    }

    @Bean
    public GeneratorRegistry generatorRegistry(Clock clock) {
        return GeneratorRegistry.defaults(new GenerationOutputParser(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ContextRetriever contextRetriever() {
        return ContextRetriever.none();
    }

    @Bean
    public PlanningAgent planningAgent(ContextRetriever contextRetriever, AppforgeProperties properties,
                                       AppforgeMetrics metrics, Clock clock) {
        return new PlanningAgent(contextRetriever, properties.getPlanning(), metrics, clock);
    }

    @Bean
    public ExecutionEngine executionEngine(ProviderGateway gateway, FallbackCoordinator fallback,
                                           GeneratorRegistry generators, EventBus eventBus,
                                           AppforgeMetrics metrics, AppforgeProperties properties, Clock clock) {
        AppforgeProperties.Engine engine = properties.getEngine();
        return new ExecutionEngine(gateway, fallback, generators, eventBus, metrics,
                new ExecutionEngine.Settings(engine.getMaxInFlight(), engine.getTaskTimeout(), engine.getPollInterval()),
                clock);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService generationRunExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "appforge-run-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public GenerationService generationService(PlanningAgent planningAgent, ExecutionEngine engine,
                                               CheckpointStore checkpointStore, AppforgeProperties properties,
                                               EventBus eventBus, AppforgeMetrics metrics,
                                               ExecutorService generationRunExecutor, Clock clock) {
        AppforgeProperties.Checkpoint checkpoint = properties.getCheckpoint();
        RetryPolicy checkpointRetry = new RetryPolicy(checkpoint.getWriteBaseDelay(),
                checkpoint.getWriteBaseDelay().multipliedBy(8), properties.getRetry().getOverallDeadline(),
                Map.of(ErrorKind.TRANSIENT, checkpoint.getWriteAttempts()), new Random());
        return new GenerationService(planningAgent, engine, checkpointStore, checkpointRetry, eventBus, metrics,
                generationRunExecutor, clock);
    }
}
