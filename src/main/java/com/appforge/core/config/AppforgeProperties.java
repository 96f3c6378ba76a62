package com.appforge.core.config;

import com.appforge.core.model.ErrorKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the orchestrator, bound from {@code appforge.*}.
 */
@Component
@ConfigurationProperties(prefix = "appforge")
public class AppforgeProperties {

    private final Engine engine = new Engine();
    private final Retry retry = new Retry();
    private final Circuit circuit = new Circuit();
    private final Checkpoint checkpoint = new Checkpoint();
    private final Planning planning = new Planning();
    private List<Provider> providers = new ArrayList<>();

    public Engine getEngine() {
        return engine;
    }

    public Retry getRetry() {
        return retry;
    }

    public Circuit getCircuit() {
        return circuit;
    }

    public Checkpoint getCheckpoint() {
        return checkpoint;
    }

    public Planning getPlanning() {
        return planning;
    }

    public List<Provider> getProviders() {
        return providers;
    }

    public void setProviders(List<Provider> providers) {
        this.providers = providers;
    }

    public static class Engine {
        private int maxInFlight = 4;
        private Duration taskTimeout = Duration.ofMinutes(5);
        private Duration pollInterval = Duration.ofMillis(200);

        public int getMaxInFlight() { return maxInFlight; }
        public void setMaxInFlight(int maxInFlight) { this.maxInFlight = maxInFlight; }
        public Duration getTaskTimeout() { return taskTimeout; }
        public void setTaskTimeout(Duration taskTimeout) { this.taskTimeout = taskTimeout; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    }

    public static class Retry {
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private Duration overallDeadline = Duration.ofMinutes(10);
        private Map<ErrorKind, Integer> maxAttempts = defaultMaxAttempts();

        public Duration getBaseDelay() { return baseDelay; }
        public void setBaseDelay(Duration baseDelay) { this.baseDelay = baseDelay; }
        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }
        public Duration getOverallDeadline() { return overallDeadline; }
        public void setOverallDeadline(Duration overallDeadline) { this.overallDeadline = overallDeadline; }
        public Map<ErrorKind, Integer> getMaxAttempts() { return maxAttempts; }

        public void setMaxAttempts(Map<ErrorKind, Integer> maxAttempts) {
            Map<ErrorKind, Integer> merged = defaultMaxAttempts();
            merged.putAll(maxAttempts);
            this.maxAttempts = merged;
        }

        private static Map<ErrorKind, Integer> defaultMaxAttempts() {
            Map<ErrorKind, Integer> defaults = new EnumMap<>(ErrorKind.class);
            defaults.put(ErrorKind.TRANSIENT, 4);
            defaults.put(ErrorKind.RATE_LIMITED, 5);
            defaults.put(ErrorKind.INVALID_OUTPUT, 2);
            defaults.put(ErrorKind.PERMANENT, 1);
            defaults.put(ErrorKind.PROVIDER_UNAVAILABLE, 3);
            return defaults;
        }
    }

    public static class Circuit {
        private int slidingWindowSize = 10;
        private int failureThreshold = 3;
        private float failureRateThreshold = 50f;
        private Duration cooldown = Duration.ofSeconds(30);

        public int getSlidingWindowSize() { return slidingWindowSize; }
        public void setSlidingWindowSize(int slidingWindowSize) { this.slidingWindowSize = slidingWindowSize; }
        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public float getFailureRateThreshold() { return failureRateThreshold; }
        public void setFailureRateThreshold(float failureRateThreshold) { this.failureRateThreshold = failureRateThreshold; }
        public Duration getCooldown() { return cooldown; }
        public void setCooldown(Duration cooldown) { this.cooldown = cooldown; }
    }

    public static class Checkpoint {
        /** "jdbc" or "memory". JDBC is only used when a DataSource is configured. */
        private String store = "jdbc";
        private int writeAttempts = 3;
        private Duration writeBaseDelay = Duration.ofMillis(100);

        public String getStore() { return store; }
        public void setStore(String store) { this.store = store; }
        public int getWriteAttempts() { return writeAttempts; }
        public void setWriteAttempts(int writeAttempts) { this.writeAttempts = writeAttempts; }
        public Duration getWriteBaseDelay() { return writeBaseDelay; }
        public void setWriteBaseDelay(Duration writeBaseDelay) { this.writeBaseDelay = writeBaseDelay; }
    }

    public static class Planning {
        private boolean includeDeployment = true;
        private int minimumTerms = 2;
        private Map<String, String> defaultFrameworks = defaultFrameworks();

        public boolean isIncludeDeployment() { return includeDeployment; }
        public void setIncludeDeployment(boolean includeDeployment) { this.includeDeployment = includeDeployment; }
        public int getMinimumTerms() { return minimumTerms; }
        public void setMinimumTerms(int minimumTerms) { this.minimumTerms = minimumTerms; }
        public Map<String, String> getDefaultFrameworks() { return defaultFrameworks; }

        public void setDefaultFrameworks(Map<String, String> defaultFrameworks) {
            Map<String, String> merged = defaultFrameworks();
            merged.putAll(defaultFrameworks);
            this.defaultFrameworks = merged;
        }

        private static Map<String, String> defaultFrameworks() {
            Map<String, String> defaults = new LinkedHashMap<>();
            defaults.put("frontend", "react");
            defaults.put("backend", "fastapi");
            defaults.put("database", "postgresql");
            defaults.put("auth", "jwt");
            defaults.put("integration", "rest");
            defaults.put("deployment", "cloud_run");
            return defaults;
        }
    }

    /**
     * One entry in the ordered provider list. Order is the configured priority.
     */
    public static class Provider {
        private String name;
        /** Name of the Spring AI ChatModel bean backing this provider. */
        private String chatModelBean;
        private String model;
        private Double temperature = 0.2;
        private Integer maxTokens = 4096;
        private int requestsPerMinute = 60;
        /** Token budget per minute, 0 for none. */
        private int tokensPerMinute = 0;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getChatModelBean() { return chatModelBean; }
        public void setChatModelBean(String chatModelBean) { this.chatModelBean = chatModelBean; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public Double getTemperature() { return temperature; }
        public void setTemperature(Double temperature) { this.temperature = temperature; }
        public Integer getMaxTokens() { return maxTokens; }
        public void setMaxTokens(Integer maxTokens) { this.maxTokens = maxTokens; }
        public int getRequestsPerMinute() { return requestsPerMinute; }
        public void setRequestsPerMinute(int requestsPerMinute) { this.requestsPerMinute = requestsPerMinute; }
        public int getTokensPerMinute() { return tokensPerMinute; }
        public void setTokensPerMinute(int tokensPerMinute) { this.tokensPerMinute = tokensPerMinute; }
    }
}
