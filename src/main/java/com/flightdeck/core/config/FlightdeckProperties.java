package com.flightdeck.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "flightdeck")
public class FlightdeckProperties {

    private int maxIterations = 100;
    private int orchestratorMaxIterations = 20;
    private long defaultTimeoutMs = 300_000;
    private long toolTimeoutMs = 120_000;
    private int heavyTokenThreshold = 2000;
    private int cloudRateLimitPerHour = 100;
    private boolean preferLocal = true;
    private int loopRetries = 1;
    private long healthCheckTimeoutMs = 5_000;
    private long healthCheckTtlMs = 30_000;

    private Backend cloud = new Backend("https://router.huggingface.co/v1", "Qwen/Qwen3-Coder-30B-A3B-Instruct", "");
    private Backend local = new Backend("http://localhost:11434", "devstral:latest", "ollama");
    private Storage storage = new Storage();

    public int getMaxIterations() { return maxIterations; }
    public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
    public int getOrchestratorMaxIterations() { return orchestratorMaxIterations; }
    public void setOrchestratorMaxIterations(int orchestratorMaxIterations) { this.orchestratorMaxIterations = orchestratorMaxIterations; }
    public long getDefaultTimeoutMs() { return defaultTimeoutMs; }
    public void setDefaultTimeoutMs(long defaultTimeoutMs) { this.defaultTimeoutMs = defaultTimeoutMs; }
    public long getToolTimeoutMs() { return toolTimeoutMs; }
    public void setToolTimeoutMs(long toolTimeoutMs) { this.toolTimeoutMs = toolTimeoutMs; }
    public int getHeavyTokenThreshold() { return heavyTokenThreshold; }
    public void setHeavyTokenThreshold(int heavyTokenThreshold) { this.heavyTokenThreshold = heavyTokenThreshold; }
    public int getCloudRateLimitPerHour() { return cloudRateLimitPerHour; }
    public void setCloudRateLimitPerHour(int cloudRateLimitPerHour) { this.cloudRateLimitPerHour = cloudRateLimitPerHour; }
    public boolean isPreferLocal() { return preferLocal; }
    public void setPreferLocal(boolean preferLocal) { this.preferLocal = preferLocal; }

    /** How many times a step whose agent got stuck in a loop is respawned with the detector's hint. */
    public int getLoopRetries() { return loopRetries; }
    public void setLoopRetries(int loopRetries) { this.loopRetries = loopRetries; }
    public long getHealthCheckTimeoutMs() { return healthCheckTimeoutMs; }
    public void setHealthCheckTimeoutMs(long healthCheckTimeoutMs) { this.healthCheckTimeoutMs = healthCheckTimeoutMs; }

    /** How long a local server health check result is reused. */
    public long getHealthCheckTtlMs() { return healthCheckTtlMs; }
    public void setHealthCheckTtlMs(long healthCheckTtlMs) { this.healthCheckTtlMs = healthCheckTtlMs; }

    public Backend getCloud() { return cloud; }
    public void setCloud(Backend cloud) { this.cloud = cloud; }
    public Backend getLocal() { return local; }
    public void setLocal(Backend local) { this.local = local; }
    public Storage getStorage() { return storage; }
    public void setStorage(Storage storage) { this.storage = storage; }

    /**
     * An OpenAI-compatible chat endpoint. The cloud backend counts as configured only
     * when an API key is set; the local backend when it is enabled and its server
     * answers a health check. {@code enabled=false} switches either off.
     */
    public static class Backend {
        private boolean enabled = true;
        private String baseUrl;
        private String modelId;
        private String apiKey;

        public Backend() {}

        Backend(String baseUrl, String modelId, String apiKey) {
            this.baseUrl = baseUrl;
            this.modelId = modelId;
            this.apiKey = apiKey;
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getModelId() { return modelId; }
        public void setModelId(String modelId) { this.modelId = modelId; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    public static class Storage {
        private String home = System.getProperty("user.home") + "/.flightdeck";
        private long flushIntervalMs = 1000;
        private int lessonCapacity = 200;
        private int semanticCapacity = 1000;

        public String getHome() { return home; }
        public void setHome(String home) { this.home = home; }
        public long getFlushIntervalMs() { return flushIntervalMs; }
        public void setFlushIntervalMs(long flushIntervalMs) { this.flushIntervalMs = flushIntervalMs; }
        public int getLessonCapacity() { return lessonCapacity; }
        public void setLessonCapacity(int lessonCapacity) { this.lessonCapacity = lessonCapacity; }
        public int getSemanticCapacity() { return semanticCapacity; }
        public void setSemanticCapacity(int semanticCapacity) { this.semanticCapacity = semanticCapacity; }

        public Path homePath() {
            return Path.of(home);
        }

        public Path lessonsFile() {
            return homePath().resolve("lessons.json");
        }

        public Path semanticMemoryFile() {
            return homePath().resolve("semantic-memory.json");
        }

        public Path sessionsDir() {
            return homePath().resolve("sessions");
        }
    }
}
