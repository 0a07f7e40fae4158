package com.rozet.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "rozet")
public class RozetProperties {

    private String workspaceRoot;
    private AiProvider aiProvider = AiProvider.GOOGLE;
    private OpenAIConfig openai = new OpenAIConfig();
    private PlannerConfig planner = new PlannerConfig();
    private LocksConfig locks = new LocksConfig();
    private WorkerConfig worker = new WorkerConfig();
    private RemoteToolsConfig remoteTools = new RemoteToolsConfig();
    private ObservabilityConfig observability = new ObservabilityConfig();
    private ContextConfig context = new ContextConfig();
    private HttpConfig http = new HttpConfig();

    public enum AiProvider {
        GOOGLE, OPENAI
    }

    public enum WorkerType {
        LOCAL, REMOTE
    }

    public static class OpenAIConfig {
        private String model;

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public static class PlannerConfig {
        private int maxTasks = 6;

        public int getMaxTasks() { return maxTasks; }
        public void setMaxTasks(int maxTasks) { this.maxTasks = maxTasks; }
    }

    public static class LocksConfig {
        private Duration acquireTimeout = Duration.ofSeconds(5);
        private Duration expiry;
        private Duration pollInterval = Duration.ofMillis(10);
        private Duration cleanupInterval = Duration.ofSeconds(60);

        public Duration getAcquireTimeout() { return acquireTimeout; }
        public void setAcquireTimeout(Duration acquireTimeout) { this.acquireTimeout = acquireTimeout; }
        public Duration getExpiry() { return expiry; }
        public void setExpiry(Duration expiry) { this.expiry = expiry; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public Duration getCleanupInterval() { return cleanupInterval; }
        public void setCleanupInterval(Duration cleanupInterval) { this.cleanupInterval = cleanupInterval; }
    }

    public static class WorkerConfig {
        private WorkerType type = WorkerType.LOCAL;
        private boolean verifyOutputs = true;
        private Duration bashTimeout = Duration.ofSeconds(60);

        public WorkerType getType() { return type; }
        public void setType(WorkerType type) { this.type = type; }
        public boolean isVerifyOutputs() { return verifyOutputs; }
        public void setVerifyOutputs(boolean verifyOutputs) { this.verifyOutputs = verifyOutputs; }
        public Duration getBashTimeout() { return bashTimeout; }
        public void setBashTimeout(Duration bashTimeout) { this.bashTimeout = bashTimeout; }
    }

    public static class RemoteToolsConfig {
        private String baseUrl;
        private String provider;
        private String model;
        private String agent = "build";
        private String sessionId;
        private Duration timeout = Duration.ofSeconds(60);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public String getAgent() { return agent; }
        public void setAgent(String agent) { this.agent = agent; }
        public String getSessionId() { return sessionId; }
        public void setSessionId(String sessionId) { this.sessionId = sessionId; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class ObservabilityConfig {
        private boolean enabled = true;
        private String url = "http://localhost:4000/events";
        private String sourceApp = "orchestrator";
        private String sessionId;
        private Duration timeout = Duration.ofSeconds(2);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getSourceApp() { return sourceApp; }
        public void setSourceApp(String sourceApp) { this.sourceApp = sourceApp; }
        public String getSessionId() { return sessionId; }
        public void setSessionId(String sessionId) { this.sessionId = sessionId; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class ContextConfig {
        private boolean enabled = true;
        private int maxTokens = 1200;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }
    }

    public static class HttpConfig {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofMinutes(5);

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
        public Duration getReadTimeout() { return readTimeout; }
        public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
    }

    public String getWorkspaceRoot() {
        return workspaceRoot;
    }

    public void setWorkspaceRoot(String workspaceRoot) {
        this.workspaceRoot = workspaceRoot;
    }

    public AiProvider getAiProvider() {
        return aiProvider;
    }

    public void setAiProvider(AiProvider aiProvider) {
        this.aiProvider = aiProvider;
    }

    public OpenAIConfig getOpenai() {
        return openai;
    }

    public void setOpenai(OpenAIConfig openai) {
        this.openai = openai;
    }

    public PlannerConfig getPlanner() {
        return planner;
    }

    public void setPlanner(PlannerConfig planner) {
        this.planner = planner != null ? planner : new PlannerConfig();
    }

    public LocksConfig getLocks() {
        return locks;
    }

    public void setLocks(LocksConfig locks) {
        this.locks = locks != null ? locks : new LocksConfig();
    }

    public WorkerConfig getWorker() {
        return worker;
    }

    public void setWorker(WorkerConfig worker) {
        this.worker = worker != null ? worker : new WorkerConfig();
    }

    public RemoteToolsConfig getRemoteTools() {
        return remoteTools;
    }

    public void setRemoteTools(RemoteToolsConfig remoteTools) {
        this.remoteTools = remoteTools != null ? remoteTools : new RemoteToolsConfig();
    }

    public ObservabilityConfig getObservability() {
        return observability;
    }

    public void setObservability(ObservabilityConfig observability) {
        this.observability = observability != null ? observability : new ObservabilityConfig();
    }

    public ContextConfig getContext() {
        return context;
    }

    public void setContext(ContextConfig context) {
        this.context = context != null ? context : new ContextConfig();
    }

    public HttpConfig getHttp() {
        return http;
    }

    public void setHttp(HttpConfig http) {
        this.http = http != null ? http : new HttpConfig();
    }
}
