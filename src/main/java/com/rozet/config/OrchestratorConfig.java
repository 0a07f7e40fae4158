package com.rozet.config;

import com.rozet.locking.FileLockManager;
import com.rozet.observability.ObservabilityClient;
import com.rozet.orchestration.Coordinator;
import com.rozet.orchestration.api.CompletionService;
import com.rozet.orchestration.api.EventProcessingService;
import com.rozet.orchestration.service.OrchestrationMetricsService;
import com.rozet.orchestration.service.OrchestrationPromptService;
import com.rozet.tools.RemoteToolClient;
import com.rozet.worker.LocalWorker;
import com.rozet.worker.RemoteToolActionExecutor;
import com.rozet.worker.RemoteToolWorker;
import com.rozet.worker.ResultVerifier;
import com.rozet.worker.ToolUsageVerifier;
import com.rozet.worker.Worker;
import com.rozet.worker.WorkerPipeline;
import com.rozet.worker.WorkerResponseParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.client.RestClient;

@Configuration
@Slf4j
public class OrchestratorConfig {

    @Bean
    @Primary
    public ChatClient chatClient(GoogleGenAiChatModel googleGenAiChatModel) {
        return ChatClient.builder(googleGenAiChatModel).build();
    }

    @Bean
    public ChatClient openAiChatClient(ObjectProvider<OpenAiChatModel> openAiChatModelProvider) {
        return openAiChatModelProvider.getIfAvailable() != null
                ? ChatClient.builder(openAiChatModelProvider.getIfAvailable()).build()
                : null;
    }

    @Bean
    public FileLockManager fileLockManager(RozetProperties properties) {
        return new FileLockManager(properties.getLocks().getPollInterval());
    }

    @Bean
    public RemoteToolClient remoteToolClient(RestClient.Builder restClientBuilder, RozetProperties properties) {
        restClientBuilder.requestFactory(RestClientConfig.requestFactory(
                properties.getHttp().getConnectTimeout(), properties.getRemoteTools().getTimeout()));
        return new RemoteToolClient(restClientBuilder, properties);
    }

    @Bean
    public ObservabilityClient observabilityClient(RestClient.Builder restClientBuilder, RozetProperties properties) {
        RozetProperties.ObservabilityConfig observability = properties.getObservability();
        restClientBuilder.requestFactory(RestClientConfig.requestFactory(
                observability.getTimeout(), observability.getTimeout()));
        return new ObservabilityClient(restClientBuilder, properties);
    }

    @Bean
    public WorkerPipeline workerPipeline(CompletionService completionService,
                                         OrchestrationPromptService promptService,
                                         WorkerResponseParser responseParser,
                                         ResultVerifier resultVerifier,
                                         OrchestrationMetricsService metricsService,
                                         RozetProperties properties) {
        return new WorkerPipeline(completionService, promptService, responseParser, resultVerifier,
                metricsService, properties.getWorker().isVerifyOutputs());
    }

    @Bean
    public Worker worker(WorkerPipeline workerPipeline, RemoteToolClient remoteToolClient, RozetProperties properties) {
        RozetProperties.WorkerConfig config = properties.getWorker();
        if (config.getType() == RozetProperties.WorkerType.REMOTE) {
            if (!remoteToolClient.isConfigured()) {
                log.warn("Remote worker selected without rozet.remote-tools.base-url; tool actions will run locally.");
            }
            return new RemoteToolWorker(workerPipeline,
                    new RemoteToolActionExecutor(remoteToolClient, config.getBashTimeout()));
        }
        return new LocalWorker(workerPipeline, new ToolUsageVerifier(config.getBashTimeout()));
    }

    @Bean
    public Coordinator coordinator(Worker worker,
                                   FileLockManager fileLockManager,
                                   EventProcessingService eventProcessingService,
                                   OrchestrationMetricsService metricsService,
                                   RozetProperties properties) {
        RozetProperties.LocksConfig locks = properties.getLocks();
        return new Coordinator(worker, fileLockManager, eventProcessingService, metricsService,
                locks.getAcquireTimeout(), locks.getExpiry());
    }
}
