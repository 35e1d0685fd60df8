package eu.virtualparadox.hybridrag.application.config;

import eu.virtualparadox.hybridrag.application.executor.IngestionExecutor;
import eu.virtualparadox.hybridrag.application.executor.QuestionExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Background executors. Each runs a single worker over an unbounded queue: indexing jobs run one
 * at a time and questions share one chat model.
 * Pending jobs are drained on shutdown.
 */
@Configuration
public class ExecutorConfig {

    private final int awaitTerminationSeconds;

    public ExecutorConfig(@Value("${executor.await-termination-seconds:60}") final int awaitTerminationSeconds) {
        this.awaitTerminationSeconds = awaitTerminationSeconds;
    }

    @Bean
    public IngestionExecutor ingestionExecutor() {
        return singleWorker(new IngestionExecutor(), "ingest-");
    }

    @Bean
    public QuestionExecutor questionExecutor() {
        return singleWorker(new QuestionExecutor(), "question-");
    }

    private <T extends ThreadPoolTaskExecutor> T singleWorker(final T executor, final String threadNamePrefix) {
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
        executor.initialize();
        return executor;
    }
}
