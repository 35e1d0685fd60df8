package eu.virtualparadox.hybridrag.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Single-worker executor for document indexing jobs.
 */
public class IngestionExecutor extends ThreadPoolTaskExecutor {
}
