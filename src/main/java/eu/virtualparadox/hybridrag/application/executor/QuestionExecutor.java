package eu.virtualparadox.hybridrag.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Single-worker executor for asynchronous question jobs.
 */
public class QuestionExecutor extends ThreadPoolTaskExecutor {
}
