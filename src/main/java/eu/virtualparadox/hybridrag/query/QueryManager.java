package eu.virtualparadox.hybridrag.query;

import eu.virtualparadox.hybridrag.application.executor.QuestionExecutor;
import eu.virtualparadox.hybridrag.query.question.QuestionJob;
import eu.virtualparadox.hybridrag.query.question.QuestionRegistry;
import eu.virtualparadox.hybridrag.rag.answer.AnswerRecord;
import eu.virtualparadox.hybridrag.rag.answer.AnswerService;
import eu.virtualparadox.hybridrag.rag.retriever.model.FusedResult;
import eu.virtualparadox.hybridrag.rag.retriever.model.SearchStats;
import eu.virtualparadox.hybridrag.rag.retriever.service.HybridRetrieverService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

import static eu.virtualparadox.hybridrag.query.question.EQuestionStatus.*;

/**
 * Entry point for questions: hybrid retrieval followed by answer generation, either inline
 * ({@link #ask(String)}) or as a tracked job on the question executor ({@link #submitQuery(String)}).
 */
@Slf4j
@Service
public class QueryManager {

    private final HybridRetrieverService retrieverService;
    private final AnswerService answerService;
    private final QuestionRegistry registry;
    private final QuestionExecutor questionExecutor;
    private final int topK;

    public QueryManager(final HybridRetrieverService retrieverService,
                        final AnswerService answerService,
                        final QuestionRegistry registry,
                        final QuestionExecutor questionExecutor,
                        @Value("${search.top-k:5}") final int topK) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }
        this.retrieverService = retrieverService;
        this.answerService = answerService;
        this.registry = registry;
        this.questionExecutor = questionExecutor;
        this.topK = topK;
    }

    /**
     * Answers a question synchronously.
     *
     * @param question user question
     * @return the answer; a no-context answer for blank questions or when nothing matches
     */
    public AnswerRecord ask(final String question) {
        final List<FusedResult> results = retrieverService.search(question, topK);
        printDebugRetrieved(results);
        return answerService.answer(question, results);
    }

    /**
     * Queues a question and returns its job immediately.
     *
     * @param question user question
     * @return job to poll through {@link #getJob(long)}
     */
    public QuestionJob submitQuery(final String question) {
        final QuestionJob job = registry.createJob(question);
        questionExecutor.submit(() -> process(job));
        return job;
    }

    public Optional<QuestionJob> getJob(final long jobId) {
        return registry.getJob(jobId);
    }

    public SearchStats stats() {
        return retrieverService.stats();
    }

    private void process(final QuestionJob job) {
        try {
            registry.updateStatus(job.getId(), RETRIEVING);
            final List<FusedResult> results = retrieverService.search(job.getQuery(), topK);
            printDebugRetrieved(results);

            registry.updateStatus(job.getId(), ANSWERING);
            final AnswerRecord answer = answerService.answer(job.getQuery(), results);
            log.info("Job {} answered with status {}", job.getId(), answer.status());

            registry.complete(job.getId(), answer);
        } catch (Exception ex) {
            log.error("Job {} failed", job.getId(), ex);
            registry.fail(job.getId(), ex.getMessage());
        }
    }

    private void printDebugRetrieved(final List<FusedResult> results) {
        if (!log.isDebugEnabled()) {
            return;
        }
        final StringBuilder sb = new StringBuilder();
        for (final FusedResult r : results) {
            sb.append(" - ").append("[").append(r.combinedScore()).append(", ").append(r.source()).append("] ")
                    .append(r.filename()).append("#").append(r.chunkId()).append(": ").append(r.text()).append("\n");
        }
        // debug only, chunk texts are large
        log.debug(" !!! Retrieved chunks:\n{}", sb);
    }
}
