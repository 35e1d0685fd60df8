package eu.virtualparadox.hybridrag.query.question;

import eu.virtualparadox.hybridrag.rag.answer.AnswerRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory registry of asynchronous question jobs.
 * <p>
 * Job ids are sequential from 1. Finished jobs are kept for polling; once more than
 * {@code maxFinishedJobs} have finished, the oldest finished ones are evicted. Queued and running
 * jobs are never evicted.
 */
@Slf4j
@Service
public class QuestionRegistry {

    private final AtomicLong counter = new AtomicLong(0);
    private final Map<Long, QuestionJob> jobs = new ConcurrentHashMap<>();
    private final int maxFinishedJobs;

    public QuestionRegistry(@Value("${question.max-finished-jobs:100}") final int maxFinishedJobs) {
        if (maxFinishedJobs <= 0) {
            throw new IllegalArgumentException("maxFinishedJobs must be positive");
        }
        this.maxFinishedJobs = maxFinishedJobs;
    }

    public QuestionJob createJob(final String query) {
        final long id = counter.incrementAndGet();
        final QuestionJob job = new QuestionJob(id, query);
        jobs.put(id, job);
        return job;
    }

    public Optional<QuestionJob> getJob(final long id) {
        return Optional.ofNullable(jobs.get(id));
    }

    public void updateStatus(final long id, final EQuestionStatus status) {
        jobs.computeIfPresent(id, (k, job) -> {
            job.setStatus(status);
            return job;
        });
    }

    public void complete(final long id, final AnswerRecord answer) {
        jobs.computeIfPresent(id, (k, job) -> {
            job.setAnswer(answer);
            job.finish(EQuestionStatus.COMPLETED);
            return job;
        });
        evictFinished();
    }

    public void fail(final long id, final String error) {
        jobs.computeIfPresent(id, (k, job) -> {
            job.setError(error);
            job.finish(EQuestionStatus.FAILED);
            return job;
        });
        evictFinished();
    }

    private synchronized void evictFinished() {
        final List<QuestionJob> finished = jobs.values().stream()
                .filter(QuestionJob::isDone)
                .sorted(Comparator.comparing(QuestionJob::getFinishedAt).thenComparingLong(QuestionJob::getId))
                .toList();
        final int excess = finished.size() - maxFinishedJobs;
        for (int i = 0; i < excess; i++) {
            jobs.remove(finished.get(i).getId());
        }
        if (excess > 0) {
            log.debug("Evicted {} finished question jobs", excess);
        }
    }
}
