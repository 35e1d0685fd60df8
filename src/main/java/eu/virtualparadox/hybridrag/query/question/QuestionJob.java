package eu.virtualparadox.hybridrag.query.question;

import eu.virtualparadox.hybridrag.rag.answer.AnswerRecord;

import java.time.Instant;

/**
 * Mutable state of an asynchronous question. Updated only through {@link QuestionRegistry}.
 */
public class QuestionJob {
    private final long id;
    private final String query;
    private final Instant createdAt;
    private volatile EQuestionStatus status;
    private volatile AnswerRecord answer;
    private volatile String error;
    private volatile Instant finishedAt;

    public QuestionJob(long id, String query) {
        this.id = id;
        this.query = query;
        this.status = EQuestionStatus.QUEUED;
        this.createdAt = Instant.now();
    }

    public long getId() { return id; }
    public String getQuery() { return query; }
    public EQuestionStatus getStatus() { return status; }
    /** @return the answer once {@link EQuestionStatus#COMPLETED}, otherwise {@code null} */
    public AnswerRecord getAnswer() { return answer; }
    /** @return the failure message once {@link EQuestionStatus#FAILED}, otherwise {@code null} */
    public String getError() { return error; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getFinishedAt() { return finishedAt; }

    public boolean isDone() {
        return status == EQuestionStatus.COMPLETED || status == EQuestionStatus.FAILED;
    }

    void setStatus(EQuestionStatus status) { this.status = status; }
    void setAnswer(AnswerRecord answer) { this.answer = answer; }
    void setError(String error) { this.error = error; }

    void finish(EQuestionStatus terminal) {
        this.finishedAt = Instant.now();
        this.status = terminal;
    }
}
