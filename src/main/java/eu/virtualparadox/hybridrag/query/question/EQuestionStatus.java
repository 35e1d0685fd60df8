package eu.virtualparadox.hybridrag.query.question;

public enum EQuestionStatus {
    QUEUED,
    RETRIEVING,
    ANSWERING,
    COMPLETED,
    FAILED
}
