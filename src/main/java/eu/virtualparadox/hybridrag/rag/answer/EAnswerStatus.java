package eu.virtualparadox.hybridrag.rag.answer;

public enum EAnswerStatus {
    ANSWERED,
    NO_CONTEXT,
    GENERATION_FAILED
}
