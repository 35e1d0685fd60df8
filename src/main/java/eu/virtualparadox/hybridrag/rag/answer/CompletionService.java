package eu.virtualparadox.hybridrag.rag.answer;

/**
 * Text generation backend used to write answers.
 */
public interface CompletionService {

    /**
     * @param systemPrompt instructions
     * @param userPrompt   question and sources
     * @return generated text, may be blank
     * @throws RuntimeException if the model cannot be reached
     */
    String complete(final String systemPrompt, final String userPrompt);
}
