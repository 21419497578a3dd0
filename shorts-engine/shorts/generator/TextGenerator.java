package shorts.generator;

/**
 * A language model behind a prompt interface.
 */
public interface TextGenerator {

    /**
     * Asks for output shaped as {@code resultType} (structured output).
     */
    <T> T generate(String systemPrompt, String userPrompt, Class<T> resultType);

    /**
     * Free-form completion, trimmed.
     */
    String complete(String systemPrompt, String userPrompt);
}
