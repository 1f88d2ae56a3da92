package org.carball.lbs.ai;

/**
 * Completes a prompt with a language model.
 */
public interface TextGenerator {

    /**
     * @throws org.carball.lbs.exception.TextGenerationException when the model cannot be reached
     */
    String generate(String systemPrompt, String userPrompt);

    String modelName();
}
