package com.askbetter.core.llm;

import com.askbetter.core.model.GenerationSettings;

/**
 * Entry point to the external generation capability.
 */
public interface GenerationGateway {

    /**
     * Opens an exchange for one generation attempt.
     *
     * @param question     the user's question, sent verbatim
     * @param instructions rubric plus any corrective feedback from earlier attempts
     * @param settings     model selection and determinism controls
     */
    GenerationExchange open(String question, String instructions, GenerationSettings settings);
}
