package com.simforge.orchestrator.generative;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Natural-language to structured-data service.
 *
 * Implementations return the raw structured output; callers validate it
 * against the schema they declared before using it.
 */
public interface GenerativeService {

    /**
     * @throws GenerativeServiceException if the service is unreachable, answers
     *         with an error status, or does not use the requested tool
     */
    JsonNode generate(PromptContext context);
}
