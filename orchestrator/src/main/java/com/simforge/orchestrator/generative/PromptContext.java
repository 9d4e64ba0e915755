package com.simforge.orchestrator.generative;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Everything a generative call needs to produce structured output.
 *
 * The service is forced to answer through the single tool described here,
 * so its reply is always a JSON object matching {@code inputSchema}.
 *
 * @param system          system prompt
 * @param prompt          user prompt
 * @param toolName        name of the structured-output tool
 * @param toolDescription what the tool's input represents
 * @param inputSchema     JSON Schema of the tool input
 */
public record PromptContext(
        String   system,
        String   prompt,
        String   toolName,
        String   toolDescription,
        JsonNode inputSchema
) {}
