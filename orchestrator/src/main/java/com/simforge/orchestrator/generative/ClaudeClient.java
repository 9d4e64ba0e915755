package com.simforge.orchestrator.generative;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link GenerativeService} backed by the Anthropic Messages API.
 *
 * Structured output uses tool calling: the request declares one tool and
 * forces the model to call it ({@code tool_choice}), and the tool's
 * {@code input} object is returned as-is.
 *
 * Raw {@link HttpClient} rather than an SDK: the endpoint is a plain JSON POST
 * and we want every header and byte on the wire visible when debugging.
 * Retries are not done here; the orchestrator owns retry decisions.
 */
@Component
public class ClaudeClient implements GenerativeService {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    /** The subset of the API response we care about. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content, String stop_reason) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String name, JsonNode input, String text) {}
    }

    private static final String API_URL = "https://api.anthropic.com/v1/messages";
    private static final String API_VER = "2023-06-01";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       model;
    private final int          maxTokens;
    private final Duration     requestTimeout;

    public ClaudeClient(@Value("${anthropic.api-key:}") String apiKey,
                        @Value("${anthropic.model:claude-sonnet-4-5}") String model,
                        @Value("${anthropic.max-tokens:2000}") int maxTokens,
                        @Value("${simforge.timeouts.generative:60s}") Duration requestTimeout,
                        ObjectMapper objectMapper) {
        this.apiKey         = apiKey;
        this.model          = model;
        this.maxTokens      = maxTokens;
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public JsonNode generate(PromptContext context) {
        if (!isConfigured()) {
            throw new GenerativeServiceException(401, "anthropic.api-key is not configured");
        }
        try {
            Map<String, Object> tool = new LinkedHashMap<>();
            tool.put("name",         context.toolName());
            tool.put("description",  context.toolDescription());
            tool.put("input_schema", context.inputSchema());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model",       model);
            body.put("max_tokens",  maxTokens);
            body.put("system",      context.system());
            body.put("tools",       List.of(tool));
            body.put("tool_choice", Map.of("type", "tool", "name", context.toolName()));
            body.put("messages",    List.of(Map.of("role", "user", "content", context.prompt())));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(API_URL))
                    .timeout(requestTimeout)
                    .header("content-type",      "application/json")
                    .header("x-api-key",         apiKey)
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new GenerativeServiceException(response.statusCode(), response.body());
            }

            MessagesResponse parsed = json.readValue(response.body(), MessagesResponse.class);
            JsonNode input = toolInput(parsed, context.toolName());
            log.debug("Tool '{}' answered ({} top-level fields)", context.toolName(), input.size());
            return input;

        } catch (GenerativeServiceException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerativeServiceException("Generative call interrupted", e);
        } catch (Exception e) {
            throw new GenerativeServiceException("Generative call failed: " + e.getMessage(), e);
        }
    }

    private static JsonNode toolInput(MessagesResponse response, String toolName) {
        if (response.content() == null) {
            throw new GenerativeServiceException(200, "response has no content blocks");
        }
        return response.content().stream()
                .filter(b -> "tool_use".equals(b.type()) && toolName.equals(b.name()))
                .map(MessagesResponse.ContentBlock::input)
                .filter(input -> input != null && input.isObject())
                .findFirst()
                .orElseThrow(() -> new GenerativeServiceException(200,
                        "model did not call tool '" + toolName + "' (stop_reason="
                        + response.stop_reason() + ")"));
    }
}
