package com.pagesmith.orchestrator.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagesmith.orchestrator.config.PagesmithProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around an OpenAI-compatible chat-completions endpoint.
 *
 * One call = one user message in, one assistant text out. Everything that can
 * go wrong (non-200, timeout, unparseable or empty body) surfaces as an
 * {@link LlmApiException}; the generation stage treats all of them alike and
 * falls back to the template page.
 */
@Component
public class ChatCompletionsClient {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionsClient.class);

    /** One chat message; role is "system", "user" or "assistant". */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CompletionResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Choice(Message message, String finish_reason) {}

        /** Text of the first choice, or null if there is none. */
        public String firstText() {
            if (choices == null || choices.isEmpty() || choices.get(0).message() == null) {
                return null;
            }
            return choices.get(0).message().content();
        }
    }

    private final HttpClient   http;
    private final ObjectMapper json;
    private final PagesmithProperties.Llm config;

    @Autowired
    public ChatCompletionsClient(PagesmithProperties properties, ObjectMapper objectMapper) {
        this(properties.getLlm(), objectMapper, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    ChatCompletionsClient(PagesmithProperties.Llm config, ObjectMapper objectMapper, HttpClient http) {
        this.config = config;
        this.json   = objectMapper;
        this.http   = http;
    }

    public boolean isConfigured() {
        return config.isConfigured();
    }

    public String model() {
        return config.getModel();
    }

    /**
     * Send a single-prompt conversation and return the assistant's text.
     *
     * @throws LlmApiException      on any provider-side failure
     * @throws InterruptedException if the calling task is abandoned mid-call
     */
    public String complete(String prompt) throws InterruptedException {
        if (!isConfigured()) {
            throw new LlmApiException(LlmApiException.NOT_CONFIGURED, "No API key configured");
        }
        try {
            String requestBody = json.writeValueAsString(Map.of(
                    "model",    config.getModel(),
                    "messages", List.of(new Message("user", prompt))
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(config.getBaseUrl() + "/chat/completions"))
                    .timeout(config.getTimeout())
                    .header("Content-Type",  "application/json")
                    .header("Authorization", "Bearer " + config.getApiKey())
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            log.debug("Calling {} with a {}-character prompt", config.getModel(), prompt.length());
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw new LlmApiException(response.statusCode(), response.body());
            }

            String text = json.readValue(response.body(), CompletionResponse.class).firstText();
            if (text == null || text.isBlank()) {
                throw new LlmApiException(response.statusCode(), "empty completion");
            }
            return text;

        } catch (LlmApiException e) {
            throw e;
        } catch (IOException e) {
            // HttpTimeoutException is an IOException too.
            throw new LlmApiException(LlmApiException.NO_RESPONSE, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
