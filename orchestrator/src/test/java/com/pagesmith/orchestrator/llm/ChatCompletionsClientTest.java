package com.pagesmith.orchestrator.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagesmith.orchestrator.config.PagesmithProperties;
import com.pagesmith.orchestrator.support.HttpStubs;
import com.pagesmith.orchestrator.support.HttpStubs.StubResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChatCompletionsClientTest {

    @Mock HttpClient http;

    ObjectMapper json = new ObjectMapper();
    PagesmithProperties.Llm config;
    ChatCompletionsClient client;

    @BeforeEach
    void setUp() {
        config = new PagesmithProperties.Llm();
        config.setBaseUrl("https://llm.test/v1");
        config.setApiKey("sk-test");
        config.setModel("test-model");
        config.setTimeout(Duration.ofSeconds(5));
        client = new ChatCompletionsClient(config, json, http);
    }

    @Test
    void complete_sendsSingleUserMessage_andReturnsFirstChoice() throws Exception {
        doReturn(new StubResponse(200, """
                {"choices":[{"message":{"role":"assistant","content":"<html>hi</html>"},"finish_reason":"stop"}]}"""))
                .when(http).send(any(), any());

        String text = client.complete("make a page");

        assertThat(text).isEqualTo("<html>hi</html>");
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http).send(captor.capture(), any());
        HttpRequest req = captor.getValue();
        assertThat(req.uri().toString()).isEqualTo("https://llm.test/v1/chat/completions");
        assertThat(req.headers().firstValue("Authorization")).contains("Bearer sk-test");
        assertThat(req.timeout()).contains(Duration.ofSeconds(5));

        JsonNode body = json.readTree(HttpStubs.bodyOf(req));
        assertThat(body.get("model").asText()).isEqualTo("test-model");
        assertThat(body.get("messages")).hasSize(1);
        assertThat(body.get("messages").get(0).get("role").asText()).isEqualTo("user");
        assertThat(body.get("messages").get(0).get("content").asText()).isEqualTo("make a page");
    }

    @Test
    void errorStatus_becomesLlmApiException() throws Exception {
        doReturn(new StubResponse(429, "{\"error\":\"rate limited\"}")).when(http).send(any(), any());

        assertThatThrownBy(() -> client.complete("p"))
                .isInstanceOf(LlmApiException.class)
                .matches(e -> ((LlmApiException) e).statusCode() == 429)
                .hasMessageContaining("LLM API error 429");
    }

    @Test
    void emptyChoices_becomeLlmApiException() throws Exception {
        doReturn(new StubResponse(200, "{\"choices\":[]}")).when(http).send(any(), any());

        assertThatThrownBy(() -> client.complete("p"))
                .isInstanceOf(LlmApiException.class)
                .matches(e -> ((LlmApiException) e).statusCode() == 200);
    }

    @Test
    void timeout_keepsTheCause() throws Exception {
        doThrow(new HttpTimeoutException("request timed out")).when(http).send(any(), any());

        assertThatThrownBy(() -> client.complete("p"))
                .isInstanceOf(LlmApiException.class)
                .hasCauseInstanceOf(HttpTimeoutException.class)
                .matches(e -> ((LlmApiException) e).statusCode() == LlmApiException.NO_RESPONSE);
    }

    @Test
    void withoutApiKey_failsWithoutCalling() throws Exception {
        config.setApiKey("");

        assertThat(client.isConfigured()).isFalse();
        assertThatThrownBy(() -> client.complete("p"))
                .isInstanceOf(LlmApiException.class)
                .matches(e -> ((LlmApiException) e).statusCode() == LlmApiException.NOT_CONFIGURED);
        verify(http, never()).send(any(), any());
    }
}
