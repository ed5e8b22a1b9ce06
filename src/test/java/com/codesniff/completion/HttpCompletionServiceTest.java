package com.codesniff.completion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.codesniff.error.ProviderException;
import com.codesniff.runtime.AppConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

class HttpCompletionServiceTest {
    private MockWebServer server;
    private HttpCompletionService service;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        service = new HttpCompletionService(new OkHttpClient(), server.url("/v1/chat/completions").toString(),
                "code-chat", "secret", 0.3, 256);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void shouldSendSystemHistoryAndPromptInOrder() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                {"choices": [{"message": {"role": "assistant", "content": "Use authenticate_user."}}]}
                """));

        String answer = service.complete("Question: how do I log in?",
                List.of(ChatMessage.user("hi"), ChatMessage.assistant("hello")));

        assertEquals("Use authenticate_user.", answer);
        RecordedRequest request = server.takeRequest();
        assertEquals("Bearer secret", request.getHeader("Authorization"));
        JsonNode body = new ObjectMapper().readTree(request.getBody().readUtf8());
        assertEquals("code-chat", body.path("model").asText());
        assertEquals(256, body.path("max_tokens").asInt());
        assertEquals(false, body.path("stream").asBoolean());
        JsonNode messages = body.path("messages");
        assertEquals(4, messages.size());
        assertEquals("system", messages.path(0).path("role").asText());
        assertEquals("hi", messages.path(1).path("content").asText());
        assertEquals("assistant", messages.path(2).path("role").asText());
        assertEquals("Question: how do I log in?", messages.path(3).path("content").asText());
    }

    @Test
    void shouldFailOnHttpError() {
        server.enqueue(new MockResponse().setResponseCode(429));

        ProviderException error = assertThrows(ProviderException.class, () -> service.complete("hi", List.of()));
        assertTrue(error.getMessage().contains("429"));
    }

    @Test
    void shouldFailWhenResponseHasNoContent() {
        server.enqueue(new MockResponse().setBody("{\"choices\": []}"));

        assertThrows(ProviderException.class, () -> service.complete("hi", List.of()));
    }

    @Test
    void shouldFailWhenResponseIsNotJson() {
        server.enqueue(new MockResponse().setBody("<html>bad gateway</html>"));

        assertThrows(ProviderException.class, () -> service.complete("hi", List.of()));
    }

    @Test
    void shouldChooseHttpClientOnlyWhenEndpointIsConfigured() {
        AppConfig config = new AppConfig();

        assertInstanceOf(ExtractiveCompletionService.class,
                CompletionServices.fromConfig(config, new OkHttpClient(), Map.of()));
        assertInstanceOf(HttpCompletionService.class, CompletionServices.fromConfig(config, new OkHttpClient(),
                Map.of(CompletionServices.URL_ENV, server.url("/v1/chat/completions").toString())));
    }
}
