package com.codesniff.completion;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codesniff.error.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * OpenAI-compatible chat completions client.
 */
public class HttpCompletionService implements CompletionService {
    private static final Logger log = LoggerFactory.getLogger(HttpCompletionService.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final double temperature;
    private final int maxTokens;

    public HttpCompletionService(OkHttpClient httpClient,
            String endpoint,
            String model,
            String apiKey,
            double temperature,
            int maxTokens) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    @Override
    public String complete(String prompt, List<ChatMessage> history) {
        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(message("system", PromptBuilder.SYSTEM_PROMPT));
        for (ChatMessage turn : history) {
            messages.add(message(turn.role(), turn.content()));
        }
        messages.add(message("user", prompt));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("temperature", temperature);
        body.put("max_tokens", maxTokens);
        body.put("stream", false);

        try {
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(mapper.writeValueAsString(body), JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            log.debug("completion.request model={} messages={}", model, messages.size());
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                if (!response.isSuccessful() || response.body() == null) {
                    throw new ProviderException("Completion service answered HTTP " + response.code());
                }
                JsonNode content = mapper.readTree(response.body().string())
                        .path("choices").path(0).path("message").path("content");
                if (!content.isTextual()) {
                    throw new ProviderException("Completion response carries no message content");
                }
                return content.asText();
            }
        } catch (IOException e) {
            throw new ProviderException("Completion service unreachable at " + endpoint, e);
        }
    }

    private static Map<String, String> message(String role, String content) {
        Map<String, String> message = new LinkedHashMap<>();
        message.put("role", role);
        message.put("content", content);
        return message;
    }
}
