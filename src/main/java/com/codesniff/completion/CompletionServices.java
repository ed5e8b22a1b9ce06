package com.codesniff.completion;

import java.time.Duration;
import java.util.Map;

import com.codesniff.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class CompletionServices {
    static final String URL_ENV = "CODESNIFF_COMPLETION_URL";

    private CompletionServices() {
    }

    public static CompletionService fromConfig(AppConfig config, OkHttpClient httpClient) {
        return fromConfig(config, httpClient, System.getenv());
    }

    static CompletionService fromConfig(AppConfig config, OkHttpClient httpClient, Map<String, String> environment) {
        AppConfig.CompletionConfig completion = config.getCompletion();
        String endpoint = environment.getOrDefault(URL_ENV, completion.getUrl());
        if (endpoint == null || endpoint.isBlank()) {
            return new ExtractiveCompletionService(completion.getMaxTokens());
        }
        String apiKey = completion.getApiKeyEnv() == null ? null : environment.get(completion.getApiKeyEnv());
        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(Duration.ofMillis(completion.getTimeoutMs()))
                .build();
        return new HttpCompletionService(client, endpoint, completion.getModel(), apiKey,
                completion.getTemperature(), completion.getMaxTokens());
    }
}
