package com.codesniff.ingest;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import com.codesniff.error.ConfigurationException;
import com.codesniff.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    static final String URL_ENV = "CODESNIFF_EMBEDDING_URL";

    private EmbeddingServices() {
    }

    public static EmbeddingService fromConfig(AppConfig config, OkHttpClient httpClient) {
        return fromConfig(config, httpClient, System.getenv());
    }

    static EmbeddingService fromConfig(AppConfig config, OkHttpClient httpClient, Map<String, String> environment) {
        AppConfig.EmbeddingConfig embedding = config.getEmbedding();
        int dimension = config.getCorpus().getDimension();
        String endpoint = environment.getOrDefault(URL_ENV, embedding.getUrl());
        String provider = embedding.getProvider() == null ? "local" : embedding.getProvider().toLowerCase(Locale.ROOT);

        if ("local".equals(provider) && (endpoint == null || endpoint.isBlank())) {
            return new LocalModelEmbeddingService(dimension);
        }
        if (endpoint == null || endpoint.isBlank()) {
            throw new ConfigurationException("Embedding provider '" + provider + "' needs an endpoint url or " + URL_ENV);
        }
        String apiKey = embedding.getApiKeyEnv() == null ? null : environment.get(embedding.getApiKeyEnv());
        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(Duration.ofMillis(embedding.getTimeoutMs()))
                .build();
        return new ExternalProviderEmbeddingService(client, endpoint, embedding.getModel(), apiKey, dimension);
    }
}
