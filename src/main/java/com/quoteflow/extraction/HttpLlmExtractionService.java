package com.quoteflow.extraction;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quoteflow.runtime.AppConfig;
import com.quoteflow.runtime.ServiceUnavailableException;

import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Dispatcher;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * JSON-over-HTTP model client. Posts {@code {model, temperature, prompt, responseFormat}} and
 * reads the answer from {@code text}, {@code output} or the first candidate part.
 *
 * <p>Interrupting the calling thread cancels the HTTP call.
 */
public class HttpLlmExtractionService implements LlmExtractionService {
    private static final Logger log = LoggerFactory.getLogger(HttpLlmExtractionService.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String apiKey;
    private final String model;
    private final double temperature;

    public HttpLlmExtractionService(OkHttpClient httpClient, String endpoint, String apiKey, String model, double temperature) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("LLM endpoint must be configured");
        }
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.model = model;
        this.temperature = temperature;
    }

    /**
     * Client whose call and read timeouts follow {@code llm.timeoutMs}, with room for one request per
     * extraction worker.
     */
    public static OkHttpClient httpClient(AppConfig.LlmConfig llm, int workers) {
        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequests(Math.max(dispatcher.getMaxRequests(), workers));
        dispatcher.setMaxRequestsPerHost(Math.max(dispatcher.getMaxRequestsPerHost(), workers));
        Duration timeout = Duration.ofMillis(llm.getTimeoutMs());
        return new OkHttpClient.Builder()
                .dispatcher(dispatcher)
                .callTimeout(timeout)
                .readTimeout(timeout)
                .build();
    }

    public static HttpLlmExtractionService fromEnvironment(OkHttpClient httpClient, String model, double temperature) {
        String endpoint = System.getenv("QUOTEFLOW_LLM_URL");
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalStateException("QUOTEFLOW_LLM_URL is not set");
        }
        return new HttpLlmExtractionService(httpClient, endpoint, System.getenv("QUOTEFLOW_LLM_API_KEY"), model, temperature);
    }

    @Override
    public String complete(ExtractionRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("temperature", temperature);
        payload.put("prompt", request.prompt());
        payload.put("responseFormat", "json");
        try {
            Request.Builder builder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(mapper.writeValueAsString(payload), JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                builder.header("Authorization", "Bearer " + apiKey);
            }
            try (Response response = await(httpClient.newCall(builder.build()), request)) {
                if (!response.isSuccessful() || response.body() == null) {
                    boolean transientFailure = response.code() == 429 || response.code() >= 500;
                    throw new ServiceUnavailableException(
                            "LLM service returned HTTP " + response.code() + " for " + request.batchId(), transientFailure);
                }
                String body = response.body().string();
                log.debug("llm.response batch={} repair={} chars={}", request.batchId(), request.repair(), body.length());
                return extractText(body);
            }
        } catch (IOException e) {
            throw new ServiceUnavailableException("LLM service unreachable for " + request.batchId(), true, e);
        }
    }

    private static Response await(Call call, ExtractionRequest request) throws IOException {
        CompletableFuture<Response> pending = new CompletableFuture<>();
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failed, IOException e) {
                pending.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call answered, Response response) {
                if (!pending.complete(response)) {
                    response.close();
                }
            }
        });
        try {
            return pending.get();
        } catch (InterruptedException e) {
            call.cancel();
            pending.cancel(false);
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException("LLM call for " + request.batchId() + " cancelled", false, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IOException io) {
                throw io;
            }
            throw new ServiceUnavailableException("LLM call for " + request.batchId() + " failed", false, e.getCause());
        }
    }

    @Override
    public String modelName() {
        return model;
    }

    private String extractText(String body) {
        try {
            JsonNode root = mapper.readTree(body);
            if (root.hasNonNull("text")) {
                return root.get("text").asText();
            }
            if (root.hasNonNull("output")) {
                return root.get("output").asText();
            }
            JsonNode part = root.path("candidates").path(0).path("content").path("parts").path(0).path("text");
            if (part.isTextual()) {
                return part.asText();
            }
        } catch (IOException e) {
            log.debug("llm.response.not-json chars={}", body.length());
        }
        return body;
    }
}
