package com.quoteflow.extraction;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.quoteflow.runtime.AppConfig;
import com.quoteflow.runtime.ServiceUnavailableException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import okhttp3.OkHttpClient;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpLlmExtractionServiceTest {
    private final CountDownLatch entered = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);
    private final ExecutorService handlers = Executors.newCachedThreadPool();
    private HttpServer server;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/fast", exchange -> respond(exchange, "{\"text\": \"{\\\"psi\\\": \\\"80\\\"}\"}"));
        server.createContext("/slow", exchange -> {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, "{\"text\": \"late\"}");
        });
        server.setExecutor(handlers);
        server.start();
    }

    @AfterEach
    void stopServer() {
        release.countDown();
        server.stop(0);
        handlers.shutdownNow();
    }

    @Test
    void shouldSizeClientTimeoutsFromConfiguredCallTimeout() {
        AppConfig.LlmConfig llm = new AppConfig.LlmConfig();

        OkHttpClient client = HttpLlmExtractionService.httpClient(llm, 8);

        assertEquals(60_000, client.callTimeoutMillis());
        assertEquals(60_000, client.readTimeoutMillis());
        assertEquals(8, client.dispatcher().getMaxRequestsPerHost());
    }

    @Test
    void shouldReturnAnswerText() {
        HttpLlmExtractionService service = service("/fast", 5_000);

        assertEquals("{\"psi\": \"80\"}", service.complete(request()));
    }

    @Test
    void shouldFailTransientlyWhenModelIsSlowerThanTimeout() {
        HttpLlmExtractionService service = service("/slow", 200);
        long started = System.nanoTime();

        ServiceUnavailableException error = assertThrows(ServiceUnavailableException.class,
                () -> service.complete(request()));

        assertTrue(error.isTransientFailure());
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) < 5_000);
    }

    @Test
    void shouldCancelCallWhenCallerIsInterrupted() throws Exception {
        HttpLlmExtractionService service = service("/slow", 30_000);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread caller = new Thread(() -> {
            try {
                service.complete(request());
            } catch (RuntimeException e) {
                failure.set(e);
            }
        });

        caller.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        caller.interrupt();
        caller.join(5_000);

        assertFalse(caller.isAlive());
        ServiceUnavailableException error = assertInstanceOf(ServiceUnavailableException.class, failure.get());
        assertFalse(error.isTransientFailure());
    }

    private HttpLlmExtractionService service(String path, int timeoutMs) {
        AppConfig.LlmConfig llm = new AppConfig.LlmConfig();
        llm.setTimeoutMs(timeoutMs);
        String endpoint = "http://127.0.0.1:" + server.getAddress().getPort() + path;
        return new HttpLlmExtractionService(HttpLlmExtractionService.httpClient(llm, 1), endpoint, null, "test-model", 0.1);
    }

    private static ExtractionRequest request() {
        return new ExtractionRequest("batch-001", "prompt", List.of("psi"), false);
    }

    private static void respond(HttpExchange exchange, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
