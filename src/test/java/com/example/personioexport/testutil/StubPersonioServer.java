package com.example.personioexport.testutil;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process HTTP server standing in for the Personio API.
 * <p>
 * Responses are registered per request path. Queued responses are served first, in order; once a
 * path's queue is empty its fixed response (if any) is served. {@code /v1/auth} issues numbered
 * tokens ({@code token-1}, {@code token-2}, ...) unless a response is registered for it.
 * Every request is recorded.
 */
public final class StubPersonioServer implements AutoCloseable {

    public static final String AUTH_PATH = "/v1/auth";

    private final HttpServer server;
    private final ExecutorService executor;
    private final Map<String, Deque<StubResponse>> queued = new ConcurrentHashMap<>();
    private final Map<String, StubResponse> fixed = new ConcurrentHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger tokensIssued = new AtomicInteger();
    private volatile Duration authDelay = Duration.ZERO;

    private StubPersonioServer(HttpServer server, ExecutorService executor) {
        this.server = server;
        this.executor = executor;
    }

    /**
     * Starts a server on an ephemeral loopback port.
     *
     * @return running server
     * @throws IOException when the port cannot be bound
     */
    public static StubPersonioServer start() throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        ExecutorService executor = Executors.newCachedThreadPool();
        StubPersonioServer stub = new StubPersonioServer(server, executor);
        server.createContext("/", stub::handle);
        server.setExecutor(executor);
        server.start();
        return stub;
    }

    public String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    public StubPersonioServer enqueue(String path, StubResponse response) {
        queued.computeIfAbsent(path, key -> new ArrayDeque<>()).add(response);
        return this;
    }

    public StubPersonioServer always(String path, StubResponse response) {
        fixed.put(path, response);
        return this;
    }

    /**
     * Delays every token issued by the default auth handler.
     */
    public void delayAuth(Duration delay) {
        this.authDelay = delay;
    }

    public List<RecordedRequest> requests() {
        return List.copyOf(requests);
    }

    public List<RecordedRequest> requests(String path) {
        return requests.stream().filter(request -> request.path().equals(path)).toList();
    }

    public int authRequests() {
        return requests(AUTH_PATH).size();
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            String path = exchange.getRequestURI().getPath();
            byte[] requestBody = exchange.getRequestBody().readAllBytes();
            requests.add(new RecordedRequest(
                    exchange.getRequestMethod(),
                    path,
                    exchange.getRequestURI().getRawQuery(),
                    exchange.getRequestHeaders().getFirst("Authorization"),
                    new String(requestBody, StandardCharsets.UTF_8)));

            StubResponse response = nextResponse(path);
            response.headers().forEach((name, value) -> exchange.getResponseHeaders().add(name, value));
            byte[] body = response.body();
            exchange.sendResponseHeaders(response.status(), body.length == 0 ? -1 : body.length);
            if (body.length > 0) {
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(body);
                }
            }
        } finally {
            exchange.close();
        }
    }

    private StubResponse nextResponse(String path) {
        Deque<StubResponse> queue = queued.get(path);
        if (queue != null) {
            synchronized (queue) {
                StubResponse response = queue.poll();
                if (response != null) {
                    return response;
                }
            }
        }
        StubResponse response = fixed.get(path);
        if (response != null) {
            return response;
        }
        if (AUTH_PATH.equals(path)) {
            return issueToken();
        }
        return StubResponse.json(404, "{\"success\":false,\"error\":{\"message\":\"no stub for " + path + "\"}}");
    }

    private StubResponse issueToken() {
        if (!authDelay.isZero()) {
            try {
                Thread.sleep(authDelay.toMillis());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
        int number = tokensIssued.incrementAndGet();
        return StubResponse.json(200, "{\"success\":true,\"data\":{\"token\":\"token-" + number + "\"}}");
    }

    /**
     * Canned HTTP response.
     */
    public record StubResponse(int status, Map<String, String> headers, byte[] body) {

        public static StubResponse json(int status, String body) {
            return new StubResponse(status, Map.of("Content-Type", "application/json"),
                    body.getBytes(StandardCharsets.UTF_8));
        }

        public static StubResponse bytes(int status, byte[] body) {
            return new StubResponse(status, Map.of("Content-Type", "application/octet-stream"), body);
        }

        public static StubResponse empty(int status) {
            return new StubResponse(status, Map.of(), new byte[0]);
        }

        public StubResponse withHeader(String name, String value) {
            Map<String, String> copy = new LinkedHashMap<>(headers);
            copy.put(name, value);
            return new StubResponse(status, copy, body);
        }
    }

    /**
     * Request as seen by the stub.
     */
    public record RecordedRequest(String method, String path, String rawQuery, String authorization, String body) {

        /**
         * @return decoded query parameters, last value wins
         */
        public Map<String, String> queryParams() {
            Map<String, String> params = new LinkedHashMap<>();
            if (rawQuery == null || rawQuery.isEmpty()) {
                return params;
            }
            for (String pair : rawQuery.split("&")) {
                int separator = pair.indexOf('=');
                String name = separator < 0 ? pair : pair.substring(0, separator);
                String value = separator < 0 ? "" : pair.substring(separator + 1);
                params.put(URLDecoder.decode(name, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
            }
            return params;
        }
    }
}
