package com.linlay.agentgateway.support;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * In-process stand-in for the agent service. Each path answers with a scripted reply and
 * records what it received.
 */
public final class StubAgentServer implements AutoCloseable {

    private final HttpServer server;
    private final ExecutorService executor;
    private final Map<String, Reply> replies = new ConcurrentHashMap<>();
    private final List<Captured> captured = new CopyOnWriteArrayList<>();

    private StubAgentServer(HttpServer server, ExecutorService executor) {
        this.server = server;
        this.executor = executor;
    }

    public static StubAgentServer start(String... paths) {
        try {
            HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
            ExecutorService executor = Executors.newCachedThreadPool();
            server.setExecutor(executor);
            StubAgentServer stub = new StubAgentServer(server, executor);
            for (String path : paths) {
                server.createContext(path, stub::handle);
            }
            server.start();
            return stub;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to start stub agent server", ex);
        }
    }

    public String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    public void reply(String path, int status, String body) {
        replies.put(path, new Reply(status, body, 0L));
    }

    public void replySlowly(String path, int status, String body, long delayMs) {
        replies.put(path, new Reply(status, body, delayMs));
    }

    public List<Captured> requests(String path) {
        return captured.stream().filter(request -> request.path().equals(path)).toList();
    }

    public int totalRequests() {
        return captured.size();
    }

    public void reset() {
        replies.clear();
        captured.clear();
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String contentType = exchange.getRequestHeaders().getFirst("Content-Type");
        captured.add(new Captured(path, exchange.getRequestMethod(), contentType, readBody(exchange.getRequestBody())));

        Reply reply = replies.getOrDefault(path, new Reply(404, "{\"detail\":\"Not Found\"}", 0L));
        if (reply.delayMs() > 0) {
            try {
                Thread.sleep(reply.delayMs());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                exchange.close();
                return;
            }
        }
        byte[] bytes = reply.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        try {
            exchange.sendResponseHeaders(reply.status(), bytes.length);
            try (OutputStream output = exchange.getResponseBody()) {
                output.write(bytes);
            }
        } catch (IOException ex) {
            // the gateway already gave up on this call
            exchange.close();
        }
    }

    private String readBody(InputStream inputStream) throws IOException {
        try (InputStream input = inputStream; ByteArrayOutputStream output = new ByteArrayOutputStream()) {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = input.read(buffer)) >= 0) {
                output.write(buffer, 0, read);
            }
            return output.toString(StandardCharsets.ISO_8859_1);
        }
    }

    public record Captured(String path, String method, String contentType, String body) {
    }

    private record Reply(int status, String body, long delayMs) {
    }
}
