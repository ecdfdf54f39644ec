package com.linlay.agentgateway.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentgateway.model.BinaryPayload;
import com.linlay.agentgateway.model.Capability;
import com.linlay.agentgateway.service.ErrorKind;
import com.linlay.agentgateway.service.GatewayException;
import com.linlay.agentgateway.support.StubAgentServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Disposable;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentClientTest {

    private StubAgentServer stub;
    private AgentClient client;

    @BeforeEach
    void setUp() {
        stub = StubAgentServer.start("/chat", "/ocr", "/health");
        client = new AgentClient(WebClient.builder().build());
    }

    @AfterEach
    void tearDown() {
        stub.close();
    }

    @Test
    void shouldPostJsonAndReturnBody() {
        stub.reply("/chat", 200, "{\"success\":true,\"response\":\"ok\"}");

        JsonNode body = client.postJson(target(Capability.STRUCTURED_QUERY, "/chat", 2000, 0),
                Map.of("message", "hello", "user_role", "employee")).block();

        assertThat(body.path("response").asText()).isEqualTo("ok");
        StubAgentServer.Captured captured = stub.requests("/chat").get(0);
        assertThat(captured.method()).isEqualTo("POST");
        assertThat(captured.contentType()).startsWith("application/json");
        assertThat(captured.body()).contains("\"message\":\"hello\"").contains("\"user_role\":\"employee\"");
    }

    @Test
    void shouldRelayFileBytesUnchanged() {
        stub.reply("/ocr", 200, "{\"success\":true}");
        byte[] bytes = "%PDF-1.4 sample".getBytes(StandardCharsets.ISO_8859_1);

        client.postFile(target(Capability.DOCUMENT_UNDERSTANDING, "/ocr", 2000, 0),
                new BinaryPayload("report.pdf", "application/pdf", bytes.length, bytes)).block();

        StubAgentServer.Captured captured = stub.requests("/ocr").get(0);
        assertThat(captured.contentType()).startsWith("multipart/form-data");
        assertThat(captured.body())
                .contains("name=\"file\"")
                .contains("filename=\"report.pdf\"")
                .contains("Content-Type: application/pdf")
                .contains("%PDF-1.4 sample");
    }

    @Test
    void shouldTimeOutSlowAgent() {
        stub.replySlowly("/chat", 200, "{\"success\":true}", 1500);

        assertThatThrownBy(() -> client.postJson(target(Capability.SMART_ROUTE, "/chat", 200, 0), Map.of("message", "hi")).block())
                .isInstanceOf(GatewayException.class)
                .hasMessage("Smart agent service timeout");
    }

    @Test
    void shouldNotRetryWhenAgentAnsweredWithError() {
        stub.reply("/chat", 502, "{\"detail\":\"bad gateway\"}");

        assertThatThrownBy(() -> client.postJson(target(Capability.STRUCTURED_QUERY, "/chat", 2000, 3), Map.of("message", "hi")).block())
                .isInstanceOf(GatewayException.class)
                .extracting(ex -> ((GatewayException) ex).kind())
                .isEqualTo(ErrorKind.DOWNSTREAM_ERROR);
        assertThat(stub.requests("/chat")).hasSize(1);
    }

    @Test
    void shouldRetryRefusedConnectionAndReportUnavailable() {
        DownstreamTarget refused = new DownstreamTarget(Capability.RETRIEVAL, "http://127.0.0.1:1", "/rag",
                new DispatchPolicy(Duration.ofSeconds(2), 2, Duration.ofMillis(10)));

        assertThatThrownBy(() -> client.postJson(refused, Map.of("message", "hi")).block())
                .isInstanceOf(GatewayException.class)
                .hasMessage("RAG service is unavailable");
    }

    @Test
    void disposingCallShouldAbortAgentConnection() throws Exception {
        CountDownLatch requestSeen = new CountDownLatch(1);
        CountDownLatch connectionClosed = new CountDownLatch(1);
        try (ServerSocket silentAgent = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            Thread acceptor = new Thread(() -> holdOpenUntilClosed(silentAgent, requestSeen, connectionClosed), "silent-agent");
            acceptor.setDaemon(true);
            acceptor.start();
            DownstreamTarget target = new DownstreamTarget(Capability.STRUCTURED_QUERY,
                    "http://127.0.0.1:" + silentAgent.getLocalPort(), "/chat",
                    new DispatchPolicy(Duration.ofSeconds(10), 0, Duration.ofMillis(10)));

            Disposable call = client.postJson(target, Map.of("message", "hi")).subscribe(body -> { }, error -> { });
            assertThat(requestSeen.await(5, TimeUnit.SECONDS)).isTrue();
            call.dispose();

            assertThat(connectionClosed.await(5, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    void checkHealthShouldReturnHealthBody() {
        stub.reply("/health", 200, "{\"status\":\"healthy\",\"agent_loaded\":true}");

        JsonNode body = client.checkHealth(URI.create(stub.baseUrl() + "/health"), Duration.ofSeconds(1)).block();

        assertThat(body.path("status").asText()).isEqualTo("healthy");
        assertThat(stub.requests("/health").get(0).method()).isEqualTo("GET");
    }

    private static void holdOpenUntilClosed(ServerSocket server, CountDownLatch requestSeen, CountDownLatch connectionClosed) {
        try (Socket socket = server.accept()) {
            socket.setSoTimeout(8000);
            InputStream in = socket.getInputStream();
            int matched = 0;
            while (matched < 4) {
                int next = in.read();
                if (next == -1) {
                    return;
                }
                matched = next == "\r\n\r\n".charAt(matched) ? matched + 1 : (next == '\r' ? 1 : 0);
            }
            requestSeen.countDown();
            while (in.read() != -1) {
                // drain the body; never answer
            }
            connectionClosed.countDown();
        } catch (SocketTimeoutException ex) {
            // still open after the read timeout: the latch stays down and the test fails
        } catch (IOException ex) {
            connectionClosed.countDown();
        }
    }

    private DownstreamTarget target(Capability capability, String path, long timeoutMs, int maxRetries) {
        return new DownstreamTarget(capability, stub.baseUrl(), path,
                new DispatchPolicy(Duration.ofMillis(timeoutMs), maxRetries, Duration.ofMillis(10)));
    }
}
