package com.linlay.agentgateway.security;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Date;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentgateway.support.StubAgentServer;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.MOCK,
    properties = {
        "agent.auth.enabled=true",
        "agent.auth.mode=jwt",
        "agent.auth.issuer=https://auth.example.local"
    }
)
@AutoConfigureWebTestClient
class AccessGateWebFilterJwtTests {

    private static final RSAKey RSA_KEY = generateRsaKey("gateway-kid");
    private static final RSAKey FOREIGN_KEY = generateRsaKey("foreign-kid");
    private static final Path JWKS_FILE = createJwksFile(RSA_KEY);
    private static final StubAgentServer STUB = StubAgentServer.start("/chat", "/health");

    @Autowired
    private WebTestClient webTestClient;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @DynamicPropertySource
    static void dynamicProperties(DynamicPropertyRegistry registry) {
        registry.add("agent.auth.jwks-uri", () -> JWKS_FILE.toUri().toString());
        registry.add("agent.auth.jwks-cache-seconds", () -> 60);
        registry.add("agent.dispatch.base-url", STUB::baseUrl);
    }

    @AfterAll
    static void afterAll() throws Exception {
        STUB.close();
        Files.deleteIfExists(JWKS_FILE);
    }

    @BeforeEach
    void setUp() {
        STUB.reset();
        STUB.reply("/chat", 200, "{\"success\":true,\"response\":\"12 orders\"}");
    }

    @Test
    void shouldRejectRequestWithoutToken() {
        webTestClient.post()
            .uri("/chat/database")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("message", "How many orders?"))
            .exchange()
            .expectStatus().isUnauthorized()
            .expectBody()
            .jsonPath("$.error").isEqualTo("UNAUTHENTICATED");

        assertThat(STUB.totalRequests()).isZero();
    }

    @Test
    void shouldRejectOpaqueBearerToken() {
        webTestClient.post()
            .uri("/chat/database")
            .header("Authorization", "Bearer not-a-jwt")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("message", "How many orders?"))
            .exchange()
            .expectStatus().isUnauthorized();

        assertThat(STUB.totalRequests()).isZero();
    }

    @Test
    void shouldRejectTokenSignedByUnknownKey() throws Exception {
        String token = issueToken(FOREIGN_KEY, "https://auth.example.local", 300, null);

        webTestClient.post()
            .uri("/chat/database")
            .header("Authorization", "Bearer " + token)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("message", "How many orders?"))
            .exchange()
            .expectStatus().isUnauthorized();

        assertThat(STUB.totalRequests()).isZero();
    }

    @Test
    void shouldRejectExpiredToken() throws Exception {
        String token = issueToken(RSA_KEY, "https://auth.example.local", -600, null);

        webTestClient.post()
            .uri("/chat/database")
            .header("Authorization", "Bearer " + token)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("message", "How many orders?"))
            .exchange()
            .expectStatus().isUnauthorized();
    }

    @Test
    void shouldRejectTokenFromOtherIssuer() throws Exception {
        String token = issueToken(RSA_KEY, "https://other.example.local", 300, null);

        webTestClient.post()
            .uri("/chat/database")
            .header("Authorization", "Bearer " + token)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("message", "How many orders?"))
            .exchange()
            .expectStatus().isUnauthorized();
    }

    @Test
    void shouldDispatchRequestWithValidToken() throws Exception {
        String token = issueToken(RSA_KEY, "https://auth.example.local", 300, null);

        webTestClient.post()
            .uri("/chat/database")
            .header("Authorization", "Bearer " + token)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("message", "How many orders?"))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.success").isEqualTo(true)
            .jsonPath("$.response").isEqualTo("12 orders");

        assertThat(STUB.requests("/chat")).hasSize(1);
        JsonNode forwarded = objectMapper.readTree(STUB.requests("/chat").get(0).body());
        assertThat(forwarded.path("user_role").asText()).isEqualTo("employee");
    }

    @Test
    void shouldUseTokenRoleWhenRequestOmitsUserRole() throws Exception {
        String token = issueToken(RSA_KEY, "https://auth.example.local", 300, "manager");

        webTestClient.post()
            .uri("/chat/database")
            .header("Authorization", "Bearer " + token)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("message", "Team budget?"))
            .exchange()
            .expectStatus().isOk();

        JsonNode forwarded = objectMapper.readTree(STUB.requests("/chat").get(0).body());
        assertThat(forwarded.path("user_role").asText()).isEqualTo("manager");
    }

    @Test
    void shouldPreferExplicitUserRoleOverTokenRole() throws Exception {
        String token = issueToken(RSA_KEY, "https://auth.example.local", 300, "admin");

        webTestClient.post()
            .uri("/chat/database")
            .header("Authorization", "Bearer " + token)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("message", "Team budget?", "user_role", "employee"))
            .exchange()
            .expectStatus().isOk();

        JsonNode forwarded = objectMapper.readTree(STUB.requests("/chat").get(0).body());
        assertThat(forwarded.path("user_role").asText()).isEqualTo("employee");
    }

    @Test
    void shouldNotGateHealthOrPreflight() {
        STUB.reply("/health", 200, "{\"status\":\"healthy\"}");

        webTestClient.get()
            .uri("/chat/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("healthy");

        webTestClient.options()
            .uri("http://localhost:3000/chat/database")
            .header("Origin", "http://localhost:5173")
            .header("Access-Control-Request-Method", "POST")
            .exchange()
            .expectStatus().isOk()
            .expectHeader().valueEquals("Access-Control-Allow-Origin", "http://localhost:5173");
    }

    private static String issueToken(RSAKey rsaKey, String issuer, long ttlSeconds, String role) throws JOSEException {
        Instant now = Instant.now();
        JWTClaimsSet.Builder claims = new JWTClaimsSet.Builder()
            .issuer(issuer)
            .subject("chat-ui-user")
            .issueTime(Date.from(now.minusSeconds(900)))
            .expirationTime(Date.from(now.plusSeconds(ttlSeconds)));
        if (role != null) {
            claims.claim("role", role);
        }
        JWTClaimsSet claimsSet = claims.build();

        SignedJWT jwt = new SignedJWT(
            new JWSHeader.Builder(JWSAlgorithm.RS256).keyID(rsaKey.getKeyID()).build(),
            claimsSet
        );

        JWSSigner signer = new RSASSASigner(rsaKey.toPrivateKey());
        jwt.sign(signer);
        return jwt.serialize();
    }

    private static Path createJwksFile(RSAKey rsaKey) {
        try {
            Path jwksFile = Files.createTempFile("agent-gateway-jwks-", ".json");
            String jwks = new JWKSet(rsaKey.toPublicJWK()).toJSONObject().toString();
            Files.writeString(jwksFile, jwks, StandardCharsets.UTF_8);
            return jwksFile;
        } catch (Exception ex) {
            throw new IllegalStateException("Failed to create temporary JWKS file for test", ex);
        }
    }

    private static RSAKey generateRsaKey(String kid) {
        try {
            return new RSAKeyGenerator(2048).keyID(kid).generate();
        } catch (JOSEException ex) {
            throw new IllegalStateException("Failed to generate RSA key for test", ex);
        }
    }
}
