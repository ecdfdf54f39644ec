package com.linlay.agentgateway.security;

import com.linlay.agentgateway.config.AppAuthProperties;
import com.linlay.agentgateway.model.Role;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.proc.SecurityContext;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.nimbusds.jwt.proc.BadJWTException;
import com.nimbusds.jwt.proc.DefaultJWTClaimsVerifier;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@code agent.auth.mode=jwt}: accepts RS-signed JWTs issued for the chat UI. Signatures are
 * checked against the local public key first, then the JWKS document. The role claim, when it
 * names a known role, becomes the caller's default role hint.
 */
@Component
@ConditionalOnProperty(prefix = "agent.auth", name = "mode", havingValue = "jwt")
public class JwksJwtVerifier implements TokenVerifier {

    private static final Logger log = LoggerFactory.getLogger(JwksJwtVerifier.class);

    private static final long MIN_JWKS_TTL_SECONDS = 30L;

    private final AppAuthProperties authProperties;
    private final Object reloadLock = new Object();

    private RSAKey localKey;
    private URL jwksUrl;
    private Duration jwksTtl;
    private DefaultJWTClaimsVerifier<SecurityContext> claimsVerifier;
    private volatile JwksSnapshot jwksSnapshot;

    public JwksJwtVerifier(AppAuthProperties authProperties) {
        this.authProperties = authProperties;
    }

    @PostConstruct
    void initialize() {
        String localPublicKey = authProperties.getLocalPublicKey();
        if (localPublicKey != null && !StringUtils.hasText(localPublicKey)) {
            throw new IllegalStateException("agent.auth.local-public-key cannot be blank");
        }
        boolean jwksRequested = StringUtils.hasText(authProperties.getJwksUri()) || authProperties.getJwksCacheSeconds() != null;
        if (jwksRequested) {
            initializeJwks();
        } else if (localPublicKey == null) {
            throw new IllegalStateException(
                    "agent.auth.mode=jwt requires agent.auth.local-public-key or agent.auth.jwks-uri"
            );
        }
        localKey = localPublicKey == null ? null : readPublicKey(localPublicKey);

        JWTClaimsSet exactMatch = StringUtils.hasText(authProperties.getIssuer())
                ? new JWTClaimsSet.Builder().issuer(authProperties.getIssuer().trim()).build()
                : new JWTClaimsSet.Builder().build();
        claimsVerifier = new DefaultJWTClaimsVerifier<>(exactMatch, Set.of("sub", "exp"));
        log.info("JWT verification enabled localKey={}, jwksUri={}, roleClaim={}",
                localKey != null, jwksUrl, authProperties.getRoleClaim());
    }

    @Override
    public Optional<CallerPrincipal> verify(String token) {
        if (!StringUtils.hasText(token)) {
            return Optional.empty();
        }
        SignedJWT jwt;
        JWTClaimsSet claims;
        try {
            jwt = SignedJWT.parse(token.trim());
            claims = jwt.getJWTClaimsSet();
        } catch (ParseException ex) {
            log.debug("Rejected token reason=unparseable, detail={}", ex.getMessage());
            return Optional.empty();
        }

        try {
            claimsVerifier.verify(claims, null);
        } catch (BadJWTException ex) {
            log.debug("Rejected token reason=claims, detail={}", ex.getMessage());
            return Optional.empty();
        }
        if (!StringUtils.hasText(claims.getSubject())) {
            return Optional.empty();
        }

        for (RSAKey key : candidateKeys(jwt.getHeader().getKeyID())) {
            if (signedBy(jwt, key)) {
                return Optional.of(toPrincipal(claims));
            }
        }
        log.debug("Rejected token reason=signature, subject={}", claims.getSubject());
        return Optional.empty();
    }

    private void initializeJwks() {
        Long cacheSeconds = authProperties.getJwksCacheSeconds();
        if (!StringUtils.hasText(authProperties.getJwksUri())
                || !StringUtils.hasText(authProperties.getIssuer())
                || cacheSeconds == null) {
            throw new IllegalStateException(
                    "agent.auth.jwks-uri, agent.auth.issuer and agent.auth.jwks-cache-seconds must be configured together"
            );
        }
        if (cacheSeconds <= 0) {
            throw new IllegalStateException("agent.auth.jwks-cache-seconds must be greater than 0");
        }
        try {
            jwksUrl = URI.create(authProperties.getJwksUri().trim()).toURL();
        } catch (IllegalArgumentException | MalformedURLException ex) {
            throw new IllegalStateException("agent.auth.jwks-uri is not a valid URL", ex);
        }
        jwksTtl = Duration.ofSeconds(Math.max(MIN_JWKS_TTL_SECONDS, cacheSeconds));
    }

    private List<RSAKey> candidateKeys(String kid) {
        List<RSAKey> keys = new ArrayList<>();
        if (localKey != null) {
            keys.add(localKey);
        }
        List<JWK> published = jwksKeys();
        List<JWK> matching = published.stream()
                .filter(key -> kid != null && kid.equals(key.getKeyID()))
                .toList();
        addRsaKeys(keys, matching.isEmpty() ? published : matching);
        return keys;
    }

    private static void addRsaKeys(List<RSAKey> target, Collection<JWK> keys) {
        for (JWK key : keys) {
            if (key instanceof RSAKey rsaKey) {
                target.add(rsaKey);
            }
        }
    }

    private List<JWK> jwksKeys() {
        if (jwksUrl == null) {
            return List.of();
        }
        JwksSnapshot current = jwksSnapshot;
        if (current != null && current.isFresh()) {
            return current.keys();
        }
        synchronized (reloadLock) {
            current = jwksSnapshot;
            if (current != null && current.isFresh()) {
                return current.keys();
            }
            try {
                List<JWK> keys = JWKSet.load(jwksUrl).getKeys();
                jwksSnapshot = new JwksSnapshot(List.copyOf(keys), Instant.now().plus(jwksTtl));
                log.debug("Loaded JWKS uri={}, keys={}", jwksUrl, keys.size());
                return jwksSnapshot.keys();
            } catch (IOException | ParseException ex) {
                log.warn("Failed to load JWKS from {}, keeping {} cached keys",
                        jwksUrl, current == null ? 0 : current.keys().size(), ex);
                return current == null ? List.of() : current.keys();
            }
        }
    }

    private CallerPrincipal toPrincipal(JWTClaimsSet claims) {
        Instant issuedAt = claims.getIssueTime() == null ? Instant.now() : claims.getIssueTime().toInstant();
        return new CallerPrincipal(
                claims.getSubject(),
                roleHint(claims),
                issuedAt,
                claims.getExpirationTime().toInstant()
        );
    }

    private Role roleHint(JWTClaimsSet claims) {
        String claimName = authProperties.getRoleClaim();
        if (!StringUtils.hasText(claimName)) {
            return null;
        }
        Object raw = claims.getClaim(claimName);
        if (raw instanceof String text) {
            return parseRole(claims, text);
        }
        if (raw instanceof Collection<?> values) {
            for (Object value : values) {
                Role role = value == null ? null : Role.parse(String.valueOf(value)).orElse(null);
                if (role != null) {
                    return role;
                }
            }
        }
        return null;
    }

    private Role parseRole(JWTClaimsSet claims, String text) {
        Role role = Role.parse(text).orElse(null);
        if (role == null) {
            log.debug("Ignoring unknown role claim subject={}, value={}", claims.getSubject(), text);
        }
        return role;
    }

    private static boolean signedBy(SignedJWT jwt, RSAKey key) {
        try {
            return jwt.verify(new RSASSAVerifier(key));
        } catch (JOSEException ex) {
            return false;
        }
    }

    private static RSAKey readPublicKey(String pem) {
        String base64 = pem
                .replace("-----BEGIN PUBLIC KEY-----", "")
                .replace("-----END PUBLIC KEY-----", "")
                .replaceAll("\\s+", "");
        try {
            byte[] der = Base64.getDecoder().decode(base64);
            RSAPublicKey publicKey = (RSAPublicKey) KeyFactory.getInstance("RSA")
                    .generatePublic(new X509EncodedKeySpec(der));
            return new RSAKey.Builder(publicKey).build();
        } catch (IllegalArgumentException | GeneralSecurityException ex) {
            throw new IllegalStateException("agent.auth.local-public-key is not a valid PEM RSA public key", ex);
        }
    }

    private record JwksSnapshot(List<JWK> keys, Instant expireAt) {

        boolean isFresh() {
            return Instant.now().isBefore(expireAt);
        }
    }
}
