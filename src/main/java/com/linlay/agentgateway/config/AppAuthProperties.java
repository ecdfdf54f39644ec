package com.linlay.agentgateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agent.auth")
public class AppAuthProperties {

    private boolean enabled = true;
    /**
     * {@code bearer} accepts any non-blank bearer token, {@code jwt} verifies a signed JWT.
     */
    private String mode = "bearer";
    private String jwksUri;
    private String issuer;
    private Long jwksCacheSeconds;
    private String localPublicKey;
    /**
     * JWT claim holding the caller's role hint; used when a request omits {@code user_role}.
     */
    private String roleClaim = "role";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getJwksUri() {
        return jwksUri;
    }

    public void setJwksUri(String jwksUri) {
        this.jwksUri = jwksUri;
    }

    public String getIssuer() {
        return issuer;
    }

    public void setIssuer(String issuer) {
        this.issuer = issuer;
    }

    public Long getJwksCacheSeconds() {
        return jwksCacheSeconds;
    }

    public void setJwksCacheSeconds(Long jwksCacheSeconds) {
        this.jwksCacheSeconds = jwksCacheSeconds;
    }

    public String getLocalPublicKey() {
        return localPublicKey;
    }

    public void setLocalPublicKey(String localPublicKey) {
        this.localPublicKey = localPublicKey;
    }

    public String getRoleClaim() {
        return roleClaim;
    }

    public void setRoleClaim(String roleClaim) {
        this.roleClaim = roleClaim;
    }
}
