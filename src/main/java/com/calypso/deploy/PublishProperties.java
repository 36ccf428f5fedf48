package com.calypso.deploy;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Hosting provider credentials and publish settings ({@code calypso.publish.*}).
 * <p>
 * Publishing and previews are disabled while {@code token} is blank.
 */
@Component
@ConfigurationProperties(prefix = "calypso.publish")
public class PublishProperties {

    private String apiUrl = "https://api.vercel.com";
    private String token = "";
    private String teamId = "";
    private String domain = "calypso.build";
    private String appUrl = "";
    private long pollIntervalMs = 2000;
    private long pollTimeoutMs = 90000;

    public boolean isConfigured() {
        return token != null && !token.isBlank();
    }

    /** Origin of the authoring app, used for links injected into previews. */
    public String resolvedAppUrl() {
        if (appUrl != null && !appUrl.isBlank()) {
            return appUrl.endsWith("/") ? appUrl.substring(0, appUrl.length() - 1) : appUrl;
        }
        return "calypso.build".equals(domain) ? "https://calypso.build" : "https://localhost:3000";
    }

    public Duration pollInterval() { return Duration.ofMillis(pollIntervalMs); }
    public Duration pollTimeout() { return Duration.ofMillis(pollTimeoutMs); }

    public String getApiUrl() { return apiUrl; }
    public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }
    public String getTeamId() { return teamId; }
    public void setTeamId(String teamId) { this.teamId = teamId; }
    public String getDomain() { return domain; }
    public void setDomain(String domain) { this.domain = domain; }
    public String getAppUrl() { return appUrl; }
    public void setAppUrl(String appUrl) { this.appUrl = appUrl; }
    public long getPollIntervalMs() { return pollIntervalMs; }
    public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
    public long getPollTimeoutMs() { return pollTimeoutMs; }
    public void setPollTimeoutMs(long pollTimeoutMs) { this.pollTimeoutMs = pollTimeoutMs; }
}
