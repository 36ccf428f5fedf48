package com.calypso.deploy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * HTTP client for the hosting provider's deployment API (Vercel-style REST).
 *
 * <p>Files are uploaded content-addressed by SHA-1 and then referenced from a
 * production deployment. Calls carry the optional {@code teamId} query unless made through
 * {@link #withToken(String)}.
 */
@Component
public class HostingProviderClient {

    private static final Logger log = LoggerFactory.getLogger(HostingProviderClient.class);

    private final PublishProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String accountToken;

    @Autowired
    public HostingProviderClient(PublishProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    HostingProviderClient(PublishProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
        this(properties, objectMapper, httpClient, null);
    }

    private HostingProviderClient(PublishProperties properties, ObjectMapper objectMapper, HttpClient httpClient,
                                  String accountToken) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        this.accountToken = accountToken;
    }

    /**
     * Client acting on the account behind {@code token} instead of the configured one.
     * The configured team is not applied.
     */
    public HostingProviderClient withToken(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Hosting access token is required");
        }
        return new HostingProviderClient(properties, objectMapper, httpClient, token);
    }

    /**
     * Uploads one file body. A 409 means the provider already has this digest.
     */
    public void uploadFile(byte[] content, String sha1) {
        var request = authorized("/v2/files")
                .header("Content-Type", "application/octet-stream")
                .header("x-vercel-digest", sha1)
                .POST(HttpRequest.BodyPublishers.ofByteArray(content))
                .build();

        var response = send(request, "POST /v2/files");
        if (response.statusCode() == 409) {
            log.debug("File {} already uploaded", sha1);
            return;
        }
        ensureSuccess(response, "File upload");
    }

    /**
     * Creates a production deployment of the referenced files under {@code name}.
     *
     * @param hostingProjectId existing provider project to deploy into, {@code null} to
     *                         resolve the project by {@code name}
     * @param framework        provider framework preset, {@code null} for a static site
     */
    public Deployment createDeployment(String name, String hostingProjectId, List<FileRef> files,
                                       String framework) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("name", name);
        if (hostingProjectId != null && !hostingProjectId.isBlank()) {
            body.put("project", hostingProjectId);
        }
        var fileArray = body.putArray("files");
        for (FileRef ref : files) {
            fileArray.addObject()
                    .put("file", ref.file())
                    .put("sha", ref.sha())
                    .put("size", ref.size());
        }
        ObjectNode settings = body.putObject("projectSettings");
        if (framework != null) {
            settings.put("framework", framework);
        } else {
            settings.putNull("framework");
        }
        body.put("target", "production");

        var request = authorized("/v13/deployments")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();

        var response = send(request, "POST /v13/deployments");
        ensureSuccess(response, "Deployment");
        JsonNode json = readTree(response.body());
        var deployment = new Deployment(
                text(json, "id"),
                json.hasNonNull("projectId") ? json.get("projectId").asText() : name,
                text(json, "url"),
                text(json, "readyState"));
        log.info("Created deployment {} for hosting project {} ({} files)",
                deployment.id(), deployment.projectId(), files.size());
        return deployment;
    }

    /** Current {@code readyState} of a deployment, or {@code null} when the provider did not answer. */
    public String getDeploymentState(String deploymentId) {
        var request = authorized("/v13/deployments/" + encode(deploymentId)).GET().build();
        var response = send(request, "GET /v13/deployments/" + deploymentId);
        if (response.statusCode() >= 400) {
            log.debug("Deployment state request for {} returned HTTP {}", deploymentId, response.statusCode());
            return null;
        }
        return text(readTree(response.body()), "readyState");
    }

    /**
     * Attaches {@code domain} to the hosting project. A 409 means it is already attached.
     */
    public void assignDomain(String hostingProjectId, String domain) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("name", domain);

        var request = authorized("/v10/projects/" + encode(hostingProjectId) + "/domains")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();

        var response = send(request, "POST /v10/projects/" + hostingProjectId + "/domains");
        if (response.statusCode() == 409) {
            log.debug("Domain {} already assigned to {}", domain, hostingProjectId);
            return;
        }
        ensureSuccess(response, "Domain assignment");
    }

    /**
     * Detaches {@code domain} from the hosting project. A 404 means it is already gone.
     */
    public void removeDomain(String hostingProjectId, String domain) {
        var request = authorized("/v9/projects/" + encode(hostingProjectId) + "/domains/" + encode(domain))
                .DELETE()
                .build();

        var response = send(request, "DELETE /v9/projects/" + hostingProjectId + "/domains/" + domain);
        if (response.statusCode() == 404) {
            log.debug("Domain {} was not assigned to {}", domain, hostingProjectId);
            return;
        }
        ensureSuccess(response, "Domain removal");
    }

    /** Whether a HEAD request to {@code url} answers with a 2xx status. */
    public boolean isReachable(String url) {
        try {
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(10))
                    .method("HEAD", HttpRequest.BodyPublishers.noBody())
                    .build();
            var response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            return response.statusCode() >= 200 && response.statusCode() < 300;
        } catch (IOException | IllegalArgumentException e) {
            log.debug("HEAD {} failed: {}", url, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpRequest.Builder authorized(String path) {
        if (accountToken == null && !properties.isConfigured()) {
            throw new DeploymentUnavailableException("Publishing is not available right now. Please try again later.");
        }
        String token = accountToken != null ? accountToken : properties.getToken();
        String query = accountToken != null ? "" : teamQuery();
        return HttpRequest.newBuilder()
                .uri(URI.create(properties.getApiUrl() + path + query))
                .timeout(Duration.ofSeconds(60))
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/json");
    }

    private String teamQuery() {
        String teamId = properties.getTeamId();
        return teamId == null || teamId.isBlank() ? "" : "?teamId=" + encode(teamId);
    }

    private HttpResponse<String> send(HttpRequest request, String description) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DeploymentProviderException("Hosting provider request failed: " + description, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeploymentProviderException("Interrupted during " + description, e);
        }
    }

    private void ensureSuccess(HttpResponse<String> response, String action) {
        int status = response.statusCode();
        if (status < 400) {
            return;
        }
        log.error("{} failed (HTTP {}): {}", action, status, response.body());
        throw new DeploymentProviderException(errorMessage(response.body(), action + " failed"), status);
    }

    /** Provider error text from {@code {"error":{"message":…}}}, else {@code fallback}. */
    String errorMessage(String body, String fallback) {
        if (body == null || body.isBlank()) {
            return fallback;
        }
        try {
            JsonNode message = objectMapper.readTree(body).path("error").path("message");
            return message.isTextual() && !message.asText().isBlank() ? message.asText() : fallback;
        } catch (IOException e) {
            return fallback;
        }
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new DeploymentProviderException("Unreadable response from hosting provider", e);
        }
    }

    private static String text(JsonNode json, String field) {
        return json.hasNonNull(field) ? json.get(field).asText() : null;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
