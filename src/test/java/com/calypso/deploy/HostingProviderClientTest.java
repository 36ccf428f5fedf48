package com.calypso.deploy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class HostingProviderClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();

    private HttpServer server;
    private PublishProperties properties;
    private HostingProviderClient client;

    private record Recorded(String method, String uri, String authorization, String digest, String body) {}

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
        properties = new PublishProperties();
        properties.setApiUrl("http://127.0.0.1:" + server.getAddress().getPort());
        properties.setToken("secret");
        client = new HostingProviderClient(properties, mapper);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void respond(String path, int status, String body) {
        server.createContext(path, exchange -> {
            capture(exchange);
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            if (bytes.length == 0) {
                exchange.sendResponseHeaders(status, -1);
            } else {
                exchange.getResponseHeaders().add("Content-Type", "application/json");
                exchange.sendResponseHeaders(status, bytes.length);
                exchange.getResponseBody().write(bytes);
            }
            exchange.close();
        });
    }

    private void capture(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        requests.add(new Recorded(exchange.getRequestMethod(), exchange.getRequestURI().toString(),
                exchange.getRequestHeaders().getFirst("Authorization"),
                exchange.getRequestHeaders().getFirst("x-vercel-digest"), body));
    }

    @Nested
    @DisplayName("uploads")
    class UploadTests {

        @Test
        @DisplayName("posts the body with its digest and bearer token")
        void upload() {
            respond("/v2/files", 200, "{}");

            client.uploadFile("hello".getBytes(StandardCharsets.UTF_8), "sha-1");

            Recorded request = requests.get(0);
            assertEquals("POST", request.method());
            assertEquals("Bearer secret", request.authorization());
            assertEquals("sha-1", request.digest());
            assertEquals("hello", request.body());
        }

        @Test
        @DisplayName("an already known file is not an error")
        void conflictTolerated() {
            respond("/v2/files", 409, "{\"error\":{\"message\":\"exists\"}}");

            assertDoesNotThrow(() -> client.uploadFile(new byte[] {1}, "sha-1"));
        }

        @Test
        @DisplayName("appends the team query when a team is configured")
        void teamQuery() {
            properties.setTeamId("team_1");
            respond("/v2/files", 200, "{}");

            client.uploadFile(new byte[] {1}, "sha-1");

            assertEquals("/v2/files?teamId=team_1", requests.get(0).uri());
        }

        @Test
        @DisplayName("a caller's token replaces the service token and team")
        void callerToken() {
            properties.setToken("");
            properties.setTeamId("team_1");
            respond("/v2/files", 200, "{}");

            client.withToken("user-token").uploadFile(new byte[] {1}, "sha-1");

            assertEquals("Bearer user-token", requests.get(0).authorization());
            assertEquals("/v2/files", requests.get(0).uri());
        }

        @Test
        @DisplayName("a blank caller token is refused")
        void blankCallerToken() {
            assertThrows(IllegalArgumentException.class, () -> client.withToken(" "));
        }
    }

    @Nested
    @DisplayName("deployments")
    class DeploymentTests {

        @Test
        @DisplayName("creates a production deployment of the referenced files")
        void create() throws IOException {
            respond("/v13/deployments", 200,
                    "{\"id\":\"dpl_1\",\"projectId\":\"prj_1\",\"url\":\"x.vercel.app\",\"readyState\":\"QUEUED\"}");

            Deployment deployment = client.createDeployment("calypso-p1", null,
                    List.of(new FileRef("index.html", "abc", 12)), null);

            assertEquals(new Deployment("dpl_1", "prj_1", "x.vercel.app", "QUEUED"), deployment);
            JsonNode body = mapper.readTree(requests.get(0).body());
            assertEquals("calypso-p1", body.get("name").asText());
            assertEquals("production", body.get("target").asText());
            assertFalse(body.has("project"));
            assertEquals("index.html", body.get("files").get(0).get("file").asText());
            assertEquals(12, body.get("files").get(0).get("size").asInt());
            assertTrue(body.get("projectSettings").get("framework").isNull());
        }

        @Test
        @DisplayName("targets a known hosting project by id")
        void knownProject() throws IOException {
            respond("/v13/deployments", 200, "{\"id\":\"dpl_2\",\"projectId\":\"prj_1\"}");

            client.createDeployment("calypso-p1", "prj_1", List.of(), "nextjs");

            JsonNode body = mapper.readTree(requests.get(0).body());
            assertEquals("prj_1", body.get("project").asText());
            assertEquals("nextjs", body.get("projectSettings").get("framework").asText());
        }

        @Test
        @DisplayName("falls back to the requested name when no project id comes back")
        void projectIdFallback() {
            respond("/v13/deployments", 200, "{\"id\":\"dpl_1\"}");

            assertEquals("calypso-p1", client.createDeployment("calypso-p1", null, List.of(), "nextjs").projectId());
        }

        @Test
        @DisplayName("surfaces the provider's error message")
        void providerError() {
            respond("/v13/deployments", 400, "{\"error\":{\"message\":\"Invalid files\"}}");

            var e = assertThrows(DeploymentProviderException.class,
                    () -> client.createDeployment("calypso-p1", null, List.of(), null));
            assertEquals("Invalid files", e.getMessage());
            assertEquals(400, e.getStatusCode());
            assertFalse(e.isAuthFailure());
        }

        @Test
        @DisplayName("flags authentication failures")
        void authFailure() {
            respond("/v13/deployments", 403, "");

            var e = assertThrows(DeploymentProviderException.class,
                    () -> client.createDeployment("calypso-p1", null, List.of(), null));
            assertTrue(e.isAuthFailure());
            assertEquals(DeploymentProviderException.MISCONFIGURED, e.clientMessage());
        }

        @Test
        @DisplayName("reads the ready state and treats error statuses as unknown")
        void state() {
            respond("/v13/deployments/dpl_1", 200, "{\"readyState\":\"READY\"}");
            respond("/v13/deployments/dpl_2", 500, "");

            assertEquals("READY", client.getDeploymentState("dpl_1"));
            assertNull(client.getDeploymentState("dpl_2"));
        }
    }

    @Nested
    @DisplayName("domains")
    class DomainTests {

        @Test
        @DisplayName("an already assigned domain is not an error")
        void assignConflict() throws IOException {
            respond("/v10/projects/prj_1/domains", 409, "{}");

            assertDoesNotThrow(() -> client.assignDomain("prj_1", "demo.calypso.build"));
            assertEquals("demo.calypso.build", mapper.readTree(requests.get(0).body()).get("name").asText());
        }

        @Test
        @DisplayName("removing a missing domain is not an error")
        void removeMissing() {
            respond("/v9/projects/prj_1/domains/demo.calypso.build", 404, "");

            assertDoesNotThrow(() -> client.removeDomain("prj_1", "demo.calypso.build"));
            assertEquals("DELETE", requests.get(0).method());
        }
    }

    @Test
    @DisplayName("reachability is a successful HEAD")
    void reachability() {
        respond("/up", 200, "");
        respond("/down", 404, "");
        String base = properties.getApiUrl();

        assertTrue(client.isReachable(base + "/up"));
        assertFalse(client.isReachable(base + "/down"));
        assertFalse(client.isReachable("not a url"));
    }

    @Test
    @DisplayName("refuses to call the provider without a token")
    void unconfigured() {
        properties.setToken(" ");

        assertThrows(DeploymentUnavailableException.class, () -> client.uploadFile(new byte[] {1}, "sha"));
        assertTrue(requests.isEmpty());
    }
}
