package com.leadharvest.sync.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadharvest.config.CrmSettings;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RestCrmClientTest {
    private MockWebServer server;
    private RestCrmClient client;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        String baseUrl = server.url("/").toString();
        CrmSettings settings = new CrmSettings(true, baseUrl, "secret-token", 5, "/api/leads", "/api/leads/{id}", 8, 100, Map.of());
        client = new RestCrmClient(settings, objectMapper);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void createPostsJsonWithBearerToken() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201).setBody("{\"id\": 42}"));

        JsonNode response = client.createLead(Map.of("name", "Alice"));

        assertThat(response.get("id").asInt()).isEqualTo(42);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/api/leads");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer secret-token");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        assertThat(objectMapper.readTree(request.getBody().readUtf8()).get("name").asText()).isEqualTo("Alice");
    }

    @Test
    void updatePutsToEncodedExternalId() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("updated"));

        JsonNode response = client.updateLead("lead 7", Map.of("name", "Alice"));

        assertThat(response.isTextual()).isTrue();
        assertThat(response.asText()).isEqualTo("updated");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("PUT");
        assertThat(request.getPath()).isEqualTo("/api/leads/lead+7");
    }

    @Test
    void errorStatusRaisesWithTruncatedBody() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("x".repeat(800)));

        assertThatThrownBy(() -> client.createLead(Map.of("name", "Alice")))
            .isInstanceOfSatisfying(CrmApiException.class, e -> {
                assertThat(e.getStatusCode()).isEqualTo(500);
                assertThat(e.getResponseBody()).hasSize(CrmApiException.MAX_BODY_LENGTH);
                assertThat(e.getMessage()).startsWith("CRM API error 500");
            });
    }

    @Test
    void updateRequiresExternalId() {
        assertThatThrownBy(() -> client.updateLead(" ", Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
