package com.leadharvest.sync.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.leadharvest.config.CrmSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

@Component
public class RestCrmClient implements CrmClient {
    private static final Logger log = LoggerFactory.getLogger(RestCrmClient.class);

    private final CrmSettings settings;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public RestCrmClient(CrmSettings settings, ObjectMapper objectMapper) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(Math.max(1, settings.timeoutSeconds())))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    @Override
    public JsonNode createLead(Map<String, Object> payload) {
        return send("POST", settings.createPath(), payload);
    }

    @Override
    public JsonNode updateLead(String externalId, Map<String, Object> payload) {
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("externalId is required for an update");
        }
        String path = settings.updatePath().replace("{id}", URLEncoder.encode(externalId.trim(), StandardCharsets.UTF_8));
        return send("PUT", path, payload);
    }

    private JsonNode send(String method, String path, Map<String, Object> payload) {
        if (!settings.isConfigured()) {
            throw new IllegalStateException("CRM base URL and token must be configured");
        }
        URI uri = URI.create(stripTrailingSlash(settings.baseUrl()) + (path.startsWith("/") ? path : "/" + path));
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize CRM payload", e);
        }
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(Math.max(1, settings.timeoutSeconds())))
            .header("Authorization", "Bearer " + settings.token())
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .method(method, HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
            .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CrmApiException("CRM request " + method + " " + uri.getPath() + " failed: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrmApiException("CRM request " + method + " " + uri.getPath() + " interrupted", e);
        }

        int status = response.statusCode();
        String responseBody = response.body() == null ? "" : response.body();
        if (status < 200 || status >= 300) {
            throw new CrmApiException(status, responseBody);
        }
        log.debug("CRM {} {} -> {}", method, uri.getPath(), status);
        return parseBody(responseBody);
    }

    private JsonNode parseBody(String body) {
        if (body.isBlank()) {
            return TextNode.valueOf("");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(body);
        }
    }

    private static String stripTrailingSlash(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
