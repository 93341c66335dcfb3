package com.ledgerpilot.budget.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.ledgerpilot.budget.config.LedgerpilotProperties;
import java.net.URI;
import java.net.http.HttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Authenticated JSON transport to the remote budget API. Paths are relative to the configured base
 * URL, start with '/', and must already be encoded. Retries are left to the caller.
 */
@Component
public class BudgetApiClient {

    private static final Logger log = LoggerFactory.getLogger(BudgetApiClient.class);

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public BudgetApiClient(LedgerpilotProperties properties, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        var remote = properties.remote();
        this.baseUrl = stripTrailingSlash(remote.baseUrl());

        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(remote.connectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(remote.readTimeout());

        this.restClient = RestClient.builder()
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeaders(headers -> headers.setBearerAuth(remote.accessToken()))
                .build();
    }

    public JsonNode request(HttpMethod method, String path) {
        return request(method, path, null);
    }

    public JsonNode request(HttpMethod method, String path, Object body) {
        URI uri = URI.create(baseUrl + path);
        String raw;
        try {
            RestClient.RequestBodySpec spec = restClient.method(method).uri(uri);
            if (body != null) {
                spec = spec.contentType(MediaType.APPLICATION_JSON).body(body);
            }
            raw = spec.retrieve().body(String.class);
        } catch (RestClientResponseException ex) {
            String responseBody = ex.getResponseBodyAsString();
            int status = ex.getStatusCode().value();
            String detail = extractDetail(responseBody, status);
            log.warn("Remote API {} {} failed (status {}): {}", method, path, status, detail);
            throw new RemoteApiException(status, detail, responseBody, ex);
        } catch (ResourceAccessException ex) {
            log.warn("Remote API {} {} unreachable: {}", method, path, ex.getMessage());
            throw new RemoteApiException(RemoteApiException.NO_RESPONSE, "Remote API unreachable: " + ex.getMessage(), null, ex);
        }
        return parse(raw);
    }

    private JsonNode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException ex) {
            throw new RemoteApiException(502, "Remote API returned malformed JSON", raw, ex);
        }
    }

    private String extractDetail(String responseBody, int status) {
        if (responseBody != null && !responseBody.isBlank()) {
            try {
                JsonNode detail = objectMapper.readTree(responseBody).path("error").path("detail");
                if (detail.isTextual() && !detail.asText().isBlank()) {
                    return detail.asText();
                }
            } catch (JsonProcessingException ex) {
                log.debug("Error body is not JSON: {}", ex.getOriginalMessage());
            }
        }
        return "Request failed with status " + status;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
