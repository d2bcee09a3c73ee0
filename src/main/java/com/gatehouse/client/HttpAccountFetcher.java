package com.gatehouse.client;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calls {@code GET <baseUrl>/auth/account} with the bearer token. Any failure, non-2xx status or
 * non-JSON body yields an empty result.
 */
public class HttpAccountFetcher implements AccountFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpAccountFetcher.class);

    static final String ACCOUNT_PATH = "/auth/account";
    static final String CLIENT_ID_HEADER = "X-Client-Id";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpAccountFetcher() {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), new ObjectMapper());
    }

    public HttpAccountFetcher(HttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<AccountPrincipal> fetch(AuthStateConfig config, String token) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(config.getBaseUrl() + ACCOUNT_PATH))
                .timeout(config.getTimeout())
                .GET();
        config.getHeaders().forEach(builder::header);
        builder.header("Authorization", "Bearer " + token);
        if (config.getClientId() != null) {
            builder.header(CLIENT_ID_HEADER, config.getClientId());
        }

        try {
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                log.debug("Session check returned {}", response.statusCode());
                return Optional.empty();
            }
            String contentType = response.headers().firstValue("Content-Type").orElse("");
            if (!contentType.contains("json") || response.body() == null || response.body().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(response.body(), AccountPrincipal.class));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Session check interrupted");
            return Optional.empty();
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Session check failed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
