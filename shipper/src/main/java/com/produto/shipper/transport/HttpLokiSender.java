package com.produto.shipper.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.produto.shipper.config.ShipperSettings;
import com.produto.shipper.model.LokiPushRequest;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Pushes batches to the Loki HTTP API with {@link HttpClient}.
 * Both the connect and the request timeout are always set so a stalled backend cannot hang the worker.
 */
@Slf4j
public class HttpLokiSender implements LogBatchSender {

    private static final int MAX_ERROR_BODY = 100;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI endpoint;
    private final Duration requestTimeout;

    public HttpLokiSender(ShipperSettings settings, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder()
                .connectTimeout(settings.getConnectTimeout())
                .build(),
            objectMapper,
            URI.create(settings.pushEndpoint()),
            settings.getRequestTimeout());
    }

    public HttpLokiSender(HttpClient httpClient, ObjectMapper objectMapper, URI endpoint, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public void send(LokiPushRequest request) {
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(request);
        } catch (JsonProcessingException e) {
            throw new LokiPushException("Failed to serialize Loki push request", e);
        }

        HttpRequest httpRequest = HttpRequest.newBuilder()
            .uri(endpoint)
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofByteArray(body))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new LokiPushException("Failed to reach Loki at " + endpoint + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LokiPushException("Interrupted while pushing to Loki", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new LokiPushException(status, abbreviate(response.body()));
        }
        log.trace("Loki accepted push of {} bytes with status {}", body.length, status);
    }

    public URI getEndpoint() {
        return endpoint;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY);
    }
}
