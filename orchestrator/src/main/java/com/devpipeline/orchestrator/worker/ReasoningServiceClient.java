package com.devpipeline.orchestrator.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for the reasoning service that does the actual stage work.
 *
 * One endpoint per stage: {@code POST {base-url}/stages/{stage}/invoke}.
 * The response body is the stage payload, envelope included.
 *
 * Called from the worker pool; {@link HttpClient#send} is interruptible, so a
 * stage timeout aborts the request in flight.
 */
@Component
public class ReasoningServiceClient {

    private static final Logger log = LoggerFactory.getLogger(ReasoningServiceClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     requestTimeout;

    public ReasoningServiceClient(
            @Value("${devpipeline.worker.base-url}") String baseUrl,
            @Value("${devpipeline.worker.request-timeout:PT30M}") Duration requestTimeout,
            ObjectMapper objectMapper) {
        this.baseUrl        = baseUrl;
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * @param body request document built by the worker
     * @return parsed response payload
     * @throws ReasoningServiceException on non-2xx status, I/O failure or unparsable body
     */
    public JsonNode invokeStage(String stageName, JsonNode body) throws InterruptedException {
        log.debug("Invoking reasoning service for stage '{}'", stageName);
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/stages/" + stageName + "/invoke"))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body)))
                .build();

        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ReasoningServiceException("Stage '" + stageName + "' invocation failed: " + e.getMessage(), e);
        }
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new ReasoningServiceException(
                    "Stage '" + stageName + "' invocation failed: HTTP " + resp.statusCode() + ": " + resp.body(),
                    resp.statusCode());
        }
        try {
            return json.readTree(resp.body());
        } catch (JsonProcessingException e) {
            throw ReasoningServiceException.malformedResponse(
                    "Stage '" + stageName + "' returned malformed JSON: " + e.getOriginalMessage(),
                    resp.statusCode(), e);
        }
    }

    private String toJson(JsonNode body) {
        try {
            return json.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ReasoningServiceException("JSON serialization failed", e);
        }
    }
}
