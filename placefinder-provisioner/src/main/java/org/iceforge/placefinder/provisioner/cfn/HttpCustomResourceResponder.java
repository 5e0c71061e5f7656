package org.iceforge.placefinder.provisioner.cfn;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * PUTs the response to the pre-signed S3 URL. The URL is signed without a content type, so the request
 * must carry an empty one.
 */
public class HttpCustomResourceResponder implements CustomResourceResponder {

    private static final Logger log = LoggerFactory.getLogger(HttpCustomResourceResponder.class);

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public HttpCustomResourceResponder(HttpClient http, ObjectMapper mapper, Duration timeout) {
        this.http = Objects.requireNonNull(http);
        this.mapper = Objects.requireNonNull(mapper);
        this.timeout = Objects.requireNonNull(timeout);
    }

    @Override
    public void send(String responseUrl, CustomResourceResponse response) {
        byte[] body;
        try {
            body = mapper.writeValueAsBytes(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize custom resource response", e);
        }

        HttpRequest req = HttpRequest.newBuilder(URI.create(responseUrl))
                .timeout(timeout)
                .header("Content-Type", "")
                .PUT(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() / 100 != 2) {
                throw new IllegalStateException("Response upload returned HTTP " + resp.statusCode() + ": " + resp.body());
            }
            log.info("Sent {} for {} (physicalId={})", response.status(), response.logicalResourceId(),
                    response.physicalResourceId());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to upload custom resource response", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while uploading custom resource response", e);
        }
    }
}
