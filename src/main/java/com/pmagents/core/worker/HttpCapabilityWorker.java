package com.pmagents.core.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pmagents.core.model.TaskRequest;
import com.pmagents.core.model.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.ExecutionException;

/**
 * Remote worker reached over HTTP: the {@link TaskRequest} is POSTed as JSON and the
 * response body is read as a {@link TaskResult}.
 *
 * <p>The request is sent asynchronously and awaited, so that interrupting the calling
 * thread (timeout or run cancellation) abandons the exchange.
 */
public class HttpCapabilityWorker implements CapabilityWorker {

    private static final Logger log = LoggerFactory.getLogger(HttpCapabilityWorker.class);

    private final String capability;
    private final URI endpoint;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpCapabilityWorker(String capability, URI endpoint, Duration connectTimeout, ObjectMapper objectMapper) {
        this.capability = capability;
        this.endpoint = endpoint;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
        this.objectMapper = objectMapper;
    }

    @Override
    public String capability() {
        return capability;
    }

    public URI endpoint() {
        return endpoint;
    }

    @Override
    public TaskResult execute(TaskRequest request) throws IOException, InterruptedException {
        var httpRequest = HttpRequest.newBuilder()
                .uri(endpoint)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(request)))
                .build();

        log.debug("POST {} for task {} (attempt {})", endpoint, request.taskId(), request.attempt());
        var pending = httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString());
        HttpResponse<String> response;
        try {
            response = pending.get();
        } catch (InterruptedException e) {
            pending.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            throw new IOException("Worker '%s' request failed: %s".formatted(capability, e.getCause().getMessage()),
                    e.getCause());
        }

        if (response.statusCode() >= 400) {
            throw new IOException("Worker '%s' POST %s failed (HTTP %d): %s"
                    .formatted(capability, endpoint, response.statusCode(), response.body()));
        }
        return objectMapper.readValue(response.body(), TaskResult.class);
    }
}
