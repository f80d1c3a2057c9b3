package com.whereq.newscaster.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.whereq.newscaster.exception.AuthException;
import com.whereq.newscaster.exception.JobNotFoundException;
import com.whereq.newscaster.exception.RenderJobException;
import com.whereq.newscaster.exception.TransientNetworkException;
import com.whereq.newscaster.exception.UnexpectedResponseException;
import com.whereq.newscaster.exception.ValidationException;
import com.whereq.newscaster.model.JobStatus;
import com.whereq.newscaster.model.RenderRequest;
import com.whereq.newscaster.model.StatusPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Render client for the lip-sync generation API:
 * {@code POST /generate} and {@code GET /generate/{id}}.
 */
@Slf4j
public class HttpRenderJobClient implements RenderJobClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration submitTimeout;

    public HttpRenderJobClient(WebClient webClient, ObjectMapper objectMapper, Duration submitTimeout) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.submitTimeout = submitTimeout;
    }

    @Override
    public String submit(RenderRequest request) {
        request.validate();

        log.debug("Submitting {} render with model {} and {} inputs",
            request.getKind(), request.getModel(), request.getInput().size());

        JsonNode body = execute(webClient.post()
                .uri("/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .exchangeToMono(response -> handleResponse(response, null)),
            submitTimeout, "submit");

        String jobId = firstNonBlank(textOf(body, "id"), textOf(body, "job_id"), textOf(body, "jobId"));
        if (jobId == null) {
            throw new UnexpectedResponseException("Render service accepted the request without a job id: " + body);
        }

        log.info("Render job {} submitted (initial status {})", jobId, textOf(body, "status"));
        return jobId;
    }

    @Override
    public StatusPayload fetchStatus(String jobId, Duration timeout) {
        if (jobId == null || jobId.isBlank()) {
            throw new ValidationException("Job id is required to fetch a status");
        }

        JsonNode body = execute(webClient.get()
                .uri("/generate/{id}", jobId)
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(response -> handleResponse(response, jobId)),
            timeout, "status of " + jobId);

        String rawStatus = textOf(body, "status");
        return StatusPayload.builder()
            .jobId(jobId)
            .rawStatus(rawStatus)
            .status(JobStatus.fromRemote(rawStatus))
            .outputUrl(firstNonBlank(textOf(body, "outputUrl"), textOf(body, "output_url")))
            .error(firstNonBlank(textOf(body, "error"), textOf(body, "errorMessage")))
            .raw(body)
            .build();
    }

    private JsonNode execute(Mono<JsonNode> call, Duration timeout, String operation) {
        try {
            return call.timeout(timeout).block();
        } catch (RenderJobException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof RenderJobException renderJobException) {
                throw renderJobException;
            }
            if (cause instanceof TimeoutException) {
                throw new TransientNetworkException("Timed out after " + timeout.toMillis() + "ms: " + operation, cause);
            }
            if (cause instanceof WebClientRequestException || cause instanceof IOException) {
                throw new TransientNetworkException("Connection failed during " + operation + ": " + cause.getMessage(), cause);
            }
            throw new UnexpectedResponseException("Unexpected failure during " + operation + ": " + cause.getMessage(), cause);
        }
    }

    private Mono<JsonNode> handleResponse(ClientResponse response, String jobId) {
        HttpStatusCode status = response.statusCode();
        return response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .flatMap(body -> {
                if (status.is2xxSuccessful()) {
                    return Mono.just(parse(body));
                }
                return Mono.error(toException(status, body, jobId));
            });
    }

    private RenderJobException toException(HttpStatusCode status, String body, String jobId) {
        int code = status.value();
        String detail = "HTTP " + code + errorDetail(body);

        RenderJobException error;
        if (code == 401 || code == 403) {
            error = new AuthException("Render service rejected credentials: " + detail);
        } else if (code == 404 && jobId != null) {
            error = new JobNotFoundException(jobId);
        } else if (code == 408 || code == 429 || status.is5xxServerError()) {
            error = new TransientNetworkException("Render service unavailable: " + detail);
        } else if (status.is4xxClientError()) {
            error = new ValidationException("Render service refused the request: " + detail);
        } else {
            error = new UnexpectedResponseException("Unexpected render service response: " + detail);
        }
        return jobId != null ? error.withJobId(jobId) : error;
    }

    private String errorDetail(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        JsonNode node = parseQuietly(body);
        String message = firstNonBlank(textOf(node, "error"), textOf(node, "message"));
        return " - " + (message != null ? message : abbreviate(body));
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            throw new UnexpectedResponseException("Render service returned an empty body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UnexpectedResponseException("Render service returned malformed JSON: " + abbreviate(body), e);
        }
    }

    private JsonNode parseQuietly(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return MissingNode.getInstance();
        }
    }

    private static String textOf(JsonNode node, String field) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        if (v.isTextual()) return v.asText();
        return v.toString();
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }

    private static String abbreviate(String s) {
        return s.length() > 200 ? s.substring(0, 200) + "..." : s;
    }
}
