package com.agentflow.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Executor that delegates a step to a remote agent over HTTP.
 *
 * The dispatch is POSTed as JSON. The agent answers with {@code {"success": <result>}} or
 * {@code {"failure": {"error_code": "...", "message": "...", "retryable": true}}}; a plain string is
 * accepted as the failure message. Connection problems and 5xx answers are retryable, 4xx answers
 * are permanent.
 */
public class HttpStepExecutor implements StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(HttpStepExecutor.class);

    public static final String AGENT_UNREACHABLE = "AGENT_UNREACHABLE";
    public static final String AGENT_ERROR = "AGENT_ERROR";
    public static final String AGENT_REJECTED = "AGENT_REJECTED";
    public static final String INVALID_RESPONSE = "INVALID_AGENT_RESPONSE";

    private final String agentName;
    private final URI endpoint;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpStepExecutor(String agentName, URI endpoint, Duration connectTimeout, ObjectMapper objectMapper) {
        this.agentName = agentName;
        this.endpoint = endpoint;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .build();
    }

    @Override
    public JsonNode execute(StepDispatch dispatch) throws StepExecutionException {
        HttpRequest request = HttpRequest.newBuilder(endpoint)
            .timeout(Duration.ofSeconds(dispatch.timeoutSeconds()))
            .header("Content-Type", "application/json")
            .header("Idempotency-Key", dispatch.idempotencyKey())
            .POST(HttpRequest.BodyPublishers.ofString(toJson(dispatch)))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.warn("Agent {} unreachable at {}: {}", agentName, endpoint, e.getMessage());
            throw new StepExecutionException(AGENT_UNREACHABLE,
                "Agent " + agentName + " unreachable: " + e.getMessage(), e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StepExecutionException(AGENT_UNREACHABLE,
                "Interrupted while waiting for agent " + agentName, e, true);
        }

        int status = response.statusCode();
        if (status >= 500) {
            throw StepExecutionException.retryable(AGENT_ERROR,
                "Agent " + agentName + " returned HTTP " + status);
        }
        if (status >= 400) {
            throw StepExecutionException.permanent(AGENT_REJECTED,
                "Agent " + agentName + " rejected the step with HTTP " + status);
        }
        return parseOutcome(response.body());
    }

    // ========== Internal Methods ==========

    private String toJson(StepDispatch dispatch) throws StepExecutionException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("step_id", dispatch.stepId());
        body.put("step_name", dispatch.stepName());
        body.put("step_type", dispatch.stepType());
        body.put("execution_id", dispatch.executionId().toString());
        body.put("workflow_id", dispatch.workflowId());
        body.put("attempt", dispatch.attempt());
        body.put("iteration", dispatch.iteration());
        body.put("timeout_seconds", dispatch.timeoutSeconds());
        body.put("idempotency_key", dispatch.idempotencyKey());
        body.set("config", dispatch.config());
        ObjectNode upstream = body.putObject("upstream_results");
        dispatch.upstreamResults().forEach(upstream::set);
        body.set("input_data", dispatch.inputData());
        body.set("event", dispatch.event());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new StepExecutionException(INVALID_RESPONSE, "Cannot encode dispatch: " + e.getMessage(), e, false);
        }
    }

    private JsonNode parseOutcome(String body) throws StepExecutionException {
        JsonNode outcome;
        try {
            outcome = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new StepExecutionException(INVALID_RESPONSE,
                "Agent " + agentName + " returned invalid JSON", e, false);
        }
        if (outcome != null && outcome.has("success")) {
            return outcome.get("success");
        }
        if (outcome != null && outcome.has("failure")) {
            JsonNode failure = outcome.get("failure");
            if (failure.isTextual()) {
                throw StepExecutionException.retryable(StepExecutionException.DEFAULT_ERROR_CODE, failure.textValue());
            }
            throw new StepExecutionException(
                failure.path("error_code").asText(StepExecutionException.DEFAULT_ERROR_CODE),
                failure.path("message").asText("Agent " + agentName + " reported a failure"),
                failure.path("retryable").asBoolean(true)
            );
        }
        throw StepExecutionException.permanent(INVALID_RESPONSE,
            "Agent " + agentName + " answered with neither 'success' nor 'failure'");
    }
}
