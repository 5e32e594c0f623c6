package com.spinbet.ledgersync.modules.chains.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spinbet.ledgersync.modules.chains.events.EventDecodeException;
import com.spinbet.ledgersync.modules.chains.events.EventNormalizer;
import com.spinbet.ledgersync.modules.chains.model.EventPage;
import com.spinbet.ledgersync.modules.chains.model.EventQuery;
import com.spinbet.ledgersync.modules.chains.model.NormalizedContractEvent;
import com.spinbet.ledgersync.config.StellarRpcProperties;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Soroban JSON-RPC client.
 * Fetches contract events by cursor or start ledger and reads the latest ledger sequence.
 */
@Slf4j
@Component
public class SorobanRpcClient implements ContractEventSource {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final EventNormalizer eventNormalizer;
    private final StellarRpcProperties properties;
    private final Tracer tracer;

    public SorobanRpcClient(@Qualifier("sorobanRestTemplate") RestTemplate restTemplate,
                            ObjectMapper objectMapper,
                            EventNormalizer eventNormalizer,
                            StellarRpcProperties properties,
                            Tracer tracer) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.eventNormalizer = eventNormalizer;
        this.properties = properties;
        this.tracer = tracer;
    }

    @Override
    public EventPage fetch(EventQuery query) {
        Span span = tracer.spanBuilder("SorobanRpcClient.fetch")
                .setAttribute("contract.id", String.valueOf(query.getContractId()))
                .setAttribute("paging.mode", query.hasCursor() ? "cursor" : "ledger")
                .startSpan();
        try {
            JsonNode result = call("getEvents", buildGetEventsParams(query));

            String nextCursor = result.hasNonNull("cursor") ? result.get("cursor").asText() : null;
            List<NormalizedContractEvent> events = new ArrayList<>();
            for (JsonNode rawEvent : result.path("events")) {
                try {
                    events.add(eventNormalizer.normalize(rawEvent, nextCursor));
                } catch (EventDecodeException e) {
                    log.warn("Dropping contract event that cannot be identified: {}", e.getMessage());
                }
            }
            Long latestLedger = result.hasNonNull("latestLedger") ? result.get("latestLedger").asLong() : null;

            span.setAttribute("events.count", events.size());
            log.debug("getEvents returned {} events, cursor={}, latestLedger={}",
                    events.size(), nextCursor, latestLedger);
            return new EventPage(events, nextCursor, latestLedger);
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public long getLatestLedger() {
        JsonNode result = call("getLatestLedger", null);
        JsonNode sequence = result.get("sequence");
        if (sequence == null || !sequence.canConvertToLong()) {
            throw new RpcException("getLatestLedger returned no sequence: " + result);
        }
        return sequence.asLong();
    }

    Map<String, Object> buildGetEventsParams(EventQuery query) {
        Map<String, Object> params = new LinkedHashMap<>();
        Map<String, Object> pagination = new LinkedHashMap<>();
        pagination.put("limit", query.getLimit());
        if (query.hasCursor()) {
            pagination.put("cursor", query.getCursor());
        } else {
            params.put("startLedger", Math.max(1L, query.getStartLedger()));
        }

        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("type", "contract");
        filter.put("contractIds", List.of(query.getContractId()));

        params.put("filters", List.of(filter));
        params.put("pagination", pagination);
        params.put("xdrFormat", "json");
        return params;
    }

    /**
     * Execute a JSON-RPC call and return its {@code result} member.
     */
    private JsonNode call(String method, Object params) {
        Map<String, Object> requestBody = new LinkedHashMap<>();
        requestBody.put("jsonrpc", "2.0");
        requestBody.put("id", 1);
        requestBody.put("method", method);
        if (params != null) {
            requestBody.put("params", params);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(requestBody, headers);

        String body;
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    properties.getRpcUrl(), HttpMethod.POST, request, String.class);
            body = response.getBody();
        } catch (RestClientResponseException e) {
            String responseBody = e.getResponseBodyAsString();
            String message = method + " failed with HTTP " + e.getStatusCode().value() + ": " + responseBody;
            if (RetentionWindowException.matches(responseBody)) {
                throw new RetentionWindowException(message, e);
            }
            throw new RpcException(message, e);
        } catch (RestClientException e) {
            throw new RpcException(method + " request failed: " + e.getMessage(), e);
        }

        if (body == null || body.isBlank()) {
            throw new RpcException(method + " returned an empty response");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new RpcException(method + " returned malformed JSON", e);
        }

        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            String message = error.path("message").asText(error.toString());
            log.warn("Soroban RPC error on {}: code={}, message={}", method, error.path("code").asText(), message);
            if (RetentionWindowException.matches(message)) {
                throw new RetentionWindowException(method + " failed: " + message);
            }
            throw new RpcException(method + " failed: " + message);
        }

        JsonNode result = root.get("result");
        if (result == null || result.isNull()) {
            throw new RpcException(method + " returned no result");
        }
        return result;
    }
}
