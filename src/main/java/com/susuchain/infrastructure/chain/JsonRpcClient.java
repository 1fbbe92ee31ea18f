package com.susuchain.infrastructure.chain;

import com.fasterxml.jackson.databind.JsonNode;
import com.susuchain.config.AutomationProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ethereum JSON-RPC over HTTP.
 *
 * Connect and read timeouts come from the chainRestClient request factory, so a
 * hung node fails the call instead of blocking the caller. Transport failures
 * count towards the chainRpc circuit breaker; once open, calls fail fast with
 * CallNotPermittedException.
 */
@Slf4j
@Component
public class JsonRpcClient {

    private final RestClient restClient;
    private final String rpcUrl;
    private final AtomicLong requestIds = new AtomicLong();

    public JsonRpcClient(@Qualifier("chainRestClient") RestClient restClient, AutomationProperties properties) {
        this.restClient = restClient;
        this.rpcUrl = properties.getChain().getRpcUrl();
    }

    /**
     * eth_call against the latest block; returns the raw 0x-hex return data.
     */
    @CircuitBreaker(name = "chainRpc")
    public String ethCall(String to, String data) {
        Map<String, String> call = new LinkedHashMap<>();
        call.put("to", to);
        call.put("data", data);

        JsonNode result = call("eth_call", List.of(call, "latest"));
        if (result == null || !result.isTextual()) {
            throw new JsonRpcException("eth_call", null, "missing result");
        }
        return result.asText();
    }

    /**
     * eth_sendTransaction from a node-managed account; returns the transaction hash.
     */
    @CircuitBreaker(name = "chainRpc")
    public String sendTransaction(String from, String to, String data) {
        Map<String, String> tx = new LinkedHashMap<>();
        tx.put("from", from);
        tx.put("to", to);
        tx.put("data", data);

        JsonNode result = call("eth_sendTransaction", List.of(tx));
        if (result == null || !result.isTextual()) {
            throw new JsonRpcException("eth_sendTransaction", null, "missing transaction hash");
        }
        return result.asText();
    }

    /**
     * Empty while the transaction is still pending.
     */
    @CircuitBreaker(name = "chainRpc")
    public Optional<JsonNode> getTransactionReceipt(String transactionHash) {
        JsonNode result = call("eth_getTransactionReceipt", List.of(transactionHash));
        if (result == null || result.isNull()) {
            return Optional.empty();
        }
        return Optional.of(result);
    }

    private JsonNode call(String method, List<Object> params) {
        long id = requestIds.incrementAndGet();

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", "2.0");
        request.put("id", id);
        request.put("method", method);
        request.put("params", params);

        log.debug("JSON-RPC request: id={}, method={}", id, method);

        JsonNode response = restClient.post()
                .uri(rpcUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(JsonNode.class);

        if (response == null) {
            throw new JsonRpcException(method, null, "empty response");
        }

        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            throw new JsonRpcException(method, error.path("code").asInt(), error.path("message").asText());
        }

        return response.get("result");
    }
}
