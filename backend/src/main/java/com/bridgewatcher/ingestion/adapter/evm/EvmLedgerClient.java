package com.bridgewatcher.ingestion.adapter.evm;

import com.bridgewatcher.ingestion.adapter.EventSelector;
import com.bridgewatcher.ingestion.adapter.LedgerClient;
import com.bridgewatcher.ingestion.adapter.LedgerFatalException;
import com.bridgewatcher.ingestion.adapter.LedgerUnavailableException;
import com.bridgewatcher.ingestion.adapter.RawLogEntry;
import com.bridgewatcher.ingestion.adapter.RpcEndpointRotator;
import com.bridgewatcher.ingestion.adapter.RpcException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link LedgerClient} over Ethereum JSON-RPC: eth_blockNumber, eth_chainId, eth_getLogs.
 * Each call tries every configured endpoint once (round-robin) while failures stay retryable; a fatal failure
 * is rethrown immediately. eth_getLogs ranges the node refuses as too wide are split in halves.
 */
@Slf4j
public class EvmLedgerClient implements LedgerClient {

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public EvmLedgerClient(EvmRpcClient rpcClient, RpcEndpointRotator rotator, RateLimiter rateLimiter,
                           ObjectMapper objectMapper) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    public long getLatestHeight() {
        return parseQuantity("eth_blockNumber", call("eth_blockNumber", Collections.emptyList()));
    }

    @Override
    public long getChainId() {
        return parseQuantity("eth_chainId", call("eth_chainId", Collections.emptyList()));
    }

    @Override
    public List<RawLogEntry> getEvents(long fromHeight, long toHeight, EventSelector eventSelector) {
        if (fromHeight > toHeight) {
            return List.of();
        }
        return fetchLogs(fromHeight, toHeight, eventSelector);
    }

    private List<RawLogEntry> fetchLogs(long fromHeight, long toHeight, EventSelector selector) {
        try {
            JsonNode result = call("eth_getLogs", Collections.singletonList(buildLogFilter(fromHeight, toHeight, selector)));
            if (!result.isArray()) {
                throw new LedgerUnavailableException("eth_getLogs returned a non-array result for ["
                        + fromHeight + "-" + toHeight + "]");
            }
            List<RawLogEntry> logs = new ArrayList<>(result.size());
            result.forEach(node -> logs.add(toRawLogEntry(node)));
            return logs;
        } catch (LedgerUnavailableException e) {
            if (isRangeTooWideError(e) && toHeight > fromHeight) {
                long mid = fromHeight + (toHeight - fromHeight) / 2;
                log.warn("Reducing block range [{}-{}] due to RPC limitation: {}", fromHeight, toHeight, e.getMessage());
                List<RawLogEntry> combined = new ArrayList<>(fetchLogs(fromHeight, mid, selector));
                combined.addAll(fetchLogs(mid + 1, toHeight, selector));
                return combined;
            }
            throw e;
        }
    }

    private JsonNode call(String method, Object params) {
        int attempts = rotator.size();
        RpcException last = null;
        for (int attempt = 0; attempt < attempts; attempt++) {
            String endpoint = rotator.getNextEndpoint();
            try {
                return callOnce(endpoint, method, params);
            } catch (LedgerUnavailableException e) {
                last = e;
                if (attempts > 1) {
                    log.warn("{} failed on {} (attempt {}/{}), trying next endpoint: {}",
                            method, endpoint, attempt + 1, attempts, e.getMessage());
                }
            }
        }
        String msg = method + " failed on " + attempts + " endpoint(s)";
        if (last != null && last.getMessage() != null && !last.getMessage().isBlank()) {
            msg += ": " + last.getMessage();
        }
        throw new LedgerUnavailableException(msg, last);
    }

    private JsonNode callOnce(String endpoint, String method, Object params) {
        if (!rateLimiter.acquirePermission()) {
            throw new LedgerUnavailableException("Local limiter timeout before " + method + " on " + endpoint);
        }
        String json;
        try {
            json = rpcClient.call(endpoint, method, params).block();
        } catch (RpcException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LedgerUnavailableException(method + " on " + endpoint + " failed: " + e.getMessage(), e);
        }
        if (json == null) {
            throw new LedgerUnavailableException(method + " returned an empty response from " + endpoint);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new LedgerUnavailableException("Failed to parse " + method + " response from " + endpoint, e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw classifyRpcError(method, endpoint, error);
        }
        JsonNode result = root.path("result");
        if (result.isMissingNode() || result.isNull()) {
            throw new LedgerUnavailableException(method + " returned no result from " + endpoint);
        }
        return result;
    }

    /**
     * JSON-RPC error objects: malformed requests (-32600, -32601, -32602) are fatal since repeating them cannot
     * succeed, unless the message says the block range is too wide. Everything else is treated as transient.
     */
    static RpcException classifyRpcError(String method, String endpoint, JsonNode error) {
        String message = method + " error from " + endpoint + ": " + error;
        int code = error.path("code").asInt(0);
        if (isRangeTooWideMessage(message) || isTransientMessage(message)) {
            return new LedgerUnavailableException(message);
        }
        if (code == -32600 || code == -32601 || code == -32602) {
            return new LedgerFatalException(message);
        }
        return new LedgerUnavailableException(message);
    }

    public static boolean isRangeTooWideError(Exception e) {
        Throwable t = e;
        while (t != null) {
            if (isRangeTooWideMessage(t.getMessage())) {
                return true;
            }
            t = t.getCause();
        }
        return false;
    }

    static boolean isRangeTooWideMessage(String message) {
        if (message == null) return false;
        String msg = message.toLowerCase();
        return msg.contains("-32701") || msg.contains("query returned more than")
                || msg.contains("too many results") || msg.contains("block range is too wide")
                || msg.contains("exceed maximum block range") || msg.contains("log response size exceeded");
    }

    static boolean isTransientMessage(String message) {
        if (message == null) return false;
        String msg = message.toLowerCase();
        return msg.contains("rate limit") || msg.contains("limit exceeded") || msg.contains("too many requests")
                || msg.contains("-32005") || msg.contains("timeout") || msg.contains("timed out")
                || msg.contains("temporary") || msg.contains("header not found") || msg.contains("please retry");
    }

    private static Map<String, Object> buildLogFilter(long fromHeight, long toHeight, EventSelector selector) {
        Map<String, Object> filter = new HashMap<>();
        filter.put("fromBlock", toQuantity(fromHeight));
        filter.put("toBlock", toQuantity(toHeight));
        filter.put("address", selector.contractAddress());
        filter.put("topics", List.of(selector.topic()));
        return filter;
    }

    private RawLogEntry toRawLogEntry(JsonNode log) {
        List<String> topics = new ArrayList<>();
        log.path("topics").forEach(t -> topics.add(t.asText()));
        return new RawLogEntry(
                textOrNull(log, "address"),
                topics,
                textOrNull(log, "data"),
                textOrNull(log, "transactionHash"),
                parseQuantityOrNull(textOrNull(log, "blockNumber")),
                parseQuantityOrNull(textOrNull(log, "logIndex")),
                log.path("removed").asBoolean(false));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    static long parseQuantity(String method, JsonNode result) {
        Long value = parseQuantityOrNull(result.asText(null));
        if (value == null) {
            throw new LedgerUnavailableException(method + " invalid result: " + result);
        }
        return value;
    }

    static Long parseQuantityOrNull(String hex) {
        if (hex == null || !hex.startsWith("0x") || hex.length() < 3) return null;
        try {
            return Long.parseLong(hex.substring(2), 16);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String toQuantity(long value) {
        return "0x" + Long.toHexString(value);
    }
}
