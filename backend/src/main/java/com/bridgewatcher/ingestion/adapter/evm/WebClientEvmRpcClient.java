package com.bridgewatcher.ingestion.adapter.evm;

import com.bridgewatcher.ingestion.adapter.LedgerFatalException;
import com.bridgewatcher.ingestion.adapter.LedgerUnavailableException;
import com.bridgewatcher.ingestion.adapter.RpcException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * EVM JSON-RPC client using WebClient. HTTP and transport errors are mapped to the ledger exception types:
 * 401/403 and other 4xx (except 408/429) are fatal, everything else is retryable.
 */
public class WebClientEvmRpcClient implements EvmRpcClient {

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientEvmRpcClient(WebClient.Builder builder, Duration timeout) {
        this.webClient = builder.build();
        this.timeout = timeout;
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", 1,
                "method", method,
                "params", params != null ? params : new Object[]{}
        );
        return Mono.defer(() -> webClient.post()
                        .uri(endpointUrl)
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(body)
                        .retrieve()
                        .bodyToMono(String.class))
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof RpcException), e -> mapError(endpointUrl, method, e));
    }

    static RpcException mapError(String endpointUrl, String method, Throwable e) {
        if (e instanceof WebClientResponseException wre) {
            int status = wre.getStatusCode().value();
            String message = method + " on " + endpointUrl + " returned HTTP " + status;
            if (status == 401 || status == 403) {
                return new LedgerFatalException(message + " (authentication rejected)", e);
            }
            if (status == 408 || status == 429 || status >= 500) {
                return new LedgerUnavailableException(message, e);
            }
            return new LedgerFatalException(message, e);
        }
        if (e instanceof TimeoutException) {
            return new LedgerUnavailableException(method + " on " + endpointUrl + " timed out", e);
        }
        if (e instanceof WebClientRequestException) {
            return new LedgerUnavailableException(method + " on " + endpointUrl + " failed: " + e.getMessage(), e);
        }
        if (e instanceof IllegalArgumentException) {
            return new LedgerFatalException("Malformed RPC endpoint " + endpointUrl + ": " + e.getMessage(), e);
        }
        return new LedgerUnavailableException(method + " on " + endpointUrl + " failed: " + e.getMessage(), e);
    }
}
