package com.bridgewatcher.attestation;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Attestation API client using WebClient. Sends the bearer API key and the record nonce as {@code Idempotency-Key}.
 * Every status code is returned to the caller; only transport failures throw.
 */
public class WebClientAttestationApiClient implements AttestationApiClient {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final WebClient webClient;
    private final String endpoint;
    private final Duration timeout;

    public WebClientAttestationApiClient(WebClient.Builder builder, String endpoint, String apiKey, Duration timeout) {
        this.webClient = builder
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .build();
        this.endpoint = endpoint;
        this.timeout = timeout;
    }

    @Override
    public AttestationResponse post(AttestationPayload payload) {
        try {
            return webClient.post()
                    .uri(endpoint)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .header(IDEMPOTENCY_KEY_HEADER, payload.nonce().toString())
                    .bodyValue(payload)
                    .exchangeToMono(response -> response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new AttestationResponse(response.statusCode().value(), body)))
                    .timeout(timeout)
                    .switchIfEmpty(Mono.error(new IllegalStateException("No response")))
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            throw new AttestationTransportException("POST " + endpoint + " failed for nonce " + payload.nonce()
                    + ": " + cause.getClass().getSimpleName() + " " + cause.getMessage(), cause);
        }
    }
}
