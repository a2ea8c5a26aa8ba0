package com.bridgewatcher.ingestion.config;

import com.bridgewatcher.config.validation.EvmAddress;
import com.bridgewatcher.ingestion.decode.EventSignature;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Source ledger settings: where to read, what to read, and how far behind the head to stay.
 *
 * @param rpcUrls                JSON-RPC endpoints, tried round-robin
 * @param contractAddress        bridge contract emitting the event
 * @param eventSignature         canonical event signature; its Keccak-256 is the topic filter
 * @param sourceChainId          expected chain id; when absent the node's eth_chainId is used
 * @param confirmationDelay      blocks behind the head that are never scanned
 * @param maxRangeSize           widest block range fetched by one scan
 * @param startHeight            first block to scan; when absent, starts a few blocks behind the safe head
 * @param startLookbackBlocks    how far behind the safe head to start when no start height is set
 * @param maxConsecutiveFailures unavailable polls in a row before giving up; 0 never gives up
 * @param requestTimeoutMs       per-request HTTP timeout
 */
@Validated
@ConfigurationProperties(prefix = "bridgewatcher.ledger")
public record LedgerProperties(
        @NotEmpty List<@NotBlank @Pattern(regexp = "^https?://\\S+$", message = "must be an http(s) URL") String> rpcUrls,
        @EvmAddress String contractAddress,
        @DefaultValue(EventSignature.BRIDGE_TRANSFER_INITIATED)
        @Pattern(regexp = "^[A-Za-z_][A-Za-z0-9_]*\\([A-Za-z0-9_,\\[\\] ]*\\)$", message = "must look like Name(type,...)")
        String eventSignature,
        @PositiveOrZero Long sourceChainId,
        @DefaultValue("6") @Min(0) int confirmationDelay,
        @DefaultValue("2000") @Min(1) int maxRangeSize,
        @PositiveOrZero Long startHeight,
        @DefaultValue("10") @Min(0) int startLookbackBlocks,
        @DefaultValue("40") @Min(0) int maxConsecutiveFailures,
        @DefaultValue("10000") @Min(1) long requestTimeoutMs
) {
}
