package com.bridgewatcher.domain;

import com.bridgewatcher.common.AddressFormat;

import java.math.BigInteger;
import java.util.Comparator;

/**
 * Normalized, chain-agnostic view of one {@code BridgeTransferInitiated} log. Immutable once built.
 * {@code (transactionHash, logIndex)} identifies the log on the source chain; {@code nonce} is the
 * idempotency key at the attestation API.
 */
public record EventRecord(
        String fromAddress,
        String toAddress,
        String tokenAddress,
        BigInteger amount,
        long sourceChainId,
        long destinationChainId,
        BigInteger nonce,
        String transactionHash,
        long blockNumber,
        long logIndex
) {

    /** Canonical processing order: block number, then log index within the block. */
    public static final Comparator<EventRecord> CANONICAL_ORDER =
            Comparator.comparingLong(EventRecord::blockNumber).thenComparingLong(EventRecord::logIndex);

    public EventRecord {
        fromAddress = requireAddress("fromAddress", fromAddress);
        toAddress = requireAddress("toAddress", toAddress);
        tokenAddress = requireAddress("tokenAddress", tokenAddress);
        requireUnsigned("amount", amount);
        requireUnsigned("nonce", nonce);
        if (sourceChainId < 0 || destinationChainId < 0) {
            throw new IllegalArgumentException("chain ids must be non-negative");
        }
        if (transactionHash == null || transactionHash.isBlank()) {
            throw new IllegalArgumentException("transactionHash is required");
        }
        if (blockNumber < 0 || logIndex < 0) {
            throw new IllegalArgumentException("blockNumber and logIndex must be non-negative");
        }
    }

    /** Discovery-layer dedup key. */
    public String logKey() {
        return transactionHash + ":" + logIndex;
    }

    private static String requireAddress(String field, String value) {
        if (!AddressFormat.isValidAddress(value)) {
            throw new IllegalArgumentException(field + " is not a valid address: " + value);
        }
        return AddressFormat.normalize(value);
    }

    private static void requireUnsigned(String field, BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException(field + " must be non-negative: " + value);
        }
    }
}
