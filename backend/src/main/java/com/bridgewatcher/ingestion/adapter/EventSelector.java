package com.bridgewatcher.ingestion.adapter;

/**
 * Which logs to fetch: emitting contract plus topic0 (Keccak-256 of the event signature).
 */
public record EventSelector(String contractAddress, String topic, String signature) {
}
