package com.bridgewatcher.ingestion.adapter;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin RPC endpoint selection. A failed call moves on to the next endpoint.
 */
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger index;

    public RpcEndpointRotator(List<String> endpoints) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.index = new AtomicInteger(0);
    }

    /**
     * Next endpoint in round-robin order.
     */
    public String getNextEndpoint() {
        int i = index.getAndIncrement() % endpoints.size();
        if (i < 0) {
            i += endpoints.size();
        }
        return endpoints.get(i);
    }

    public int size() {
        return endpoints.size();
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
