package com.bridgewatcher.ingestion.adapter.evm;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC transport, kept behind an interface so the ledger client can be tested with canned responses.
 * Endpoint failover is handled by {@link EvmLedgerClient}.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call. Method and params are standard Ethereum JSON-RPC.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getLogs"
     * @param params      method params (e.g. filter object)
     * @return response body as string (JSON); errors with
     *         {@link com.bridgewatcher.ingestion.adapter.LedgerUnavailableException} or
     *         {@link com.bridgewatcher.ingestion.adapter.LedgerFatalException} on HTTP or transport failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
