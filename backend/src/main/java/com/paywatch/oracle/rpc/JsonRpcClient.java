package com.paywatch.oracle.rpc;

import reactor.core.publisher.Mono;

/**
 * JSON-RPC 2.0 client abstraction (EVM and Solana speak the same envelope). Mocked in verifier tests.
 */
public interface JsonRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getLogs", "getSignaturesForAddress"
     * @param params      method params
     * @return response body as string (JSON); errors with {@link com.paywatch.oracle.OracleException} on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
