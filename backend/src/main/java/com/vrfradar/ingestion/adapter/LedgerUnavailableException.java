package com.vrfradar.ingestion.adapter;

/**
 * Thrown when a ledger call fails: HTTP or JSON-RPC error, malformed response, timeout or exhausted RPC budget.
 */
public class LedgerUnavailableException extends RuntimeException {

    public LedgerUnavailableException(String message) {
        super(message);
    }

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
