package com.routecast.common.exception;

/**
 * Storage-layer failure of the performance ledger or routing table store.
 * The only error that is fatal to a tracking cycle.
 */
public class LedgerUnavailableException extends RoutingEngineException {

    public LedgerUnavailableException(String message, Throwable cause) {
        super(null, message, cause);
    }
}
