package com.tenex.sync.core.transport;

/**
 * Base type of failures raised at the transport boundary. Parsing and merging never raise.
 */
public abstract class SyncTransportException extends RuntimeException {

    protected SyncTransportException(String message) {
        super(message);
    }

    protected SyncTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
