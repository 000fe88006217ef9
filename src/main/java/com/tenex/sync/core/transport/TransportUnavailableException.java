package com.tenex.sync.core.transport;

/**
 * A subscribe, collect or publish call failed. Recoverable: the caller may retry.
 */
public class TransportUnavailableException extends SyncTransportException {

    public TransportUnavailableException(String message) {
        super(message);
    }

    public TransportUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
