package com.tenex.sync.core.transport;

/**
 * No transport client or signer is bound. Fatal to the requested operation; retrying without
 * configuration changes will not help.
 */
public class TransportNotConfiguredException extends SyncTransportException {

    public TransportNotConfiguredException(String message) {
        super(message);
    }
}
