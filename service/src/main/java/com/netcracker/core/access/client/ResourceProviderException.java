package com.netcracker.core.access.client;

import com.netcracker.core.access.service.AccessManagerException;

/**
 * Transport, authentication, not-found or parse failure reported by the resource provider.
 */
public class ResourceProviderException extends AccessManagerException {

    public ResourceProviderException(String message) {
        super(message);
    }

    public ResourceProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
