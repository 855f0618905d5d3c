package com.netcracker.core.access.service;

/**
 * Base type of failures that end the reconciliation of a group or a target.
 */
public class AccessManagerException extends RuntimeException {

    public AccessManagerException(String message) {
        super(message);
    }

    public AccessManagerException(String message, Throwable cause) {
        super(message, cause);
    }
}
