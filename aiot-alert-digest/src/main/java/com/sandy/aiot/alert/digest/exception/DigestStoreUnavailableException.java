package com.sandy.aiot.alert.digest.exception;

/**
 * The digest store could not complete an operation. Nothing was committed;
 * the caller decides whether and when to retry.
 */
public class DigestStoreUnavailableException extends RuntimeException {
    public DigestStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
