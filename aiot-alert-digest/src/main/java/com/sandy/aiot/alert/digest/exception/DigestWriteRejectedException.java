package com.sandy.aiot.alert.digest.exception;

/**
 * The store refused a digest write for a reason retrying cannot fix (value too long,
 * missing column value, check constraint). Nothing was committed.
 */
public class DigestWriteRejectedException extends RuntimeException {
    public DigestWriteRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
