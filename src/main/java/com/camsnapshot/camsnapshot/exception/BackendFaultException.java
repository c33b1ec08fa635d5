package com.camsnapshot.camsnapshot.exception;

/**
 * Remote backend error that is not a "not found" answer: timeouts, refused
 * connections, 5xx responses, unparseable listings.
 */
public class BackendFaultException extends SnapshotStorageException {

    private final int statusCode;

    public BackendFaultException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public BackendFaultException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status returned by the backend, or -1 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
