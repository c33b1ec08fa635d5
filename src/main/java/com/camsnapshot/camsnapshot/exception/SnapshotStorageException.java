package com.camsnapshot.camsnapshot.exception;

/**
 * Base type for failures raised by the snapshot storage and retention code.
 */
public class SnapshotStorageException extends RuntimeException {

    public SnapshotStorageException(String message) {
        super(message);
    }

    public SnapshotStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
