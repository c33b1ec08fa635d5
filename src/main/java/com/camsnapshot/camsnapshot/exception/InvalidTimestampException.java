package com.camsnapshot.camsnapshot.exception;

/**
 * A timestamp, file name field or snapshot id that cannot be turned into a storage address.
 */
public class InvalidTimestampException extends SnapshotStorageException {

    public InvalidTimestampException(String message) {
        super(message);
    }

    public InvalidTimestampException(String message, Throwable cause) {
        super(message, cause);
    }
}
