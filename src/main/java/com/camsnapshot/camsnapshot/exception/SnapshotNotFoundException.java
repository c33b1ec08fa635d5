package com.camsnapshot.camsnapshot.exception;

/**
 * Confirmed absence of a snapshot. Only this failure triggers the local disk fallback.
 */
public class SnapshotNotFoundException extends SnapshotStorageException {

    public SnapshotNotFoundException(String message) {
        super(message);
    }
}
