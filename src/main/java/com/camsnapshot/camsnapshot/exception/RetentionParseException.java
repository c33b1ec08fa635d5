package com.camsnapshot.camsnapshot.exception;

/**
 * A day-partition directory under the recordings tree does not parse as a date.
 */
public class RetentionParseException extends SnapshotStorageException {

    public RetentionParseException(String cameraExid, String partition, Throwable cause) {
        super("[" + cameraExid + "] invalid day partition '" + partition + "'", cause);
    }
}
