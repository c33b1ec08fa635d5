package com.camsnapshot.camsnapshot.exception;

public class SnapshotUnavailableException extends SnapshotStorageException {

    public SnapshotUnavailableException(String cameraExid, Throwable cause) {
        super("Thumbnail unavailable for camera " + cameraExid, cause);
    }
}
