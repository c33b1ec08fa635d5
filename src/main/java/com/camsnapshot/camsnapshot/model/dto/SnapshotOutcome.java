package com.camsnapshot.camsnapshot.model.dto;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of one capture attempt, as fed to the liveness state machine.
 */
@Getter
@AllArgsConstructor
@ToString
public class SnapshotOutcome {
    private final boolean success;
    private final Instant timestamp;
    private final String errorClass;
    private final int errorWeight;

    public static SnapshotOutcome success(Instant timestamp) {
        return new SnapshotOutcome(true, timestamp, null, 0);
    }

    public static SnapshotOutcome failure(Instant timestamp, String errorClass, int errorWeight) {
        return new SnapshotOutcome(false, timestamp, errorClass, errorWeight);
    }
}
