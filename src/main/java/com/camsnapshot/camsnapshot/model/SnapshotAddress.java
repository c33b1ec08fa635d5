package com.camsnapshot.camsnapshot.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Storage address of one snapshot. Derived from camera, timestamp and tag, never stored.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class SnapshotAddress {
    private final String cameraExid;
    private final int year;
    private final int month;
    private final int day;
    private final int hour;
    private final int minute;
    private final int second;
    private final String fraction; // first three sub-second digits, zero padded
    private final SourceTag sourceTag;
}
