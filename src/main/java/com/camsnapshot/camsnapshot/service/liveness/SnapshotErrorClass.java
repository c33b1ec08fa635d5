package com.camsnapshot.camsnapshot.service.liveness;

import java.util.Locale;

/**
 * Classes of capture failure and how much each counts towards taking a camera offline.
 * A camera goes offline once the weights of its consecutive failures add up to 100.
 */
public enum SnapshotErrorClass {
    ECONNREFUSED(100),
    EHOSTUNREACH(100),
    ENETUNREACH(100),
    NXDOMAIN(100),
    UNAUTHORIZED(100),
    FORBIDDEN(100),
    NOT_FOUND(100),
    DEVICE_ERROR(100),
    DEVICE_BUSY(100),
    MOVED(100),
    BAD_REQUEST(50),
    TIMEOUT(25),
    CLOSED(25),
    NOT_A_JPEG(10),
    UNHANDLED(10),
    // local resource exhaustion, says nothing about the camera
    SYSTEM_LIMIT(0),
    EMFILE(0);

    private final int weight;

    SnapshotErrorClass(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SnapshotErrorClass fromCode(String code) {
        if (code == null || code.isBlank()) {
            return UNHANDLED;
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("REQ_TIMEDOUT") || normalized.equals("CONNECT_TIMEOUT")) {
            return TIMEOUT;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return UNHANDLED;
        }
    }
}
