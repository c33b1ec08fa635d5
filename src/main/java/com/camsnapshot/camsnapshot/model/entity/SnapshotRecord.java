package com.camsnapshot.camsnapshot.model.entity;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One row per successful capture. Append only: rows outlive the files they describe.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotRecord {
    private long cameraId;
    private Instant createdAt;
    private String notes;
    private Double motionLevel;
    private String snapshotId;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("cameraId", cameraId);
        map.put("createdAt", createdAt != null ? createdAt.toString() : null);
        map.put("notes", notes);
        map.put("motionLevel", motionLevel);
        map.put("snapshotId", snapshotId);
        return map;
    }
}
