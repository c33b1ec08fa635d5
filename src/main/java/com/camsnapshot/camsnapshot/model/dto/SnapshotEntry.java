package com.camsnapshot.camsnapshot.model.dto;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

// Range query result, rebuilt from a storage path
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class SnapshotEntry {
    private Instant createdAt;
    private String notes;
    private Double motionLevel;
}
