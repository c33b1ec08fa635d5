package com.camsnapshot.camsnapshot.service.liveness;

import lombok.AllArgsConstructor;
import lombok.Getter;

// Most recent image per camera, kept for motion comparison
@Getter
@AllArgsConstructor
public class LastSnapshot {
    private final byte[] image;
}
