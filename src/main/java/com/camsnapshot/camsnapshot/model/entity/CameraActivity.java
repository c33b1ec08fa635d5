package com.camsnapshot.camsnapshot.model.entity;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CameraActivity {
    public static final String ONLINE = "online";
    public static final String OFFLINE = "offline";

    private long cameraId;
    private String cameraExid;
    private String action; // online | offline
    private Instant doneAt;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("cameraId", cameraId);
        map.put("cameraExid", cameraExid);
        map.put("action", action);
        map.put("doneAt", doneAt != null ? doneAt.toString() : null);
        return map;
    }
}
