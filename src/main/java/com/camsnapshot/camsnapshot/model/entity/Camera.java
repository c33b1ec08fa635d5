package com.camsnapshot.camsnapshot.model.entity;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class Camera {
    public static final int KEEP_FOREVER = -1;

    private String id;          // Firestore document id
    private long numericId;
    private String exid;
    private String name;
    private boolean online;
    private Instant lastOnlineAt;
    private Instant lastPolledAt;
    private Instant updatedAt;
    private int storageDuration = KEEP_FOREVER; // days
    private boolean onlineEmailOwnerNotification;
    private String ownerUsername;
    private String ownerEmail;

    public boolean keepsForever() {
        return storageDuration == KEEP_FOREVER;
    }

    public Camera copy() {
        return fromMap(id, toMap());
    }

    // Status fields only, written on liveness transitions
    public Map<String, Object> statusMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("isOnline", online);
        map.put("lastPolledAt", toText(lastPolledAt));
        map.put("updatedAt", toText(updatedAt));
        if (lastOnlineAt != null) {
            map.put("lastOnlineAt", toText(lastOnlineAt));
        }
        return map;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("numericId", numericId);
        map.put("exid", exid);
        map.put("name", name);
        map.put("isOnline", online);
        map.put("lastOnlineAt", toText(lastOnlineAt));
        map.put("lastPolledAt", toText(lastPolledAt));
        map.put("updatedAt", toText(updatedAt));
        map.put("storageDuration", storageDuration);
        map.put("isOnlineEmailOwnerNotification", onlineEmailOwnerNotification);
        map.put("ownerUsername", ownerUsername);
        map.put("ownerEmail", ownerEmail);
        return map;
    }

    public static Camera fromMap(String id, Map<String, Object> data) {
        Camera camera = new Camera();
        camera.setId(id);
        camera.setExid((String) data.get("exid"));
        camera.setName((String) data.get("name"));
        camera.setOnline(Boolean.TRUE.equals(data.get("isOnline")));
        camera.setOnlineEmailOwnerNotification(Boolean.TRUE.equals(data.get("isOnlineEmailOwnerNotification")));
        camera.setOwnerUsername((String) data.get("ownerUsername"));
        camera.setOwnerEmail((String) data.get("ownerEmail"));
        camera.setLastOnlineAt(parse(data.get("lastOnlineAt")));
        camera.setLastPolledAt(parse(data.get("lastPolledAt")));
        camera.setUpdatedAt(parse(data.get("updatedAt")));

        Object numericId = data.get("numericId");
        if (numericId instanceof Number) {
            camera.setNumericId(((Number) numericId).longValue());
        }
        Object duration = data.get("storageDuration");
        if (duration instanceof Number) {
            camera.setStorageDuration(((Number) duration).intValue());
        }
        return camera;
    }

    private static String toText(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    private static Instant parse(Object value) {
        return value instanceof String ? Instant.parse((String) value) : null;
    }
}
