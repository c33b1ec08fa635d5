package com.camsnapshot.camsnapshot.model.entity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class User {
    private String id;
    private String username;
    private String email;
    private List<String> cameraIds; // exids shared with this user

    public User() {
        this.cameraIds = new ArrayList<>();
    }

    // Create from Firestore document
    public static User fromMap(String id, Map<String, Object> data) {
        User user = new User();
        user.setId(id);
        user.setUsername((String) data.get("username"));
        user.setEmail((String) data.get("email"));

        @SuppressWarnings("unchecked")
        List<String> cameras = (List<String>) data.get("cameraIds");
        if (cameras != null) {
            user.setCameraIds(cameras);
        }
        return user;
    }
}
