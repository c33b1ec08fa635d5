package com.camsnapshot.camsnapshot.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

//For kafka per-user camera status broadcasts
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class CameraStatusMessage {
    private String cameraExid;
    private boolean online;
    private String username;
    private long timestamp;
}
