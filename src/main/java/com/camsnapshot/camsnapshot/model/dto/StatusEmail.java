package com.camsnapshot.camsnapshot.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

//For kafka owner e-mail requests, picked up by the mailer service
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class StatusEmail {
    private String template; // camera_online | camera_offline
    private String cameraExid;
    private String cameraName;
    private String ownerUsername;
    private String ownerEmail;
}
