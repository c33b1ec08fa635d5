package com.camsnapshot.camsnapshot.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class CacheInvalidationJob {
    private String queue;
    private String worker;
    private String cameraExid;
}
