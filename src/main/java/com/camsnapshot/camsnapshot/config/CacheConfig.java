package com.camsnapshot.camsnapshot.config;

import com.camsnapshot.camsnapshot.model.entity.Camera;
import com.camsnapshot.camsnapshot.service.cache.EphemeralCache;
import com.camsnapshot.camsnapshot.service.cache.InMemoryEphemeralCache;
import com.camsnapshot.camsnapshot.service.liveness.LastSnapshot;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

    // Weighted consecutive capture failures per camera exid
    @Bean
    public EphemeralCache<Integer> snapshotErrorCache() {
        return new InMemoryEphemeralCache<>("snapshot_error");
    }

    @Bean
    public EphemeralCache<Camera> cameraFullCache() {
        return new InMemoryEphemeralCache<>("camera_full");
    }

    @Bean
    public EphemeralCache<LastSnapshot> lastSnapshotCache() {
        return new InMemoryEphemeralCache<>("last_snapshot");
    }
}
