package com.camsnapshot.camsnapshot.service.notification;

import com.camsnapshot.camsnapshot.model.dto.CacheInvalidationJob;
import com.camsnapshot.camsnapshot.model.dto.CameraStatusMessage;
import com.camsnapshot.camsnapshot.model.dto.StatusEmail;
import com.camsnapshot.camsnapshot.model.entity.Camera;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/**
 * Outbound messages for downstream services. Sends are asynchronous; the returned
 * futures are not awaited.
 */
@Service
public class CameraEventProducer {

    static final String CACHE_INVALIDATION_WORKER = "CacheInvalidationWorker";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String cacheInvalidationTopic;
    private final String statusTopic;
    private final String emailTopic;

    public CameraEventProducer(KafkaTemplate<String, Object> kafkaTemplate,
                               @Value("${kafka.topic.cache-invalidation:camera-cache-invalidation}") String cacheInvalidationTopic,
                               @Value("${kafka.topic.camera-status:camera-status}") String statusTopic,
                               @Value("${kafka.topic.camera-email:camera-email}") String emailTopic) {
        this.kafkaTemplate = kafkaTemplate;
        this.cacheInvalidationTopic = cacheInvalidationTopic;
        this.statusTopic = statusTopic;
        this.emailTopic = emailTopic;
    }

    public void enqueueCacheInvalidation(String cameraExid) {
        CacheInvalidationJob job = CacheInvalidationJob.builder()
                .queue("cache")
                .worker(CACHE_INVALIDATION_WORKER)
                .cameraExid(cameraExid)
                .build();
        kafkaTemplate.send(cacheInvalidationTopic, cameraExid, job);
    }

    public void broadcastStatus(String cameraExid, boolean online, String username) {
        CameraStatusMessage message = CameraStatusMessage.builder()
                .cameraExid(cameraExid)
                .online(online)
                .username(username)
                .timestamp(System.currentTimeMillis())
                .build();
        kafkaTemplate.send(statusTopic, username, message); // key (partition by user)
    }

    public void sendStatusEmail(Camera camera, boolean online) {
        StatusEmail email = StatusEmail.builder()
                .template(online ? "camera_online" : "camera_offline")
                .cameraExid(camera.getExid())
                .cameraName(camera.getName())
                .ownerUsername(camera.getOwnerUsername())
                .ownerEmail(camera.getOwnerEmail())
                .build();
        kafkaTemplate.send(emailTopic, camera.getExid(), email);
    }
}
