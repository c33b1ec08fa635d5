package com.camsnapshot.camsnapshot.service.notification;

import com.camsnapshot.camsnapshot.model.entity.Camera;
import com.camsnapshot.camsnapshot.model.entity.CameraActivity;
import com.camsnapshot.camsnapshot.model.entity.User;
import com.camsnapshot.camsnapshot.repository.CameraActivityRepository;
import com.camsnapshot.camsnapshot.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Side effects of a liveness transition that the caller never waits for.
 */
@Component
public class CameraStatusNotifier {

    private static final Logger log = LoggerFactory.getLogger(CameraStatusNotifier.class);

    private final UserRepository userRepository;
    private final CameraActivityRepository cameraActivityRepository;
    private final CameraEventProducer cameraEventProducer;

    public CameraStatusNotifier(UserRepository userRepository,
                                CameraActivityRepository cameraActivityRepository,
                                CameraEventProducer cameraEventProducer) {
        this.userRepository = userRepository;
        this.cameraActivityRepository = cameraActivityRepository;
        this.cameraEventProducer = cameraEventProducer;
    }

    public void broadcastToUsers(Camera camera) {
        for (User user : userRepository.findWithAccessTo(camera)) {
            cameraEventProducer.broadcastStatus(camera.getExid(), camera.isOnline(), user.getUsername());
        }
    }

    /**
     * Appends the activity row, then e-mails the owner when they opted in. The e-mail
     * goes out even when the activity insert fails.
     */
    public void logStatusChange(Camera camera, boolean online, Instant doneAt) {
        try {
            cameraActivityRepository.insert(CameraActivity.builder()
                    .cameraId(camera.getNumericId())
                    .cameraExid(camera.getExid())
                    .action(online ? CameraActivity.ONLINE : CameraActivity.OFFLINE)
                    .doneAt(doneAt)
                    .build());
        } catch (RuntimeException e) {
            log.error("[{}] [camera_activity] failed to log {}: {}",
                    camera.getExid(), online ? "online" : "offline", e.getMessage(), e);
        }

        if (camera.isOnlineEmailOwnerNotification()) {
            cameraEventProducer.sendStatusEmail(camera, online);
        }
    }
}
