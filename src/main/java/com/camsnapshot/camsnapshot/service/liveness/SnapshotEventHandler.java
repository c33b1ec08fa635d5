package com.camsnapshot.camsnapshot.service.liveness;

import com.camsnapshot.camsnapshot.model.SourceTag;
import com.camsnapshot.camsnapshot.model.dto.SnapshotOutcome;
import com.camsnapshot.camsnapshot.model.entity.Camera;
import com.camsnapshot.camsnapshot.model.entity.SnapshotRecord;
import com.camsnapshot.camsnapshot.repository.SnapshotRepository;
import com.camsnapshot.camsnapshot.service.cache.EphemeralCache;
import com.camsnapshot.camsnapshot.service.motion.MotionLevelComparator;
import com.camsnapshot.camsnapshot.service.storage.SnapshotAddressResolver;
import com.camsnapshot.camsnapshot.service.storage.SnapshotStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Entry point for the poller: one call per capture attempt.
 */
@Service
public class SnapshotEventHandler {

    private static final Logger log = LoggerFactory.getLogger(SnapshotEventHandler.class);

    static final String PROXY_NOTES = SourceTag.RECORDINGS.notes();

    private final CameraStatusService cameraStatusService;
    private final SnapshotStorage snapshotStorage;
    private final SnapshotRepository snapshotRepository;
    private final SnapshotAddressResolver resolver;
    private final MotionLevelComparator motionLevelComparator;
    private final EphemeralCache<LastSnapshot> lastSnapshotCache;

    public SnapshotEventHandler(CameraStatusService cameraStatusService,
                                SnapshotStorage snapshotStorage,
                                SnapshotRepository snapshotRepository,
                                SnapshotAddressResolver resolver,
                                MotionLevelComparator motionLevelComparator,
                                EphemeralCache<LastSnapshot> lastSnapshotCache) {
        this.cameraStatusService = cameraStatusService;
        this.snapshotStorage = snapshotStorage;
        this.snapshotRepository = snapshotRepository;
        this.resolver = resolver;
        this.motionLevelComparator = motionLevelComparator;
        this.lastSnapshotCache = lastSnapshotCache;
    }

    /**
     * Stores the image and its metadata row and records a success for the camera. The
     * camera answered, so a storage failure does not count against its liveness.
     */
    public void onSnapshot(String cameraExid, Instant timestamp, byte[] image) {
        log.debug("[{}] [snapshot_success]", cameraExid);

        Double motionLevel = lastSnapshotCache.get(cameraExid)
                .flatMap(previous -> calculateMotionLevel(cameraExid, image, previous.getImage()))
                .orElse(null);

        try {
            snapshotStorage.save(cameraExid, timestamp, image, PROXY_NOTES);
        } catch (RuntimeException e) {
            log.error("[{}] [snapshot_save] failed: {}", cameraExid, e.getMessage(), e);
        }

        try {
            Optional<Camera> camera = cameraStatusService.updateCameraStatus(cameraExid, SnapshotOutcome.success(timestamp));
            camera.ifPresent(c -> saveSnapshotRecord(c, timestamp, motionLevel, PROXY_NOTES));
        } catch (RuntimeException e) {
            log.error("[{}] [update_status] failed: {}", cameraExid, e.getMessage(), e);
        }

        lastSnapshotCache.put(cameraExid, new LastSnapshot(image));
    }

    public void onSnapshotError(String cameraExid, Instant timestamp, String errorCode) {
        SnapshotErrorClass errorClass = SnapshotErrorClass.fromCode(errorCode);
        log.debug("[{}] [snapshot_error] [{}]", cameraExid, errorClass.code());

        try {
            cameraStatusService.updateCameraStatus(cameraExid,
                    SnapshotOutcome.failure(timestamp, errorClass.code(), errorClass.weight()));
        } catch (RuntimeException e) {
            log.error("[{}] [update_status] failed: {}", cameraExid, e.getMessage(), e);
        }
    }

    private Optional<Double> calculateMotionLevel(String cameraExid, byte[] current, byte[] previous) {
        try {
            return motionLevelComparator.compare(cameraExid, current, previous);
        } catch (RuntimeException e) {
            log.warn("[{}] [motion_level] {}", cameraExid, e.getMessage());
            return Optional.empty();
        }
    }

    private void saveSnapshotRecord(Camera camera, Instant timestamp, Double motionLevel, String notes) {
        SnapshotRecord record = SnapshotRecord.builder()
                .cameraId(camera.getNumericId())
                .createdAt(timestamp)
                .notes(notes)
                .motionLevel(motionLevel)
                .snapshotId(resolver.formatSnapshotId(camera.getNumericId(), timestamp))
                .build();
        try {
            snapshotRepository.insert(record);
        } catch (RuntimeException e) {
            log.error("[{}] [snapshot_record] failed: {}", camera.getExid(), e.getMessage(), e);
        }
    }
}
