package com.camsnapshot.camsnapshot.service.liveness;

import com.camsnapshot.camsnapshot.model.dto.SnapshotOutcome;
import com.camsnapshot.camsnapshot.model.entity.Camera;
import com.camsnapshot.camsnapshot.repository.CameraRepository;
import com.camsnapshot.camsnapshot.service.cache.EphemeralCache;
import com.camsnapshot.camsnapshot.service.notification.CameraEventProducer;
import com.camsnapshot.camsnapshot.service.notification.CameraStatusNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Online/offline state machine fed by capture outcomes.
 *
 * <p>A single success brings an offline camera back online. Failures accumulate their
 * weights and an online camera only goes offline once the total reaches
 * {@link #OFFLINE_THRESHOLD}. Only actual transitions are persisted and notified.
 *
 * <p>Outcomes for one camera are expected one at a time (one capture in flight per
 * camera); outcomes for different cameras never contend.
 */
@Service
public class CameraStatusService {

    private static final Logger log = LoggerFactory.getLogger(CameraStatusService.class);

    public static final int OFFLINE_THRESHOLD = 100;

    private final CameraRepository cameraRepository;
    private final EphemeralCache<Integer> snapshotErrorCache;
    private final EphemeralCache<Camera> cameraFullCache;
    private final CameraEventProducer cameraEventProducer;
    private final CameraStatusNotifier cameraStatusNotifier;
    private final ExecutorService statusPersistenceExecutor;
    private final Executor notificationExecutor;
    private final long persistenceTimeoutMs;

    public CameraStatusService(CameraRepository cameraRepository,
                               EphemeralCache<Integer> snapshotErrorCache,
                               EphemeralCache<Camera> cameraFullCache,
                               CameraEventProducer cameraEventProducer,
                               CameraStatusNotifier cameraStatusNotifier,
                               @Qualifier("statusPersistenceExecutor") ExecutorService statusPersistenceExecutor,
                               @Qualifier("notificationExecutor") Executor notificationExecutor,
                               @Value("${liveness.persistence-timeout-ms:1000}") long persistenceTimeoutMs) {
        this.cameraRepository = cameraRepository;
        this.snapshotErrorCache = snapshotErrorCache;
        this.cameraFullCache = cameraFullCache;
        this.cameraEventProducer = cameraEventProducer;
        this.cameraStatusNotifier = cameraStatusNotifier;
        this.statusPersistenceExecutor = statusPersistenceExecutor;
        this.notificationExecutor = notificationExecutor;
        this.persistenceTimeoutMs = persistenceTimeoutMs;
    }

    /**
     * @return the camera as this process now sees it, or empty for a blank or unknown exid
     */
    public Optional<Camera> updateCameraStatus(String cameraExid, SnapshotOutcome outcome) {
        if (cameraExid == null || cameraExid.isBlank()) {
            return Optional.empty();
        }

        Optional<Camera> found = getFull(cameraExid);
        if (found.isEmpty()) {
            log.warn("[{}] [update_status] unknown camera", cameraExid);
            return Optional.empty();
        }

        Camera camera = found.get();
        if (outcome.isSuccess()) {
            snapshotErrorCache.put(cameraExid, 0);
            if (!camera.isOnline()) {
                camera = changeCameraStatus(camera, outcome.getTimestamp(), true);
                log.warn("[{}] [update_status] [online]", cameraExid);
            }
            return Optional.of(camera);
        }

        int errorTotal = snapshotErrorCache.update(cameraExid, 0, total -> total + outcome.getErrorWeight());
        if (camera.isOnline()) {
            if (errorTotal >= OFFLINE_THRESHOLD) {
                snapshotErrorCache.put(cameraExid, 0);
                camera = changeCameraStatus(camera, outcome.getTimestamp(), false);
                log.warn("[{}] [update_status] [offline] [{}]", cameraExid, outcome.getErrorClass());
            } else {
                log.warn("[{}] [update_status] [error] [{}] [{}]", cameraExid, outcome.getErrorClass(), errorTotal);
            }
        }
        return Optional.of(camera);
    }

    public int errorTotal(String cameraExid) {
        return snapshotErrorCache.getOrDefault(cameraExid, 0);
    }

    public Optional<Camera> getFull(String cameraExid) {
        return cameraFullCache.getOrCompute(cameraExid, exid -> cameraRepository.findByExid(exid).orElse(null));
    }

    /**
     * Applies the new status to the cached view, then persists it within the timeout and
     * hands the notifications to the notification executor. A slow or failed write is
     * logged and the cached view is kept as is.
     */
    Camera changeCameraStatus(Camera camera, Instant timestamp, boolean online) {
        Camera updated = camera.copy();
        updated.setOnline(online);
        updated.setLastPolledAt(timestamp);
        updated.setUpdatedAt(timestamp);
        if (online) {
            updated.setLastOnlineAt(timestamp);
        }
        String exid = updated.getExid();
        cameraFullCache.put(exid, updated);

        persistStatus(updated);

        submitNotification(exid, () -> cameraStatusNotifier.broadcastToUsers(updated));
        submitNotification(exid, () -> cameraStatusNotifier.logStatusChange(updated, online, timestamp));
        return updated;
    }

    private void persistStatus(Camera camera) {
        String exid = camera.getExid();
        Future<?> task;
        try {
            task = statusPersistenceExecutor.submit(() -> {
                cameraRepository.updateStatus(camera);
                cameraFullCache.delete(exid);
                cameraEventProducer.enqueueCacheInvalidation(exid);
            });
        } catch (RejectedExecutionException e) {
            log.error("[{}] [update_status] persistence rejected: {}", exid, e.getMessage());
            return;
        }

        try {
            task.get(persistenceTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            log.error("[{}] [update_status] persistence timed out after {} ms", exid, persistenceTimeoutMs);
        } catch (ExecutionException e) {
            log.error("[{}] [update_status] persistence failed: {}", exid, e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel(true);
            log.error("[{}] [update_status] interrupted while persisting", exid);
        }
    }

    private void submitNotification(String cameraExid, Runnable notification) {
        try {
            notificationExecutor.execute(() -> {
                try {
                    notification.run();
                } catch (RuntimeException e) {
                    log.error("[{}] [camera_notify] failed: {}", cameraExid, e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("[{}] [camera_notify] dropped: {}", cameraExid, e.getMessage());
        }
    }
}
