package com.camsnapshot.camsnapshot.service.retention;

import com.camsnapshot.camsnapshot.model.entity.Camera;
import com.camsnapshot.camsnapshot.repository.CameraRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

@Component
public class RetentionScheduler {

    private static final Logger log = LoggerFactory.getLogger(RetentionScheduler.class);

    private final RetentionSweeper retentionSweeper;
    private final CameraRepository cameraRepository;
    private final ExecutorService retentionExecutor;
    private final boolean enabled;

    public RetentionScheduler(RetentionSweeper retentionSweeper,
                              CameraRepository cameraRepository,
                              @Qualifier("retentionExecutor") ExecutorService retentionExecutor,
                              @Value("${retention.enabled:true}") boolean enabled) {
        this.retentionSweeper = retentionSweeper;
        this.cameraRepository = cameraRepository;
        this.retentionExecutor = retentionExecutor;
        this.enabled = enabled;
    }

    @Scheduled(cron = "${retention.cron:0 0 2 * * *}", zone = "UTC")
    public void scheduleCleanup() {
        if (!enabled) {
            return;
        }
        try {
            List<Camera> cameras = cameraRepository.findWithRetention();
            retentionExecutor.execute(() -> sweepAll(cameras));
        } catch (RejectedExecutionException e) {
            log.warn("[snapshot_delete_disk] retention executor is shut down, skipping: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("[snapshot_delete_disk] could not load cameras: {}", e.getMessage(), e);
        }
    }

    /**
     * Sweeps each camera in turn. A failing camera is logged and skipped.
     *
     * @return number of cameras whose sweep failed
     */
    public int sweepAll(List<Camera> cameras) {
        long t0 = System.nanoTime();
        int failed = 0;
        for (Camera camera : cameras) {
            try {
                retentionSweeper.cleanup(camera);
            } catch (RuntimeException e) {
                failed++;
                log.error("[{}] [snapshot_delete_disk] failed: {}", camera.getExid(), e.getMessage(), e);
            }
        }
        long ms = (System.nanoTime() - t0) / 1_000_000L;
        log.info("[snapshot_delete_disk] swept {} cameras in {} ms, {} failed", cameras.size(), ms, failed);
        return failed;
    }
}
