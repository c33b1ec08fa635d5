package com.camsnapshot.camsnapshot.service.liveness;

import com.camsnapshot.camsnapshot.model.dto.SnapshotOutcome;
import com.camsnapshot.camsnapshot.model.entity.Camera;
import com.camsnapshot.camsnapshot.repository.CameraRepository;
import com.camsnapshot.camsnapshot.service.cache.InMemoryEphemeralCache;
import com.camsnapshot.camsnapshot.service.notification.CameraEventProducer;
import com.camsnapshot.camsnapshot.service.notification.CameraStatusNotifier;
import org.junit.jupiter.api.*;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CameraStatusServiceTest {

    private static final Instant TS = Instant.parse("2024-03-05T10:15:30Z");

    private CameraRepository cameraRepository;
    private CameraEventProducer eventProducer;
    private CameraStatusNotifier notifier;
    private InMemoryEphemeralCache<Camera> cameraCache;
    private ExecutorService persistenceExecutor;
    private Camera stored;

    @BeforeEach
    void setUp() {
        cameraRepository = mock(CameraRepository.class);
        eventProducer = mock(CameraEventProducer.class);
        notifier = mock(CameraStatusNotifier.class);
        cameraCache = new InMemoryEphemeralCache<>("camera_full");
        persistenceExecutor = Executors.newSingleThreadExecutor();

        stored = new Camera();
        stored.setId("doc-1");
        stored.setNumericId(12);
        stored.setExid("cam1");
        stored.setOnline(true);

        // The repository reflects what was last written
        when(cameraRepository.findByExid("cam1")).thenAnswer(inv -> Optional.of(stored.copy()));
        doAnswer(inv -> {
            stored = ((Camera) inv.getArgument(0)).copy();
            return null;
        }).when(cameraRepository).updateStatus(any(Camera.class));
    }

    @AfterEach
    void tearDown() {
        persistenceExecutor.shutdownNow();
    }

    private CameraStatusService service(long timeoutMs) {
        return new CameraStatusService(cameraRepository, new InMemoryEphemeralCache<>("snapshot_error"), cameraCache,
                eventProducer, notifier, persistenceExecutor, Runnable::run, timeoutMs);
    }

    private static SnapshotOutcome failure(int weight) {
        return SnapshotOutcome.failure(TS, "timeout", weight);
    }

    @Test
    void testFailuresBelowThresholdNeverTransition() {
        CameraStatusService service = service(1000);

        service.updateCameraStatus("cam1", failure(25));
        service.updateCameraStatus("cam1", failure(25));
        service.updateCameraStatus("cam1", failure(25));
        Optional<Camera> camera = service.updateCameraStatus("cam1", failure(24));

        assertTrue(camera.orElseThrow().isOnline());
        assertEquals(99, service.errorTotal("cam1"));
        verify(cameraRepository, never()).updateStatus(any());
        verifyNoInteractions(notifier);
    }

    @Test
    void testReachingThresholdGoesOfflineOnceAndResets() {
        CameraStatusService service = service(1000);

        service.updateCameraStatus("cam1", failure(50));
        Optional<Camera> camera = service.updateCameraStatus("cam1", failure(50));

        assertFalse(camera.orElseThrow().isOnline());
        assertEquals(0, service.errorTotal("cam1"));
        assertFalse(stored.isOnline());
        assertEquals(TS, stored.getLastPolledAt());

        // Already offline: failures accumulate without another transition
        service.updateCameraStatus("cam1", failure(100));
        service.updateCameraStatus("cam1", failure(100));

        assertEquals(200, service.errorTotal("cam1"));
        verify(cameraRepository, times(1)).updateStatus(any());
        verify(eventProducer, times(1)).enqueueCacheInvalidation("cam1");
        verify(notifier, times(1)).broadcastToUsers(any());
        verify(notifier, times(1)).logStatusChange(any(), eq(false), eq(TS));
    }

    @Test
    void testSingleSuccessBringsCameraOnline() {
        stored.setOnline(false);
        CameraStatusService service = service(1000);
        service.updateCameraStatus("cam1", failure(25));

        Instant later = TS.plusSeconds(60);
        Optional<Camera> camera = service.updateCameraStatus("cam1", SnapshotOutcome.success(later));

        assertTrue(camera.orElseThrow().isOnline());
        assertEquals(later, camera.get().getLastOnlineAt());
        assertEquals(0, service.errorTotal("cam1"));
        assertTrue(stored.isOnline());
        verify(notifier).logStatusChange(any(), eq(true), eq(later));
    }

    @Test
    void testRepeatedSuccessHasNoSideEffects() {
        CameraStatusService service = service(1000);
        service.updateCameraStatus("cam1", failure(75));

        service.updateCameraStatus("cam1", SnapshotOutcome.success(TS));
        service.updateCameraStatus("cam1", SnapshotOutcome.success(TS));

        assertEquals(0, service.errorTotal("cam1"));
        verify(cameraRepository, never()).updateStatus(any());
        verifyNoInteractions(notifier, eventProducer);
    }

    @Test
    void testSuccessResetsAccumulation() {
        CameraStatusService service = service(1000);

        service.updateCameraStatus("cam1", failure(75));
        service.updateCameraStatus("cam1", SnapshotOutcome.success(TS));
        service.updateCameraStatus("cam1", failure(75));

        assertTrue(service.getFull("cam1").orElseThrow().isOnline());
        assertEquals(75, service.errorTotal("cam1"));
    }

    @Test
    void testPersistenceTimeoutStillNotifies() {
        doAnswer(inv -> {
            Thread.sleep(5_000);
            return null;
        }).when(cameraRepository).updateStatus(any(Camera.class));
        CameraStatusService service = service(50);

        long t0 = System.nanoTime();
        Optional<Camera> camera = service.updateCameraStatus("cam1", failure(100));
        long ms = (System.nanoTime() - t0) / 1_000_000L;

        assertTrue(ms < 2_000, "caller should not wait for the slow write, took " + ms + " ms");
        assertFalse(camera.orElseThrow().isOnline());
        // The cached view keeps the new status
        assertFalse(cameraCache.get("cam1").orElseThrow().isOnline());
        verify(eventProducer, never()).enqueueCacheInvalidation(anyString());
        verify(notifier).broadcastToUsers(any());
        verify(notifier).logStatusChange(any(), eq(false), eq(TS));
    }

    @Test
    void testPersistenceFailureStillNotifies() {
        doThrow(new RuntimeException("Failed to update camera status")).when(cameraRepository).updateStatus(any());
        CameraStatusService service = service(1000);

        Optional<Camera> camera = service.updateCameraStatus("cam1", failure(100));

        assertFalse(camera.orElseThrow().isOnline());
        verify(notifier).broadcastToUsers(any());
        verify(notifier).logStatusChange(any(), eq(false), eq(TS));
    }

    @Test
    void testNotificationFailureIsContained() {
        doThrow(new RuntimeException("kafka down")).when(notifier).broadcastToUsers(any());
        CameraStatusService service = service(1000);

        assertDoesNotThrow(() -> service.updateCameraStatus("cam1", failure(100)));
        verify(notifier).logStatusChange(any(), eq(false), eq(TS));
    }

    @Test
    void testNotificationsRunOnNotificationExecutor() {
        List<Runnable> queued = new ArrayList<>();
        CameraStatusService service = new CameraStatusService(cameraRepository,
                new InMemoryEphemeralCache<>("snapshot_error"), cameraCache,
                eventProducer, notifier, persistenceExecutor, queued::add, 1000);

        service.updateCameraStatus("cam1", failure(100));

        assertFalse(queued.isEmpty());
        verifyNoInteractions(notifier);

        queued.forEach(Runnable::run);
        verify(notifier).broadcastToUsers(any());
        verify(notifier).logStatusChange(any(), eq(false), eq(TS));
    }

    @Test
    void testTransitionWritesStatusFields() {
        CameraStatusService service = service(1000);

        service.updateCameraStatus("cam1", failure(100));

        ArgumentCaptor<Camera> written = ArgumentCaptor.forClass(Camera.class);
        verify(cameraRepository).updateStatus(written.capture());
        assertEquals("doc-1", written.getValue().getId());
        assertFalse(written.getValue().isOnline());
        assertEquals(TS, written.getValue().getUpdatedAt());
        assertNull(written.getValue().getLastOnlineAt());
    }

    @Test
    void testUnknownOrBlankCamera() {
        when(cameraRepository.findByExid("ghost")).thenReturn(Optional.empty());
        CameraStatusService service = service(1000);

        assertTrue(service.updateCameraStatus("ghost", failure(100)).isEmpty());
        assertTrue(service.updateCameraStatus(" ", failure(100)).isEmpty());
        assertTrue(service.updateCameraStatus(null, SnapshotOutcome.success(TS)).isEmpty());
        verify(cameraRepository, never()).updateStatus(any());
    }
}
