package com.camsnapshot.camsnapshot.service.notification;

import com.camsnapshot.camsnapshot.model.entity.Camera;
import com.camsnapshot.camsnapshot.model.entity.CameraActivity;
import com.camsnapshot.camsnapshot.model.entity.User;
import com.camsnapshot.camsnapshot.repository.CameraActivityRepository;
import com.camsnapshot.camsnapshot.repository.UserRepository;
import org.junit.jupiter.api.*;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CameraStatusNotifierTest {

    private static final Instant TS = Instant.parse("2024-03-05T10:15:30Z");

    private UserRepository userRepository;
    private CameraActivityRepository activityRepository;
    private CameraEventProducer eventProducer;
    private CameraStatusNotifier notifier;
    private Camera camera;

    @BeforeEach
    void setUp() {
        userRepository = mock(UserRepository.class);
        activityRepository = mock(CameraActivityRepository.class);
        eventProducer = mock(CameraEventProducer.class);
        notifier = new CameraStatusNotifier(userRepository, activityRepository, eventProducer);

        camera = new Camera();
        camera.setNumericId(12);
        camera.setExid("cam1");
        camera.setOnline(false);
        camera.setOwnerUsername("owner");
    }

    @Test
    void testBroadcastToUsers() {
        when(userRepository.findWithAccessTo(camera)).thenReturn(List.of(user("owner"), user("viewer")));

        notifier.broadcastToUsers(camera);

        verify(eventProducer).broadcastStatus("cam1", false, "owner");
        verify(eventProducer).broadcastStatus("cam1", false, "viewer");
    }

    @Test
    void testLogStatusChange_WritesActivity() {
        notifier.logStatusChange(camera, false, TS);

        ArgumentCaptor<CameraActivity> activity = ArgumentCaptor.forClass(CameraActivity.class);
        verify(activityRepository).insert(activity.capture());
        assertEquals(CameraActivity.OFFLINE, activity.getValue().getAction());
        assertEquals(TS, activity.getValue().getDoneAt());
        verify(eventProducer, never()).sendStatusEmail(any(), anyBoolean());
    }

    @Test
    void testLogStatusChange_EmailSentEvenWhenActivityFails() {
        camera.setOnlineEmailOwnerNotification(true);
        doThrow(new RuntimeException("Failed to insert camera activity")).when(activityRepository).insert(any());

        notifier.logStatusChange(camera, true, TS);

        verify(eventProducer).sendStatusEmail(camera, true);
    }

    private static User user(String username) {
        User user = new User();
        user.setUsername(username);
        return user;
    }
}
