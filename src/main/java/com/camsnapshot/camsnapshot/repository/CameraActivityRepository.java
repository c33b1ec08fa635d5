package com.camsnapshot.camsnapshot.repository;

import com.camsnapshot.camsnapshot.model.entity.CameraActivity;
import com.camsnapshot.camsnapshot.service.firestore.FirebaseAdminBootstrap;
import com.google.cloud.firestore.Firestore;
import com.google.firebase.cloud.FirestoreClient;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Repository;

import java.util.concurrent.ExecutionException;

@Repository
@RequiredArgsConstructor
public class CameraActivityRepository {

    private static final String COLLECTION = "camera_activities";
    private final FirebaseAdminBootstrap bootstrap;

    public void insert(CameraActivity activity) {
        if (!bootstrap.isInitialized()) {
            throw new IllegalStateException("Firebase is not initialized");
        }
        try {
            Firestore db = FirestoreClient.getFirestore();
            db.collection(COLLECTION).document().set(activity.toMap()).get();
        } catch (InterruptedException | ExecutionException e) {
            throw new RuntimeException("Failed to save camera activity", e);
        }
    }
}
