package com.camsnapshot.camsnapshot.repository;

import com.camsnapshot.camsnapshot.model.entity.Camera;
import com.camsnapshot.camsnapshot.service.firestore.FirebaseAdminBootstrap;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import com.google.cloud.firestore.SetOptions;
import com.google.firebase.cloud.FirestoreClient;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

@Repository
@RequiredArgsConstructor
public class CameraRepository {

    private static final String COLLECTION = "cameras";
    private final FirebaseAdminBootstrap bootstrap;

    private Firestore getFirestore() {
        if (!bootstrap.isInitialized()) {
            throw new IllegalStateException("Firebase is not initialized");
        }
        return FirestoreClient.getFirestore();
    }

    public Optional<Camera> findByExid(String exid) {
        try {
            QuerySnapshot querySnapshot = getFirestore().collection(COLLECTION)
                    .whereEqualTo("exid", exid)
                    .limit(1)
                    .get()
                    .get();

            if (querySnapshot.isEmpty()) {
                return Optional.empty();
            }

            DocumentSnapshot doc = querySnapshot.getDocuments().get(0);
            return Optional.of(Camera.fromMap(doc.getId(), doc.getData()));
        } catch (InterruptedException | ExecutionException e) {
            throw new RuntimeException("Failed to find camera by exid", e);
        }
    }

    // Cameras with a finite storage duration
    public List<Camera> findWithRetention() {
        try {
            List<QueryDocumentSnapshot> documents = getFirestore().collection(COLLECTION)
                    .whereNotEqualTo("storageDuration", Camera.KEEP_FOREVER)
                    .get()
                    .get()
                    .getDocuments();

            List<Camera> cameras = new ArrayList<>();
            for (QueryDocumentSnapshot doc : documents) {
                cameras.add(Camera.fromMap(doc.getId(), doc.getData()));
            }
            return cameras;
        } catch (InterruptedException | ExecutionException e) {
            throw new RuntimeException("Failed to fetch cameras with retention", e);
        }
    }

    public void updateStatus(Camera camera) {
        try {
            getFirestore().collection(COLLECTION)
                    .document(camera.getId())
                    .set(camera.statusMap(), SetOptions.merge())
                    .get();
        } catch (InterruptedException | ExecutionException e) {
            throw new RuntimeException("Failed to update camera status", e);
        }
    }
}
