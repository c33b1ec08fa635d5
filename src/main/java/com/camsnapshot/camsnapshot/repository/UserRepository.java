package com.camsnapshot.camsnapshot.repository;

import com.camsnapshot.camsnapshot.model.entity.Camera;
import com.camsnapshot.camsnapshot.model.entity.User;
import com.camsnapshot.camsnapshot.service.firestore.FirebaseAdminBootstrap;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.firebase.cloud.FirestoreClient;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

@Repository
@RequiredArgsConstructor
public class UserRepository {

    private static final String COLLECTION = "users";
    private final FirebaseAdminBootstrap bootstrap;

    private Firestore getFirestore() {
        if (!bootstrap.isInitialized()) {
            throw new IllegalStateException("Firebase is not initialized");
        }
        return FirestoreClient.getFirestore();
    }

    /**
     * The camera owner plus every user the camera is shared with, each once.
     */
    public List<User> findWithAccessTo(Camera camera) {
        try {
            Firestore db = getFirestore();
            Map<String, User> users = new LinkedHashMap<>();

            if (camera.getOwnerUsername() != null) {
                for (QueryDocumentSnapshot doc : db.collection(COLLECTION)
                        .whereEqualTo("username", camera.getOwnerUsername())
                        .limit(1)
                        .get()
                        .get()
                        .getDocuments()) {
                    users.put(doc.getId(), User.fromMap(doc.getId(), doc.getData()));
                }
            }

            for (QueryDocumentSnapshot doc : db.collection(COLLECTION)
                    .whereArrayContains("cameraIds", camera.getExid())
                    .get()
                    .get()
                    .getDocuments()) {
                users.putIfAbsent(doc.getId(), User.fromMap(doc.getId(), doc.getData()));
            }

            return new ArrayList<>(users.values());
        } catch (InterruptedException | ExecutionException e) {
            throw new RuntimeException("Failed to find users with access to camera", e);
        }
    }
}
