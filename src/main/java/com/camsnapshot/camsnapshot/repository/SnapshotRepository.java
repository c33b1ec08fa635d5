package com.camsnapshot.camsnapshot.repository;

import com.camsnapshot.camsnapshot.model.entity.SnapshotRecord;
import com.camsnapshot.camsnapshot.service.firestore.FirebaseAdminBootstrap;
import com.google.cloud.firestore.Firestore;
import com.google.firebase.cloud.FirestoreClient;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Repository;

import java.util.concurrent.ExecutionException;

@Repository
@RequiredArgsConstructor
public class SnapshotRepository {

    private static final String COLLECTION = "snapshots";
    private final FirebaseAdminBootstrap bootstrap;

    // Document id is the snapshot id, so a replayed capture overwrites instead of duplicating
    public void insert(SnapshotRecord record) {
        if (!bootstrap.isInitialized()) {
            throw new IllegalStateException("Firebase is not initialized");
        }
        try {
            Firestore db = FirestoreClient.getFirestore();
            db.collection(COLLECTION).document(record.getSnapshotId()).set(record.toMap()).get();
        } catch (InterruptedException | ExecutionException e) {
            throw new RuntimeException("Failed to save snapshot record", e);
        }
    }
}
