package com.camsnapshot.camsnapshot.service.storage;

import com.camsnapshot.camsnapshot.exception.SnapshotNotFoundException;
import com.camsnapshot.camsnapshot.exception.SnapshotUnavailableException;
import com.camsnapshot.camsnapshot.model.SourceTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;

/**
 * Snapshot persistence over the SeaweedFS store (canonical copy) and the local disk
 * (latest thumbnail per camera, and fallback reads for snapshots that never made it
 * to SeaweedFS).
 */
@Service
public class SnapshotStorage {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStorage.class);

    /** Snapshots older than this were never written to SeaweedFS. */
    public static final Instant SEAWEEDFS_START = Instant.ofEpochSecond(1_463_788_800L);

    private static final String STORAGE_PREFIX = "/storage";

    private final SnapshotAddressResolver resolver;
    private final SeaweedFsClient seaweedFsClient;

    public SnapshotStorage(SnapshotAddressResolver resolver, SeaweedFsClient seaweedFsClient) {
        this.resolver = resolver;
        this.seaweedFsClient = seaweedFsClient;
    }

    public Instant seaweedfsStartTimestamp() {
        return SEAWEEDFS_START;
    }

    /**
     * Uploads the image and then overwrites the camera's local thumbnail, whatever the tag.
     */
    public void save(String cameraExid, Instant timestamp, byte[] image, String notes) {
        SourceTag tag = SourceTag.fromNotes(notes);
        String filePath = resolver.filePath(cameraExid, timestamp, tag, SnapshotAddressResolver.REMOTE_ROOT);

        seaweedFsClient.upload(filePath, image);
        log.debug("[{}] [snapshot_save] [{}]", cameraExid, filePath);

        saveThumbnail(cameraExid, image);
    }

    /**
     * Writes a custom thumbnail to SeaweedFS, replacing the file when it already exists.
     * An unreachable backend on the existence probe fails the call.
     */
    public void saveThumbnailOverride(String filePath, byte[] image) {
        String path = filePath.startsWith(STORAGE_PREFIX) ? filePath.substring(STORAGE_PREFIX.length()) : filePath;

        if (seaweedFsClient.exists(path)) {
            seaweedFsClient.replace(path, image);
        } else {
            seaweedFsClient.upload(path, image);
        }
        log.info("[thumbnail_export] [{}]", path);
    }

    /**
     * Reads a snapshot from SeaweedFS. Falls back to the local disk only when SeaweedFS
     * answers "not found"; any other backend failure is rethrown.
     */
    public byte[] load(String cameraExid, String snapshotId, String notes) {
        SourceTag tag = SourceTag.fromNotes(notes);
        Instant timestamp = SnapshotAddressResolver.timestampFromSnapshotId(snapshotId);

        try {
            return seaweedFsClient.download(
                    resolver.filePath(cameraExid, timestamp, tag, SnapshotAddressResolver.REMOTE_ROOT));
        } catch (SnapshotNotFoundException e) {
            log.debug("[{}] [snapshot_load] [{}] not in SeaweedFS, reading disk", cameraExid, snapshotId);
            return diskLoad(cameraExid, timestamp, tag);
        }
    }

    public byte[] loadThumbnail(String cameraExid) {
        try {
            return Files.readAllBytes(Paths.get(resolver.thumbnailPath(cameraExid)));
        } catch (IOException e) {
            throw new SnapshotUnavailableException(cameraExid, e);
        }
    }

    private byte[] diskLoad(String cameraExid, Instant timestamp, SourceTag tag) {
        Path file = Paths.get(resolver.filePath(cameraExid, timestamp, tag, resolver.getLocalRoot()));
        try {
            return Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new SnapshotNotFoundException("Snapshot not found: " + file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private void saveThumbnail(String cameraExid, byte[] image) {
        Path thumbnail = Paths.get(resolver.thumbnailPath(cameraExid));
        try {
            Files.createDirectories(thumbnail.getParent());
            Files.write(thumbnail, image);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write thumbnail " + thumbnail, e);
        }
    }
}
