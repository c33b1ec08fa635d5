package com.camsnapshot.camsnapshot.service.storage;

import com.camsnapshot.camsnapshot.exception.InvalidTimestampException;
import com.camsnapshot.camsnapshot.exception.SnapshotStorageException;
import com.camsnapshot.camsnapshot.model.SourceTag;
import com.camsnapshot.camsnapshot.model.dto.SnapshotEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lists the snapshots SeaweedFS holds for one camera in the hour that contains a
 * given timestamp, across every source tag directory.
 */
@Service
public class SnapshotRangeQuery {

    private static final Logger log = LoggerFactory.getLogger(SnapshotRangeQuery.class);

    private final SnapshotAddressResolver resolver;
    private final SeaweedFsClient seaweedFsClient;
    private final int pageSize;

    public SnapshotRangeQuery(SnapshotAddressResolver resolver,
                              SeaweedFsClient seaweedFsClient,
                              @Value("${snapshot.range.page-size:3600}") int pageSize) {
        this.resolver = resolver;
        this.seaweedFsClient = seaweedFsClient;
        this.pageSize = pageSize;
    }

    /**
     * @throws com.camsnapshot.camsnapshot.exception.SnapshotNotFoundException when the
     *         camera has no snapshots directory
     * @throws com.camsnapshot.camsnapshot.exception.BackendFaultException when the
     *         camera's tag directories cannot be listed
     */
    public List<SnapshotEntry> loadRange(String cameraExid, Instant from) {
        List<String> tagDirectories = seaweedFsClient.listSubdirectories(
                resolver.snapshotsDirectory(cameraExid, SnapshotAddressResolver.REMOTE_ROOT));

        List<SnapshotEntry> snapshots = new ArrayList<>();
        for (String tagDirectory : tagDirectories) {
            snapshots.addAll(loadTagRange(cameraExid, from, tagDirectory));
        }
        return snapshots;
    }

    private List<SnapshotEntry> loadTagRange(String cameraExid, Instant from, String tagDirectory) {
        SourceTag tag = SourceTag.fromDirectoryName(tagDirectory);
        String directoryPath = resolver.directoryPath(cameraExid, from, tagDirectory, SnapshotAddressResolver.REMOTE_ROOT);

        List<String> files;
        try {
            files = seaweedFsClient.listFiles(directoryPath, pageSize);
        } catch (SnapshotStorageException e) {
            log.warn("[{}] [snapshot_range] [{}] listing failed, skipping: {}", cameraExid, tagDirectory, e.getMessage());
            return Collections.emptyList();
        }

        List<SnapshotEntry> snapshots = new ArrayList<>(files.size());
        for (String file : files) {
            try {
                snapshots.add(SnapshotEntry.builder()
                        .createdAt(SnapshotAddressResolver.timestampFromPath(directoryPath, file))
                        .notes(tag.notes())
                        .motionLevel(null)
                        .build());
            } catch (InvalidTimestampException e) {
                log.debug("[{}] [snapshot_range] skipping {}{}", cameraExid, directoryPath, file);
            }
        }
        return snapshots;
    }
}
