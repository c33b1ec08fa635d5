package com.camsnapshot.camsnapshot.service.retention;

import com.camsnapshot.camsnapshot.exception.RetentionParseException;
import com.camsnapshot.camsnapshot.model.SourceTag;
import com.camsnapshot.camsnapshot.model.entity.Camera;
import com.camsnapshot.camsnapshot.service.storage.LocalDirectoryLister;
import com.camsnapshot.camsnapshot.service.storage.SnapshotAddressResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Deletes local recordings day-partitions that fall entirely before a camera's
 * retention cutoff. Snapshot rows in the database are left alone.
 */
@Service
public class RetentionSweeper {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    private final SnapshotAddressResolver resolver;
    private final LocalDirectoryLister lister;
    private final Clock clock;
    private final long deletePauseMs;

    public RetentionSweeper(SnapshotAddressResolver resolver,
                            LocalDirectoryLister lister,
                            Clock clock,
                            @Value("${retention.delete-pause-ms:10}") long deletePauseMs) {
        this.resolver = resolver;
        this.lister = lister;
        this.clock = clock;
        this.deletePauseMs = deletePauseMs;
    }

    /**
     * @return the days that were deleted, oldest first
     * @throws RetentionParseException when a partition name is not a date; nothing is
     *         deleted for the camera in that case
     */
    public List<LocalDate> cleanup(Camera camera) {
        if (camera.keepsForever()) {
            return new ArrayList<>();
        }

        String cameraExid = camera.getExid();
        LocalDate dayBeforeExpiry = cutoff(camera);
        log.info("[{}] [snapshot_delete_disk]", cameraExid);

        List<LocalDate> deleted = new ArrayList<>();
        for (Map.Entry<LocalDate, Path> partition : dayPartitions(cameraExid).entrySet()) {
            if (!partition.getKey().isBefore(dayBeforeExpiry)) {
                continue;
            }
            log.info("[{}] [snapshot_delete_disk] [{}]", cameraExid, partition.getKey());
            if (!deleteTree(partition.getValue())) {
                break;
            }
            deleted.add(partition.getKey());
        }
        return deleted;
    }

    LocalDate cutoff(Camera camera) {
        return LocalDate.now(clock).minusDays(camera.getStorageDuration());
    }

    private Map<LocalDate, Path> dayPartitions(String cameraExid) {
        String recordings = resolver.snapshotsDirectory(cameraExid, resolver.getLocalRoot())
                + SourceTag.RECORDINGS.directoryName() + "/";

        Map<LocalDate, Path> partitions = new LinkedHashMap<>();
        for (String year : children(recordings, 4)) {
            for (String month : children(recordings + year + "/", 2)) {
                for (String day : children(recordings + year + "/" + month + "/", 2)) {
                    String name = year + "/" + month + "/" + day;
                    try {
                        LocalDate date = LocalDate.parse(year + "-" + month + "-" + day);
                        partitions.put(date, Paths.get(recordings + name));
                    } catch (DateTimeParseException e) {
                        throw new RetentionParseException(cameraExid, name, e);
                    }
                }
            }
        }
        return partitions;
    }

    private List<String> children(String directory, int width) {
        return lister.listDirectories(directory).stream()
                .filter(name -> name.length() == width)
                .collect(Collectors.toList());
    }

    /**
     * Removes the tree one entry at a time, pausing between deletions.
     *
     * @return false when interrupted
     */
    private boolean deleteTree(Path root) {
        if (!Files.exists(root)) {
            return true;
        }
        List<Path> entries;
        try (Stream<Path> walk = Files.walk(root)) {
            entries = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk " + root, e);
        }

        for (Path entry : entries) {
            try {
                Files.deleteIfExists(entry);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete " + entry, e);
            }
            if (deletePauseMs > 0) {
                try {
                    Thread.sleep(deletePauseMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Retention sweep interrupted while deleting {}", root);
                    return false;
                }
            }
        }
        return true;
    }
}
