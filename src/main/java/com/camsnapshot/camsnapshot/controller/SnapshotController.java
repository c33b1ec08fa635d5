package com.camsnapshot.camsnapshot.controller;

import com.camsnapshot.camsnapshot.exception.InvalidTimestampException;
import com.camsnapshot.camsnapshot.exception.SnapshotNotFoundException;
import com.camsnapshot.camsnapshot.model.dto.SnapshotEntry;
import com.camsnapshot.camsnapshot.service.storage.LatestSnapshotLocator;
import com.camsnapshot.camsnapshot.service.storage.SnapshotRangeQuery;
import com.camsnapshot.camsnapshot.service.storage.SnapshotStorage;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.List;

/**
 * Read-only snapshot endpoints.
 *
 * GET /cameras/{exid}/thumbnail               - latest local thumbnail
 * GET /cameras/{exid}/snapshots/latest        - newest snapshot on local disk
 * GET /cameras/{exid}/snapshots/{snapshotId}  - one snapshot, ?notes= selects the source
 * GET /cameras/{exid}/snapshots?from=...      - snapshots in the hour containing from (unix seconds)
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/cameras/{exid}")
public class SnapshotController {

    private final SnapshotStorage snapshotStorage;
    private final LatestSnapshotLocator latestSnapshotLocator;
    private final SnapshotRangeQuery snapshotRangeQuery;

    @GetMapping("/thumbnail")
    public ResponseEntity<byte[]> thumbnail(@PathVariable String exid) {
        return jpeg(snapshotStorage.loadThumbnail(exid));
    }

    @GetMapping("/snapshots/latest")
    public ResponseEntity<byte[]> latest(@PathVariable String exid) {
        String path = latestSnapshotLocator.latest(exid)
                .orElseThrow(() -> new SnapshotNotFoundException("No snapshots on disk for " + exid));
        try {
            return jpeg(Files.readAllBytes(Paths.get(path)));
        } catch (NoSuchFileException e) {
            throw new SnapshotNotFoundException("Snapshot not found: " + path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    @GetMapping("/snapshots/{snapshotId}")
    public ResponseEntity<byte[]> snapshot(@PathVariable String exid,
                                           @PathVariable String snapshotId,
                                           @RequestParam(required = false) String notes) {
        return jpeg(snapshotStorage.load(exid, snapshotId, notes));
    }

    @GetMapping("/snapshots")
    public ResponseEntity<List<SnapshotEntry>> range(@PathVariable String exid, @RequestParam long from) {
        Instant fromTimestamp;
        try {
            fromTimestamp = Instant.ofEpochSecond(from);
        } catch (DateTimeException e) {
            throw new InvalidTimestampException("Timestamp out of range: " + from, e);
        }
        return ResponseEntity.ok(snapshotRangeQuery.loadRange(exid, fromTimestamp));
    }

    private static ResponseEntity<byte[]> jpeg(byte[] image) {
        return ResponseEntity.ok().contentType(MediaType.IMAGE_JPEG).body(image);
    }
}
