package com.camsnapshot.camsnapshot.service.storage;

import com.camsnapshot.camsnapshot.exception.InvalidTimestampException;
import com.camsnapshot.camsnapshot.model.SnapshotAddress;
import com.camsnapshot.camsnapshot.model.SourceTag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps (camera, timestamp, source tag) to the hierarchical storage path shared by the
 * remote store and the local disk cache:
 * {@code {root}/{camera}/snapshots/{tag}/YYYY/MM/DD/HH/mm_ss_fff.jpg}.
 *
 * <p>All components are UTC and zero padded, so lexicographic order of a directory
 * listing is chronological order. No I/O happens here.
 */
@Component
public class SnapshotAddressResolver {

    public static final String REMOTE_ROOT = "";
    public static final String THUMBNAIL_FILE = "thumbnail.jpg";

    private static final Instant MIN_TIMESTAMP = Instant.EPOCH;
    private static final Instant MAX_TIMESTAMP = Instant.parse("9999-12-31T23:59:59.999999Z");
    private static final DateTimeFormatter SNAPSHOT_ID_SECONDS = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final String localRoot;

    public SnapshotAddressResolver(@Value("${snapshot.storage.root-dir:/storage}") String localRoot) {
        this.localRoot = stripTrailingSlash(localRoot);
    }

    public String getLocalRoot() {
        return localRoot;
    }

    public SnapshotAddress resolve(String cameraExid, Instant timestamp, SourceTag sourceTag) {
        ZonedDateTime t = toUtc(timestamp);
        String fraction = fileName(timestamp).substring(6, 9);
        return new SnapshotAddress(cameraExid, t.getYear(), t.getMonthValue(), t.getDayOfMonth(),
                t.getHour(), t.getMinute(), t.getSecond(), fraction, sourceTag);
    }

    public String directoryPath(String cameraExid, Instant timestamp, SourceTag sourceTag) {
        return directoryPath(cameraExid, timestamp, sourceTag, localRoot);
    }

    public String directoryPath(String cameraExid, Instant timestamp, SourceTag sourceTag, String root) {
        return directoryPath(cameraExid, timestamp, sourceTag.directoryName(), root);
    }

    // Raw directory name, as found in a listing
    public String directoryPath(String cameraExid, Instant timestamp, String tagDirectory, String root) {
        ZonedDateTime t = toUtc(timestamp);
        return String.format("%s/%s/snapshots/%s/%04d/%02d/%02d/%02d/",
                root, cameraExid, tagDirectory,
                t.getYear(), t.getMonthValue(), t.getDayOfMonth(), t.getHour());
    }

    public String filePath(String cameraExid, Instant timestamp, SourceTag sourceTag, String root) {
        return directoryPath(cameraExid, timestamp, sourceTag, root) + fileName(timestamp);
    }

    public String snapshotsDirectory(String cameraExid, String root) {
        return root + "/" + cameraExid + "/snapshots/";
    }

    public String thumbnailPath(String cameraExid) {
        return snapshotsDirectory(cameraExid, localRoot) + THUMBNAIL_FILE;
    }

    public String fileName(Instant timestamp) {
        ZonedDateTime t = toUtc(timestamp);
        int micros = t.getNano() / 1_000;
        String field = String.format("%02d_%02d_", t.getMinute(), t.getSecond());
        if (micros != 0) {
            field = field + String.format("%06d", micros);
        }
        return formatFileName(field);
    }

    /**
     * A 6-byte minute/second field gets a zero sub-second part, a field of 9 or
     * more bytes keeps its first 9 bytes.
     */
    public static String formatFileName(String field) {
        if (field == null) {
            throw new InvalidTimestampException("File name field is missing");
        }
        if (field.length() == 6) {
            return field + "000.jpg";
        }
        if (field.length() >= 9) {
            return field.substring(0, 9) + ".jpg";
        }
        throw new InvalidTimestampException("Unexpected file name field '" + field + "'");
    }

    /**
     * Rebuilds a timestamp (second precision) from the YYYY/MM/DD/HH tail of a
     * directory path and the mm_ss prefix of a file name.
     */
    public static Instant timestampFromPath(String directoryPath, String fileName) {
        List<String> parts = new ArrayList<>();
        for (String part : directoryPath.split("/")) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        String[] nameParts = fileName.split("_");
        if (parts.size() < 4 || nameParts.length < 3) {
            throw new InvalidTimestampException("Cannot read timestamp from " + directoryPath + fileName);
        }

        int n = parts.size();
        try {
            LocalDateTime dateTime = LocalDateTime.of(
                    Integer.parseInt(parts.get(n - 4)),
                    Integer.parseInt(parts.get(n - 3)),
                    Integer.parseInt(parts.get(n - 2)),
                    Integer.parseInt(parts.get(n - 1)),
                    Integer.parseInt(nameParts[0]),
                    Integer.parseInt(nameParts[1]));
            return dateTime.toInstant(ZoneOffset.UTC);
        } catch (NumberFormatException | DateTimeException e) {
            throw new InvalidTimestampException("Cannot read timestamp from " + directoryPath + fileName, e);
        }
    }

    public String formatSnapshotId(long cameraId, Instant timestamp) {
        ZonedDateTime t = toUtc(timestamp);
        return cameraId + "_" + t.format(SNAPSHOT_ID_SECONDS) + String.format("%06d", t.getNano() / 1_000);
    }

    public static Instant timestampFromSnapshotId(String snapshotId) {
        if (snapshotId == null) {
            throw new InvalidTimestampException("Snapshot id is missing");
        }
        String encoded = snapshotId.substring(snapshotId.lastIndexOf('_') + 1);
        if (encoded.length() < 14 || encoded.length() > 20 || !encoded.chars().allMatch(Character::isDigit)) {
            throw new InvalidTimestampException("Malformed snapshot id '" + snapshotId + "'");
        }

        try {
            LocalDateTime seconds = LocalDateTime.parse(encoded.substring(0, 14), SNAPSHOT_ID_SECONDS);
            String micros = (encoded.substring(14) + "000000").substring(0, 6);
            return seconds.toInstant(ZoneOffset.UTC).plusNanos(Long.parseLong(micros) * 1_000L);
        } catch (DateTimeParseException e) {
            throw new InvalidTimestampException("Malformed snapshot id '" + snapshotId + "'", e);
        }
    }

    private static ZonedDateTime toUtc(Instant timestamp) {
        if (timestamp == null) {
            throw new InvalidTimestampException("Timestamp is missing");
        }
        if (timestamp.isBefore(MIN_TIMESTAMP) || timestamp.isAfter(MAX_TIMESTAMP)) {
            throw new InvalidTimestampException("Timestamp out of range: " + timestamp.getEpochSecond());
        }
        return timestamp.atZone(ZoneOffset.UTC);
    }

    private static String stripTrailingSlash(String root) {
        return root.endsWith("/") ? root.substring(0, root.length() - 1) : root;
    }
}
