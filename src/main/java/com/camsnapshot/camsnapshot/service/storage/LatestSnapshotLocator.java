package com.camsnapshot.camsnapshot.service.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Finds the most recent snapshot of a camera without a recursive listing.
 *
 * <p>For each source tag directory it walks year, month, day and hour taking the last
 * child in sorted order, then the last snapshot file in that hour. Zero padded
 * components make lexicographic order chronological. Candidates from different tags
 * are compared on the trailing {@code YYYY/MM/DD/HH/mm_ss_fff.jpg} part of the path.
 */
@Component
public class LatestSnapshotLocator {

    private static final Logger log = LoggerFactory.getLogger(LatestSnapshotLocator.class);

    static final int DATE_SUFFIX_LENGTH = "YYYY/MM/DD/HH/mm_ss_fff.jpg".length();
    private static final Pattern SNAPSHOT_FILE = Pattern.compile("\\d{2}_\\d{2}_\\d{3}\\.jpg");
    private static final int[] LEVEL_WIDTHS = {4, 2, 2, 2}; // year, month, day, hour

    private final SnapshotAddressResolver resolver;
    private final DirectoryLister localLister;
    private final DirectoryLister remoteLister;

    public LatestSnapshotLocator(SnapshotAddressResolver resolver,
                                 LocalDirectoryLister localLister,
                                 RemoteDirectoryLister remoteLister) {
        this.resolver = resolver;
        this.localLister = localLister;
        this.remoteLister = remoteLister;
    }

    public Optional<String> latest(String cameraExid) {
        return latest(cameraExid, localLister);
    }

    public Optional<String> latestRemote(String cameraExid) {
        return latest(cameraExid, remoteLister);
    }

    public Optional<String> latest(String cameraExid, DirectoryLister lister) {
        String snapshots = resolver.snapshotsDirectory(cameraExid, lister.root());

        Optional<String> latest = lister.listDirectories(snapshots).stream()
                .filter(tag -> !SnapshotAddressResolver.THUMBNAIL_FILE.equals(tag))
                .map(tag -> latestForTag(lister, snapshots + tag + "/"))
                .flatMap(Optional::stream)
                .max(Comparator.comparing(LatestSnapshotLocator::dateSuffix));

        log.debug("[{}] [latest] {}", cameraExid, latest.orElse("none"));
        return latest;
    }

    private Optional<String> latestForTag(DirectoryLister lister, String tagDirectory) {
        String directory = tagDirectory;
        for (int width : LEVEL_WIDTHS) {
            Optional<String> child = last(lister.listDirectories(directory), width);
            if (child.isEmpty()) {
                return Optional.empty();
            }
            directory = directory + child.get() + "/";
        }

        String hourDirectory = directory;
        List<String> files = lister.listFiles(hourDirectory);
        return files.stream()
                .filter(name -> SNAPSHOT_FILE.matcher(name).matches())
                .reduce((first, second) -> second)
                .map(name -> hourDirectory + name);
    }

    private static Optional<String> last(List<String> names, int width) {
        return names.stream()
                .filter(name -> name.length() == width)
                .reduce((first, second) -> second);
    }

    static String dateSuffix(String path) {
        return path.length() <= DATE_SUFFIX_LENGTH ? path : path.substring(path.length() - DATE_SUFFIX_LENGTH);
    }
}
