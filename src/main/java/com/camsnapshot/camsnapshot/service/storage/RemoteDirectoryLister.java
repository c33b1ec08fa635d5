package com.camsnapshot.camsnapshot.service.storage;

import com.camsnapshot.camsnapshot.exception.SnapshotNotFoundException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Component
public class RemoteDirectoryLister implements DirectoryLister {

    private final SeaweedFsClient seaweedFsClient;
    private final int pageSize;

    public RemoteDirectoryLister(SeaweedFsClient seaweedFsClient,
                                 @Value("${snapshot.range.page-size:3600}") int pageSize) {
        this.seaweedFsClient = seaweedFsClient;
        this.pageSize = pageSize;
    }

    @Override
    public String root() {
        return SnapshotAddressResolver.REMOTE_ROOT;
    }

    @Override
    public List<String> listDirectories(String directory) {
        try {
            return sorted(seaweedFsClient.listSubdirectories(directory));
        } catch (SnapshotNotFoundException e) {
            return Collections.emptyList();
        }
    }

    @Override
    public List<String> listFiles(String directory) {
        try {
            return sorted(seaweedFsClient.listFiles(directory, pageSize));
        } catch (SnapshotNotFoundException e) {
            return Collections.emptyList();
        }
    }

    private static List<String> sorted(List<String> names) {
        List<String> copy = new ArrayList<>(names);
        Collections.sort(copy);
        return copy;
    }
}
