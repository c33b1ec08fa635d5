package com.camsnapshot.camsnapshot.service.storage;

import java.util.List;

/**
 * Directory listing over one storage backend. Names are returned sorted ascending;
 * a directory that does not exist lists as empty.
 */
public interface DirectoryLister {

    /** Root prefix that storage paths for this backend start with. */
    String root();

    List<String> listDirectories(String directory);

    List<String> listFiles(String directory);
}
