package com.camsnapshot.camsnapshot.service.storage;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Component
public class LocalDirectoryLister implements DirectoryLister {

    private final SnapshotAddressResolver resolver;

    public LocalDirectoryLister(SnapshotAddressResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public String root() {
        return resolver.getLocalRoot();
    }

    @Override
    public List<String> listDirectories(String directory) {
        return list(directory, Files::isDirectory);
    }

    @Override
    public List<String> listFiles(String directory) {
        return list(directory, Files::isRegularFile);
    }

    private List<String> list(String directory, Predicate<Path> filter) {
        Path dir = Paths.get(directory);
        if (!Files.isDirectory(dir)) {
            return Collections.emptyList();
        }
        try (Stream<Path> children = Files.list(dir)) {
            return children
                    .filter(filter)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + directory, e);
        }
    }
}
