package com.example.seriesscan.infrastructure.fs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalDirectoryService implements DirectoryService {

    private static final Logger log = LoggerFactory.getLogger(LocalDirectoryService.class);

    @Override
    public boolean exists(Path folder) {
        return folder != null && Files.isDirectory(folder);
    }

    @Override
    public boolean fileExists(Path file) {
        return file != null && Files.isRegularFile(file);
    }

    @Override
    public List<Path> getDirectories(Path folder) {
        if (!exists(folder)) {
            return Collections.emptyList();
        }
        List<Path> directories = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder, Files::isDirectory)) {
            for (Path child : stream) {
                directories.add(child);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list directories of " + folder, e);
        }
        return directories;
    }

    @Override
    public List<Path> getFilesWithExtensions(Path folder, Set<String> extensions) {
        if (!exists(folder)) {
            return Collections.emptyList();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder, Files::isRegularFile)) {
            for (Path child : stream) {
                if (hasExtension(child, extensions)) {
                    files.add(child);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list files of " + folder, e);
        }
        log.debug("Listed folder={} matchingFiles={}", folder, files.size());
        return files;
    }

    @Override
    public List<String> readAllLines(Path file) throws IOException {
        return Files.readAllLines(file, StandardCharsets.UTF_8);
    }

    @Override
    public Path realPath(Path folder) throws IOException {
        return folder.toRealPath();
    }

    private boolean hasExtension(Path file, Set<String> extensions) {
        if (extensions == null || extensions.isEmpty()) {
            return true;
        }
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String ext : extensions) {
            if (name.endsWith("." + ext)) {
                return true;
            }
        }
        return false;
    }
}
