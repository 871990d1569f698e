package com.example.seriesscan.application.service;

import com.example.seriesscan.infrastructure.fs.DirectoryService;
import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exclusion globs loaded from a folder's ignore file. A path is excluded when any glob
 * matches its path relative to that folder, its absolute path, or its bare file name.
 */
public class IgnoreMatcher {

    private static final Logger log = LoggerFactory.getLogger(IgnoreMatcher.class);

    private final Path baseFolder;
    private final List<PathMatcher> matchers;

    IgnoreMatcher(Path baseFolder, List<String> patterns) {
        this.baseFolder = baseFolder;
        FileSystem fileSystem = baseFolder.getFileSystem();
        List<PathMatcher> compiled = new ArrayList<>(patterns.size());
        for (String pattern : patterns) {
            try {
                compiled.add(fileSystem.getPathMatcher("glob:" + pattern));
            } catch (IllegalArgumentException | UnsupportedOperationException e) {
                log.warn("IGNORE_PATTERN_INVALID folder={} pattern={} reason={} - skipping",
                        baseFolder, pattern, e.getMessage());
            }
        }
        this.matchers = compiled;
    }

    /**
     * Loads the ignore file from a folder. Lines that are not valid globs are logged and
     * skipped. Returns null when the file is absent, unreadable or holds no usable pattern.
     */
    public static IgnoreMatcher load(DirectoryService directoryService, Path folder, String ignoreFileName) {
        if (folder == null || ignoreFileName == null || ignoreFileName.trim().isEmpty()) {
            return null;
        }
        Path ignoreFile = folder.resolve(ignoreFileName);
        if (!directoryService.fileExists(ignoreFile)) {
            return null;
        }
        List<String> lines;
        try {
            lines = directoryService.readAllLines(ignoreFile);
        } catch (IOException e) {
            log.warn("IGNORE_FILE_UNREADABLE file={} reason={}", ignoreFile, e.getMessage());
            return null;
        }
        List<String> patterns = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line == null ? "" : line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            patterns.add(trimmed);
        }
        IgnoreMatcher matcher = new IgnoreMatcher(folder, patterns);
        if (matcher.isEmpty()) {
            log.warn("IGNORE_FILE_EMPTY file={} - ignoring", ignoreFile);
            return null;
        }
        log.debug("IGNORE_FILE_LOADED file={} patterns={}", ignoreFile, patterns);
        return matcher;
    }

    public boolean matches(Path path) {
        if (path == null) {
            return false;
        }
        Path fileName = path.getFileName();
        Path relative = path.startsWith(baseFolder) ? baseFolder.relativize(path) : null;
        Path absolute = path.toAbsolutePath();
        for (PathMatcher matcher : matchers) {
            if (relative != null && matcher.matches(relative)) {
                return true;
            }
            if (matcher.matches(absolute)) {
                return true;
            }
            if (fileName != null && matcher.matches(fileName)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when no line of the ignore file compiled to a usable glob.
     */
    boolean isEmpty() {
        return matchers.isEmpty();
    }
}
