package com.example.seriesscan.application.service;

import com.example.seriesscan.common.concurrent.NamedThreadFactory;
import com.example.seriesscan.common.config.AppScanProperties;
import com.example.seriesscan.common.exception.BusinessException;
import com.example.seriesscan.infrastructure.fs.DirectoryService;
import com.example.seriesscan.infrastructure.parser.ParserPatterns;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DirectoryWalker {

    private static final Logger log = LoggerFactory.getLogger(DirectoryWalker.class);

    private final DirectoryService directoryService;
    private final AppScanProperties appScanProperties;

    public DirectoryWalker(DirectoryService directoryService, AppScanProperties appScanProperties) {
        this.directoryService = directoryService;
        this.appScanProperties = appScanProperties;
    }

    /**
     * Loads the ignore rules stored in a folder, or null when it has none.
     */
    public IgnoreMatcher loadIgnoreMatcher(Path folder) {
        return IgnoreMatcher.load(directoryService, folder, appScanProperties.getIgnoreFileName());
    }

    public List<Path> scan(Path root) {
        return scan(root, null);
    }

    /**
     * Every supported file under {@code root}, recursively. When {@code matcher} is null the
     * root's own ignore file is used. A missing root yields an empty list.
     */
    public List<Path> scan(Path root, IgnoreMatcher matcher) {
        return scan(root, matcher, ParserPatterns.SUPPORTED_EXTENSIONS);
    }

    public List<Path> scan(Path root, IgnoreMatcher matcher, Set<String> extensions) {
        if (!directoryService.exists(root)) {
            return new ArrayList<>();
        }
        IgnoreMatcher effective = matcher != null ? matcher : loadIgnoreMatcher(root);

        List<Path> files = new ArrayList<>();
        Set<Path> visited = new HashSet<>();
        Deque<Path> dirs = new ArrayDeque<>();
        dirs.push(root);
        while (!dirs.isEmpty()) {
            Path dir = dirs.pop();
            if (!visited.add(realPathOf(dir))) {
                log.debug("SCAN_DIR_REVISITED dir={} - skipping link cycle", dir);
                continue;
            }
            List<Path> children;
            List<Path> dirFiles;
            try {
                children = directoryService.getDirectories(dir);
                dirFiles = directoryService.getFilesWithExtensions(dir, extensions);
            } catch (UncheckedIOException e) {
                log.error("SCAN_DIR_UNREADABLE dir={} reason={} - skipping", dir, e.getMessage(), e);
                continue;
            }
            for (Path child : children) {
                if (effective != null && effective.matches(child)) {
                    log.debug("SCAN_DIR_IGNORED dir={}", child);
                    continue;
                }
                dirs.push(child);
            }
            for (Path file : dirFiles) {
                if (effective != null && effective.matches(file)) {
                    continue;
                }
                files.add(file);
            }
        }
        return files;
    }

    /**
     * Immediate subfolders of a library root that are not excluded by the ignore rules.
     */
    public List<Path> listSeriesFolders(Path libraryRoot, IgnoreMatcher matcher) {
        if (!directoryService.exists(libraryRoot)) {
            return Collections.emptyList();
        }
        List<Path> folders = new ArrayList<>();
        for (Path child : directoryService.getDirectories(libraryRoot)) {
            if (matcher == null || !matcher.matches(child)) {
                folders.add(child);
            }
        }
        Collections.sort(folders);
        return folders;
    }

    /**
     * Supported files placed directly in a folder, ignore rules applied.
     */
    public List<Path> listLooseFiles(Path folder, IgnoreMatcher matcher) {
        List<Path> files = new ArrayList<>();
        for (Path file : directoryService.getFilesWithExtensions(folder, ParserPatterns.SUPPORTED_EXTENSIONS)) {
            if (matcher == null || !matcher.matches(file)) {
                files.add(file);
            }
        }
        Collections.sort(files);
        return files;
    }

    /**
     * Runs {@code onFile} for every eligible file under {@code root} on a bounded worker pool.
     * A failing callback is logged and counted; sibling files keep being processed.
     *
     * @throws BusinessException with {@link BusinessException#SCAN_ROOT_NOT_FOUND} when root is missing
     */
    public TraversalResult traverseParallel(Path root, FileAction onFile, Set<String> extensions) {
        requireRoot(root);
        List<Path> files = scan(root, null, extensions);
        return processParallel(files, onFile);
    }

    private Path realPathOf(Path dir) {
        try {
            Path real = directoryService.realPath(dir);
            return real != null ? real : dir.toAbsolutePath().normalize();
        } catch (IOException e) {
            log.debug("Real path unavailable, dir={}, reason={}", dir, e.getMessage());
            return dir.toAbsolutePath().normalize();
        }
    }

    /**
     * @throws BusinessException with {@link BusinessException#SCAN_ROOT_NOT_FOUND} when root is missing
     */
    public void requireRoot(Path root) {
        if (!directoryService.exists(root)) {
            throw new BusinessException(BusinessException.SCAN_ROOT_NOT_FOUND,
                    "The directory '" + root + "' does not exist");
        }
    }

    /**
     * Runs {@code onFile} for each given file on a bounded worker pool, isolating failures per file.
     */
    public TraversalResult processParallel(List<Path> files, FileAction onFile) {
        TraversalResult result = new TraversalResult();
        if (files.isEmpty()) {
            return result;
        }
        int workers = Math.max(1, Math.min(appScanProperties.effectiveParallelism(), files.size()));
        ExecutorService executor = Executors.newFixedThreadPool(workers, new NamedThreadFactory("scan-file-"));
        CompletionService<Path> completionService = new ExecutorCompletionService<>(executor);
        AtomicInteger failed = new AtomicInteger();
        try {
            for (Path file : files) {
                completionService.submit(() -> {
                    try {
                        onFile.accept(file);
                    } catch (Exception e) {
                        failed.incrementAndGet();
                        log.warn("SCAN_FILE_CALLBACK_FAILED file={} reason={}", file, e.getMessage(), e);
                    }
                    return file;
                });
            }
            for (int i = 0; i < files.size(); i++) {
                completionService.take().get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            throw new IllegalStateException("File traversal interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("File traversal task failed", e.getCause());
        } finally {
            executor.shutdown();
        }
        result.setVisitedFiles(files.size());
        result.setFailedFiles(failed.get());
        return result;
    }

    @FunctionalInterface
    public interface FileAction {

        void accept(Path file) throws Exception;
    }

    public static class TraversalResult {

        private int visitedFiles;
        private int failedFiles;

        public int getVisitedFiles() {
            return visitedFiles;
        }

        public void setVisitedFiles(int visitedFiles) {
            this.visitedFiles = visitedFiles;
        }

        public int getFailedFiles() {
            return failedFiles;
        }

        public void setFailedFiles(int failedFiles) {
            this.failedFiles = failedFiles;
        }
    }
}
