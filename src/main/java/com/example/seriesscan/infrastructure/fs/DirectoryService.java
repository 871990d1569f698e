package com.example.seriesscan.infrastructure.fs;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Filesystem boundary of the scanner. Implementations may sit on any
 * {@link java.nio.file.FileSystem}, so scans can run against an in-memory tree.
 */
public interface DirectoryService {

    /** Whether the folder exists and is a directory. */
    boolean exists(Path folder);

    boolean fileExists(Path file);

    /**
     * Immediate subdirectories of a folder. Empty when the folder does not exist.
     *
     * @throws java.io.UncheckedIOException when the folder cannot be listed
     */
    List<Path> getDirectories(Path folder);

    /**
     * Regular files directly inside a folder whose name ends with one of the extensions
     * (lower-case, without the leading dot; compound extensions such as {@code tar.gz} allowed).
     */
    List<Path> getFilesWithExtensions(Path folder, Set<String> extensions);

    List<String> readAllLines(Path file) throws IOException;

    /**
     * Canonical location of a folder with symbolic links resolved, used to visit every
     * directory once.
     */
    Path realPath(Path folder) throws IOException;
}
