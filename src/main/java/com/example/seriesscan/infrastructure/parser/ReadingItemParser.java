package com.example.seriesscan.infrastructure.parser;

import com.example.seriesscan.domain.enumtype.LibraryType;
import com.example.seriesscan.domain.model.ComicInfo;
import com.example.seriesscan.domain.model.ParsedRecord;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Format-specific parsing of a single library file.
 */
public interface ReadingItemParser {

    /**
     * Parses a file into a record, or returns null when the file does not describe a series.
     *
     * @throws java.io.FileNotFoundException or {@link java.nio.file.NoSuchFileException} when the file is gone
     */
    ParsedRecord parse(Path file, Path rootPath, LibraryType libraryType) throws IOException;

    /** Embedded metadata of the file, or null when it carries none. */
    ComicInfo getComicInfo(Path file) throws IOException;
}
