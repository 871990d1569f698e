package com.example.seriesscan.infrastructure.parser;

import com.example.seriesscan.domain.enumtype.LibraryType;
import com.example.seriesscan.domain.model.ComicInfo;
import com.example.seriesscan.domain.model.ParsedRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.springframework.stereotype.Component;

/**
 * Filename-driven parser with ComicInfo support for zip archives.
 */
@Component
public class DefaultReadingItemParser implements ReadingItemParser {

    private final FilenameRecordParser filenameRecordParser;
    private final ComicInfoReader comicInfoReader;

    public DefaultReadingItemParser(FilenameRecordParser filenameRecordParser, ComicInfoReader comicInfoReader) {
        this.filenameRecordParser = filenameRecordParser;
        this.comicInfoReader = comicInfoReader;
    }

    @Override
    public ParsedRecord parse(Path file, Path rootPath, LibraryType libraryType) throws IOException {
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString());
        }
        return filenameRecordParser.parse(file, rootPath, libraryType);
    }

    @Override
    public ComicInfo getComicInfo(Path file) throws IOException {
        return comicInfoReader.read(file);
    }
}
