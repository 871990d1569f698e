package com.example.seriesscan.application.service;

import com.example.seriesscan.domain.enumtype.LibraryType;
import com.example.seriesscan.domain.model.ComicInfo;
import com.example.seriesscan.domain.model.ParsedRecord;
import com.example.seriesscan.infrastructure.parser.FilenameRecordParser;
import com.example.seriesscan.infrastructure.parser.ParserPatterns;
import com.example.seriesscan.infrastructure.parser.ReadingItemParser;
import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Parses one file into a record and applies its embedded metadata. Does not track.
 */
@Service
public class FileRecordProcessor {

    private static final Logger log = LoggerFactory.getLogger(FileRecordProcessor.class);

    private final ReadingItemParser readingItemParser;
    private final FilenameRecordParser defaultParser;

    public FileRecordProcessor(ReadingItemParser readingItemParser, FilenameRecordParser defaultParser) {
        this.readingItemParser = readingItemParser;
        this.defaultParser = defaultParser;
    }

    /**
     * Returns the enriched record, or null when the file does not describe a series.
     * Cover images are skipped silently; any other unparseable file is logged at warn.
     *
     * @throws IOException when the file cannot be read, including when it no longer exists
     */
    public ParsedRecord process(Path file, Path rootPath, LibraryType libraryType) throws IOException {
        ParsedRecord record = readingItemParser.parse(file, rootPath, libraryType);
        if (record == null) {
            if (!(ParserPatterns.isImage(file) && ParserPatterns.isCoverImage(file))) {
                log.warn("SCAN_PARSE_FAILED Could not parse series from path={}", file);
            }
            return null;
        }

        // Library-level classification disagrees with epub rules. The trigger inspects the
        // series name rather than record.getVolumes(); kept as is until checked against real files.
        if (ParserPatterns.isEpub(file)
                && !ParsedRecord.DEFAULT_VOLUME.equals(ParserPatterns.parseVolume(record.getSeries()))) {
            ParsedRecord bookRecord = defaultParser.parse(file, rootPath, LibraryType.BOOK);
            if (bookRecord != null) {
                bookRecord.merge(readingItemParser.parse(file, rootPath, libraryType));
                record = bookRecord;
            }
        }

        ComicInfo comicInfo = readingItemParser.getComicInfo(file);
        record.setComicInfo(comicInfo);
        if (comicInfo != null) {
            applyComicInfo(record, comicInfo);
        }
        return record;
    }

    private void applyComicInfo(ParsedRecord record, ComicInfo comicInfo) {
        if (StringUtils.hasLength(comicInfo.getVolume())) {
            record.setVolumes(comicInfo.getVolume());
        }
        if (StringUtils.hasLength(comicInfo.getSeries())) {
            record.setSeries(comicInfo.getSeries().trim());
        }
        if (StringUtils.hasLength(comicInfo.getNumber())) {
            record.setChapters(comicInfo.getNumber());
        }
        if (StringUtils.hasLength(comicInfo.getTitleSort())) {
            record.setSeriesSort(comicInfo.getTitleSort().trim());
        }
        if (StringUtils.hasLength(comicInfo.getFormat()) && ParserPatterns.hasComicInfoSpecial(comicInfo.getFormat())) {
            record.setSpecial(true);
            record.setChapters(ParsedRecord.DEFAULT_CHAPTER);
            record.setVolumes(ParsedRecord.DEFAULT_VOLUME);
        }
        if (StringUtils.hasLength(comicInfo.getSeriesSort())) {
            record.setSeriesSort(comicInfo.getSeriesSort().trim());
        }
        if (StringUtils.hasLength(comicInfo.getLocalizedSeries())) {
            record.setLocalizedSeries(comicInfo.getLocalizedSeries().trim());
        }
    }
}
