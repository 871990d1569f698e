package com.example.seriesscan.infrastructure.parser;

import com.example.seriesscan.domain.enumtype.LibraryType;
import com.example.seriesscan.domain.enumtype.MangaFormat;
import com.example.seriesscan.domain.model.ParsedRecord;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Parses series, volume and chapter designators out of a file name, falling back to the
 * parent folder for the series name. Knows nothing about file contents.
 */
@Component
public class FilenameRecordParser {

    private static final Pattern BRACKET_GROUP_PATTERN = Pattern.compile("\\[[^\\]]*\\]|\\([^)]*\\)|\\{[^}]*\\}");
    private static final Pattern TRAILING_NUMBER_PATTERN = Pattern.compile("^(?<series>.+?)[\\s-]+(?<chapter>\\d+(?:\\.\\d+)?)$");
    private static final Pattern MULTI_SPACE_PATTERN = Pattern.compile("\\s{2,}");
    private static final Pattern EDGE_PUNCTUATION_PATTERN = Pattern.compile("^[\\s\\-_.,:]+|[\\s\\-_.,:]+$");

    /**
     * Returns null when the file cannot describe a series (cover images, unsupported formats).
     */
    public ParsedRecord parse(Path file, Path rootPath, LibraryType libraryType) {
        if (file == null || file.getFileName() == null) {
            return null;
        }
        MangaFormat format = ParserPatterns.formatOf(file);
        if (format == MangaFormat.UNKNOWN) {
            return null;
        }
        if (format == MangaFormat.IMAGE && ParserPatterns.isCoverImage(file)) {
            return null;
        }

        String baseName = ParserPatterns.baseName(file);
        String cleaned = clean(baseName);

        ParsedRecord record = new ParsedRecord();
        record.setFilename(file.getFileName().toString());
        record.setFullFilePath(file);
        record.setFormat(format);
        record.setTitle(cleaned);

        String volume = ParserPatterns.parseVolume(cleaned);
        record.setVolumes(volume);
        if (libraryType != LibraryType.BOOK) {
            record.setChapters(ParserPatterns.parseChapter(cleaned));
        }

        String series = format == MangaFormat.IMAGE ? "" : extractSeries(cleaned);
        if (libraryType != LibraryType.BOOK && ParsedRecord.DEFAULT_VOLUME.equals(volume)
                && ParsedRecord.DEFAULT_CHAPTER.equals(record.getChapters())) {
            Matcher trailing = TRAILING_NUMBER_PATTERN.matcher(series);
            if (trailing.matches()) {
                series = trim(trailing.group("series"));
                record.setChapters(ParserPatterns.stripLeadingZeros(trailing.group("chapter")));
            }
        }

        if (libraryType != LibraryType.BOOK && ParserPatterns.hasSpecialMarker(cleaned)) {
            record.setSpecial(true);
            record.setVolumes(ParsedRecord.DEFAULT_VOLUME);
            record.setChapters(ParsedRecord.DEFAULT_CHAPTER);
        }

        if (series.isEmpty()) {
            series = seriesFromFolder(file, rootPath);
        }
        record.setSeries(series);
        return record;
    }

    private String extractSeries(String cleaned) {
        int cut = cleaned.length();
        cut = Math.min(cut, firstMatchStart(cleaned, ParserPatterns.VOLUME_PATTERNS));
        cut = Math.min(cut, firstMatchStart(cleaned, ParserPatterns.CHAPTER_PATTERNS));
        Matcher special = ParserPatterns.SPECIAL_MARKER_PATTERN.matcher(cleaned);
        if (special.find()) {
            cut = Math.min(cut, special.start());
        }
        return trim(cleaned.substring(0, cut));
    }

    private String seriesFromFolder(Path file, Path rootPath) {
        Path parent = file.getParent();
        if (parent == null || parent.getFileName() == null) {
            return "";
        }
        if (rootPath != null && parent.normalize().equals(rootPath.normalize())) {
            return "";
        }
        return extractSeries(clean(parent.getFileName().toString()));
    }

    private int firstMatchStart(String text, Iterable<Pattern> patterns) {
        int first = text.length();
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                first = Math.min(first, matcher.start());
            }
        }
        return first;
    }

    private String clean(String value) {
        String result = value.replace('_', ' ');
        result = BRACKET_GROUP_PATTERN.matcher(result).replaceAll(" ");
        result = MULTI_SPACE_PATTERN.matcher(result).replaceAll(" ");
        return result.trim();
    }

    private String trim(String value) {
        String result = EDGE_PUNCTUATION_PATTERN.matcher(value).replaceAll("");
        return MULTI_SPACE_PATTERN.matcher(result).replaceAll(" ");
    }
}
