package com.example.seriesscan.infrastructure.parser;

import com.example.seriesscan.domain.enumtype.MangaFormat;
import com.example.seriesscan.domain.model.ParsedRecord;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless filename predicates and designator extraction shared by the scanner.
 */
public final class ParserPatterns {

    public static final Set<String> ARCHIVE_EXTENSIONS = orderedSet(
            "cbz", "zip", "rar", "cbr", "tar.gz", "7zip", "7z", "cb7", "cbt");

    public static final Set<String> BOOK_EXTENSIONS = orderedSet("epub", "pdf");

    public static final Set<String> IMAGE_EXTENSIONS = orderedSet("png", "jpeg", "jpg", "webp", "gif");

    public static final Set<String> SUPPORTED_EXTENSIONS;

    static {
        Set<String> all = new LinkedHashSet<>();
        all.addAll(ARCHIVE_EXTENSIONS);
        all.addAll(BOOK_EXTENSIONS);
        all.addAll(IMAGE_EXTENSIONS);
        SUPPORTED_EXTENSIONS = Collections.unmodifiableSet(all);
    }

    private static final Pattern COVER_IMAGE_PATTERN = Pattern.compile(
            "(?<![a-z0-9])(?<!back[ _-])(cover|folder)(?![a-z0-9])", Pattern.CASE_INSENSITIVE);

    private static final Pattern COMIC_INFO_SPECIAL_PATTERN = Pattern.compile(
            "\\b(Specials?|One[- ]?Shot|Extra(?:\\sChapter)?|Art Collection|Side Stories|Bonus)\\b",
            Pattern.CASE_INSENSITIVE);

    static final Pattern SPECIAL_MARKER_PATTERN = Pattern.compile(
            "\\b(SP\\d+|Specials?|Omake|One[- ]?Shot)\\b", Pattern.CASE_INSENSITIVE);

    static final List<Pattern> VOLUME_PATTERNS = Arrays.asList(
            Pattern.compile("\\b(?:v|vol\\.?|volume)\\s?(?<volume>\\d+(?:[.-]\\d+)?)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\btome\\s?(?<volume>\\d+)\\b", Pattern.CASE_INSENSITIVE));

    static final List<Pattern> CHAPTER_PATTERNS = Arrays.asList(
            Pattern.compile("\\b(?:c|ch\\.?|chapter)\\s?(?<chapter>\\d+(?:\\.\\d+)?)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("#(?<chapter>\\d+(?:\\.\\d+)?)\\b"));

    private ParserPatterns() {
    }

    public static boolean isArchive(Path file) {
        return hasExtension(file, ARCHIVE_EXTENSIONS);
    }

    public static boolean isBook(Path file) {
        return hasExtension(file, BOOK_EXTENSIONS);
    }

    public static boolean isEpub(Path file) {
        return "epub".equals(extension(file));
    }

    public static boolean isPdf(Path file) {
        return "pdf".equals(extension(file));
    }

    public static boolean isImage(Path file) {
        return hasExtension(file, IMAGE_EXTENSIONS);
    }

    /**
     * True for images named like a cover or folder thumbnail ({@code cover.jpg}, {@code folder.png}).
     * Back covers are not covers.
     */
    public static boolean isCoverImage(Path file) {
        if (file == null || file.getFileName() == null) {
            return false;
        }
        return COVER_IMAGE_PATTERN.matcher(baseName(file)).find();
    }

    public static boolean hasComicInfoSpecial(String comicInfoFormat) {
        if (comicInfoFormat == null || comicInfoFormat.isEmpty()) {
            return false;
        }
        return COMIC_INFO_SPECIAL_PATTERN.matcher(comicInfoFormat).find();
    }

    public static boolean hasSpecialMarker(String text) {
        return text != null && SPECIAL_MARKER_PATTERN.matcher(text).find();
    }

    /**
     * Volume designator found in the text, without leading zeros, or
     * {@link ParsedRecord#DEFAULT_VOLUME} when there is none.
     */
    public static String parseVolume(String text) {
        String value = firstGroup(text, VOLUME_PATTERNS, "volume");
        return value == null ? ParsedRecord.DEFAULT_VOLUME : stripLeadingZeros(value);
    }

    public static String parseChapter(String text) {
        String value = firstGroup(text, CHAPTER_PATTERNS, "chapter");
        return value == null ? ParsedRecord.DEFAULT_CHAPTER : stripLeadingZeros(value);
    }

    public static MangaFormat formatOf(Path file) {
        if (isArchive(file)) {
            return MangaFormat.ARCHIVE;
        }
        if (isEpub(file)) {
            return MangaFormat.EPUB;
        }
        if (isPdf(file)) {
            return MangaFormat.PDF;
        }
        if (isImage(file)) {
            return MangaFormat.IMAGE;
        }
        return MangaFormat.UNKNOWN;
    }

    /**
     * Lower-case extension of the file, compound for {@code .tar.gz}. Empty when there is none.
     */
    public static String extension(Path file) {
        if (file == null || file.getFileName() == null) {
            return "";
        }
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".tar.gz")) {
            return "tar.gz";
        }
        int idx = name.lastIndexOf('.');
        if (idx <= 0 || idx >= name.length() - 1) {
            return "";
        }
        return name.substring(idx + 1);
    }

    /**
     * File name without its extension.
     */
    public static String baseName(Path file) {
        String name = file.getFileName().toString();
        String ext = extension(file);
        if (ext.isEmpty()) {
            return name;
        }
        return name.substring(0, name.length() - ext.length() - 1);
    }

    private static boolean hasExtension(Path file, Set<String> extensions) {
        return extensions.contains(extension(file));
    }

    private static String firstGroup(String text, List<Pattern> patterns, String group) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return matcher.group(group);
            }
        }
        return null;
    }

    static String stripLeadingZeros(String value) {
        int idx = 0;
        while (idx < value.length() - 1 && value.charAt(idx) == '0' && Character.isDigit(value.charAt(idx + 1))) {
            idx++;
        }
        return value.substring(idx);
    }

    private static Set<String> orderedSet(String... values) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(values)));
    }
}
