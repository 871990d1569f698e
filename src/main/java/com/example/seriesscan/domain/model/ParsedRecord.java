package com.example.seriesscan.domain.model;

import com.example.seriesscan.common.util.SeriesNameNormalizer;
import com.example.seriesscan.domain.enumtype.MangaFormat;
import java.nio.file.Path;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Result of parsing a single file. Equality is identity: the same file parsed twice
 * yields two distinct records.
 */
@Getter
@Setter
@ToString
public class ParsedRecord {

    public static final String DEFAULT_VOLUME = "0";

    public static final String DEFAULT_CHAPTER = "0";

    private String series = "";

    private String seriesSort = "";

    private String localizedSeries = "";

    private String volumes = DEFAULT_VOLUME;

    private String chapters = DEFAULT_CHAPTER;

    private String title = "";

    private String edition = "";

    private MangaFormat format = MangaFormat.UNKNOWN;

    private boolean special;

    private String filename;

    private Path fullFilePath;

    @ToString.Exclude
    private ComicInfo comicInfo;

    /**
     * Normalized series name, computed from the current {@link #series} on every call.
     */
    public String getNormalizedSeries() {
        return SeriesNameNormalizer.normalize(series);
    }

    /**
     * Fills fields this record did not find from {@code other}. Fields already set here win.
     */
    public void merge(ParsedRecord other) {
        if (other == null) {
            return;
        }
        chapters = isEmptyOrDefault(chapters, DEFAULT_CHAPTER) ? other.chapters : chapters;
        volumes = isEmptyOrDefault(volumes, DEFAULT_VOLUME) ? other.volumes : volumes;
        edition = isEmpty(edition) ? other.edition : edition;
        title = isEmpty(title) ? other.title : title;
        series = isEmpty(series) ? other.series : series;
        special = special || other.special;
    }

    private static boolean isEmptyOrDefault(String value, String defaultValue) {
        return isEmpty(value) || defaultValue.equals(value);
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
