package com.example.seriesscan.domain.model;

import com.example.seriesscan.domain.enumtype.MangaFormat;
import java.util.Objects;
import lombok.Getter;

/**
 * Aggregation key of a scan: one logical series under one format.
 *
 * <p>Two identities are equal when format and normalized name are equal, so the
 * aggregation map can never hold two keys for the same normalized-name cluster.
 */
@Getter
public final class SeriesIdentity {

    private final String name;

    private final String normalizedName;

    private final MangaFormat format;

    /**
     * Highest folder that contains the series. May be null.
     */
    private final String folderPath;

    public SeriesIdentity(String name, String normalizedName, MangaFormat format, String folderPath) {
        this.name = name;
        this.normalizedName = normalizedName == null ? "" : normalizedName;
        this.format = format;
        this.folderPath = folderPath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SeriesIdentity)) {
            return false;
        }
        SeriesIdentity other = (SeriesIdentity) o;
        return format == other.format && normalizedName.equals(other.normalizedName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(normalizedName, format);
    }

    @Override
    public String toString() {
        return "SeriesIdentity{name='" + name + "', normalizedName='" + normalizedName
                + "', format=" + format + ", folderPath='" + folderPath + "'}";
    }
}
