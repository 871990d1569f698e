package com.example.seriesscan.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.Data;

/**
 * Embedded per-file metadata (the {@code ComicInfo.xml} sidecar of comic archives).
 * Only the fields the scanner consumes are mapped.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JacksonXmlRootElement(localName = "ComicInfo")
public class ComicInfo {

    @JsonProperty("Series")
    private String series;

    @JsonProperty("LocalizedSeries")
    private String localizedSeries;

    @JsonProperty("SeriesSort")
    private String seriesSort;

    @JsonProperty("TitleSort")
    private String titleSort;

    @JsonProperty("Title")
    private String title;

    @JsonProperty("Volume")
    private String volume;

    @JsonProperty("Number")
    private String number;

    @JsonProperty("Format")
    private String format;
}
