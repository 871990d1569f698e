package com.example.seriesscan.application.service;

import com.example.seriesscan.common.util.SeriesNameNormalizer;
import com.example.seriesscan.domain.enumtype.MangaFormat;
import com.example.seriesscan.domain.model.ParsedRecord;
import com.example.seriesscan.domain.model.SeriesIdentity;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.springframework.util.StringUtils;

/**
 * Aggregates parsed records into series for one scan.
 *
 * <p>All of name merging, identity lookup, identity creation and append happen under one
 * lock, so concurrent calls resolving to the same series can never both create a key.
 * When a record matches more than one existing identity the record is logged with the
 * {@link #CRITICAL} marker and left out; identities are never merged automatically.
 */
public class SeriesTracker {

    private static final Logger log = LoggerFactory.getLogger(SeriesTracker.class);

    public static final Marker CRITICAL = MarkerFactory.getMarker("CRITICAL");

    public enum TrackOutcome {
        TRACKED,
        ALREADY_TRACKED,
        SKIPPED_EMPTY_SERIES,
        SKIPPED_CONFLICT
    }

    private final Map<SeriesIdentity, List<ParsedRecord>> scannedSeries = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final MeterRegistry meterRegistry;

    public SeriesTracker() {
        this(null);
    }

    public SeriesTracker(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public TrackOutcome track(ParsedRecord record) {
        if (record == null || !StringUtils.hasLength(record.getSeries())) {
            return TrackOutcome.SKIPPED_EMPTY_SERIES;
        }
        lock.lock();
        try {
            List<SeriesIdentity> mergeCandidates = findMergeCandidates(record);
            if (mergeCandidates.size() > 1) {
                logConflict(record, mergeCandidates);
                return TrackOutcome.SKIPPED_CONFLICT;
            }
            if (mergeCandidates.size() == 1 && StringUtils.hasLength(mergeCandidates.get(0).getName())) {
                record.setSeries(mergeCandidates.get(0).getName());
            }

            String normalizedSeries = SeriesNameNormalizer.normalize(record.getSeries());
            String normalizedSort = SeriesNameNormalizer.normalize(record.getSeriesSort());
            String normalizedLocalized = SeriesNameNormalizer.normalize(record.getLocalizedSeries());

            List<SeriesIdentity> matches = findKeys(record.getFormat(),
                    normalizedSeries, normalizedLocalized, normalizedSort);
            if (matches.size() > 1) {
                logConflict(record, matches);
                return TrackOutcome.SKIPPED_CONFLICT;
            }
            SeriesIdentity key = matches.isEmpty()
                    ? new SeriesIdentity(record.getSeries(), normalizedSeries, record.getFormat(), folderOf(record))
                    : matches.get(0);

            List<ParsedRecord> records = scannedSeries.computeIfAbsent(key, k -> new ArrayList<>());
            for (ParsedRecord existing : records) {
                if (existing == record) {
                    return TrackOutcome.ALREADY_TRACKED;
                }
            }
            records.add(record);
            return TrackOutcome.TRACKED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Name of the existing series the record should be grouped into, matching on series and
     * localized series. Returns the record's own series when nothing, or more than one
     * series, matches.
     */
    public String mergeName(ParsedRecord record) {
        lock.lock();
        try {
            List<SeriesIdentity> candidates = findMergeCandidates(record);
            if (candidates.size() > 1) {
                logConflict(record, candidates);
                return record.getSeries();
            }
            if (candidates.size() == 1 && StringUtils.hasLength(candidates.get(0).getName())) {
                return candidates.get(0).getName();
            }
            return record.getSeries();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy of the aggregation map holding only series with at least one record.
     */
    public Map<SeriesIdentity, List<ParsedRecord>> snapshot() {
        lock.lock();
        try {
            Map<SeriesIdentity, List<ParsedRecord>> result = new LinkedHashMap<>();
            for (Map.Entry<SeriesIdentity, List<ParsedRecord>> entry : scannedSeries.entrySet()) {
                if (!entry.getValue().isEmpty()) {
                    result.put(entry.getKey(), new ArrayList<>(entry.getValue()));
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public int seriesCount() {
        lock.lock();
        try {
            return scannedSeries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * All records of a scan result whose series matches any of the given names under the format.
     * Empty when there is no such series.
     */
    public static List<ParsedRecord> findRecords(Map<SeriesIdentity, List<ParsedRecord>> scanResult,
                                                 String name,
                                                 String localizedName,
                                                 String originalName,
                                                 MangaFormat format) {
        if (scanResult == null || scanResult.isEmpty()) {
            return Collections.emptyList();
        }
        String normalizedName = SeriesNameNormalizer.normalize(name);
        String normalizedLocalized = SeriesNameNormalizer.normalize(localizedName);
        String normalizedOriginal = SeriesNameNormalizer.normalize(originalName);
        List<ParsedRecord> records = new ArrayList<>();
        for (Map.Entry<SeriesIdentity, List<ParsedRecord>> entry : scanResult.entrySet()) {
            SeriesIdentity key = entry.getKey();
            if (key.getFormat() == format
                    && matchesAny(key.getNormalizedName(), normalizedName, normalizedLocalized, normalizedOriginal)) {
                records.addAll(entry.getValue());
            }
        }
        return records;
    }

    private List<SeriesIdentity> findMergeCandidates(ParsedRecord record) {
        String normalizedSeries = SeriesNameNormalizer.normalize(record.getSeries());
        String normalizedLocalized = SeriesNameNormalizer.normalize(record.getLocalizedSeries());
        List<SeriesIdentity> candidates = new ArrayList<>();
        for (SeriesIdentity key : scannedSeries.keySet()) {
            if (key.getFormat() == record.getFormat()
                    && matchesAny(SeriesNameNormalizer.normalize(key.getNormalizedName()),
                    normalizedSeries, normalizedLocalized)) {
                candidates.add(key);
            }
        }
        return candidates;
    }

    private List<SeriesIdentity> findKeys(MangaFormat format, String... normalizedNames) {
        List<SeriesIdentity> keys = new ArrayList<>();
        for (SeriesIdentity key : scannedSeries.keySet()) {
            if (key.getFormat() == format && matchesAny(key.getNormalizedName(), normalizedNames)) {
                keys.add(key);
            }
        }
        return keys;
    }

    private static boolean matchesAny(String normalizedKey, String... candidates) {
        for (String candidate : candidates) {
            if (StringUtils.hasLength(candidate) && candidate.equals(normalizedKey)) {
                return true;
            }
        }
        return false;
    }

    private void logConflict(ParsedRecord record, List<SeriesIdentity> matches) {
        log.error(CRITICAL, "SERIES_DUPLICATE_KEY series={} file={} matchCount={} - record skipped",
                record.getSeries(), record.getFullFilePath(), matches.size());
        for (SeriesIdentity match : matches) {
            log.error(CRITICAL, "SERIES_DUPLICATE_KEY_MATCH series={} matches={}", record.getSeries(), match);
        }
        if (meterRegistry != null) {
            try {
                meterRegistry.counter("library.scan.series.conflict").increment();
            } catch (Exception e) {
                log.debug("Metric counter update failed, name=library.scan.series.conflict", e);
            }
        }
    }

    private String folderOf(ParsedRecord record) {
        Path file = record.getFullFilePath();
        if (file == null || file.getParent() == null) {
            return null;
        }
        return file.getParent().toString();
    }
}
