package com.example.seriesscan.application.service;

import com.example.seriesscan.common.util.SeriesNameNormalizer;
import com.example.seriesscan.domain.model.ParsedRecord;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Collapses a folder batch published partly under a localized title onto one series name.
 *
 * <p>Example: {@code Accel World v01.cbz} (no localized title) and
 * {@code World of Acceleration v02.cbz} (localized title "Accel World") both end up with
 * series "Accel World". Only rewritten records take the localized title.
 */
public final class LocalizedSeriesReconciler {

    private static final Logger log = LoggerFactory.getLogger(LocalizedSeriesReconciler.class);

    private LocalizedSeriesReconciler() {
    }

    public static void reconcile(List<ParsedRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        String localizedSeries = null;
        for (ParsedRecord record : records) {
            if (StringUtils.hasLength(record.getLocalizedSeries())) {
                localizedSeries = record.getLocalizedSeries();
                break;
            }
        }
        if (localizedSeries == null) {
            return;
        }

        String canonicalSeries = findCanonicalSeries(records, localizedSeries);
        if (!StringUtils.hasLength(canonicalSeries)) {
            return;
        }

        String normalizedCanonical = SeriesNameNormalizer.normalize(canonicalSeries);
        int rewritten = 0;
        for (ParsedRecord record : records) {
            if (!SeriesNameNormalizer.normalize(record.getSeries()).equals(normalizedCanonical)) {
                record.setSeries(canonicalSeries);
                record.setLocalizedSeries(localizedSeries);
                rewritten++;
            }
        }
        if (rewritten > 0) {
            log.debug("LOCALIZED_SERIES_MERGED series={} localized={} rewritten={}",
                    canonicalSeries, localizedSeries, rewritten);
        }
    }

    /**
     * First series in batch order that is not merely its own record's localized title. Falls
     * back to the first series that differs from the chosen localized title.
     */
    private static String findCanonicalSeries(List<ParsedRecord> records, String localizedSeries) {
        for (ParsedRecord record : records) {
            String series = record.getSeries();
            if (StringUtils.hasLength(series) && !series.equals(record.getLocalizedSeries())) {
                return series;
            }
        }
        for (ParsedRecord record : records) {
            String series = record.getSeries();
            if (StringUtils.hasLength(series) && !series.equals(localizedSeries)) {
                return series;
            }
        }
        return null;
    }
}
