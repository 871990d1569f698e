package com.example.seriesscan.application.service;

import com.example.seriesscan.common.config.AppScanProperties;
import com.example.seriesscan.common.exception.BusinessException;
import com.example.seriesscan.domain.enumtype.LibraryType;
import com.example.seriesscan.domain.enumtype.ProgressEventType;
import com.example.seriesscan.domain.model.ParsedRecord;
import com.example.seriesscan.domain.model.ScanProgressEvent;
import com.example.seriesscan.domain.model.SeriesIdentity;
import com.example.seriesscan.infrastructure.event.ScanEventHub;
import com.example.seriesscan.infrastructure.parser.ParserPatterns;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Scans library folders into a series to records mapping.
 *
 * <p>Each call owns its own {@link SeriesTracker}; nothing is shared between scans. Missing
 * or unreadable roots and folders, missing files and unparseable files are logged and
 * skipped, so a scan always runs to completion and always publishes its end event.
 */
@Service
public class LibraryScanService {

    private static final Logger log = LoggerFactory.getLogger(LibraryScanService.class);

    private final DirectoryWalker directoryWalker;
    private final FileRecordProcessor fileRecordProcessor;
    private final ScanEventHub scanEventHub;
    private final AppScanProperties appScanProperties;
    private final MeterRegistry meterRegistry;

    public LibraryScanService(DirectoryWalker directoryWalker,
                              FileRecordProcessor fileRecordProcessor,
                              ScanEventHub scanEventHub,
                              AppScanProperties appScanProperties,
                              ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.directoryWalker = directoryWalker;
        this.fileRecordProcessor = fileRecordProcessor;
        this.scanEventHub = scanEventHub;
        this.appScanProperties = appScanProperties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    /**
     * Folder-batch scan. Every batch is parsed, reconciled for localized titles and then
     * tracked. With {@code isLibraryScan} each immediate subfolder of a root is a batch and the
     * root's loose files form one more; otherwise the whole root is one batch.
     *
     * @param folderCallback optional, receives each non-empty batch after it was tracked
     * @return series with at least one record
     */
    public Map<SeriesIdentity, List<ParsedRecord>> scanLibrary(LibraryType libraryType,
                                                               Collection<Path> folders,
                                                               String libraryName,
                                                               boolean isLibraryScan,
                                                               Consumer<List<ParsedRecord>> folderCallback) {
        SeriesTracker seriesTracker = new SeriesTracker(meterRegistry);
        ScanProgressTracker progress = newProgressTracker(libraryName);
        log.info("LIBRARY_SCAN_START library={} type={} roots={} libraryScan={}",
                libraryName, libraryType, folders.size(), isLibraryScan);
        publishProgress("", libraryName, ProgressEventType.STARTED);

        for (Path root : folders) {
            try {
                directoryWalker.requireRoot(root);
                if (isLibraryScan) {
                    scanLibraryRoot(root, libraryType, libraryName, seriesTracker, progress, folderCallback);
                } else {
                    progress.addDiscoveredFolders(1);
                    List<Path> files = directoryWalker.scan(root);
                    processFolder(root, root, files, libraryType, libraryName, seriesTracker, progress, folderCallback);
                }
            } catch (BusinessException e) {
                handleRootFailure(libraryName, root, e, progress);
            } catch (RuntimeException e) {
                incrementCounter("library.scan.root.failed");
                log.error("SCAN_ROOT_FAILED library={} root={} reason={} - continuing with next root",
                        libraryName, root, e.getMessage(), e);
            }
        }

        publishProgress("", libraryName, ProgressEventType.ENDED);
        Map<SeriesIdentity, List<ParsedRecord>> result = seriesTracker.snapshot();
        progress.logSummary(result.size());
        return result;
    }

    /**
     * File-granularity scan: every file is tracked as soon as it is parsed, in parallel, without
     * localized-title reconciliation.
     */
    public Map<SeriesIdentity, List<ParsedRecord>> scanLibraryByFile(LibraryType libraryType,
                                                                     Collection<Path> folders,
                                                                     String libraryName) {
        SeriesTracker seriesTracker = new SeriesTracker(meterRegistry);
        ScanProgressTracker progress = newProgressTracker(libraryName);
        log.info("LIBRARY_SCAN_START library={} type={} roots={} mode=BY_FILE",
                libraryName, libraryType, folders.size());
        publishProgress("", libraryName, ProgressEventType.STARTED);

        for (Path root : folders) {
            try {
                progress.addDiscoveredFolders(1);
                DirectoryWalker.TraversalResult traversal = directoryWalker.traverseParallel(root, file -> {
                    ParsedRecord record = processFile(file, root, libraryType, progress);
                    if (record != null) {
                        trackRecord(seriesTracker, record, progress);
                    }
                    publishProgress(file.toString(), libraryName, ProgressEventType.UPDATED);
                }, ParserPatterns.SUPPORTED_EXTENSIONS);
                progress.onFolderDiscovered(root.toString(), traversal.getVisitedFiles());
                progress.onFolderCompleted();
            } catch (BusinessException e) {
                handleRootFailure(libraryName, root, e, progress);
            } catch (RuntimeException e) {
                incrementCounter("library.scan.root.failed");
                log.error("SCAN_ROOT_FAILED library={} root={} reason={} - continuing with next root",
                        libraryName, root, e.getMessage(), e);
            }
        }

        publishProgress("", libraryName, ProgressEventType.ENDED);
        Map<SeriesIdentity, List<ParsedRecord>> result = seriesTracker.snapshot();
        progress.logSummary(result.size());
        return result;
    }

    private void scanLibraryRoot(Path root,
                                 LibraryType libraryType,
                                 String libraryName,
                                 SeriesTracker seriesTracker,
                                 ScanProgressTracker progress,
                                 Consumer<List<ParsedRecord>> folderCallback) {
        IgnoreMatcher matcher = directoryWalker.loadIgnoreMatcher(root);
        List<Path> seriesFolders = directoryWalker.listSeriesFolders(root, matcher);
        List<Path> looseFiles = directoryWalker.listLooseFiles(root, matcher);
        progress.addDiscoveredFolders(seriesFolders.size() + (looseFiles.isEmpty() ? 0 : 1));
        log.debug("LIBRARY_SCAN_ROOT library={} root={} seriesFolders={} looseFiles={}",
                libraryName, root, seriesFolders.size(), looseFiles.size());

        if (!looseFiles.isEmpty()) {
            processFolder(root, root, looseFiles, libraryType, libraryName, seriesTracker, progress, folderCallback);
        }
        for (Path folder : seriesFolders) {
            try {
                List<Path> files = directoryWalker.scan(folder, matcher);
                processFolder(root, folder, files, libraryType, libraryName, seriesTracker, progress, folderCallback);
            } catch (RuntimeException e) {
                progress.onFolderCompleted();
                incrementCounter("library.scan.folder.failed");
                log.error("SCAN_FOLDER_FAILED library={} folder={} reason={} - skipping",
                        libraryName, folder, e.getMessage(), e);
            }
        }
    }

    private void processFolder(Path root,
                               Path folder,
                               List<Path> files,
                               LibraryType libraryType,
                               String libraryName,
                               SeriesTracker seriesTracker,
                               ScanProgressTracker progress,
                               Consumer<List<ParsedRecord>> folderCallback) {
        List<Path> orderedFiles = new ArrayList<>(files);
        Collections.sort(orderedFiles);
        progress.onFolderDiscovered(folder.toString(), orderedFiles.size());

        Map<Path, ParsedRecord> parsed = new ConcurrentHashMap<>();
        directoryWalker.processParallel(orderedFiles, file -> {
            ParsedRecord record = processFile(file, root, libraryType, progress);
            if (record != null) {
                parsed.put(file, record);
            }
            publishProgress(file.toString(), libraryName, ProgressEventType.UPDATED);
        });

        List<ParsedRecord> records = new ArrayList<>(parsed.size());
        for (Path file : orderedFiles) {
            ParsedRecord record = parsed.get(file);
            if (record != null) {
                records.add(record);
            }
        }

        LocalizedSeriesReconciler.reconcile(records);
        for (ParsedRecord record : records) {
            trackRecord(seriesTracker, record, progress);
        }

        if (!records.isEmpty() && folderCallback != null) {
            try {
                folderCallback.accept(records);
            } catch (RuntimeException e) {
                log.error("SCAN_FOLDER_CALLBACK_FAILED library={} folder={}", libraryName, folder, e);
            }
        }
        progress.onFolderCompleted();
    }

    private ParsedRecord processFile(Path file, Path root, LibraryType libraryType, ScanProgressTracker progress) {
        try {
            ParsedRecord record = fileRecordProcessor.process(file, root, libraryType);
            if (record == null) {
                progress.onFileUnparsed();
            } else {
                progress.onFileParsed();
                incrementCounter("library.scan.file.parsed");
            }
            return record;
        } catch (FileNotFoundException | NoSuchFileException e) {
            progress.onFileFailed();
            incrementCounter("library.scan.file.failed");
            log.error("SCAN_FILE_MISSING The file {} could not be found", file, e);
        } catch (IOException | RuntimeException e) {
            progress.onFileFailed();
            incrementCounter("library.scan.file.failed");
            log.warn("SCAN_FILE_FAILED path={} reason={}", file, e.getMessage(), e);
        }
        return null;
    }

    private void trackRecord(SeriesTracker seriesTracker, ParsedRecord record, ScanProgressTracker progress) {
        try {
            SeriesTracker.TrackOutcome outcome = seriesTracker.track(record);
            progress.onRecordTracked(outcome == SeriesTracker.TrackOutcome.TRACKED);
        } catch (RuntimeException e) {
            progress.onRecordTracked(false);
            log.error("SCAN_TRACK_FAILED An exception occurred during tracking path={}. Skipping this file",
                    record.getFullFilePath(), e);
        }
    }

    private void handleRootFailure(String libraryName, Path root, BusinessException e, ScanProgressTracker progress) {
        if (BusinessException.SCAN_ROOT_NOT_FOUND.equals(e.getCode())) {
            progress.onRootMissing();
            incrementCounter("library.scan.root.missing");
            log.error("SCAN_ROOT_MISSING library={} The directory '{}' does not exist", libraryName, root, e);
        } else {
            log.error("SCAN_ROOT_FAILED library={} root={} code={}", libraryName, root, e.getCode(), e);
        }
    }

    private ScanProgressTracker newProgressTracker(String libraryName) {
        return new ScanProgressTracker(libraryName,
                appScanProperties.getProgressLogIntervalSec(),
                appScanProperties.getLargeFolderWarnThreshold());
    }

    private void publishProgress(String path, String libraryName, ProgressEventType eventType) {
        try {
            scanEventHub.publish(ScanEventHub.NOTIFICATION_PROGRESS, new ScanProgressEvent(path, libraryName, eventType));
        } catch (RuntimeException e) {
            log.debug("Progress event publish failed, library={}, type={}", libraryName, eventType, e);
        }
    }

    private void incrementCounter(String name) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name).increment();
        } catch (Exception e) {
            log.debug("Metric counter update failed, name={}", name, e);
        }
    }
}
