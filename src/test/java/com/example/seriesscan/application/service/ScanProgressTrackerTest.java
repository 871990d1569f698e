package com.example.seriesscan.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ScanProgressTrackerTest {

    private Logger trackerLogger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        trackerLogger = (Logger) LoggerFactory.getLogger(ScanProgressTracker.class);
        appender = new ListAppender<>();
        appender.start();
        trackerLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        trackerLogger.detachAppender(appender);
    }

    @Test
    void countersShouldFollowFileAndRecordOutcomes() {
        ScanProgressTracker tracker = new ScanProgressTracker("Manga", 30, 0);
        tracker.addDiscoveredFolders(2);
        tracker.onFolderDiscovered("/lib/a", 3);
        tracker.onFileParsed();
        tracker.onFileUnparsed();
        tracker.onFileFailed();
        tracker.onRecordTracked(true);
        tracker.onRecordTracked(false);
        tracker.onRootMissing();
        tracker.onFolderCompleted();

        assertEquals(3, tracker.getFilesProcessed());
        assertEquals(1, tracker.getFilesParsed());
        assertEquals(1, tracker.getFilesUnparsed());
        assertEquals(1, tracker.getFilesFailed());
        assertEquals(1, tracker.getRecordsTracked());
        assertEquals(1, tracker.getRecordsSkipped());
        assertEquals(1, tracker.getMissingRoots());
        assertEquals(1, tracker.getCompletedFolders());
        assertEquals(2, tracker.getTotalFolders());
        assertEquals(50, tracker.getProgressPercent());
    }

    @Test
    void milestonesShouldBeLoggedOncePerTenPercent() {
        ScanProgressTracker tracker = new ScanProgressTracker("Manga", 30, 0);
        tracker.addDiscoveredFolders(20);
        for (int i = 0; i < 20; i++) {
            tracker.onFolderCompleted();
        }

        assertEquals(10, countInfo("LIBRARY_SCAN_MILESTONE"));
        assertEquals(100, tracker.getProgressPercent());
    }

    @Test
    void largeFolderShouldBeReportedAboveThreshold() {
        ScanProgressTracker tracker = new ScanProgressTracker("Manga", 30, 10);
        tracker.onFolderDiscovered("/lib/small", 10);
        tracker.onFolderDiscovered("/lib/huge", 11);

        long warnings = appender.list.stream()
                .filter(event -> event.getLevel() == Level.WARN && event.getMessage().startsWith("LARGE_FOLDER_DETECTED"))
                .count();
        assertEquals(1, warnings);
    }

    @Test
    void progressShouldBeZeroWithoutFolders() {
        ScanProgressTracker tracker = new ScanProgressTracker("Manga", 0, 0);
        tracker.onFolderCompleted();
        tracker.logSummary(0);

        assertEquals(0, tracker.getProgressPercent());
        assertEquals(1, countInfo("LIBRARY_SCAN_SUMMARY"));
    }

    private long countInfo(String key) {
        return appender.list.stream()
                .filter(event -> event.getLevel() == Level.INFO && event.getMessage().startsWith(key))
                .count();
    }
}
