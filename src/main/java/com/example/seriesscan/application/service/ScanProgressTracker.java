package com.example.seriesscan.application.service;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts scan progress per folder batch and logs milestones, periodic progress and a final
 * summary. Counters only ever grow. Safe for concurrent file callbacks.
 */
public class ScanProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(ScanProgressTracker.class);

    private final String libraryName;
    private final long startTimeMs;
    private final int logIntervalSec;
    private final int largeFolderWarnThreshold;

    private int missingRoots;
    private int totalFolders;
    private int completedFolders;
    private int filesDiscovered;
    private int filesProcessed;
    private int filesParsed;
    private int filesUnparsed;
    private int filesFailed;
    private int recordsTracked;
    private int recordsSkipped;

    private long lastLogTimeMs;
    private int lastMilestonePct = -1;

    public ScanProgressTracker(String libraryName, int logIntervalSec, int largeFolderWarnThreshold) {
        this.libraryName = libraryName;
        this.startTimeMs = System.currentTimeMillis();
        this.lastLogTimeMs = this.startTimeMs;
        this.logIntervalSec = logIntervalSec > 0 ? logIntervalSec : 30;
        this.largeFolderWarnThreshold = Math.max(0, largeFolderWarnThreshold);
    }

    public synchronized void onRootMissing() {
        missingRoots++;
    }

    public synchronized void addDiscoveredFolders(int count) {
        totalFolders += count;
    }

    public synchronized void onFolderDiscovered(String folder, int fileCount) {
        filesDiscovered += fileCount;
        if (largeFolderWarnThreshold > 0 && fileCount > largeFolderWarnThreshold) {
            log.warn("LARGE_FOLDER_DETECTED library={} folder={} fileCount={} threshold={}",
                    libraryName, folder, fileCount, largeFolderWarnThreshold);
        }
    }

    public synchronized void onFileParsed() {
        filesProcessed++;
        filesParsed++;
        logIfDue();
    }

    public synchronized void onFileUnparsed() {
        filesProcessed++;
        filesUnparsed++;
        logIfDue();
    }

    public synchronized void onFileFailed() {
        filesProcessed++;
        filesFailed++;
        logIfDue();
    }

    public synchronized void onRecordTracked(boolean tracked) {
        if (tracked) {
            recordsTracked++;
        } else {
            recordsSkipped++;
        }
    }

    public synchronized void onFolderCompleted() {
        completedFolders++;
        checkMilestone();
    }

    public synchronized void logSummary(int seriesCount) {
        log.info("LIBRARY_SCAN_SUMMARY library={} folders={}/{} missingRoots={} files={}/{} parsed={} "
                        + "unparsed={} failed={} tracked={} skipped={} series={} elapsed={}",
                libraryName, completedFolders, totalFolders, missingRoots, filesProcessed, filesDiscovered,
                filesParsed, filesUnparsed, filesFailed, recordsTracked, recordsSkipped, seriesCount,
                formatElapsed(System.currentTimeMillis() - startTimeMs));
    }

    public synchronized int getProgressPercent() {
        if (totalFolders <= 0) {
            return 0;
        }
        return (int) (completedFolders * 100L / totalFolders);
    }

    private void checkMilestone() {
        if (totalFolders <= 0) {
            return;
        }
        int pct = getProgressPercent();
        int currentBucket = pct / 10;
        int lastBucket = lastMilestonePct / 10;
        if (currentBucket > lastBucket && pct <= 100) {
            log.info("LIBRARY_SCAN_MILESTONE {}% library={} folders={}/{} files={} parsed={} failed={} elapsed={}",
                    currentBucket * 10, libraryName, completedFolders, totalFolders,
                    filesProcessed, filesParsed, filesFailed,
                    formatElapsed(System.currentTimeMillis() - startTimeMs));
            lastMilestonePct = pct;
        }
    }

    private void logIfDue() {
        long now = System.currentTimeMillis();
        if (now - lastLogTimeMs < logIntervalSec * 1000L) {
            return;
        }
        lastLogTimeMs = now;
        long elapsedMs = now - startTimeMs;
        double filesPerSec = elapsedMs <= 0 ? 0D : filesProcessed * 1000.0 / elapsedMs;
        log.info("LIBRARY_SCAN_PROGRESS library={} folders={}/{} files={}/{} speed={} elapsed={}",
                libraryName, completedFolders, totalFolders, filesProcessed, filesDiscovered,
                String.format(Locale.ROOT, "%.1f files/s", filesPerSec), formatElapsed(elapsedMs));
    }

    private String formatElapsed(long elapsedMs) {
        if (elapsedMs < 1000) {
            return elapsedMs + "ms";
        }
        long seconds = elapsedMs / 1000;
        long minutes = seconds / 60;
        long remainSeconds = seconds % 60;
        if (minutes <= 0) {
            return seconds + "s";
        }
        long hours = minutes / 60;
        long remainMinutes = minutes % 60;
        if (hours <= 0) {
            return minutes + "m" + remainSeconds + "s";
        }
        return hours + "h" + remainMinutes + "m" + remainSeconds + "s";
    }

    public synchronized int getCompletedFolders() { return completedFolders; }
    public synchronized int getTotalFolders() { return totalFolders; }
    public synchronized int getFilesProcessed() { return filesProcessed; }
    public synchronized int getFilesParsed() { return filesParsed; }
    public synchronized int getFilesUnparsed() { return filesUnparsed; }
    public synchronized int getFilesFailed() { return filesFailed; }
    public synchronized int getMissingRoots() { return missingRoots; }
    public synchronized int getRecordsTracked() { return recordsTracked; }
    public synchronized int getRecordsSkipped() { return recordsSkipped; }
}
