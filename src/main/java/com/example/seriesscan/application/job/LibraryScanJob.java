package com.example.seriesscan.application.job;

import com.example.seriesscan.application.service.LibraryScanService;
import com.example.seriesscan.common.config.AppLibraryProperties;
import com.example.seriesscan.common.config.AppScanProperties;
import com.example.seriesscan.domain.model.ParsedRecord;
import com.example.seriesscan.domain.model.SeriesIdentity;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class LibraryScanJob {

    private static final Logger log = LoggerFactory.getLogger(LibraryScanJob.class);

    private final AppScanProperties appScanProperties;
    private final AppLibraryProperties appLibraryProperties;
    private final LibraryScanService libraryScanService;

    public LibraryScanJob(AppScanProperties appScanProperties,
                          AppLibraryProperties appLibraryProperties,
                          LibraryScanService libraryScanService) {
        this.appScanProperties = appScanProperties;
        this.appLibraryProperties = appLibraryProperties;
        this.libraryScanService = libraryScanService;
    }

    @Scheduled(cron = "${app.scan.cron:0 0 3 * * ?}")
    public void run() {
        if (!appScanProperties.isScheduledEnabled()) {
            log.debug("Library scan skipped: scheduling disabled");
            return;
        }
        List<AppLibraryProperties.Library> libraries = appLibraryProperties.getLibraries();
        if (libraries == null || libraries.isEmpty()) {
            log.debug("Library scan skipped: no library configured");
            return;
        }
        log.info("Library scan schedule triggered, libraryCount={}, cron={}",
                libraries.size(), appScanProperties.getCron());
        for (AppLibraryProperties.Library library : libraries) {
            try {
                scanLibrary(library);
            } catch (Exception e) {
                log.warn("Library scan failed unexpectedly, library={}", library.getName(), e);
            }
        }
    }

    /**
     * Scans one configured library and returns its series mapping.
     */
    public Map<SeriesIdentity, List<ParsedRecord>> scanLibrary(AppLibraryProperties.Library library) {
        List<Path> folders = new ArrayList<>();
        for (String folder : library.getFolders()) {
            if (StringUtils.hasText(folder)) {
                folders.add(Paths.get(folder.trim()));
            }
        }
        Map<SeriesIdentity, List<ParsedRecord>> result =
                libraryScanService.scanLibrary(library.getType(), folders, library.getName(), true, null);
        int recordCount = 0;
        for (List<ParsedRecord> records : result.values()) {
            recordCount += records.size();
        }
        log.info("Library scan finished, library={}, series={}, records={}",
                library.getName(), result.size(), recordCount);
        return result;
    }
}
