package com.example.seriesscan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import com.example.seriesscan.application.service.LibraryScanService;
import com.example.seriesscan.common.config.AppScanProperties;
import com.example.seriesscan.domain.enumtype.LibraryType;
import java.util.Collections;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = "app.scan.parallelism=2")
class LibrarySeriesScannerApplicationTest {

    @Autowired
    private AppScanProperties appScanProperties;

    @Autowired
    private LibraryScanService libraryScanService;

    @Test
    void contextShouldBindScanProperties() {
        assertEquals(2, appScanProperties.effectiveParallelism());
        assertEquals(".libraryignore", appScanProperties.getIgnoreFileName());
        assertFalse(appScanProperties.isScheduledEnabled());
        assertEquals(0, libraryScanService.scanLibrary(
                LibraryType.MANGA, Collections.emptyList(), "empty", true, null).size());
    }
}
