package com.example.seriesscan.application.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.seriesscan.application.service.LibraryScanService;
import com.example.seriesscan.common.config.AppLibraryProperties;
import com.example.seriesscan.common.config.AppScanProperties;
import com.example.seriesscan.domain.enumtype.LibraryType;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class LibraryScanJobTest {

    private AppScanProperties scanProperties;
    private AppLibraryProperties libraryProperties;
    private LibraryScanService libraryScanService;
    private LibraryScanJob libraryScanJob;

    @BeforeEach
    void setUp() {
        scanProperties = new AppScanProperties();
        libraryProperties = new AppLibraryProperties();
        libraryScanService = mock(LibraryScanService.class);
        libraryScanJob = new LibraryScanJob(scanProperties, libraryProperties, libraryScanService);
    }

    @Test
    void runShouldDoNothingWhenSchedulingDisabled() {
        libraryProperties.setLibraries(Collections.singletonList(library("Manga", LibraryType.MANGA, "/data/manga")));

        libraryScanJob.run();

        verify(libraryScanService, never()).scanLibrary(any(), any(), anyString(), anyBoolean(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void runShouldScanEveryLibraryEvenWhenOneFails() {
        scanProperties.setScheduledEnabled(true);
        libraryProperties.setLibraries(Arrays.asList(
                library("Comics", LibraryType.COMIC, "/data/comics"),
                library("Books", LibraryType.BOOK, "/data/books", " ", "/data/more-books ")));
        when(libraryScanService.scanLibrary(eq(LibraryType.COMIC), any(), eq("Comics"), eq(true), isNull()))
                .thenThrow(new IllegalStateException("disk offline"));
        when(libraryScanService.scanLibrary(eq(LibraryType.BOOK), any(), eq("Books"), eq(true), isNull()))
                .thenReturn(Collections.emptyMap());

        libraryScanJob.run();

        ArgumentCaptor<List> folders = ArgumentCaptor.forClass(List.class);
        verify(libraryScanService).scanLibrary(eq(LibraryType.BOOK), folders.capture(), eq("Books"), eq(true), isNull());
        assertEquals(Arrays.asList(Paths.get("/data/books"), Paths.get("/data/more-books")), folders.getValue());
    }

    private AppLibraryProperties.Library library(String name, LibraryType type, String... folders) {
        AppLibraryProperties.Library library = new AppLibraryProperties.Library();
        library.setName(name);
        library.setType(type);
        library.setFolders(Arrays.asList(folders));
        return library;
    }
}
