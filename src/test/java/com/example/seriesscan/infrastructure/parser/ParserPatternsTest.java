package com.example.seriesscan.infrastructure.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.seriesscan.domain.enumtype.MangaFormat;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;

class ParserPatternsTest {

    @Test
    void extensionShouldHandleCompoundAndMissingExtensions() {
        assertEquals("tar.gz", ParserPatterns.extension(Paths.get("/lib/Series v01.TAR.GZ")));
        assertEquals("cbz", ParserPatterns.extension(Paths.get("/lib/Series v01.CBZ")));
        assertEquals("", ParserPatterns.extension(Paths.get("/lib/README")));
        assertEquals("", ParserPatterns.extension(Paths.get("/lib/.libraryignore")));
        assertEquals("Series v01", ParserPatterns.baseName(Paths.get("/lib/Series v01.tar.gz")));
    }

    @Test
    void formatOfShouldClassifyByExtension() {
        assertEquals(MangaFormat.ARCHIVE, ParserPatterns.formatOf(Paths.get("a.cbr")));
        assertEquals(MangaFormat.EPUB, ParserPatterns.formatOf(Paths.get("a.epub")));
        assertEquals(MangaFormat.PDF, ParserPatterns.formatOf(Paths.get("a.pdf")));
        assertEquals(MangaFormat.IMAGE, ParserPatterns.formatOf(Paths.get("a.webp")));
        assertEquals(MangaFormat.UNKNOWN, ParserPatterns.formatOf(Paths.get("a.txt")));
        assertTrue(ParserPatterns.isBook(Paths.get("a.pdf")));
        assertFalse(ParserPatterns.isArchive(Paths.get("a.pdf")));
    }

    @Test
    void isCoverImageShouldIgnoreBackCoversAndEmbeddedWords() {
        assertTrue(ParserPatterns.isCoverImage(Paths.get("cover.jpg")));
        assertTrue(ParserPatterns.isCoverImage(Paths.get("Folder.png")));
        assertTrue(ParserPatterns.isCoverImage(Paths.get("vol1 cover.jpg")));
        assertFalse(ParserPatterns.isCoverImage(Paths.get("back_cover.jpg")));
        assertFalse(ParserPatterns.isCoverImage(Paths.get("discover.png")));
        assertFalse(ParserPatterns.isCoverImage(Paths.get("001.png")));
    }

    @Test
    void parseVolumeAndChapterShouldStripLeadingZeros() {
        assertEquals("5", ParserPatterns.parseVolume("Accel World Vol.05"));
        assertEquals("1.5", ParserPatterns.parseVolume("Accel World v1.5"));
        assertEquals("3", ParserPatterns.parseVolume("Asterix Tome 3"));
        assertEquals("0", ParserPatterns.parseVolume("Accel World"));
        assertEquals("0", ParserPatterns.parseVolume(null));
        assertEquals("12.5", ParserPatterns.parseChapter("Monster Ch. 012.5"));
        assertEquals("7", ParserPatterns.parseChapter("Batman #007"));
        assertEquals("0", ParserPatterns.parseChapter("Monster"));
    }

    @Test
    void specialPredicatesShouldMatchMarkers() {
        assertTrue(ParserPatterns.hasSpecialMarker("Berserk SP01"));
        assertTrue(ParserPatterns.hasSpecialMarker("Naruto Omake"));
        assertFalse(ParserPatterns.hasSpecialMarker("Spider-Man"));
        assertTrue(ParserPatterns.hasComicInfoSpecial("One-Shot"));
        assertTrue(ParserPatterns.hasComicInfoSpecial("Specials"));
        assertFalse(ParserPatterns.hasComicInfoSpecial("Series"));
        assertFalse(ParserPatterns.hasComicInfoSpecial(null));
    }

    @Test
    void stripLeadingZerosShouldKeepLastDigit() {
        assertEquals("0", ParserPatterns.stripLeadingZeros("000"));
        assertEquals("0.5", ParserPatterns.stripLeadingZeros("0.5"));
        assertEquals("120", ParserPatterns.stripLeadingZeros("0120"));
    }
}
