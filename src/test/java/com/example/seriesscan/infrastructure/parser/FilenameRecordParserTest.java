package com.example.seriesscan.infrastructure.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.seriesscan.domain.enumtype.LibraryType;
import com.example.seriesscan.domain.enumtype.MangaFormat;
import com.example.seriesscan.domain.model.ParsedRecord;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;

class FilenameRecordParserTest {

    private static final Path ROOT = Paths.get("/library/manga");

    private final FilenameRecordParser parser = new FilenameRecordParser();

    @Test
    void parseShouldReadSeriesAndVolume() {
        Path file = ROOT.resolve("Accel World/Accel World v01.cbz");

        ParsedRecord record = parser.parse(file, ROOT, LibraryType.MANGA);

        assertEquals("Accel World", record.getSeries());
        assertEquals("1", record.getVolumes());
        assertEquals("0", record.getChapters());
        assertEquals(MangaFormat.ARCHIVE, record.getFormat());
        assertEquals("Accel World v01.cbz", record.getFilename());
        assertEquals(file, record.getFullFilePath());
        assertFalse(record.isSpecial());
    }

    @Test
    void parseShouldDropBracketGroupsAndUnderscores() {
        ParsedRecord record = parser.parse(ROOT.resolve("Monster/[Group]_Monster_c005_(2004).cbz"),
                ROOT, LibraryType.MANGA);

        assertEquals("Monster", record.getSeries());
        assertEquals("5", record.getChapters());
    }

    @Test
    void parseShouldTreatTrailingNumberAsChapter() {
        ParsedRecord record = parser.parse(ROOT.resolve("One Piece/One Piece 012.cbz"), ROOT, LibraryType.MANGA);

        assertEquals("One Piece", record.getSeries());
        assertEquals("12", record.getChapters());
    }

    @Test
    void parseShouldKeepTrailingNumberInBookLibraries() {
        ParsedRecord record = parser.parse(ROOT.resolve("Catch 22.epub"), ROOT, LibraryType.BOOK);

        assertEquals("Catch 22", record.getSeries());
        assertEquals("0", record.getChapters());
        assertEquals(MangaFormat.EPUB, record.getFormat());
    }

    @Test
    void parseShouldFlagSpecials() {
        ParsedRecord record = parser.parse(ROOT.resolve("Berserk/Berserk v02 SP01.cbz"), ROOT, LibraryType.MANGA);

        assertEquals("Berserk", record.getSeries());
        assertTrue(record.isSpecial());
        assertEquals(ParsedRecord.DEFAULT_VOLUME, record.getVolumes());
        assertEquals(ParsedRecord.DEFAULT_CHAPTER, record.getChapters());
    }

    @Test
    void parseShouldUseFolderNameForLooseImages() {
        ParsedRecord record = parser.parse(ROOT.resolve("Monster/001.jpg"), ROOT, LibraryType.MANGA);

        assertEquals("Monster", record.getSeries());
        assertEquals(MangaFormat.IMAGE, record.getFormat());
    }

    @Test
    void parseShouldNotUseRootAsSeries() {
        ParsedRecord record = parser.parse(ROOT.resolve("001.jpg"), ROOT, LibraryType.MANGA);

        assertEquals("", record.getSeries());
    }

    @Test
    void parseShouldRejectCoversAndUnknownFormats() {
        assertNull(parser.parse(ROOT.resolve("Monster/cover.jpg"), ROOT, LibraryType.MANGA));
        assertNull(parser.parse(ROOT.resolve("Monster/notes.txt"), ROOT, LibraryType.MANGA));
    }
}
