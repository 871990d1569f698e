package com.example.seriesscan.infrastructure.parser;

import com.example.seriesscan.domain.model.ComicInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.ProviderNotFoundException;
import java.util.Iterator;
import java.util.Locale;
import java.util.stream.Stream;
import java.util.zip.ZipException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads {@code ComicInfo.xml} out of zip based comic archives.
 */
@Component
public class ComicInfoReader {

    private static final Logger log = LoggerFactory.getLogger(ComicInfoReader.class);

    private static final String COMIC_INFO_ENTRY = "comicinfo.xml";

    private static final XmlMapper XML_MAPPER = XmlMapper.builder()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    /**
     * Returns null for formats without a zip container and for archives without the entry.
     *
     * @throws IOException when the archive cannot be opened, including when it is not a zip
     */
    public ComicInfo read(Path file) throws IOException {
        String ext = ParserPatterns.extension(file);
        if (!"cbz".equals(ext) && !"zip".equals(ext)) {
            return null;
        }
        try (FileSystem zip = openArchive(file)) {
            Path entry = findComicInfoEntry(zip);
            if (entry == null) {
                return null;
            }
            try (InputStream in = Files.newInputStream(entry)) {
                return XML_MAPPER.readValue(in, ComicInfo.class);
            } catch (JsonProcessingException e) {
                log.warn("COMIC_INFO_MALFORMED file={} reason={}", file, e.getOriginalMessage());
                return null;
            }
        }
    }

    private FileSystem openArchive(Path file) throws IOException {
        try {
            return FileSystems.newFileSystem(file);
        } catch (ProviderNotFoundException e) {
            throw new ZipException("Not a zip archive: " + file);
        }
    }

    private Path findComicInfoEntry(FileSystem zip) throws IOException {
        Path nested = null;
        for (Path entryRoot : zip.getRootDirectories()) {
            try (Stream<Path> entries = Files.walk(entryRoot)) {
                Iterator<Path> it = entries.iterator();
                while (it.hasNext()) {
                    Path entry = it.next();
                    if (entry.getFileName() == null || Files.isDirectory(entry)) {
                        continue;
                    }
                    if (!COMIC_INFO_ENTRY.equals(entry.getFileName().toString().toLowerCase(Locale.ROOT))) {
                        continue;
                    }
                    if (entry.getNameCount() == 1) {
                        return entry;
                    }
                    if (nested == null) {
                        nested = entry;
                    }
                }
            }
        }
        return nested;
    }
}
