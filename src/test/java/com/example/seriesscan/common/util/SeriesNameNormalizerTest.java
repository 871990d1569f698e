package com.example.seriesscan.common.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class SeriesNameNormalizerTest {

    @Test
    void normalizeShouldLowerCaseAndStripPunctuation() {
        assertEquals("accelworld", SeriesNameNormalizer.normalize("Accel World"));
        assertEquals("kaguyasama", SeriesNameNormalizer.normalize("Kaguya-sama!"));
        assertEquals("c++primer", SeriesNameNormalizer.normalize("C++ Primer"));
        assertEquals("2001spaceodyssey", SeriesNameNormalizer.normalize("2001: Space Odyssey"));
    }

    @Test
    void normalizeShouldKeepNonLatinLetters() {
        assertEquals("進撃の巨人", SeriesNameNormalizer.normalize("進撃の巨人 "));
        assertEquals("émile", SeriesNameNormalizer.normalize("Émile"));
    }

    @Test
    void normalizeShouldReturnEmptyForNullOrEmpty() {
        assertEquals("", SeriesNameNormalizer.normalize(null));
        assertEquals("", SeriesNameNormalizer.normalize(""));
        assertEquals("", SeriesNameNormalizer.normalize(" - ! "));
    }

    @Test
    void normalizeShouldBeIdempotent() {
        String[] samples = {"Accel World", "  The_Legend (2010) ", "Ça Va?", "One+Two", "進撃の巨人", "", "!!!"};
        for (String sample : samples) {
            String once = SeriesNameNormalizer.normalize(sample);
            assertEquals(once, SeriesNameNormalizer.normalize(once), sample);
        }
    }
}
