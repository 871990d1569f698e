package com.example.seriesscan.domain.enumtype;

/**
 * Classification of a library. Drives which filename rules the parser applies.
 */
public enum LibraryType {
    MANGA,
    COMIC,
    BOOK
}
