package com.example.seriesscan.domain.enumtype;

public enum MangaFormat {
    IMAGE,
    ARCHIVE,
    EPUB,
    PDF,
    UNKNOWN
}
