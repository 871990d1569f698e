package com.example.seriesscan.domain.enumtype;

public enum ProgressEventType {
    STARTED,
    UPDATED,
    ENDED
}
