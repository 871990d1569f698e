package com.example.seriesscan.domain.model;

import com.example.seriesscan.domain.enumtype.ProgressEventType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScanProgressEvent {

    /**
     * File or folder being processed. Empty for start and end events.
     */
    private String path;

    private String libraryName;

    private ProgressEventType eventType;
}
