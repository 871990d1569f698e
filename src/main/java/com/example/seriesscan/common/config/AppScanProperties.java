package com.example.seriesscan.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.scan")
public class AppScanProperties {

    /**
     * Worker count for parallel file processing. Zero or negative means available processors.
     */
    private int parallelism = 0;

    /**
     * Name of the optional per-folder file holding ignore globs, one per line.
     */
    private String ignoreFileName = ".libraryignore";

    private int progressLogIntervalSec = 30;

    /**
     * Warn in logs when a folder batch holds more files than this threshold. Set to 0 to disable.
     */
    private int largeFolderWarnThreshold = 500;

    private boolean scheduledEnabled = false;

    private String cron = "0 0 3 * * ?";

    public int effectiveParallelism() {
        if (parallelism > 0) {
            return parallelism;
        }
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }
}
