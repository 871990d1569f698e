package com.example.seriesscan;

import com.example.seriesscan.common.config.AppLibraryProperties;
import com.example.seriesscan.common.config.AppScanProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({
        AppScanProperties.class,
        AppLibraryProperties.class
})
public class LibrarySeriesScannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LibrarySeriesScannerApplication.class, args);
    }
}
