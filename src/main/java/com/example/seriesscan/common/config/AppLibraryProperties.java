package com.example.seriesscan.common.config;

import com.example.seriesscan.domain.enumtype.LibraryType;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app")
public class AppLibraryProperties {

    private List<Library> libraries = new ArrayList<>();

    @Data
    public static class Library {

        private String name;

        private LibraryType type = LibraryType.MANGA;

        private List<String> folders = new ArrayList<>();
    }
}
