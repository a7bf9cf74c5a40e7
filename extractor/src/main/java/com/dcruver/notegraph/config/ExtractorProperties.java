package com.dcruver.notegraph.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain configuration values consumed by the extractor.
 * Defaults match a stock Logseq graph so the class works without Spring.
 */
@ConfigurationProperties(prefix = "notegraph")
@Data
public class ExtractorProperties {

    /** Root of the note collection */
    private String notesPath = "./notes";

    private List<String> noteExtensions = new ArrayList<>(List.of(".md"));

    /** Leading directories that do not contribute to page names */
    private List<String> rootDirectories = new ArrayList<>(List.of("pages", "journals"));

    /** Markers inside file names that stand for the namespace separator */
    private List<String> fileNamespaceMarkers = new ArrayList<>(List.of("___", "%2F"));

    private String namespaceSeparator = "/";

    private int tabWidth = 2;

    private List<String> directiveTokens = new ArrayList<>(List.of(
        "QUOTE", "NOTE", "TIP", "IMPORTANT", "CAUTION", "WARNING", "PINNED",
        "CENTER", "EXAMPLE", "COMMENT", "SRC", "EXPORT", "VERSE", "QUERY"
    ));

    // Task markers, matched case-sensitively
    private List<String> markerTokens = new ArrayList<>(List.of(
        "TODO", "DOING", "DONE", "LATER", "NOW", "WAITING", "CANCELED"
    ));

    // Reserved property keys
    private String publicKey = "public";
    private String headingKey = "heading";
    private String tagsKey = "tags";
    private String idKey = "id";

    private List<String> trueValues = new ArrayList<>(List.of("true", "1", "yes", "on", "enabled"));

    private List<String> assetExtensions = new ArrayList<>(List.of(
        "png", "jpg", "jpeg", "gif", "svg", "webp", "bmp", "ico",
        "pdf", "mp3", "mp4", "m4a", "wav", "ogg", "webm", "mov", "zip"
    ));

    private String assetsDirectory = "assets";

    /** Worker threads for per-note extraction; zero or less means one per core */
    private int parallelism = 0;

    private String outputDir = "./graph-out";

    public int effectiveParallelism() {
        return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
    }

    public boolean isTrue(String value) {
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        return trueValues.stream().anyMatch(v -> v.equalsIgnoreCase(trimmed));
    }
}
