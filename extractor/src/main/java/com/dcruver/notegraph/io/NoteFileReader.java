package com.dcruver.notegraph.io;

import com.dcruver.notegraph.config.ExtractorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads note files and maps their location in the collection to a page name.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NoteFileReader {

    private final ExtractorProperties properties;

    /**
     * Read one note file as UTF-8
     */
    public NoteSource read(Path root, Path file) throws IOException {
        String relativePath = relativePath(root, file);
        String text = Files.readString(file, StandardCharsets.UTF_8);
        return new NoteSource(relativePath, pageNameFor(relativePath), text);
    }

    public boolean isNote(Path file) {
        String fileName = file.getFileName().toString();
        return properties.getNoteExtensions().stream().anyMatch(fileName::endsWith);
    }

    public String relativePath(Path root, Path file) {
        List<String> parts = new ArrayList<>();
        for (Path part : root.relativize(file)) {
            parts.add(part.toString());
        }
        return String.join("/", parts);
    }

    /**
     * Page name for a note: directories become namespace segments, a leading root directory
     * such as {@code pages/} is dropped, and in-name markers like {@code ___} become separators.
     * {@code projects/alpha.md} maps to {@code projects/alpha}.
     */
    public String pageNameFor(String relativePath) {
        String separator = properties.getNamespaceSeparator();
        List<String> segments = new ArrayList<>(List.of(relativePath.split("/")));

        if (segments.size() > 1 && properties.getRootDirectories().contains(segments.get(0))) {
            segments.remove(0);
        }

        int last = segments.size() - 1;
        segments.set(last, stripExtension(segments.get(last)));

        List<String> named = new ArrayList<>();
        for (String segment : segments) {
            String name = segment;
            for (String marker : properties.getFileNamespaceMarkers()) {
                name = name.replace(marker, separator);
            }
            named.add(name);
        }
        return String.join(separator, named);
    }

    private String stripExtension(String fileName) {
        for (String extension : properties.getNoteExtensions()) {
            if (fileName.endsWith(extension)) {
                return fileName.substring(0, fileName.length() - extension.length());
            }
        }
        return fileName;
    }
}
