package com.dcruver.notegraph.identity;

import com.dcruver.notegraph.config.ExtractorProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Canonical forms for page names and resource paths.
 *
 * Page names are case-insensitive and whitespace-insensitive, so distinct spellings of one
 * name collapse into a single page. Resource paths keep their case.
 */
@Component
@RequiredArgsConstructor
public class NameNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern URI = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*:.+");
    private static final Pattern WINDOWS_DRIVE = Pattern.compile("^[A-Za-z]:[\\\\/].*");

    private final ExtractorProperties properties;

    /**
     * Normalize a page name; returns an empty string when nothing nameable remains
     */
    public String normalizePageName(String raw) {
        if (raw == null) {
            return "";
        }

        String separator = properties.getNamespaceSeparator();
        List<String> segments = new ArrayList<>();
        for (String segment : raw.split(Pattern.quote(separator), -1)) {
            String cleaned = WHITESPACE.matcher(segment.strip()).replaceAll(" ").toLowerCase(Locale.ROOT);
            if (!cleaned.isEmpty()) {
                segments.add(cleaned);
            }
        }
        return String.join(separator, segments);
    }

    /**
     * Namespace ancestors of a normalized name, nearest first: {@code a/b/c} gives {@code a/b, a}
     */
    public List<String> ancestorsOf(String normalizedName) {
        List<String> ancestors = new ArrayList<>();
        String separator = properties.getNamespaceSeparator();
        int cut = normalizedName.lastIndexOf(separator);
        while (cut > 0) {
            String ancestor = normalizedName.substring(0, cut);
            ancestors.add(ancestor);
            cut = ancestor.lastIndexOf(separator);
        }
        return ancestors;
    }

    /**
     * Normalize a resource path. URIs are only trimmed; file paths get their
     * separators standardized and {@code .}/{@code ..} segments folded.
     */
    public String normalizeResourcePath(String raw) {
        if (raw == null) {
            return "";
        }

        String path = raw.strip();
        if (URI.matcher(path).matches() && !WINDOWS_DRIVE.matcher(path).matches()) {
            return path;
        }

        path = path.replace('\\', '/');
        boolean absolute = path.startsWith("/");

        Deque<String> kept = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..") && !kept.isEmpty() && !kept.peekLast().equals("..")) {
                kept.removeLast();
            } else if (segment.equals("..") && absolute) {
                // Cannot climb above the root
                continue;
            } else {
                kept.addLast(segment);
            }
        }

        String joined = String.join("/", kept);
        return absolute ? "/" + joined : joined;
    }

    /**
     * True for binary or media files: embeds, known asset extensions, or anything under the assets directory
     */
    public boolean isAssetPath(String normalizedPath, boolean embed) {
        if (embed) {
            return true;
        }

        String path = normalizedPath;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }

        for (String segment : path.split("/")) {
            if (segment.equals(properties.getAssetsDirectory())) {
                return true;
            }
        }

        int dot = path.lastIndexOf('.');
        if (dot < 0 || dot < path.lastIndexOf('/')) {
            return false;
        }
        String extension = path.substring(dot + 1).toLowerCase(Locale.ROOT);
        return properties.getAssetExtensions().stream().anyMatch(extension::equalsIgnoreCase);
    }
}
