package com.dcruver.notegraph.parse;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds page links, tags, block references and resource references in block content.
 *
 * Every candidate match is collected first, then spans are claimed left to right with the
 * longest candidate winning at a given start, so no stretch of text yields two references.
 * Fenced code and inline code spans are never scanned.
 */
@Component
@Slf4j
public class LinkExtractor {

    private static final String CODE_FENCE = "```";
    private static final String UUID_TEXT = "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}";

    private static final Pattern MARKDOWN_LINK = Pattern.compile(
        "(!?)\\[([^\\[\\]]*)\\]\\((\\(\\(" + UUID_TEXT + "\\)\\)|\\[\\[[^\\[\\]]+\\]\\]|[^()\\s]+)\\)");
    private static final Pattern BLOCK_REF = Pattern.compile("\\(\\((" + UUID_TEXT + ")\\)\\)");
    private static final Pattern TAG = Pattern.compile("(?:^|(?<=[\\s(,]))#(?!\\+)([^\\s#,;!?()\\[\\]{}\"'`]+)");
    private static final Pattern BARE_PATH = Pattern.compile("(?:^|(?<=[\\s(]))(\\.{1,2}/[^\\s()\\[\\]<>\"'`]+)");
    private static final Pattern URI_SCHEME = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*://.*|^file:.*");

    // Tie-breakers when two candidates share a start and length
    private static final int PRIORITY_MARKDOWN = 0;
    private static final int PRIORITY_BRACKET = 1;
    private static final int PRIORITY_BLOCK = 2;
    private static final int PRIORITY_PATH = 3;
    private static final int PRIORITY_TAG = 4;

    /**
     * Extract all references from a block's content, in text order
     */
    public List<Reference> extract(String content) {
        List<Reference> references = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return references;
        }

        boolean inFence = false;
        for (String line : content.split("\n", -1)) {
            if (line.strip().startsWith(CODE_FENCE)) {
                inFence = !inFence;
                continue;
            }
            if (!inFence) {
                references.addAll(extractLine(line));
            }
        }

        return references;
    }

    /**
     * True for targets that name a file or URL rather than a page
     */
    public static boolean isPathLike(String target) {
        String t = target.strip();
        return t.startsWith("./")
            || t.startsWith("../")
            || t.startsWith("/")
            || t.startsWith("~/")
            || URI_SCHEME.matcher(t).matches();
    }

    static boolean hasFileExtension(String target) {
        String name = target.substring(target.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 && dot < name.length() - 1;
    }

    private List<Reference> extractLine(String line) {
        String text = maskInlineCode(line);
        List<Candidate> candidates = new ArrayList<>();

        collectMarkdownLinks(text, candidates);
        collectBracketLinks(text, candidates);
        collectBlockRefs(text, candidates);
        collectBarePaths(text, candidates);
        collectTags(text, candidates);

        candidates.sort(Comparator
            .comparingInt(Candidate::getStart)
            .thenComparing(Comparator.comparingInt(Candidate::length).reversed())
            .thenComparingInt(Candidate::getPriority));

        List<Reference> claimed = new ArrayList<>();
        int claimedTo = 0;
        for (Candidate candidate : candidates) {
            if (candidate.getStart() >= claimedTo) {
                claimed.add(candidate.getReference());
                claimedTo = candidate.getEnd();
            }
        }

        return claimed;
    }

    private void collectMarkdownLinks(String text, List<Candidate> candidates) {
        Matcher matcher = MARKDOWN_LINK.matcher(text);
        while (matcher.find()) {
            boolean embed = !matcher.group(1).isEmpty();
            String label = matcher.group(2).strip();
            String target = matcher.group(3);
            Reference reference;

            if (target.startsWith("((")) {
                reference = new BlockReference(UUID.fromString(target.substring(2, target.length() - 2)));
            } else if (target.startsWith("[[")) {
                String page = target.substring(2, target.length() - 2).strip();
                if (page.isEmpty()) {
                    continue;
                }
                reference = isPathLike(page)
                    ? new ResourceReference(page, label.isEmpty() ? page : label, embed)
                    : new PageReference(page);
            } else if (isPathLike(target) || hasFileExtension(target)) {
                reference = new ResourceReference(target, label.isEmpty() ? target : label, embed);
            } else {
                log.debug("Ignoring markdown link to bare name: {}", target);
                continue;
            }

            candidates.add(new Candidate(matcher.start(), matcher.end(), PRIORITY_MARKDOWN, reference));
        }
    }

    /**
     * Double-bracket links, with nesting balanced so the outermost pair claims the span
     */
    private void collectBracketLinks(String text, List<Candidate> candidates) {
        int from = 0;
        while ((from = text.indexOf("[[", from)) >= 0) {
            int close = findClosing(text, from);
            if (close < 0) {
                log.debug("Unclosed page link in: {}", text);
                from += 2;
                continue;
            }

            String inner = text.substring(from + 2, close);
            String target = inner.replace("[[", "").replace("]]", "").strip();
            int end = close + 2;

            if (!target.isEmpty()) {
                boolean asTag = from > 0 && text.charAt(from - 1) == '#'
                    && (from == 1 || isTagBoundary(text.charAt(from - 2)));
                if (asTag) {
                    candidates.add(new Candidate(from - 1, end, PRIORITY_BRACKET, new TagReference(target)));
                } else if (isPathLike(target)) {
                    candidates.add(new Candidate(from, end, PRIORITY_BRACKET, new ResourceReference(target, target, false)));
                } else {
                    candidates.add(new Candidate(from, end, PRIORITY_BRACKET, new PageReference(target)));
                }
            }

            from += 2;
        }
    }

    private void collectBlockRefs(String text, List<Candidate> candidates) {
        Matcher matcher = BLOCK_REF.matcher(text);
        while (matcher.find()) {
            UUID target = UUID.fromString(matcher.group(1));
            candidates.add(new Candidate(matcher.start(), matcher.end(), PRIORITY_BLOCK, new BlockReference(target)));
        }
    }

    private void collectBarePaths(String text, List<Candidate> candidates) {
        Matcher matcher = BARE_PATH.matcher(text);
        while (matcher.find()) {
            String path = trimTrailingPunctuation(matcher.group(1));
            if (path.length() <= 3) {
                continue;
            }
            int end = matcher.start(1) + path.length();
            candidates.add(new Candidate(matcher.start(1), end, PRIORITY_PATH, new ResourceReference(path, path, false)));
        }
    }

    private void collectTags(String text, List<Candidate> candidates) {
        Matcher matcher = TAG.matcher(text);
        while (matcher.find()) {
            String tag = trimTrailingPunctuation(matcher.group(1));
            if (tag.isEmpty()) {
                continue;
            }
            int start = matcher.start(1) - 1;
            int end = matcher.start(1) + tag.length();
            candidates.add(new Candidate(start, end, PRIORITY_TAG, new TagReference(tag)));
        }
    }

    private int findClosing(String text, int open) {
        int depth = 0;
        int i = open;
        while (i < text.length() - 1) {
            if (text.startsWith("[[", i)) {
                depth++;
                i += 2;
            } else if (text.startsWith("]]", i)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
                i += 2;
            } else {
                i++;
            }
        }
        return -1;
    }

    private static boolean isTagBoundary(char c) {
        return Character.isWhitespace(c) || c == '(' || c == ',';
    }

    private static String trimTrailingPunctuation(String token) {
        int end = token.length();
        while (end > 0 && ".:,;".indexOf(token.charAt(end - 1)) >= 0) {
            end--;
        }
        return token.substring(0, end);
    }

    /**
     * Blank out inline code spans, keeping offsets stable
     */
    static String maskInlineCode(String line) {
        int open = line.indexOf('`');
        if (open < 0) {
            return line;
        }

        StringBuilder masked = new StringBuilder(line);
        while (open >= 0) {
            int close = line.indexOf('`', open + 1);
            if (close < 0) {
                break;
            }
            for (int i = open; i <= close; i++) {
                masked.setCharAt(i, ' ');
            }
            open = line.indexOf('`', close + 1);
        }
        return masked.toString();
    }

    @Value
    private static class Candidate {
        int start;
        int end;
        int priority;
        Reference reference;

        int length() {
            return end - start;
        }
    }
}
