package com.dcruver.notegraph.parse;

import com.dcruver.notegraph.config.ExtractorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the text of one outline note into an ordered sequence of blocks.
 *
 * A block opens with a {@code -} bullet; its depth comes from the nearest open block with a
 * smaller indentation column, so uneven indentation rounds to the closest sensible parent.
 * Lines before the first bullet form a pre-block at depth 0. Nothing here throws on bad input:
 * malformed lines fall back to plain content.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutlineParser {

    private static final Pattern OPENER = Pattern.compile("^([ \\t]*)-(?:[ \\t]+(.*)|[ \\t]*)$");
    private static final Pattern HEADING = Pattern.compile("^#{1,6}\\s.*");
    private static final Pattern BEGIN_DIRECTIVE = Pattern.compile("^#\\+BEGIN_(\\w+)\\b.*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern END_DIRECTIVE = Pattern.compile("^#\\+END_(\\w+)\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern BRACKET_DIRECTIVE = Pattern.compile("^\\{\\{(\\w+)\\s*(.*?)\\s*\\}\\}$");
    private static final String CODE_FENCE = "```";

    private final ExtractorProperties properties;
    private final PropertyExtractor propertyExtractor;

    /**
     * Parse note text. Each call to {@code iterator()} starts a fresh, lazy pass over the text.
     */
    public Iterable<ParsedBlock> parse(String text) {
        String source = text == null ? "" : text;
        return () -> new BlockIterator(source);
    }

    /**
     * Convenience for callers that want every block at once
     */
    public List<ParsedBlock> parseAll(String text) {
        List<ParsedBlock> blocks = new ArrayList<>();
        parse(text).forEach(blocks::add);
        return blocks;
    }

    int columnOf(String line) {
        int column = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') {
                column++;
            } else if (c == '\t') {
                column += properties.getTabWidth();
            } else {
                break;
            }
        }
        return column;
    }

    /**
     * Remove at most {@code columns} columns of leading whitespace
     */
    String stripIndent(String line, int columns) {
        int column = 0;
        int i = 0;
        while (i < line.length() && column < columns) {
            char c = line.charAt(i);
            if (c == ' ') {
                column++;
            } else if (c == '\t') {
                column += properties.getTabWidth();
            } else {
                break;
            }
            i++;
        }
        return line.substring(i);
    }

    /**
     * Build one block from its (already unindented) lines
     */
    ParsedBlock buildBlock(int ordinal, Integer parentOrdinal, int depth, int position, List<String> rawLines) {
        List<String> lines = new ArrayList<>(rawLines);
        List<Property> props = new ArrayList<>();

        // Properties: leading run at line 0, or at line 1 when line 0 is ordinary text
        int runStart = !lines.isEmpty() && propertyExtractor.isPropertyLine(lines.get(0)) ? 0 : 1;
        if (!lines.isEmpty() && isFence(lines.get(0))) {
            runStart = lines.size();
        }
        int runEnd = runStart;
        while (runEnd < lines.size()) {
            Optional<Property> prop = propertyExtractor.parseLine(lines.get(runEnd));
            if (prop.isEmpty()) {
                break;
            }
            props.add(prop.get());
            runEnd++;
        }
        if (runEnd > runStart) {
            lines.subList(runStart, runEnd).clear();
        }

        String directive = extractDirective(lines, ordinal);

        String firstLine = lines.stream().filter(l -> !l.isBlank()).findFirst().orElse("");
        boolean heading = HEADING.matcher(firstLine).matches() || propertyExtractor.isHeading(props);

        String content = joinTrimmed(lines);
        boolean propertyOnly = !props.isEmpty() && content.isEmpty() && directive == null;

        return ParsedBlock.builder()
            .ordinal(ordinal)
            .parentOrdinal(parentOrdinal)
            .depth(depth)
            .position(position)
            .content(content)
            .directive(directive)
            .heading(heading)
            .properties(List.copyOf(props))
            .propertyOnly(propertyOnly)
            .build();
    }

    /**
     * Detect a leading directive on the first content line, stripping its markers from {@code lines}
     */
    private String extractDirective(List<String> lines, int ordinal) {
        int first = 0;
        while (first < lines.size() && lines.get(first).isBlank()) {
            first++;
        }
        if (first >= lines.size()) {
            return null;
        }

        String line = lines.get(first).strip();

        Matcher begin = BEGIN_DIRECTIVE.matcher(line);
        if (begin.matches()) {
            String token = recognizedDirective(begin.group(1));
            if (token == null) {
                log.debug("Unrecognized directive {} in block {}", begin.group(1), ordinal);
                return null;
            }
            lines.remove(first);
            for (int i = first; i < lines.size(); i++) {
                Matcher end = END_DIRECTIVE.matcher(lines.get(i).strip());
                if (end.matches() && end.group(1).equalsIgnoreCase(token)) {
                    lines.remove(i);
                    return token;
                }
            }
            log.warn("Unclosed #+BEGIN_{} directive in block {}", token, ordinal);
            return token;
        }

        Matcher bracket = BRACKET_DIRECTIVE.matcher(line);
        if (bracket.matches()) {
            String token = recognizedDirective(bracket.group(1));
            if (token != null) {
                String args = bracket.group(2);
                if (args.isBlank()) {
                    lines.remove(first);
                } else {
                    lines.set(first, args);
                }
                return token;
            }
            return null;
        }

        for (String marker : properties.getMarkerTokens()) {
            if (line.equals(marker)) {
                lines.remove(first);
                return marker;
            }
            if (line.startsWith(marker + " ")) {
                lines.set(first, line.substring(marker.length() + 1).strip());
                return marker;
            }
        }

        return null;
    }

    private String recognizedDirective(String token) {
        String upper = token.toUpperCase(Locale.ROOT);
        return properties.getDirectiveTokens().stream()
            .map(t -> t.toUpperCase(Locale.ROOT))
            .filter(upper::equals)
            .findFirst()
            .orElse(null);
    }

    private static String joinTrimmed(List<String> lines) {
        int start = 0;
        int end = lines.size();
        while (start < end && lines.get(start).isBlank()) {
            start++;
        }
        while (end > start && lines.get(end - 1).isBlank()) {
            end--;
        }
        return String.join("\n", lines.subList(start, end));
    }

    private static boolean isFence(String line) {
        return line.strip().startsWith(CODE_FENCE);
    }

    /**
     * Open ancestor on the indentation stack
     */
    private static final class OpenBlock {
        final int column;
        final int depth;
        final int ordinal;
        int children;

        OpenBlock(int column, int depth, int ordinal) {
            this.column = column;
            this.depth = depth;
            this.ordinal = ordinal;
        }
    }

    /**
     * Lazy single pass over the lines of one note
     */
    private final class BlockIterator implements Iterator<ParsedBlock> {
        private final Iterator<String> lines;
        private final Deque<OpenBlock> stack = new ArrayDeque<>();
        private String pending;
        private ParsedBlock next;
        private int ordinal;
        private int roots;

        BlockIterator(String text) {
            this.lines = text.lines().iterator();
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = readBlock();
            }
            return next != null;
        }

        @Override
        public ParsedBlock next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ParsedBlock block = next;
            next = null;
            return block;
        }

        private String nextLine() {
            if (pending != null) {
                String line = pending;
                pending = null;
                return line;
            }
            return lines.hasNext() ? lines.next() : null;
        }

        private ParsedBlock readBlock() {
            String first = nextLine();
            while (first != null && first.isBlank()) {
                first = nextLine();
            }
            if (first == null) {
                return null;
            }

            List<String> blockLines = new ArrayList<>();
            int column;
            int depth;
            int position;
            Integer parentOrdinal;
            int contentIndent;

            Matcher opener = OPENER.matcher(first);
            if (opener.matches()) {
                column = columnOf(opener.group(1));
                while (!stack.isEmpty() && stack.peek().column >= column) {
                    stack.pop();
                }
                OpenBlock parent = stack.peek();
                if (parent == null) {
                    depth = 0;
                    position = roots++;
                    parentOrdinal = null;
                } else {
                    depth = parent.depth + 1;
                    position = parent.children++;
                    parentOrdinal = parent.ordinal;
                }
                blockLines.add(opener.group(2) == null ? "" : opener.group(2));
                contentIndent = column + 2;
            } else {
                // Text ahead of any bullet: the pre-block
                if (ordinal > 0) {
                    log.debug("Unattached line treated as root content: {}", first);
                }
                stack.clear();
                column = 0;
                depth = 0;
                position = roots++;
                parentOrdinal = null;
                blockLines.add(first.strip());
                contentIndent = columnOf(first);
            }

            int blockOrdinal = ordinal++;
            stack.push(new OpenBlock(column, depth, blockOrdinal));

            boolean inFence = isFence(blockLines.get(0));
            String line;
            while ((line = nextLine()) != null) {
                Matcher nextOpener = OPENER.matcher(line);
                if (nextOpener.matches()) {
                    boolean nestedInFence = inFence && columnOf(nextOpener.group(1)) > column;
                    if (!nestedInFence) {
                        pending = line;
                        break;
                    }
                }
                String content = stripIndent(line, contentIndent);
                if (isFence(content)) {
                    inFence = !inFence;
                }
                blockLines.add(content);
            }

            if (inFence) {
                log.warn("Unclosed code fence in block {}; ending it at the next bullet", blockOrdinal);
            }

            return buildBlock(blockOrdinal, parentOrdinal, depth, position, blockLines);
        }
    }
}
