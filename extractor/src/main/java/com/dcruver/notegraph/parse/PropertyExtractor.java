package com.dcruver.notegraph.parse;

import com.dcruver.notegraph.config.ExtractorProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls {@code key:: value} properties and tag lists out of block and page text.
 */
@Component
@RequiredArgsConstructor
public class PropertyExtractor {

    private static final Pattern PROPERTY_LINE = Pattern.compile("^([A-Za-z0-9_][\\w\\-.?/]*)::(?:[ \\t]+(.*))?$");

    private final ExtractorProperties properties;

    /**
     * Parse a single line as a property, ignoring leading indentation
     */
    public Optional<Property> parseLine(String line) {
        if (line == null) {
            return Optional.empty();
        }

        Matcher matcher = PROPERTY_LINE.matcher(line.strip());
        if (!matcher.matches()) {
            return Optional.empty();
        }

        String rawKey = matcher.group(1);
        String value = matcher.group(2) == null ? "" : matcher.group(2).strip();
        return Optional.of(new Property(rawKey.strip().toLowerCase(Locale.ROOT), rawKey, value));
    }

    public boolean isPropertyLine(String line) {
        return parseLine(line).isPresent();
    }

    /**
     * Split a list-valued property on commas that sit outside {@code [[...]]},
     * unwrapping page-link brackets and tag hashes from each item.
     */
    public List<String> splitValues(String value) {
        List<String> items = new ArrayList<>();
        if (value == null || value.isBlank()) {
            return items;
        }

        StringBuilder current = new StringBuilder();
        int bracketDepth = 0;
        for (int i = 0; i < value.length(); i++) {
            if (value.startsWith("[[", i)) {
                bracketDepth++;
                current.append("[[");
                i++;
            } else if (value.startsWith("]]", i) && bracketDepth > 0) {
                bracketDepth--;
                current.append("]]");
                i++;
            } else if (value.charAt(i) == ',' && bracketDepth == 0) {
                addItem(items, current.toString());
                current.setLength(0);
            } else {
                current.append(value.charAt(i));
            }
        }
        addItem(items, current.toString());

        return items;
    }

    /**
     * Tag names declared through the reserved tags property, in declaration order
     */
    public List<String> tagsOf(List<Property> props) {
        List<String> tags = new ArrayList<>();
        for (Property prop : props) {
            if (prop.getKey().equals(properties.getTagsKey())) {
                tags.addAll(splitValues(prop.getValue()));
            }
        }
        return tags;
    }

    public boolean isPublic(List<Property> props) {
        return hasTrueValue(props, properties.getPublicKey());
    }

    public boolean isHeading(List<Property> props) {
        return hasTrueValue(props, properties.getHeadingKey());
    }

    public Optional<String> valueOf(List<Property> props, String key) {
        return props.stream()
            .filter(prop -> prop.getKey().equals(key))
            .map(Property::getValue)
            .findFirst();
    }

    private boolean hasTrueValue(List<Property> props, String key) {
        return props.stream()
            .anyMatch(prop -> prop.getKey().equals(key) && properties.isTrue(prop.getValue()));
    }

    private void addItem(List<String> items, String raw) {
        String item = raw.strip();
        if (item.startsWith("#")) {
            item = item.substring(1);
        }
        if (item.startsWith("[[") && item.endsWith("]]") && item.length() >= 4) {
            item = item.substring(2, item.length() - 2);
        }
        item = item.strip();
        if (!item.isEmpty()) {
            items.add(item);
        }
    }
}
