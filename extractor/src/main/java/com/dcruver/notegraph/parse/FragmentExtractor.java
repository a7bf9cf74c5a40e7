package com.dcruver.notegraph.parse;

import com.dcruver.notegraph.config.ExtractorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs the per-note pipeline: outline parsing, then property, tag and link extraction.
 * Stateless and safe to call from several worker threads at once.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FragmentExtractor {

    private final ExtractorProperties properties;
    private final OutlineParser outlineParser;
    private final PropertyExtractor propertyExtractor;
    private final LinkExtractor linkExtractor;

    public NoteFragment extract(String relativePath, String pageName, String text) {
        List<BlockFragment> blocks = new ArrayList<>();
        List<Property> pageProperties = List.of();

        for (ParsedBlock parsed : outlineParser.parse(text)) {
            Optional<UUID> explicitId = explicitId(parsed, relativePath);
            List<Property> blockProperties = withoutId(parsed.getProperties());
            List<Reference> references = referencesOf(parsed.getContent(), blockProperties);

            // First root block made only of properties is the page's properties section
            boolean pageSection = parsed.getOrdinal() == 0 && parsed.isPropertyOnly();
            if (pageSection) {
                pageProperties = blockProperties;
                blockProperties = List.of();
            }

            BlockFragment block = BlockFragment.builder()
                .uuid(explicitId.orElseGet(() -> generatedId(relativePath, parsed.getOrdinal())))
                .explicitId(explicitId.isPresent())
                .ordinal(parsed.getOrdinal())
                .parentOrdinal(parsed.getParentOrdinal())
                .depth(parsed.getDepth())
                .position(parsed.getPosition())
                .content(parsed.getContent())
                .directive(parsed.getDirective())
                .heading(parsed.isHeading())
                .properties(blockProperties)
                .tags(propertyExtractor.tagsOf(blockProperties))
                .references(references)
                .build();

            log.debug("Block {} of {} at depth {}: {} references", block.getOrdinal(), relativePath,
                block.getDepth(), block.getReferences().size());
            blocks.add(block);
        }

        return NoteFragment.builder()
            .relativePath(relativePath)
            .pageName(pageName)
            .pageProperties(pageProperties)
            .pageTags(propertyExtractor.tagsOf(pageProperties))
            .pagePublic(propertyExtractor.isPublic(pageProperties))
            .blocks(List.copyOf(blocks))
            .build();
    }

    /**
     * Stable identifier for a block without an id:: property, so repeated runs agree
     */
    public static UUID generatedId(String relativePath, int ordinal) {
        String seed = "block:" + relativePath + "#" + ordinal;
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8));
    }

    private Optional<UUID> explicitId(ParsedBlock parsed, String relativePath) {
        Optional<String> raw = propertyExtractor.valueOf(parsed.getProperties(), properties.getIdKey());
        if (raw.isEmpty()) {
            return Optional.empty();
        }

        try {
            return Optional.of(UUID.fromString(raw.get().strip()));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed block id '{}' in {} (block {})", raw.get(), relativePath, parsed.getOrdinal());
            return Optional.empty();
        }
    }

    /**
     * Links in the block text followed by links written inside property values.
     * Tag values are left out since they already become tags.
     */
    private List<Reference> referencesOf(String content, List<Property> props) {
        List<Reference> references = new ArrayList<>(linkExtractor.extract(content));
        for (Property prop : props) {
            if (!prop.getKey().equals(properties.getTagsKey())) {
                references.addAll(linkExtractor.extract(prop.getValue()));
            }
        }
        return List.copyOf(references);
    }

    private List<Property> withoutId(List<Property> props) {
        return props.stream()
            .filter(prop -> !prop.getKey().equals(properties.getIdKey()))
            .toList();
    }
}
