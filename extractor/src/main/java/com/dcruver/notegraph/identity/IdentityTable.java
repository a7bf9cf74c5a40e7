package com.dcruver.notegraph.identity;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * The canonical page and resource tables for one extraction run.
 *
 * Entries are addressed by normalized key, never by object reference, so a placeholder that
 * is later authored is updated in place and every relationship already pointing at the key
 * stays valid. Page names and resource paths live in separate tables and are never merged.
 * One instance per run; not thread-safe.
 */
@Slf4j
@RequiredArgsConstructor
public class IdentityTable {

    private final NameNormalizer normalizer;

    private final Map<String, PageEntry> pages = new TreeMap<>();
    private final Map<String, ResourceEntry> resources = new TreeMap<>();
    private final List<NamespaceLink> namespaceLinks = new ArrayList<>();

    /**
     * Register a reference to a page, creating a placeholder if the name is new.
     *
     * @return the canonical name, or empty when the raw name normalizes to nothing
     */
    public Optional<String> referencePage(String rawName) {
        String name = normalizer.normalizePageName(rawName);
        if (name.isEmpty()) {
            log.debug("Dropping reference to unnameable page '{}'", rawName);
            return Optional.empty();
        }

        materialize(name);
        return Optional.of(name);
    }

    /**
     * Register a page authored by a note. A placeholder under the same name is promoted in place;
     * a page already authored by another note absorbs this one.
     */
    public PageEntry authorPage(String rawName, String source, boolean isPublic) {
        String name = normalizer.normalizePageName(rawName);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Note " + source + " maps to an empty page name");
        }

        boolean known = pages.containsKey(name);
        PageEntry entry = materialize(name);
        if (entry.isPlaceholder()) {
            if (known) {
                log.debug("Promoting placeholder page '{}' authored by {}", name, source);
            }
            entry.setPlaceholder(false);
        } else {
            log.warn("Notes {} and {} both map to page '{}'; merging them", entry.getSources(), source, name);
        }

        entry.getSources().add(source);
        entry.setPublic(entry.isPublic() || isPublic);
        return entry;
    }

    /**
     * Register a reference to a file or URL
     *
     * @return the canonical path, or empty when nothing remains after normalization
     */
    public Optional<String> referenceResource(String rawPath, boolean embed) {
        String path = normalizer.normalizeResourcePath(rawPath);
        if (path.isEmpty()) {
            log.debug("Dropping reference to empty resource path '{}'", rawPath);
            return Optional.empty();
        }

        ResourceEntry entry = resources.get(path);
        if (entry == null) {
            entry = new ResourceEntry(path);
            resources.put(path, entry);
        }
        entry.setAsset(entry.isAsset() || normalizer.isAssetPath(path, embed));
        return Optional.of(path);
    }

    public Optional<PageEntry> page(String name) {
        return Optional.ofNullable(pages.get(normalizer.normalizePageName(name)));
    }

    public Collection<PageEntry> getPages() {
        return Collections.unmodifiableCollection(pages.values());
    }

    public Collection<ResourceEntry> getResources() {
        return Collections.unmodifiableCollection(resources.values());
    }

    public List<NamespaceLink> getNamespaceLinks() {
        return Collections.unmodifiableList(namespaceLinks);
    }

    private PageEntry materialize(String name) {
        PageEntry entry = pages.get(name);
        if (entry != null) {
            return entry;
        }

        entry = new PageEntry(name);
        pages.put(name, entry);
        log.debug("Materialized page '{}'", name);

        // Every ancestor segment is a page of its own
        for (String ancestor : normalizer.ancestorsOf(name)) {
            materialize(ancestor);
            namespaceLinks.add(new NamespaceLink(name, ancestor));
        }
        return entry;
    }
}
