package com.dcruver.notegraph.graph;

import com.dcruver.notegraph.identity.IdentityTable;
import com.dcruver.notegraph.identity.NameNormalizer;
import com.dcruver.notegraph.identity.NamespaceLink;
import com.dcruver.notegraph.identity.PageEntry;
import com.dcruver.notegraph.parse.BlockFragment;
import com.dcruver.notegraph.parse.BlockReference;
import com.dcruver.notegraph.parse.NoteFragment;
import com.dcruver.notegraph.parse.PageReference;
import com.dcruver.notegraph.parse.Property;
import com.dcruver.notegraph.parse.Reference;
import com.dcruver.notegraph.parse.ResourceReference;
import com.dcruver.notegraph.parse.TagReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Consolidates per-note fragments into one graph.
 *
 * Runs single-threaded over fragments in path order with an identity table scoped to the
 * call. Forward references create placeholder pages that later notes promote in place.
 * Block references are resolved last, once every block is known.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GraphAssembler {

    private final NameNormalizer normalizer;
    private final GraphValidator validator;

    /**
     * Build and validate the graph for a set of fragments
     *
     * @throws GraphConsistencyException if the result violates a structural invariant
     */
    public NoteGraph assemble(List<NoteFragment> fragments) {
        Run run = new Run(new IdentityTable(normalizer));

        List<NoteFragment> ordered = new ArrayList<>(fragments);
        ordered.sort(Comparator.comparing(NoteFragment::getRelativePath));

        for (NoteFragment fragment : ordered) {
            run.addNote(fragment);
        }
        run.resolveBlockLinks();
        run.addNamespaces();

        NoteGraph graph = run.snapshot();
        validator.validate(graph);

        log.info("Assembled graph: {} pages ({} placeholders), {} blocks, {} resources, {} relationships",
            graph.getPages().size(), graph.placeholderCount(), graph.getBlocks().size(),
            graph.getResources().size(), graph.getRelationships().size());
        return graph;
    }

    /**
     * Working state of one assembly; discarded when the snapshot is taken
     */
    private static final class Run {
        private final IdentityTable identity;
        private final Set<Relationship> relationships = new LinkedHashSet<>();
        private final Map<UUID, BlockNode> blocks = new LinkedHashMap<>();
        private final Map<String, Integer> rootCounts = new HashMap<>();
        private final List<PendingBlockLink> pendingBlockLinks = new ArrayList<>();

        Run(IdentityTable identity) {
            this.identity = identity;
        }

        void addNote(NoteFragment fragment) {
            PageEntry page = identity.authorPage(fragment.getPageName(), fragment.getRelativePath(),
                fragment.isPagePublic());
            NodeRef pageRef = NodeRef.page(page.getName());

            addProperties(pageRef, fragment.getPageProperties());
            addTags(pageRef, fragment.getPageTags());

            // Merged notes continue the root sibling order of the page
            int rootOffset = rootCounts.getOrDefault(page.getName(), 0);
            int roots = 0;
            Map<Integer, UUID> uuidByOrdinal = new HashMap<>();

            for (BlockFragment block : fragment.getBlocks()) {
                UUID uuid = block.getUuid();
                if (blocks.containsKey(uuid)) {
                    UUID replacement = duplicateId(fragment.getRelativePath(), block.getOrdinal());
                    log.warn("Block id {} in {} is already used; assigning {}", uuid,
                        fragment.getRelativePath(), replacement);
                    uuid = replacement;
                }
                uuidByOrdinal.put(block.getOrdinal(), uuid);

                UUID parent = block.getParentOrdinal() == null ? null : uuidByOrdinal.get(block.getParentOrdinal());
                int position = block.getPosition();
                if (parent == null) {
                    position += rootOffset;
                    roots++;
                }

                blocks.put(uuid, BlockNode.builder()
                    .uuid(uuid)
                    .page(page.getName())
                    .parent(parent)
                    .content(block.getContent())
                    .isHeading(block.isHeading())
                    .directive(block.getDirective())
                    .position(position)
                    .depth(block.getDepth())
                    .build());

                NodeRef blockRef = NodeRef.block(uuid);
                NodeRef holder = parent == null ? pageRef : NodeRef.block(parent);
                relationships.add(Relationship.holds(holder, blockRef, position, block.getDepth()));

                addProperties(blockRef, block.getProperties());
                addTags(blockRef, block.getTags());
                addReferences(blockRef, block.getReferences());
            }

            rootCounts.put(page.getName(), rootOffset + roots);
        }

        void addProperties(NodeRef owner, List<Property> props) {
            for (Property prop : props) {
                identity.referencePage(prop.getKey())
                    .ifPresent(key -> relationships.add(Relationship.hasProperty(owner, key, prop.getValue())));
            }
        }

        void addTags(NodeRef owner, List<String> tags) {
            for (String tag : tags) {
                identity.referencePage(tag)
                    .ifPresent(name -> relationships.add(Relationship.isTagged(owner, name)));
            }
        }

        void addReferences(NodeRef blockRef, List<Reference> references) {
            for (Reference reference : references) {
                switch (reference.getKind()) {
                    case PAGE -> identity.referencePage(((PageReference) reference).getTarget())
                        .ifPresent(name -> relationships.add(Relationship.links(blockRef, name)));
                    case TAG -> identity.referencePage(((TagReference) reference).getTarget())
                        .ifPresent(name -> relationships.add(Relationship.linksAsTag(blockRef, name)));
                    case RESOURCE -> {
                        ResourceReference resource = (ResourceReference) reference;
                        identity.referenceResource(resource.getTarget(), resource.isEmbed())
                            .ifPresent(path -> relationships.add(
                                Relationship.linksToResource(blockRef, path, resource.getLabel())));
                    }
                    case BLOCK -> pendingBlockLinks.add(
                        new PendingBlockLink(blockRef, ((BlockReference) reference).getTarget()));
                }
            }
        }

        void resolveBlockLinks() {
            for (PendingBlockLink link : pendingBlockLinks) {
                if (blocks.containsKey(link.target)) {
                    relationships.add(Relationship.linksToBlock(link.source, NodeRef.block(link.target)));
                } else {
                    log.debug("Dropping reference from {} to unknown block {}", link.source, link.target);
                }
            }
        }

        void addNamespaces() {
            for (NamespaceLink link : identity.getNamespaceLinks()) {
                relationships.add(Relationship.inNamespace(link.getPage(), link.getNamespace()));
            }
        }

        NoteGraph snapshot() {
            List<PageNode> pages = identity.getPages().stream()
                .map(p -> new PageNode(p.getName(), p.isPlaceholder(), p.isPublic()))
                .toList();
            List<ResourceNode> resources = identity.getResources().stream()
                .map(r -> new ResourceNode(r.getPath(), r.isAsset()))
                .toList();
            List<Relationship> sorted = new ArrayList<>(relationships);
            sorted.sort(Comparator.naturalOrder());

            return new NoteGraph(pages, new ArrayList<>(blocks.values()), resources, sorted);
        }

        private static UUID duplicateId(String relativePath, int ordinal) {
            String seed = "duplicate:" + relativePath + "#" + ordinal;
            return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8));
        }
    }

    private static final class PendingBlockLink {
        final NodeRef source;
        final UUID target;

        PendingBlockLink(NodeRef source, UUID target) {
            this.source = source;
            this.target = target;
        }
    }
}
