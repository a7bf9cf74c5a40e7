package com.dcruver.notegraph.parse;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * A block with its properties, tags and references extracted, still local to one note.
 */
@Value
@Builder
public class BlockFragment {
    UUID uuid;
    boolean explicitId;  // came from an id:: property

    int ordinal;
    Integer parentOrdinal;
    int depth;
    int position;

    String content;
    String directive;
    boolean heading;

    List<Property> properties;
    List<String> tags;
    List<Reference> references;
}
