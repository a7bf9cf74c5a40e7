package com.dcruver.notegraph.parse;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One block as it comes out of the outline parser, before references are resolved.
 * Parent links use the ordinal of the parent within the same note.
 */
@Value
@Builder
public class ParsedBlock {
    int ordinal;
    Integer parentOrdinal;  // null for roots
    int depth;
    int position;

    String content;
    String directive;  // null when absent
    boolean heading;
    List<Property> properties;

    // Every non-blank line was a property line
    boolean propertyOnly;

    public boolean isRoot() {
        return parentOrdinal == null;
    }
}
