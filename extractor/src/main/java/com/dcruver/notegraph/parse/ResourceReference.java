package com.dcruver.notegraph.parse;

import lombok.Value;

/**
 * Reference to a file or URL. {@code embed} is set for the {@code ![label](path)} form.
 */
@Value
public class ResourceReference implements Reference {
    String target;
    String label;
    boolean embed;

    @Override
    public ReferenceKind getKind() {
        return ReferenceKind.RESOURCE;
    }
}
