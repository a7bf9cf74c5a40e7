package com.dcruver.notegraph.parse;

import lombok.Value;

@Value
public class TagReference implements Reference {
    String target;

    @Override
    public ReferenceKind getKind() {
        return ReferenceKind.TAG;
    }
}
