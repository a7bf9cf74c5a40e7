package com.dcruver.notegraph.parse;

import lombok.Value;

import java.util.UUID;

@Value
public class BlockReference implements Reference {
    UUID target;

    @Override
    public ReferenceKind getKind() {
        return ReferenceKind.BLOCK;
    }
}
