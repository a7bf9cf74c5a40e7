package com.dcruver.notegraph.parse;

import lombok.Value;

@Value
public class PageReference implements Reference {
    String target;

    @Override
    public ReferenceKind getKind() {
        return ReferenceKind.PAGE;
    }
}
