package com.dcruver.notegraph.parse;

/**
 * A reference found in block content. Each implementation carries only the payload its kind needs.
 */
public interface Reference {

    ReferenceKind getKind();
}
