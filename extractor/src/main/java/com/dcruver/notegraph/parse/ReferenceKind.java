package com.dcruver.notegraph.parse;

/**
 * The closed set of reference forms found in block content.
 */
public enum ReferenceKind {
    /** {@code [[Page]]} */
    PAGE,

    /** {@code #tag} or {@code #[[tag]]} */
    TAG,

    /** {@code ((uuid))} */
    BLOCK,

    /** A file, asset or URL, optionally with a display label */
    RESOURCE
}
