package com.dcruver.notegraph.io;

import lombok.Value;

/**
 * Raw text of one note plus the names it is known by.
 */
@Value
public class NoteSource {
    String relativePath;  // '/'-separated, relative to the collection root
    String pageName;      // raw spelling; normalized later
    String text;
}
