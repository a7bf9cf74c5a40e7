package com.dcruver.notegraph.identity;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical page record in an identity table. Mutable only while the run is consolidating.
 */
@Data
public class PageEntry {
    private final String name;
    private boolean placeholder = true;
    private boolean isPublic;

    // Relative paths of the notes that authored this page
    private final List<String> sources = new ArrayList<>();
}
