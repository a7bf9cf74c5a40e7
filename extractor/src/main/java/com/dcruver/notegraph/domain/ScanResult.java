package com.dcruver.notegraph.domain;

import com.dcruver.notegraph.parse.NoteFragment;
import lombok.Value;

import java.util.List;

/**
 * Output of the per-note phase: fragments in relative-path order plus the notes that failed.
 */
@Value
public class ScanResult {
    int notesFound;
    List<NoteFragment> fragments;
    List<SkippedNote> skipped;
}
