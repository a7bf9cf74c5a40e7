package com.dcruver.notegraph.domain;

import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Summary of one extraction run.
 * Counts are zero when the run failed its consistency check.
 */
@Data
@Builder
@With
public class ExtractionReport {
    private final String notesPath;

    private final int notesFound;
    private final int notesSucceeded;
    private final List<SkippedNote> skipped;

    private final boolean consistent;
    private final String consistencyError;

    // Graph size
    private final int pageCount;
    private final int placeholderCount;
    private final int blockCount;
    private final int resourceCount;
    private final Map<String, Integer> relationshipCounts;  // table name -> rows

    private final Instant startedAt;
    private final Instant finishedAt;

    public int getNotesSkipped() {
        return skipped == null ? 0 : skipped.size();
    }

    public int getRelationshipTotal() {
        return relationshipCounts == null ? 0
            : relationshipCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Duration getDuration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }
}
