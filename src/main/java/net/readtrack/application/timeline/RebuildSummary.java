package net.readtrack.application.timeline;

import jakarta.annotation.Nullable;

/**
 * Outcome of a rebuild or cascade refresh.
 *
 * @param scanned entity keys examined
 * @param updated event rows whose payload changed
 * @param unchanged entity keys whose events already matched current state
 * @param orphaned entity keys whose source entity no longer exists
 * @param pruned event rows deleted under {@link OrphanPolicy#PRUNE}
 * @param errors entity keys that could not be refreshed
 * @param batches committed or rolled-back batches
 * @param resumedFrom checkpoint key the run continued after, if any
 * @param cancelled whether the run stopped before enumerating every key
 * @param durationMs wall-clock duration
 */
public record RebuildSummary(
    long scanned,
    long updated,
    long unchanged,
    long orphaned,
    long pruned,
    long errors,
    int batches,
    @Nullable String resumedFrom,
    boolean cancelled,
    long durationMs
) {
}
