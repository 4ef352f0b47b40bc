package net.readtrack.application.timeline;

import jakarta.annotation.Nullable;
import java.time.Instant;

public record RebuildProgress(
    boolean running,
    long scanned,
    long updated,
    long orphaned,
    long errors,
    int batches,
    @Nullable String lastCommittedKey,
    @Nullable Instant startedAt,
    @Nullable RebuildSummary lastResult
) {
    static RebuildProgress idle() {
        return new RebuildProgress(false, 0, 0, 0, 0, 0, null, null, null);
    }
}
