package net.readtrack.application.timeline;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

@Component
public class RebuildProgressTracker {

    private final AtomicReference<RebuildProgress> progress = new AtomicReference<>(RebuildProgress.idle());

    public RebuildProgress getProgress() {
        return progress.get();
    }

    void start(Instant startedAt, @Nullable String resumedFrom) {
        RebuildSummary previous = progress.get().lastResult();
        progress.set(new RebuildProgress(true, 0, 0, 0, 0, 0, resumedFrom, startedAt, previous));
    }

    void batchCompleted(long scanned, long updated, long orphaned, long errors, int batches, String lastKey) {
        progress.updateAndGet(current -> new RebuildProgress(
            true, scanned, updated, orphaned, errors, batches, lastKey, current.startedAt(), current.lastResult()
        ));
    }

    void finish(RebuildSummary summary) {
        progress.updateAndGet(current -> new RebuildProgress(
            false,
            summary.scanned(),
            summary.updated(),
            summary.orphaned(),
            summary.errors(),
            summary.batches(),
            current.lastCommittedKey(),
            current.startedAt(),
            summary
        ));
    }
}
