package net.readtrack.application.timeline;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.Nullable;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import net.readtrack.adapters.persistence.RebuildCheckpointRepository;
import net.readtrack.adapters.persistence.TimelineEventRepository;
import net.readtrack.domain.timeline.EntityKey;
import net.readtrack.domain.timeline.EntitySnapshotReader;
import net.readtrack.domain.timeline.TimelinePayload;
import net.readtrack.domain.timeline.snapshot.TimelineSnapshot;
import net.readtrack.exception.RebuildAlreadyRunningException;
import net.readtrack.exception.RetryInterruptedException;
import net.readtrack.support.retry.TransientStorageRetrySupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Rewrites stored timeline payloads from the current state of their source entities.
 *
 * <p>A full rebuild walks every distinct entity key that has events, in bounded batches. Each
 * batch reads each entity once, rewrites all of its events and advances the checkpoint in one
 * transaction, so a crash loses at most the batch in flight and a later run with
 * {@code resume=true} continues after the last committed key. Identity columns are never
 * touched. Only one full rebuild runs at a time; each run owns its cancellation flag, so a
 * cancel request reaches exactly the run that was active when it was made.</p>
 */
@Service
public class TimelineRebuildService {

    private static final Logger log = LoggerFactory.getLogger(TimelineRebuildService.class);

    static final String FULL_REBUILD_JOB = "timeline-full-rebuild";

    private final TimelineEventRepository timelineEventRepository;
    private final EntitySnapshotReader entitySnapshotReader;
    private final RebuildCheckpointRepository checkpointRepository;
    private final RebuildProgressTracker progressTracker;
    private final RebuildSettings settings;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final TransientStorageRetrySupport.RetryConfig retryConfig;

    private final Counter entitiesUpdated;
    private final Counter entitiesOrphaned;
    private final Counter entitiesFailed;
    private final Counter batchesRolledBack;

    // cancellation flag of the active full rebuild, null when idle
    private final AtomicReference<AtomicBoolean> activeRun = new AtomicReference<>();

    public TimelineRebuildService(TimelineEventRepository timelineEventRepository,
                                  EntitySnapshotReader entitySnapshotReader,
                                  RebuildCheckpointRepository checkpointRepository,
                                  RebuildProgressTracker progressTracker,
                                  RebuildSettings settings,
                                  PlatformTransactionManager transactionManager,
                                  MeterRegistry meterRegistry,
                                  Clock clock) {
        this.timelineEventRepository = timelineEventRepository;
        this.entitySnapshotReader = entitySnapshotReader;
        this.checkpointRepository = checkpointRepository;
        this.progressTracker = progressTracker;
        this.settings = settings;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.retryConfig = new TransientStorageRetrySupport.RetryConfig(
            log, settings.maxStorageAttempts(), settings.retryBackoffMillis());
        this.entitiesUpdated = meterRegistry.counter("timeline.rebuild.entities", "outcome", "updated");
        this.entitiesOrphaned = meterRegistry.counter("timeline.rebuild.entities", "outcome", "orphaned");
        this.entitiesFailed = meterRegistry.counter("timeline.rebuild.entities", "outcome", "error");
        this.batchesRolledBack = meterRegistry.counter("timeline.rebuild.batches.rolled-back");
    }

    @Component
    public static class ConfigLoader {
        @Bean
        public RebuildSettings rebuildSettings(
            @Value("${app.timeline.rebuild.batch-size:100}") int batchSize,
            @Value("${app.timeline.rebuild.orphan-policy:FREEZE}") String orphanPolicy,
            @Value("${app.timeline.rebuild.max-storage-attempts:3}") int maxStorageAttempts,
            @Value("${app.timeline.rebuild.retry-backoff-ms:200}") long retryBackoffMillis
        ) {
            return new RebuildSettings(batchSize, OrphanPolicy.fromProperty(orphanPolicy), maxStorageAttempts, retryBackoffMillis);
        }
    }

    /**
     * @param batchSize entity keys per transaction
     * @param orphanPolicy handling of events whose entity is gone
     * @param maxStorageAttempts attempts per batch on transient storage failures
     * @param retryBackoffMillis base linear backoff between attempts
     */
    public record RebuildSettings(int batchSize, OrphanPolicy orphanPolicy, int maxStorageAttempts, long retryBackoffMillis) {
        public RebuildSettings {
            if (batchSize < 1) {
                throw new IllegalArgumentException("app.timeline.rebuild.batch-size must be at least 1 but was " + batchSize);
            }
            if (orphanPolicy == null) {
                orphanPolicy = OrphanPolicy.FREEZE;
            }
            if (maxStorageAttempts < 1) {
                maxStorageAttempts = 1;
            }
        }
    }

    public boolean isRunning() {
        return activeRun.get() != null;
    }

    public RebuildProgress getProgress() {
        return progressTracker.getProgress();
    }

    /** Requests that the running rebuild stop after its current batch. */
    public void cancel() {
        AtomicBoolean cancelFlag = activeRun.get();
        if (cancelFlag != null) {
            cancelFlag.set(true);
            log.info("Timeline rebuild cancellation requested");
        }
    }

    @PreDestroy
    void stopOnShutdown() {
        cancel();
    }

    /**
     * Rebuilds every stored event payload.
     *
     * @param resume continue after the checkpoint left by an interrupted run instead of starting over
     * @return totals for the run
     * @throws RebuildAlreadyRunningException when another rebuild is executing
     */
    public RebuildSummary rebuildAll(boolean resume) {
        AtomicBoolean cancelFlag = new AtomicBoolean(false);
        if (!activeRun.compareAndSet(null, cancelFlag)) {
            throw new RebuildAlreadyRunningException();
        }
        try {
            return runFullRebuild(resume, cancelFlag);
        } finally {
            activeRun.set(null);
        }
    }

    /**
     * Refreshes one entity's events and those of every entity whose payload embeds it.
     * Runs independently of full rebuilds and leaves the checkpoint alone.
     */
    public RebuildSummary refreshEntityCascade(EntityKey key) {
        long startedAt = clock.millis();
        List<EntityKey> keys = new ArrayList<>();
        keys.add(key);
        keys.addAll(TransientStorageRetrySupport.execute(retryConfig, "dependents of " + key,
            () -> entitySnapshotReader.dependentsOf(key)));

        RunTotals totals = new RunTotals();
        for (int from = 0; from < keys.size(); from += settings.batchSize()) {
            List<EntityKey> chunk = keys.subList(from, Math.min(keys.size(), from + settings.batchSize()));
            totals.add(processBatchWithRetry(chunk, null));
        }
        RebuildSummary summary = totals.toSummary(null, false, clock.millis() - startedAt);
        log.info("Timeline cascade refresh for {}: scanned={}, updated={}, orphaned={}, errors={}",
            key, summary.scanned(), summary.updated(), summary.orphaned(), summary.errors());
        return summary;
    }

    private RebuildSummary runFullRebuild(boolean resume, AtomicBoolean cancelFlag) {
        long startedAt = clock.millis();
        EntityKey after = null;
        if (resume) {
            after = checkpointRepository.find(FULL_REBUILD_JOB).orElse(null);
        } else {
            checkpointRepository.clear(FULL_REBUILD_JOB);
        }
        String resumedFrom = after == null ? null : after.toString();
        progressTracker.start(Instant.ofEpochMilli(startedAt), resumedFrom);
        log.info("Timeline rebuild starting (resume={}, after={}, batchSize={}, orphanPolicy={})",
            resume, resumedFrom, settings.batchSize(), settings.orphanPolicy());

        RunTotals totals = new RunTotals();
        boolean stopped = false;
        try {
            while (true) {
                if (cancelFlag.get() || Thread.currentThread().isInterrupted()) {
                    stopped = true;
                    log.info("Timeline rebuild cancelled after {} batches ({} entities)", totals.batches, totals.scanned);
                    break;
                }
                EntityKey lowerBound = after;
                List<EntityKey> keys = TransientStorageRetrySupport.execute(retryConfig, "rebuild key scan",
                    () -> timelineEventRepository.findEntityKeysAfter(lowerBound, settings.batchSize()));
                if (keys.isEmpty()) {
                    break;
                }
                totals.add(processBatchWithRetry(keys, FULL_REBUILD_JOB));
                after = keys.get(keys.size() - 1);
                progressTracker.batchCompleted(totals.scanned, totals.updated, totals.orphaned, totals.errors,
                    totals.batches, after.toString());
            }
        } catch (RetryInterruptedException ex) {
            stopped = true;
            log.info("Timeline rebuild interrupted while waiting to retry {}; stopping after {} batches ({} entities)",
                ex.getOperationLabel(), totals.batches, totals.scanned);
        } catch (RuntimeException ex) {
            RebuildSummary partial = totals.toSummary(resumedFrom, true, clock.millis() - startedAt);
            progressTracker.finish(partial);
            log.error("Timeline rebuild aborted after {} batches; checkpoint kept for resume", totals.batches, ex);
            throw ex;
        }

        if (!stopped) {
            checkpointRepository.clear(FULL_REBUILD_JOB);
        }
        RebuildSummary summary = totals.toSummary(resumedFrom, stopped, clock.millis() - startedAt);
        progressTracker.finish(summary);
        log.info("Timeline rebuild {}: scanned={}, updated={}, unchanged={}, orphaned={}, pruned={}, errors={}, batches={}, {}ms",
            stopped ? "cancelled" : "complete",
            summary.scanned(), summary.updated(), summary.unchanged(), summary.orphaned(),
            summary.pruned(), summary.errors(), summary.batches(), summary.durationMs());
        return summary;
    }

    private BatchTotals processBatchWithRetry(List<EntityKey> keys, @Nullable String checkpointJob) {
        EntityKey first = keys.get(0);
        EntityKey last = keys.get(keys.size() - 1);
        try {
            return TransientStorageRetrySupport.execute(retryConfig, "rebuild batch " + first + ".." + last,
                () -> transactionTemplate.execute(status -> processBatch(keys, checkpointJob)));
        } catch (DataAccessException ex) {
            batchesRolledBack.increment();
            entitiesFailed.increment(keys.size());
            log.error("Timeline rebuild batch {}..{} rolled back; counting {} entities as errors: {}",
                first, last, keys.size(), ex.getMessage(), ex);
            return BatchTotals.failed(keys.size());
        }
    }

    private BatchTotals processBatch(List<EntityKey> keys, @Nullable String checkpointJob) {
        BatchTotals batch = new BatchTotals();
        for (EntityKey key : keys) {
            batch.scanned++;
            Optional<TimelineSnapshot> snapshot = entitySnapshotReader.read(key);
            if (snapshot.isEmpty()) {
                batch.orphaned++;
                entitiesOrphaned.increment();
                if (settings.orphanPolicy() == OrphanPolicy.PRUNE) {
                    batch.pruned += timelineEventRepository.deleteByEntity(key);
                    log.debug("Pruned events of orphaned {}", key);
                }
                continue;
            }
            TimelinePayload payload;
            try {
                payload = snapshot.get().toPayload();
            } catch (RuntimeException ex) {
                batch.errors++;
                entitiesFailed.increment();
                log.warn("Skipping {} during timeline rebuild: {}", key, ex.getMessage());
                continue;
            }
            int changed = timelineEventRepository.rewritePayload(key, payload);
            if (changed > 0) {
                batch.updated += changed;
                entitiesUpdated.increment();
            } else {
                batch.unchanged++;
            }
        }
        if (checkpointJob != null) {
            checkpointRepository.save(checkpointJob, keys.get(keys.size() - 1));
        }
        return batch;
    }

    private static final class BatchTotals {
        long scanned;
        long updated;
        long unchanged;
        long orphaned;
        long pruned;
        long errors;

        static BatchTotals failed(int keyCount) {
            BatchTotals totals = new BatchTotals();
            totals.scanned = keyCount;
            totals.errors = keyCount;
            return totals;
        }
    }

    private static final class RunTotals {
        long scanned;
        long updated;
        long unchanged;
        long orphaned;
        long pruned;
        long errors;
        int batches;

        void add(BatchTotals batch) {
            scanned += batch.scanned;
            updated += batch.updated;
            unchanged += batch.unchanged;
            orphaned += batch.orphaned;
            pruned += batch.pruned;
            errors += batch.errors;
            batches++;
        }

        RebuildSummary toSummary(@Nullable String resumedFrom, boolean cancelled, long durationMs) {
            return new RebuildSummary(scanned, updated, unchanged, orphaned, pruned, errors, batches,
                resumedFrom, cancelled, durationMs);
        }
    }
}
