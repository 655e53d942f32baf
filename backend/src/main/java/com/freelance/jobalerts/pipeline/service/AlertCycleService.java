package com.freelance.jobalerts.pipeline.service;

import com.freelance.jobalerts.config.AlertsProperties;
import com.freelance.jobalerts.pipeline.model.CycleOutcome;
import com.freelance.jobalerts.pipeline.model.CycleState;
import com.freelance.jobalerts.pipeline.model.CycleStats;
import com.freelance.jobalerts.pipeline.model.DeliveryResult;
import com.freelance.jobalerts.pipeline.model.FeedStats;
import com.freelance.jobalerts.pipeline.model.FingerprintedJob;
import com.freelance.jobalerts.pipeline.model.JobRecord;
import com.freelance.jobalerts.pipeline.model.KeyScope;
import com.freelance.jobalerts.pipeline.model.KeywordMatch;
import com.freelance.jobalerts.pipeline.model.MarkResult;
import com.freelance.jobalerts.pipeline.model.OutboundMessage;
import com.freelance.jobalerts.pipeline.model.RawListing;
import com.freelance.jobalerts.pipeline.model.Recipient;
import com.freelance.jobalerts.pipeline.model.SourceFetchResult;
import com.freelance.jobalerts.pipeline.notify.FanOutNotifier;
import com.freelance.jobalerts.pipeline.notify.JobMessageFormatter;
import com.freelance.jobalerts.pipeline.persistence.WorkerLeaseRepository;
import com.freelance.jobalerts.pipeline.source.JobSourceAdapter;
import com.freelance.jobalerts.pipeline.source.SourceRegistry;
import com.freelance.jobalerts.pipeline.stats.StatsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One fetch, normalize, filter, notify and publish pass. Only one cycle runs at a time in this
 * process, and the worker lease keeps other processes out while it does.
 *
 * <p>A key is written to the idempotency store only after the matching delivery succeeded.
 * The lease is renewed before every send; a {@link LeaseLostException} or any
 * {@link StoreUnavailableException} aborts the cycle. Everything else is contained and
 * reported through the published {@link CycleStats}.
 */
@Service
public class AlertCycleService {
    static final String LEASE_NAME = "alert-cycle";

    private static final Logger log = LoggerFactory.getLogger(AlertCycleService.class);

    private final SourceRegistry sourceRegistry;
    private final JobNormalizer normalizer;
    private final DuplicateCollapser duplicateCollapser;
    private final FingerprintService fingerprintService;
    private final KeywordMatcher keywordMatcher;
    private final JobMessageFormatter messageFormatter;
    private final FanOutNotifier notifier;
    private final IdempotencyStore idempotencyStore;
    private final RecipientDirectory recipientDirectory;
    private final WorkerLeaseRepository leaseRepository;
    private final List<StatsSink> statsSinks;
    private final AlertsProperties properties;
    private final ExecutorService sourceExecutor;
    private final ReentrantLock cycleLock = new ReentrantLock();
    private final String ownerId;

    private volatile CycleState state = CycleState.IDLE;

    public AlertCycleService(
        SourceRegistry sourceRegistry,
        JobNormalizer normalizer,
        DuplicateCollapser duplicateCollapser,
        FingerprintService fingerprintService,
        KeywordMatcher keywordMatcher,
        JobMessageFormatter messageFormatter,
        FanOutNotifier notifier,
        IdempotencyStore idempotencyStore,
        RecipientDirectory recipientDirectory,
        WorkerLeaseRepository leaseRepository,
        List<StatsSink> statsSinks,
        AlertsProperties properties,
        @Qualifier("sourceExecutor") ExecutorService sourceExecutor
    ) {
        this.sourceRegistry = sourceRegistry;
        this.normalizer = normalizer;
        this.duplicateCollapser = duplicateCollapser;
        this.fingerprintService = fingerprintService;
        this.keywordMatcher = keywordMatcher;
        this.messageFormatter = messageFormatter;
        this.notifier = notifier;
        this.idempotencyStore = idempotencyStore;
        this.recipientDirectory = recipientDirectory;
        this.leaseRepository = leaseRepository;
        this.statsSinks = statsSinks;
        this.properties = properties;
        this.sourceExecutor = sourceExecutor;
        this.ownerId = "worker-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    public CycleState currentState() {
        return state;
    }

    public boolean isCycleRunning() {
        return cycleLock.isLocked();
    }

    /**
     * Runs one cycle on the calling thread.
     *
     * @throws CycleInProgressException when another cycle is already running in this process
     */
    public CycleStats runCycle() {
        if (!cycleLock.tryLock()) {
            throw new CycleInProgressException("An alert cycle is already running");
        }
        try {
            return runLeasedCycle();
        } finally {
            state = CycleState.IDLE;
            cycleLock.unlock();
        }
    }

    private CycleStats runLeasedCycle() {
        CycleRun run = new CycleRun(Instant.now(), System.nanoTime());
        boolean leased;
        try {
            leased = leaseRepository.tryAcquire(LEASE_NAME, ownerId, properties.getWorker().getLeaseTtlSeconds());
        } catch (StoreUnavailableException e) {
            return abort(run, e);
        }
        if (!leased) {
            log.info("Skipping alert cycle, lease {} is held by another worker", LEASE_NAME);
            return run.toStats(CycleOutcome.SKIPPED, null);
        }
        try {
            CycleStats stats = execute(run);
            publish(stats);
            log.info(
                "Alert cycle completed in {}s: sent={} feeds={} dropped={} stale={} collapsed={} alreadySent={} failed={}",
                String.format("%.2f", stats.cycleSeconds()),
                stats.sentThisCycle(),
                stats.feeds(),
                stats.normalizationDropped(),
                stats.staleDropped(),
                stats.duplicatesCollapsed(),
                stats.alreadySent(),
                stats.failedDeliveries()
            );
            return stats;
        } catch (StoreUnavailableException | LeaseLostException e) {
            return abort(run, e);
        } finally {
            releaseLease();
        }
    }

    private CycleStats execute(CycleRun run) {
        List<Recipient> recipients = loadRecipients(run.startedAt);
        List<String> queryKeywords = queryKeywords(recipients);

        state = CycleState.FETCHING;
        List<RawListing> rawListings = new ArrayList<>();
        for (SourceFetchResult result : fetchAll(queryKeywords, run.startedAt)) {
            if (result.isSuccessful()) {
                run.feeds.put(result.sourceId(), new FeedStats(result.listings().size(), null));
                rawListings.addAll(result.listings());
            } else {
                log.warn("Source {} failed: {}", result.sourceId(), result.error().describe());
                run.feeds.put(result.sourceId(), new FeedStats(0, result.error().describe()));
            }
        }

        state = CycleState.NORMALIZING;
        List<JobRecord> jobs = new ArrayList<>();
        for (RawListing raw : rawListings) {
            Optional<JobRecord> normalized = normalizer.normalize(raw);
            if (normalized.isEmpty()) {
                run.normalizationDropped++;
            } else if (normalizer.isStale(normalized.get(), run.startedAt)) {
                run.staleDropped++;
            } else {
                jobs.add(normalized.get());
            }
        }

        state = CycleState.FILTERING;
        List<JobRecord> distinct = duplicateCollapser.collapse(jobs);
        run.duplicatesCollapsed = jobs.size() - distinct.size();
        List<PendingDelivery> pending = pendingDeliveries(fingerprint(distinct), recipients);
        Set<String> sentKeys = idempotencyStore.findSent(pending.stream().map(PendingDelivery::key).toList());
        List<PendingDelivery> fresh = new ArrayList<>();
        for (PendingDelivery delivery : pending) {
            if (sentKeys.contains(delivery.key())) {
                run.alreadySent++;
            } else {
                fresh.add(delivery);
            }
        }

        renewLease();
        state = CycleState.NOTIFYING;
        deliverAll(run, fresh);

        state = CycleState.PUBLISHING;
        return run.toStats(CycleOutcome.COMPLETED, null);
    }

    private List<Recipient> loadRecipients(Instant now) {
        List<Recipient> eligible = new ArrayList<>();
        for (Recipient recipient : recipientDirectory.listEligibleRecipients()) {
            if (recipient.isEligible(now)) {
                eligible.add(recipient);
            }
        }
        return eligible;
    }

    private List<String> queryKeywords(List<Recipient> recipients) {
        TreeSet<String> union = new TreeSet<>();
        for (Recipient recipient : recipients) {
            union.addAll(recipient.keywords());
        }
        return union.stream()
            .limit(properties.getDelivery().getMaxQueryKeywords())
            .toList();
    }

    private List<SourceFetchResult> fetchAll(List<String> keywords, Instant now) {
        List<JobSourceAdapter> adapters = sourceRegistry.dueAdapters(now);
        Map<String, Future<SourceFetchResult>> futures = new LinkedHashMap<>();
        for (JobSourceAdapter adapter : adapters) {
            // FutureTask, so cancel(true) interrupts an adapter that overran the deadline
            futures.put(adapter.sourceId(), sourceExecutor.submit(() -> fetchSafely(adapter, keywords)));
        }

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(properties.getWorker().getSourceTimeoutSeconds());
        List<SourceFetchResult> results = new ArrayList<>();
        for (Map.Entry<String, Future<SourceFetchResult>> entry : futures.entrySet()) {
            String sourceId = entry.getKey();
            Future<SourceFetchResult> future = entry.getValue();
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                results.add(future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Source {} did not answer within the deadline, cancelled", sourceId);
                results.add(SourceFetchResult.failure(sourceId, "timeout", "source did not answer in time"));
            } catch (ExecutionException e) {
                results.add(SourceFetchResult.failure(sourceId, "adapter_exception", String.valueOf(e.getCause())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                results.add(SourceFetchResult.failure(sourceId, "interrupted", null));
            }
        }
        return results;
    }

    private SourceFetchResult fetchSafely(JobSourceAdapter adapter, List<String> keywords) {
        try {
            SourceFetchResult result = adapter.fetch(keywords);
            if (result == null) {
                return SourceFetchResult.failure(adapter.sourceId(), "invalid_result", "adapter returned nothing");
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("Source adapter {} threw", adapter.sourceId(), e);
            return SourceFetchResult.failure(adapter.sourceId(), "adapter_exception", e.getClass().getSimpleName());
        }
    }

    private List<FingerprintedJob> fingerprint(List<JobRecord> jobs) {
        List<FingerprintedJob> fingerprinted = new ArrayList<>(jobs.size());
        for (JobRecord job : jobs) {
            fingerprinted.add(new FingerprintedJob(job, fingerprintService.fingerprint(job)));
        }
        // newest first so the per-recipient cap keeps the freshest listings
        fingerprinted.sort(Comparator.comparing(
            (FingerprintedJob item) -> item.job().postedAt(),
            Comparator.nullsLast(Comparator.reverseOrder())
        ));
        return fingerprinted;
    }

    private List<PendingDelivery> pendingDeliveries(List<FingerprintedJob> jobs, List<Recipient> recipients) {
        KeyScope scope = properties.getDelivery().getKeyScope();
        List<PendingDelivery> pending = new ArrayList<>();
        for (FingerprintedJob job : jobs) {
            for (Recipient recipient : recipients) {
                KeywordMatch match = keywordMatcher.match(job.job(), recipient.keywords());
                if (match.matched()) {
                    pending.add(new PendingDelivery(
                        recipient,
                        job,
                        match,
                        scope.key(recipient.id(), job.fingerprint()),
                        scope == KeyScope.RECIPIENT ? recipient.id() : null
                    ));
                }
            }
        }
        return pending;
    }

    private void deliverAll(CycleRun run, List<PendingDelivery> deliveries) {
        int cap = properties.getDelivery().getMaxMessagesPerRecipient();
        Map<Long, Integer> sentPerRecipient = new HashMap<>();
        Set<Long> failedRecipients = new HashSet<>();
        Set<String> markedThisCycle = new HashSet<>();

        for (PendingDelivery delivery : deliveries) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Alert cycle interrupted, remaining deliveries wait for the next cycle");
                break;
            }
            long recipientId = delivery.recipient().id();
            if (failedRecipients.contains(recipientId)) {
                continue;
            }
            if (sentPerRecipient.getOrDefault(recipientId, 0) >= cap) {
                continue;
            }
            renewLease();
            OutboundMessage message = messageFormatter.format(delivery.job().job(), delivery.match(), Instant.now());
            DeliveryResult result = notifier.deliver(delivery.recipient(), message);
            if (!result.delivered()) {
                run.failedDeliveries++;
                if (result.skipRecipient()) {
                    failedRecipients.add(recipientId);
                }
                log.warn(
                    "Delivery to recipient {} failed after {} attempts: {}",
                    recipientId,
                    result.attempts(),
                    result.reason()
                );
                continue;
            }
            run.sent++;
            sentPerRecipient.merge(recipientId, 1, Integer::sum);
            if (markedThisCycle.add(delivery.key())) {
                MarkResult marked = idempotencyStore.markSent(
                    delivery.key(),
                    delivery.job().fingerprint(),
                    delivery.storedRecipientId(),
                    delivery.job().job().source()
                );
                if (marked == MarkResult.ALREADY_EXISTS) {
                    run.markConflicts++;
                    log.warn("Key {} was already marked by another writer", delivery.key());
                }
            }
        }
    }

    private void renewLease() {
        if (!leaseRepository.renew(LEASE_NAME, ownerId, properties.getWorker().getLeaseTtlSeconds())) {
            throw new LeaseLostException("Worker lease " + LEASE_NAME + " was taken over by another worker");
        }
    }

    private CycleStats abort(CycleRun run, RuntimeException e) {
        log.error("Alert cycle aborted: {}", e.getMessage(), e);
        state = CycleState.PUBLISHING;
        CycleStats stats = run.toStats(CycleOutcome.ABORTED, e.getMessage());
        publish(stats);
        return stats;
    }

    private void publish(CycleStats stats) {
        for (StatsSink sink : statsSinks) {
            try {
                sink.publish(stats);
            } catch (RuntimeException e) {
                log.warn("Stats sink {} failed", sink.getClass().getSimpleName(), e);
            }
        }
    }

    private void releaseLease() {
        try {
            leaseRepository.release(LEASE_NAME, ownerId);
        } catch (StoreUnavailableException e) {
            log.warn("Failed to release lease {}, it expires on its own", LEASE_NAME, e);
        }
    }

    private record PendingDelivery(
        Recipient recipient,
        FingerprintedJob job,
        KeywordMatch match,
        String key,
        Long storedRecipientId
    ) {
    }

    private static final class CycleRun {
        private final Instant startedAt;
        private final long startNanos;
        private final Map<String, FeedStats> feeds = new LinkedHashMap<>();
        private int normalizationDropped;
        private int staleDropped;
        private int duplicatesCollapsed;
        private int alreadySent;
        private int failedDeliveries;
        private int markConflicts;
        private int sent;

        private CycleRun(Instant startedAt, long startNanos) {
            this.startedAt = startedAt;
            this.startNanos = startNanos;
        }

        private CycleStats toStats(CycleOutcome outcome, String abortReason) {
            double seconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
            return new CycleStats(
                outcome,
                startedAt,
                seconds,
                sent,
                Collections.unmodifiableMap(new LinkedHashMap<>(feeds)),
                normalizationDropped,
                staleDropped,
                duplicatesCollapsed,
                alreadySent,
                failedDeliveries,
                markConflicts,
                abortReason
            );
        }
    }
}
