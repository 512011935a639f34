package io.infopulse.ingestion.api.service;

import io.infopulse.ingestion.api.dto.Category;
import io.infopulse.ingestion.api.dto.CycleSummary;
import io.infopulse.ingestion.api.dto.CycleSummary.Trigger;
import io.infopulse.ingestion.api.dto.EngineStatus;
import io.infopulse.ingestion.api.dto.IntelligenceItem;
import io.infopulse.ingestion.api.dto.SourcesInfo;
import io.infopulse.ingestion.api.exception.ConfigurationException;
import io.infopulse.ingestion.api.exception.EngineStateException;
import io.infopulse.ingestion.api.exception.ErrorCategory;
import io.infopulse.ingestion.api.exception.FeedException;
import io.infopulse.ingestion.api.exception.StoreException;
import io.infopulse.ingestion.api.store.IntelligenceStore;
import io.infopulse.ingestion.config.FeedSource;
import io.infopulse.ingestion.config.IngestionConfig;
import io.infopulse.ingestion.config.ProcessingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Drives periodic ingestion cycles and serves read-only queries over the store.
 * <p>
 * Lifecycle is {@code Stopped -> Running -> Stopped}. While running, one scheduler thread
 * fires cycles at a fixed rate and also runs manual refreshes, so cycles never overlap.
 * Each cycle fans the enabled sources out to at most {@code maxConcurrentFetches} worker
 * threads and aggregates their results on the cycle thread before a single batch write.
 * Queries delegate to the store in any run state; read failures degrade to empty results.
 */
@Service
public class IngestionEngine implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(IngestionEngine.class);

    private final IngestionConfig config;
    private final Map<String, FeedFetcher> fetchers;
    private final IntelligenceStore store;
    private final EventPublisherService eventPublisher;

    private final Object lifecycleMonitor = new Object();
    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicReference<CompletableFuture<CycleSummary>> pendingCycle = new AtomicReference<>();
    private final AtomicLong cycleCounter = new AtomicLong();

    private volatile boolean running;
    private volatile CycleSummary lastCycle;

    // guarded by lifecycleMonitor
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> periodicTask;

    public IngestionEngine(IngestionConfig config,
                           List<FeedFetcher> fetchers,
                           IntelligenceStore store,
                           EventPublisherService eventPublisher) {
        this.config = config;
        this.store = store;
        this.eventPublisher = eventPublisher;
        this.fetchers = fetchers.stream()
                .collect(Collectors.toUnmodifiableMap(FeedFetcher::fetchMethod, Function.identity(),
                        (first, second) -> {
                            throw new ConfigurationException(
                                    "Two fetchers registered for method " + first.fetchMethod());
                        }));
    }

    @Override
    public void start() {
        synchronized (lifecycleMonitor) {
            if (running) {
                throw new EngineStateException("Ingestion engine is already running");
            }

            ProcessingConfig processing = config.processing();
            CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("ingestion-scheduler-");
            threadFactory.setDaemon(true);

            scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory);
            periodicTask = scheduler.scheduleAtFixedRate(this::scheduledCycle,
                    processing.getInitialDelayMs(), processing.getScheduleIntervalMs(), TimeUnit.MILLISECONDS);
            running = true;

            logger.info("Ingestion engine started: {} enabled sources, every {}, up to {} concurrent fetches",
                    config.getEnabledSources().size(), processing.scheduleInterval(),
                    processing.maxConcurrentFetches());
        }
    }

    /**
     * Stops the periodic timer and waits for a running or queued cycle to finish its write.
     * No-op when already stopped.
     */
    @Override
    public void stop() {
        synchronized (lifecycleMonitor) {
            if (!running) {
                return;
            }

            periodicTask.cancel(false);
            scheduler.shutdown();

            try {
                long timeoutMs = config.processing().shutdownTimeout().toMillis();
                if (!scheduler.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                    logger.warn("Ingestion cycle did not drain within {}ms, interrupting it", timeoutMs);
                    scheduler.shutdownNow();
                    // the interrupted cycle still writes what it collected
                    if (!scheduler.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                        logger.warn("Ingestion cycle still running {}ms after interrupt, abandoning it", timeoutMs);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                scheduler.shutdownNow();
            }

            CompletableFuture<CycleSummary> abandoned = pendingCycle.getAndSet(null);
            if (abandoned != null) {
                abandoned.completeExceptionally(new EngineStateException("Ingestion engine stopped"));
            }

            running = false;
            logger.info("Ingestion engine stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return config.processing().enableScheduling();
    }

    /**
     * Requests an out-of-band cycle without touching the periodic timer. A request made while
     * a cycle is queued or running joins that cycle instead of starting another one.
     *
     * @return completes with the summary of the cycle that served this request; fails with
     * {@link EngineStateException} when the engine is stopped
     */
    public CompletableFuture<CycleSummary> refreshNow() {
        synchronized (lifecycleMonitor) {
            if (!running) {
                return CompletableFuture.failedFuture(new EngineStateException("Ingestion engine is not running"));
            }

            CompletableFuture<CycleSummary> cycle = new CompletableFuture<>();
            CompletableFuture<CycleSummary> existing = pendingCycle.compareAndExchange(null, cycle);
            if (existing != null) {
                logger.info("Manual refresh joined the cycle already in progress");
                return existing;
            }

            scheduler.execute(() -> runTracked(cycle, Trigger.MANUAL));
            logger.info("Manual refresh queued");
            return cycle;
        }
    }

    /**
     * Runs one full cycle on the calling thread, whatever the run state. Waits for any other
     * cycle to finish first.
     */
    public CycleSummary runCycle() {
        return runCycle(Trigger.MANUAL);
    }

    public List<IntelligenceItem> latest(Category category, int limit) {
        try {
            return store.getLatest(category, limit);
        } catch (StoreException e) {
            logger.error("Latest query failed (category: {}, limit: {}): {}", category, limit, e.getMessage(), e);
            return List.of();
        }
    }

    public Optional<IntelligenceItem> byId(String id) {
        try {
            return store.getById(id);
        } catch (StoreException e) {
            logger.error("Lookup of item {} failed: {}", id, e.getMessage(), e);
            return Optional.empty();
        }
    }

    public long totalCount() {
        return count(null);
    }

    public long count(Category category) {
        try {
            return store.count(category);
        } catch (StoreException e) {
            logger.error("Count query failed (category: {}): {}", category, e.getMessage(), e);
            return 0L;
        }
    }

    public Optional<CycleSummary> getLastCycle() {
        return Optional.ofNullable(lastCycle);
    }

    public EngineStatus status() {
        ProcessingConfig processing = config.processing();
        return new EngineStatus(
                running,
                config.getEnabledSources().size(),
                processing.maxConcurrentFetches(),
                processing.getScheduleIntervalMs(),
                totalCount(),
                lastCycle
        );
    }

    public SourcesInfo sourcesInfo() {
        return new SourcesInfo(
                config.sources(),
                config.sources().size(),
                config.getEnabledSources().size(),
                lastCycle != null ? lastCycle.startedAt() : null
        );
    }

    private void scheduledCycle() {
        CompletableFuture<CycleSummary> cycle = new CompletableFuture<>();
        if (!pendingCycle.compareAndSet(null, cycle)) {
            logger.debug("Scheduled cycle skipped, a manual refresh is already queued");
            return;
        }
        runTracked(cycle, Trigger.SCHEDULED);
    }

    private void runTracked(CompletableFuture<CycleSummary> cycle, Trigger trigger) {
        CycleSummary summary;
        try {
            summary = runCycle(trigger);
        } catch (RuntimeException e) {
            // keeps the fixed-rate task alive
            logger.error("Ingestion cycle failed: {}", e.getMessage(), e);
            pendingCycle.compareAndSet(cycle, null);
            cycle.completeExceptionally(e);
            return;
        }

        // cleared first so a caller woken by the future can queue a fresh cycle
        pendingCycle.compareAndSet(cycle, null);
        cycle.complete(summary);
    }

    private CycleSummary runCycle(Trigger trigger) {
        cycleLock.lock();
        try {
            return executeCycle(trigger);
        } finally {
            cycleLock.unlock();
        }
    }

    private CycleSummary executeCycle(Trigger trigger) {
        String cycleId = "CYCLE-" + cycleCounter.incrementAndGet();
        Instant startedAt = Instant.now();
        long startTime = System.currentTimeMillis();

        List<FeedSource> sources = config.getEnabledSources();
        logger.info("Starting ingestion cycle {} ({}) for {} enabled sources", cycleId, trigger, sources.size());

        List<IntelligenceItem> fetched = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        collect(sources, fetched, failures);

        // an interrupt from stop() must not abort the write of what was already collected
        boolean interrupted = Thread.interrupted();
        if (interrupted) {
            logger.warn("Cycle {} was interrupted, writing the {} items collected before it", cycleId, fetched.size());
        }

        List<IntelligenceItem> newItems = List.of();
        try {
            newItems = store.insertBatch(fetched).inserted();
        } catch (StoreException e) {
            logger.error("Batch write of {} items failed, nothing ingested this cycle: {}",
                    fetched.size(), e.getMessage(), e);
        }

        int evicted = evictExpired();

        CycleSummary summary = new CycleSummary(
                cycleId,
                trigger,
                startedAt,
                System.currentTimeMillis() - startTime,
                sources.size(),
                failures.size(),
                fetched.size(),
                newItems.size(),
                evicted,
                failures
        );
        lastCycle = summary;

        eventPublisher.publishNewItems(newItems);
        eventPublisher.publishCycleCompleted(summary);

        logger.info("Finished ingestion cycle {}: {} sources ({} failed), {} items fetched, {} new, {} evicted in {}ms",
                cycleId, summary.sourcesAttempted(), summary.sourcesFailed(), summary.itemsFetched(),
                summary.itemsInserted(), summary.itemsEvicted(), summary.durationMs());

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return summary;
    }

    /**
     * Fans sources out to the worker pool and consumes exactly one result per source.
     */
    private void collect(List<FeedSource> sources, List<IntelligenceItem> fetched, Map<String, String> failures) {
        if (sources.isEmpty()) {
            return;
        }

        int workers = Math.min(config.processing().maxConcurrentFetches(), sources.size());
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("ingestion-worker-");
        threadFactory.setDaemon(true);
        ExecutorService pool = Executors.newFixedThreadPool(workers, threadFactory);

        try {
            CompletionService<SourceResult> completion = new ExecutorCompletionService<>(pool);
            for (FeedSource source : sources) {
                completion.submit(() -> fetchSource(source));
            }

            for (int received = 0; received < sources.size(); received++) {
                SourceResult result = completion.take().get();
                if (result.failed()) {
                    failures.put(result.source().id(), result.failure());
                } else {
                    fetched.addAll(result.items());
                }
            }

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Ingestion cycle interrupted, keeping {} items collected so far", fetched.size());

        } catch (ExecutionException e) {
            throw new IllegalStateException("Fetch worker failed unexpectedly", e.getCause());

        } finally {
            pool.shutdownNow();
        }
    }

    private SourceResult fetchSource(FeedSource source) {
        try {
            FeedFetcher fetcher = fetchers.get(source.fetchMethod());
            if (fetcher == null) {
                throw new FeedException("Unsupported fetch method: " + source.fetchMethod(),
                        ErrorCategory.UNSUPPORTED_METHOD);
            }

            List<IntelligenceItem> items = fetcher.fetch(source);
            logger.info("Processed feed {}: {} items", source.name(), items != null ? items.size() : 0);
            return SourceResult.success(source, items != null ? items : List.of());

        } catch (FeedException e) {
            logger.error("Failed to {} feed {}: {} (category: {})",
                    e.isParseError() ? "parse" : "fetch", source.name(), e.getMessage(), e.getCategory());
            return SourceResult.failure(source, e.getCategory() + ": " + e.getMessage());

        } catch (RuntimeException e) {
            logger.error("Unexpected error processing feed {}: {}", source.name(), e.getMessage(), e);
            return SourceResult.failure(source, ErrorCategory.UNKNOWN + ": " + e.getMessage());
        }
    }

    private int evictExpired() {
        try {
            return store.evictOlderThan(config.processing().retention());
        } catch (StoreException e) {
            logger.error("Retention eviction failed: {}", e.getMessage(), e);
            return 0;
        }
    }

    private record SourceResult(FeedSource source, List<IntelligenceItem> items, String failure) {

        static SourceResult success(FeedSource source, List<IntelligenceItem> items) {
            return new SourceResult(source, items, null);
        }

        static SourceResult failure(FeedSource source, String failure) {
            return new SourceResult(source, List.of(), failure);
        }

        boolean failed() {
            return failure != null;
        }
    }
}
