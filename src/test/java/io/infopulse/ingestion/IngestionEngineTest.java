package io.infopulse.ingestion;

import com.rometools.rome.feed.synd.SyndContentImpl;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndEntryImpl;
import io.infopulse.ingestion.api.dto.Category;
import io.infopulse.ingestion.api.dto.CycleSummary;
import io.infopulse.ingestion.api.dto.IntelligenceItem;
import io.infopulse.ingestion.api.dto.Severity;
import io.infopulse.ingestion.api.exception.EngineStateException;
import io.infopulse.ingestion.api.exception.ErrorCategory;
import io.infopulse.ingestion.api.exception.FeedException;
import io.infopulse.ingestion.api.exception.StoreException;
import io.infopulse.ingestion.api.service.EventPublisherService;
import io.infopulse.ingestion.api.service.FeedEntryNormalizer;
import io.infopulse.ingestion.api.service.FeedFetcher;
import io.infopulse.ingestion.api.service.IngestionEngine;
import io.infopulse.ingestion.api.store.BatchInsertResult;
import io.infopulse.ingestion.api.store.InMemoryIntelligenceStore;
import io.infopulse.ingestion.api.store.IntelligenceStore;
import io.infopulse.ingestion.config.FeedSource;
import io.infopulse.ingestion.config.HttpConfig;
import io.infopulse.ingestion.config.IngestionConfig;
import io.infopulse.ingestion.config.ProcessingConfig;
import io.infopulse.ingestion.config.SeverityAnalysis;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionEngineTest {

    @Mock
    private EventPublisherService eventPublisher;

    private InMemoryIntelligenceStore store;
    private EntryFetcher fetcher;
    private IngestionEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryIntelligenceStore();
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.stop();
        }
    }

    @Test
    @DisplayName("Should ingest every enabled source into the store")
    void shouldIngestEnabledSources() {
        FeedSource sourceA = source("src-a", Category.CYBERSEC);
        FeedSource sourceB = source("src-b", Category.AITOOLS);
        IngestionConfig config = config(5, sourceA, sourceB);
        fetcher = new EntryFetcher(config);
        fetcher.serve("src-a",
                entry("a-1", "CVE-2024-3400 CRITICAL command injection", "https://a.example/1", "Patch now"),
                entry("a-2", "Weekly threat roundup", "https://a.example/2", "Ransomware trends"));
        fetcher.serve("src-b",
                entry("b-1", "New code assistant released", "https://b.example/1", "Autocompletion for shells"));
        engine = engine(config, store);

        CycleSummary summary = engine.runCycle();

        assertThat(summary.sourcesAttempted()).isEqualTo(2);
        assertThat(summary.sourcesFailed()).isZero();
        assertThat(summary.itemsFetched()).isEqualTo(3);
        assertThat(summary.itemsInserted()).isEqualTo(3);

        assertThat(engine.totalCount()).isEqualTo(3);
        assertThat(engine.count(Category.CYBERSEC)).isEqualTo(2);
        assertThat(engine.count(Category.AITOOLS)).isEqualTo(1);

        List<IntelligenceItem> cybersec = engine.latest(Category.CYBERSEC, 10);
        assertThat(cybersec).extracting(IntelligenceItem::title)
                .contains("CVE-2024-3400 CRITICAL command injection");
        assertThat(cybersec).filteredOn(item -> item.title().startsWith("CVE"))
                .extracting(IntelligenceItem::severity)
                .containsExactly(Severity.CRITICAL);
        assertThat(engine.getLastCycle()).contains(summary);
    }

    @Test
    @DisplayName("Should not fetch disabled sources")
    void shouldSkipDisabledSources() {
        FeedSource enabled = source("on", Category.CYBERSEC);
        FeedSource disabled = new FeedSource("off", "Off", "https://off.example/feed",
                List.of(Category.CYBERSEC), "rss", false, 60);
        IngestionConfig config = config(5, enabled, disabled);
        fetcher = new EntryFetcher(config);
        fetcher.serve("on", entry("1", "Title", "https://on.example/1", "body"));
        fetcher.serve("off", entry("2", "Other", "https://off.example/2", "body"));
        engine = engine(config, store);

        CycleSummary summary = engine.runCycle();

        assertThat(summary.sourcesAttempted()).isEqualTo(1);
        assertThat(fetcher.callsFor("off")).isZero();
        assertThat(engine.totalCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should be idempotent when a source serves the same entries again")
    void shouldDeduplicateAcrossCycles() {
        FeedSource source = source("repeat", Category.OPENSOURCE);
        IngestionConfig config = config(2, source);
        fetcher = new EntryFetcher(config);
        fetcher.serve("repeat",
                entry("r-1", "Release 1.0", "https://r.example/1", "Notes"),
                entry("r-2", "Release 1.1", "https://r.example/2", "More notes"));
        engine = engine(config, store);

        CycleSummary first = engine.runCycle();
        CycleSummary second = engine.runCycle();

        assertThat(first.itemsInserted()).isEqualTo(2);
        assertThat(second.itemsFetched()).isEqualTo(2);
        assertThat(second.itemsInserted()).isZero();
        assertThat(engine.totalCount()).isEqualTo(2);
        assertThat(second.cycleId()).isNotEqualTo(first.cycleId());
    }

    @Test
    @DisplayName("Should deduplicate the same story carried by two sources")
    void shouldDeduplicateAcrossSources() {
        FeedSource first = source("first", Category.CYBERSEC);
        FeedSource second = source("second", Category.INFOSEC_NEWS);
        IngestionConfig config = config(2, first, second);
        fetcher = new EntryFetcher(config);
        fetcher.serve("first", entry("x", "Shared story", "https://shared.example/story", "Same text"));
        fetcher.serve("second", entry("y", "Shared story", "https://shared.example/story", "Same text"));
        engine = engine(config, store);

        CycleSummary summary = engine.runCycle();

        assertThat(summary.itemsFetched()).isEqualTo(2);
        assertThat(summary.itemsInserted()).isEqualTo(1);
        assertThat(engine.totalCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should never run more fetches at once than the configured limit")
    void shouldBoundConcurrentFetches() {
        List<FeedSource> sources = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            sources.add(source("slow-" + i, Category.CYBERSEC));
        }
        IngestionConfig config = config(2, sources.toArray(FeedSource[]::new));
        SlowFetcher slow = new SlowFetcher(Duration.ofMillis(100));
        engine = new IngestionEngine(config, List.of(slow), store, eventPublisher);

        long started = System.nanoTime();
        CycleSummary summary = engine.runCycle();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(summary.sourcesAttempted()).isEqualTo(5);
        assertThat(summary.sourcesFailed()).isZero();
        assertThat(slow.maxInFlight()).isLessThanOrEqualTo(2);
        assertThat(elapsedMs).isGreaterThanOrEqualTo(300);
    }

    @Test
    @DisplayName("Should keep ingesting other sources when one fails")
    void shouldIsolateFailingSources() {
        FeedSource healthy = source("healthy", Category.CYBERSEC);
        FeedSource notFound = source("missing", Category.CYBERSEC);
        FeedSource broken = source("broken", Category.AITOOLS);
        IngestionConfig config = config(3, healthy, notFound, broken);
        fetcher = new EntryFetcher(config);
        fetcher.serve("healthy", entry("h", "Still here", "https://h.example/1", "ok"));
        fetcher.fail("missing", new FeedException("Feed not found (404)", ErrorCategory.NOT_FOUND));
        fetcher.crash("broken", new IllegalStateException("boom"));
        engine = engine(config, store);

        CycleSummary summary = engine.runCycle();

        assertThat(summary.sourcesFailed()).isEqualTo(2);
        assertThat(summary.failures()).containsOnlyKeys("missing", "broken");
        assertThat(summary.failures().get("missing")).startsWith("NOT_FOUND");
        assertThat(summary.failures().get("broken")).startsWith("UNKNOWN");
        assertThat(summary.itemsInserted()).isEqualTo(1);
        assertThat(engine.totalCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should fail a source whose fetch method has no fetcher")
    void shouldFailUnsupportedFetchMethod() {
        FeedSource scraped = new FeedSource("scraped", "Scraped", "https://s.example",
                List.of(Category.OPENSOURCE), "scrape", true, 60);
        IngestionConfig config = config(1, scraped);
        fetcher = new EntryFetcher(config);
        engine = engine(config, store);

        CycleSummary summary = engine.runCycle();

        assertThat(summary.sourcesFailed()).isEqualTo(1);
        assertThat(summary.failures().get("scraped")).startsWith(ErrorCategory.UNSUPPORTED_METHOD.name());
    }

    @Test
    @DisplayName("Should complete the cycle without items when the batch write fails")
    void shouldSurviveStoreWriteFailure() {
        IntelligenceStore failingStore = mock(IntelligenceStore.class);
        when(failingStore.insertBatch(anyList())).thenThrow(new StoreException("disk full"));
        FeedSource source = source("src", Category.CYBERSEC);
        IngestionConfig config = config(1, source);
        fetcher = new EntryFetcher(config);
        fetcher.serve("src", entry("1", "Title", "https://x.example/1", "body"));
        engine = engine(config, failingStore);

        CycleSummary summary = engine.runCycle();

        assertThat(summary.itemsFetched()).isEqualTo(1);
        assertThat(summary.itemsInserted()).isZero();
        verify(eventPublisher).publishNewItems(List.of());
        verify(failingStore).evictOlderThan(Duration.ofDays(30));
    }

    @Test
    @DisplayName("Should evict expired items after writing the batch")
    void shouldEvictAfterWrite() {
        IntelligenceStore mockStore = mock(IntelligenceStore.class);
        when(mockStore.insertBatch(anyList())).thenReturn(BatchInsertResult.empty());
        when(mockStore.evictOlderThan(any(Duration.class))).thenReturn(4);
        FeedSource source = source("src", Category.CYBERSEC);
        IngestionConfig config = config(1, source);
        fetcher = new EntryFetcher(config);
        fetcher.serve("src", entry("1", "Title", "https://x.example/1", "body"));
        engine = engine(config, mockStore);

        CycleSummary summary = engine.runCycle();

        InOrder order = inOrder(mockStore, eventPublisher);
        order.verify(mockStore).insertBatch(anyList());
        order.verify(mockStore).evictOlderThan(Duration.ofDays(30));
        order.verify(eventPublisher).publishCycleCompleted(summary);
        assertThat(summary.itemsEvicted()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should answer queries with empty results when the store cannot be read")
    void shouldDegradeQueriesOnReadFailure() {
        IntelligenceStore failingStore = mock(IntelligenceStore.class);
        when(failingStore.getLatest(any(), anyInt())).thenThrow(new StoreException("unavailable"));
        when(failingStore.getById("id")).thenThrow(new StoreException("unavailable"));
        when(failingStore.count(any())).thenThrow(new StoreException("unavailable"));
        IngestionConfig config = config(1);
        engine = new IngestionEngine(config, List.of(), failingStore, eventPublisher);

        assertThat(engine.latest(null, 10)).isEmpty();
        assertThat(engine.byId("id")).isEmpty();
        assertThat(engine.totalCount()).isZero();
        assertThat(engine.count(Category.CYBERSEC)).isZero();
    }

    @Test
    @DisplayName("Should reject starting an engine that is already running")
    void shouldRejectDoubleStart() {
        IngestionConfig config = config(1, Duration.ofHours(1));
        engine = new IngestionEngine(config, List.of(), store, eventPublisher);

        engine.start();

        assertThat(engine.isRunning()).isTrue();
        assertThatThrownBy(engine::start).isInstanceOf(EngineStateException.class);
    }

    @Test
    @DisplayName("Should treat stop on a stopped engine as a no-op")
    void shouldStopIdempotently() {
        IngestionConfig config = config(1, Duration.ofHours(1));
        engine = new IngestionEngine(config, List.of(), store, eventPublisher);

        assertThatCode(engine::stop).doesNotThrowAnyException();

        engine.start();
        engine.stop();
        assertThat(engine.isRunning()).isFalse();
        assertThatCode(engine::stop).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should run the first cycle immediately when started without initial delay")
    void shouldRunFirstCycleOnStart() throws Exception {
        FeedSource source = source("eager", Category.CYBERSEC);
        IngestionConfig config = config(1, Duration.ZERO, source);
        CountDownLatch fetched = new CountDownLatch(1);
        fetcher = new EntryFetcher(config) {
            @Override
            public List<IntelligenceItem> fetch(FeedSource feedSource) throws FeedException {
                List<IntelligenceItem> items = super.fetch(feedSource);
                fetched.countDown();
                return items;
            }
        };
        fetcher.serve("eager", entry("1", "Title", "https://x.example/1", "body"));
        engine = engine(config, store);

        engine.start();

        assertThat(fetched.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Should fail a refresh requested while the engine is stopped")
    void shouldFailRefreshWhenStopped() {
        engine = new IngestionEngine(config(1), List.of(), store, eventPublisher);

        CompletableFuture<CycleSummary> refresh = engine.refreshNow();

        assertThat(refresh).isCompletedExceptionally();
        assertThatThrownBy(refresh::get)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(EngineStateException.class);
    }

    @Test
    @DisplayName("Should join refresh requests made while a cycle is pending")
    void shouldCoalesceRefreshRequests() throws Exception {
        FeedSource source = source("gated", Category.CYBERSEC);
        IngestionConfig config = config(1, Duration.ofHours(1), source);
        CountDownLatch gate = new CountDownLatch(1);
        fetcher = new EntryFetcher(config) {
            @Override
            public List<IntelligenceItem> fetch(FeedSource feedSource) throws FeedException {
                try {
                    gate.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.fetch(feedSource);
            }
        };
        fetcher.serve("gated", entry("1", "Title", "https://x.example/1", "body"));
        engine = engine(config, store);
        engine.start();

        CompletableFuture<CycleSummary> first = engine.refreshNow();
        CompletableFuture<CycleSummary> second = engine.refreshNow();
        gate.countDown();

        CycleSummary summary = first.get(5, TimeUnit.SECONDS);
        assertThat(second).isSameAs(first);
        assertThat(summary.trigger()).isEqualTo(CycleSummary.Trigger.MANUAL);
        assertThat(summary.itemsInserted()).isEqualTo(1);
        assertThat(fetcher.callsFor("gated")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should let an in-flight cycle finish its write before stop returns")
    void shouldDrainCycleOnStop() throws Exception {
        FeedSource source = source("draining", Category.CYBERSEC);
        IngestionConfig config = config(1, Duration.ofHours(1), source);
        CountDownLatch inFetch = new CountDownLatch(1);
        fetcher = new EntryFetcher(config) {
            @Override
            public List<IntelligenceItem> fetch(FeedSource feedSource) throws FeedException {
                inFetch.countDown();
                try {
                    Thread.sleep(200);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.fetch(feedSource);
            }
        };
        fetcher.serve("draining", entry("1", "Title", "https://x.example/1", "body"));
        engine = engine(config, store);
        engine.start();

        CompletableFuture<CycleSummary> refresh = engine.refreshNow();
        assertThat(inFetch.await(5, TimeUnit.SECONDS)).isTrue();
        engine.stop();

        assertThat(refresh).isDone();
        assertThat(refresh.get().itemsInserted()).isEqualTo(1);
        assertThat(store.count(null)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should write collected items without an interrupt when stop times out")
    void shouldWriteCollectedItemsWhenStopInterruptsCycle() throws Exception {
        FeedSource fast = source("fast", Category.CYBERSEC);
        FeedSource stuck = source("stuck", Category.CYBERSEC);
        IngestionConfig config = config(2, Duration.ofHours(1), Duration.ofMillis(250), fast, stuck);
        CountDownLatch stuckStarted = new CountDownLatch(1);
        fetcher = new EntryFetcher(config) {
            @Override
            public List<IntelligenceItem> fetch(FeedSource feedSource) throws FeedException {
                if (feedSource.id().equals("stuck")) {
                    stuckStarted.countDown();
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return super.fetch(feedSource);
            }
        };
        fetcher.serve("fast", entry("1", "Collected early", "https://fast.example/1", "body"));
        fetcher.serve("stuck", entry("2", "Never collected", "https://stuck.example/2", "body"));
        AtomicBoolean writeSawInterrupt = new AtomicBoolean(true);
        InMemoryIntelligenceStore recordingStore = new InMemoryIntelligenceStore() {
            @Override
            public BatchInsertResult insertBatch(List<IntelligenceItem> items) {
                writeSawInterrupt.set(Thread.currentThread().isInterrupted());
                return super.insertBatch(items);
            }
        };
        engine = engine(config, recordingStore);
        engine.start();

        CompletableFuture<CycleSummary> refresh = engine.refreshNow();
        assertThat(stuckStarted.await(5, TimeUnit.SECONDS)).isTrue();
        engine.stop();

        assertThat(refresh).isDone();
        assertThat(writeSawInterrupt).isFalse();
        assertThat(refresh.get().itemsInserted()).isEqualTo(1);
        assertThat(recordingStore.getLatest(null, 10)).extracting(IntelligenceItem::title)
                .containsExactly("Collected early");
    }

    @Test
    @DisplayName("Should start a fresh cycle for a refresh issued right after the previous one completed")
    void shouldQueueNewCycleAfterPreviousRefreshCompletes() throws Exception {
        FeedSource source = source("again", Category.CYBERSEC);
        IngestionConfig config = config(1, Duration.ofHours(1), source);
        fetcher = new EntryFetcher(config);
        fetcher.serve("again", entry("1", "Title", "https://x.example/1", "body"));
        engine = engine(config, store);
        engine.start();

        CompletableFuture<CycleSummary> first = engine.refreshNow();
        CycleSummary firstSummary = first.get(5, TimeUnit.SECONDS);
        CompletableFuture<CycleSummary> second = engine.refreshNow();
        CycleSummary secondSummary = second.get(5, TimeUnit.SECONDS);

        assertThat(second).isNotSameAs(first);
        assertThat(secondSummary.cycleId()).isNotEqualTo(firstSummary.cycleId());
        assertThat(fetcher.callsFor("again")).isEqualTo(2);
    }

    @Test
    @DisplayName("Should report status and configured sources")
    void shouldReportStatus() {
        FeedSource on = source("on", Category.CYBERSEC);
        FeedSource off = new FeedSource("off", "Off", "https://off.example",
                List.of(Category.AITOOLS), "rss", false, 60);
        IngestionConfig config = config(3, on, off);
        fetcher = new EntryFetcher(config);
        fetcher.serve("on", entry("1", "Title", "https://x.example/1", "body"));
        engine = engine(config, store);

        assertThat(engine.sourcesInfo().lastUpdated()).isNull();
        engine.runCycle();

        var status = engine.status();
        assertThat(status.running()).isFalse();
        assertThat(status.enabledSources()).isEqualTo(1);
        assertThat(status.maxConcurrentFetches()).isEqualTo(3);
        assertThat(status.totalItems()).isEqualTo(1);
        assertThat(status.lastCycle()).isNotNull();

        var sources = engine.sourcesInfo();
        assertThat(sources.totalSources()).isEqualTo(2);
        assertThat(sources.enabledSources()).isEqualTo(1);
        assertThat(sources.lastUpdated()).isNotNull();
    }

    private IngestionEngine engine(IngestionConfig config, IntelligenceStore intelligenceStore) {
        return new IngestionEngine(config, List.of(fetcher), intelligenceStore, eventPublisher);
    }

    private static IngestionConfig config(int maxConcurrentFetches, FeedSource... sources) {
        return config(maxConcurrentFetches, Duration.ofHours(1), sources);
    }

    private static IngestionConfig config(int maxConcurrentFetches, Duration initialDelay, FeedSource... sources) {
        return config(maxConcurrentFetches, initialDelay, Duration.ofSeconds(10), sources);
    }

    private static IngestionConfig config(int maxConcurrentFetches, Duration initialDelay, Duration shutdownTimeout,
                                          FeedSource... sources) {
        ProcessingConfig processing = new ProcessingConfig(
                Duration.ofMinutes(5), initialDelay, maxConcurrentFetches, Duration.ofDays(30), 500, false,
                shutdownTimeout);
        return new IngestionConfig(List.of(sources), processing, HttpConfig.defaults(), SeverityAnalysis.defaults());
    }

    private static FeedSource source(String id, Category category) {
        return new FeedSource(id, id.toUpperCase(), "https://" + id + ".example/feed", List.of(category), "rss", true, 60);
    }

    private static SyndEntry entry(String guid, String title, String link, String description) {
        SyndEntry entry = new SyndEntryImpl();
        entry.setUri(guid);
        entry.setTitle(title);
        entry.setLink(link);
        SyndContentImpl content = new SyndContentImpl();
        content.setValue(description);
        entry.setDescription(content);
        entry.setPublishedDate(Date.from(Instant.now().minusSeconds(60)));
        return entry;
    }

    /**
     * Serves canned Rome entries per source id through the real normalizer.
     */
    private static class EntryFetcher implements FeedFetcher {

        private final FeedEntryNormalizer normalizer;
        private final Map<String, List<SyndEntry>> entries = new HashMap<>();
        private final Map<String, FeedException> failures = new HashMap<>();
        private final Map<String, RuntimeException> crashes = new HashMap<>();
        private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

        EntryFetcher(IngestionConfig config) {
            this.normalizer = new FeedEntryNormalizer(config);
        }

        void serve(String sourceId, SyndEntry... served) {
            entries.put(sourceId, List.of(served));
        }

        void fail(String sourceId, FeedException failure) {
            failures.put(sourceId, failure);
        }

        void crash(String sourceId, RuntimeException crash) {
            crashes.put(sourceId, crash);
        }

        int callsFor(String sourceId) {
            AtomicInteger count = calls.get(sourceId);
            return count != null ? count.get() : 0;
        }

        @Override
        public String fetchMethod() {
            return "rss";
        }

        @Override
        public List<IntelligenceItem> fetch(FeedSource source) throws FeedException {
            calls.computeIfAbsent(source.id(), id -> new AtomicInteger()).incrementAndGet();

            if (failures.containsKey(source.id())) {
                throw failures.get(source.id());
            }
            if (crashes.containsKey(source.id())) {
                throw crashes.get(source.id());
            }

            Instant fetchedAt = Instant.now();
            List<SyndEntry> served = entries.getOrDefault(source.id(), List.of());
            List<IntelligenceItem> items = new ArrayList<>();
            for (int i = 0; i < served.size(); i++) {
                normalizer.normalize(served.get(i), i, source, fetchedAt).ifPresent(items::add);
            }
            return items;
        }
    }

    private static class SlowFetcher implements FeedFetcher {

        private final Duration latency;
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger maxInFlight = new AtomicInteger();

        SlowFetcher(Duration latency) {
            this.latency = latency;
        }

        int maxInFlight() {
            return maxInFlight.get();
        }

        @Override
        public String fetchMethod() {
            return "rss";
        }

        @Override
        public List<IntelligenceItem> fetch(FeedSource source) {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                Thread.sleep(latency.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
            return List.of();
        }
    }
}
