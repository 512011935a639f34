package io.infopulse.ingestion.api.store;

import io.infopulse.ingestion.api.dto.Category;
import io.infopulse.ingestion.api.dto.IntelligenceItem;
import io.infopulse.ingestion.api.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local store: an arena of items keyed by id plus secondary indices by fingerprint,
 * category and publish time. All indices change together under the write lock, and a batch
 * is validated in full before any of it is applied.
 */
public class InMemoryIntelligenceStore implements IntelligenceStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryIntelligenceStore.class);

    private static final Comparator<Entry> NEWEST_FIRST = Comparator
            .comparing((Entry entry) -> entry.item().published()).reversed()
            .thenComparingLong(Entry::seq);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, Entry> byId = new HashMap<>();
    private final Map<String, String> idByHash = new HashMap<>();
    private final Map<Category, NavigableSet<Entry>> byCategory = new EnumMap<>(Category.class);
    private final NavigableSet<Entry> byPublished = new TreeSet<>(NEWEST_FIRST);

    private long nextSeq;

    private record Entry(IntelligenceItem item, long seq) {}

    @Override
    public BatchInsertResult insertBatch(List<IntelligenceItem> items) {
        if (items == null || items.isEmpty()) {
            return BatchInsertResult.empty();
        }

        lock.writeLock().lock();
        try {
            for (int i = 0; i < items.size(); i++) {
                validate(items.get(i), i);
            }

            List<IntelligenceItem> inserted = new ArrayList<>();
            for (IntelligenceItem item : items) {
                if (idByHash.containsKey(item.hash()) || byId.containsKey(item.id())) {
                    continue;
                }
                index(new Entry(item, nextSeq++));
                inserted.add(item);
            }

            logger.info("Inserted {} intelligence items ({} duplicates skipped)",
                    inserted.size(), items.size() - inserted.size());
            return new BatchInsertResult(List.copyOf(inserted), items.size() - inserted.size());

        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<IntelligenceItem> getById(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(byId.get(id)).map(Entry::item);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<IntelligenceItem> getLatest(Category category, int limit) {
        lock.readLock().lock();
        try {
            Collection<Entry> source = category == null
                    ? byPublished
                    : byCategory.getOrDefault(category, emptyIndex());

            return source.stream()
                    .limit(limit > 0 ? limit : Long.MAX_VALUE)
                    .map(Entry::item)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long count(Category category) {
        lock.readLock().lock();
        try {
            return category == null
                    ? byId.size()
                    : byCategory.getOrDefault(category, emptyIndex()).size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int evictOlderThan(Duration maxAge) {
        Instant cutoff = Instant.now().minus(maxAge);

        lock.writeLock().lock();
        try {
            List<Entry> expired = new ArrayList<>();
            Iterator<Entry> oldestFirst = byPublished.descendingIterator();
            while (oldestFirst.hasNext()) {
                Entry entry = oldestFirst.next();
                if (!entry.item().published().isBefore(cutoff)) {
                    break;
                }
                expired.add(entry);
            }

            expired.forEach(this::unindex);
            logger.info("Evicted {} intelligence items published before {}", expired.size(), cutoff);
            return expired.size();

        } finally {
            lock.writeLock().unlock();
        }
    }

    private void index(Entry entry) {
        IntelligenceItem item = entry.item();
        byId.put(item.id(), entry);
        idByHash.put(item.hash(), item.id());
        byCategory.computeIfAbsent(item.category(), c -> new TreeSet<>(NEWEST_FIRST)).add(entry);
        byPublished.add(entry);
    }

    private void unindex(Entry entry) {
        IntelligenceItem item = entry.item();
        byId.remove(item.id());
        idByHash.remove(item.hash());
        NavigableSet<Entry> categoryIndex = byCategory.get(item.category());
        if (categoryIndex != null) {
            categoryIndex.remove(entry);
        }
        byPublished.remove(entry);
    }

    private static void validate(IntelligenceItem item, int position) {
        Set<String> missing = new HashSet<>();
        if (item == null) {
            throw new StoreException("Batch item " + position + " is null");
        }
        if (item.id() == null) missing.add("id");
        if (item.sourceId() == null) missing.add("sourceId");
        if (item.category() == null) missing.add("category");
        if (item.title() == null) missing.add("title");
        if (item.url() == null) missing.add("url");
        if (item.published() == null) missing.add("published");
        if (item.retrieved() == null) missing.add("retrieved");
        if (item.hash() == null) missing.add("hash");

        if (!missing.isEmpty()) {
            throw new StoreException("Batch item " + position + " is missing " + missing + "; batch rejected");
        }
    }

    private static NavigableSet<Entry> emptyIndex() {
        return new TreeSet<>(NEWEST_FIRST);
    }
}
