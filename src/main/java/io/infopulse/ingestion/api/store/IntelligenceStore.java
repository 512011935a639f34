package io.infopulse.ingestion.api.store;

import io.infopulse.ingestion.api.dto.Category;
import io.infopulse.ingestion.api.dto.IntelligenceItem;
import io.infopulse.ingestion.api.exception.StoreException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Owner of all persisted intelligence items.
 * <p>
 * Fingerprint uniqueness is enforced here, not by callers: concurrent batches carrying the
 * same fingerprint resolve to a single stored item. Every operation is safe to call from
 * fetch workers and query threads at the same time. Failures surface as
 * {@link StoreException}.
 */
public interface IntelligenceStore {

    /**
     * Inserts every item whose fingerprint and id are not yet stored; the rest are skipped
     * silently. The batch is applied atomically: either all eligible items become visible
     * or, on failure, none do.
     */
    BatchInsertResult insertBatch(List<IntelligenceItem> items);

    Optional<IntelligenceItem> getById(String id);

    /**
     * Items ordered by publish time, newest first; ties keep insertion order.
     *
     * @param category null for all categories
     * @param limit    {@code <= 0} returns every matching item
     */
    List<IntelligenceItem> getLatest(Category category, int limit);

    /**
     * @param category null for all categories
     */
    long count(Category category);

    /**
     * Removes items published before {@code now - maxAge}.
     *
     * @return number of items removed
     */
    int evictOlderThan(Duration maxAge);
}
