package io.infopulse.ingestion.api.store;

import io.infopulse.ingestion.api.dto.Category;
import io.infopulse.ingestion.api.dto.IntelligenceItem;
import io.infopulse.ingestion.api.dto.Severity;
import io.infopulse.ingestion.api.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable store over the {@code intelligence} table (see {@code schema.sql}).
 * <p>
 * Writers are serialized through a single lock so the duplicate check and the insert of a
 * batch run as one unit; the unique index on {@code hash} backs this up against writers
 * outside this process. Readers go straight to the database.
 */
public class JdbcIntelligenceStore implements IntelligenceStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcIntelligenceStore.class);

    private static final String COLUMNS =
            "id, source_id, category, title, url, summary, published, retrieved, hash, severity";

    private static final String INSERT_SQL = """
            INSERT INTO intelligence (seq, id, source_id, category, title, url, summary, published, retrieved, hash, severity)
            VALUES (NEXT VALUE FOR intelligence_seq, :id, :sourceId, :category, :title, :url, :summary,
                    :published, :retrieved, :hash, :severity)
            """;

    private static final RowMapper<IntelligenceItem> ROW_MAPPER = (rs, rowNum) -> {
        String severity = rs.getString("severity");
        return new IntelligenceItem(
                rs.getString("id"),
                rs.getString("source_id"),
                Category.valueOf(rs.getString("category")),
                rs.getString("title"),
                rs.getString("url"),
                rs.getString("summary"),
                rs.getObject("published", OffsetDateTime.class).toInstant(),
                rs.getObject("retrieved", OffsetDateTime.class).toInstant(),
                rs.getString("hash"),
                severity != null ? Severity.valueOf(severity) : null
        );
    };

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final ReentrantLock writeLock = new ReentrantLock();

    public JdbcIntelligenceStore(NamedParameterJdbcTemplate jdbc, PlatformTransactionManager transactionManager) {
        this.jdbc = jdbc;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public BatchInsertResult insertBatch(List<IntelligenceItem> items) {
        if (items == null || items.isEmpty()) {
            return BatchInsertResult.empty();
        }

        writeLock.lock();
        try {
            BatchInsertResult result = transactionTemplate.execute(status -> insertNew(items));
            logger.info("Inserted {} intelligence items ({} duplicates skipped)",
                    result.insertedCount(), result.skipped());
            return result;

        } catch (DataAccessException | TransactionException e) {
            throw new StoreException("Failed to insert batch of " + items.size() + " items", e);

        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Optional<IntelligenceItem> getById(String id) {
        try {
            List<IntelligenceItem> found = jdbc.query(
                    "SELECT " + COLUMNS + " FROM intelligence WHERE id = :id",
                    new MapSqlParameterSource("id", id),
                    ROW_MAPPER);
            return found.stream().findFirst();

        } catch (DataAccessException e) {
            throw new StoreException("Failed to look up intelligence item " + id, e);
        }
    }

    @Override
    public List<IntelligenceItem> getLatest(Category category, int limit) {
        var params = new MapSqlParameterSource();
        var sql = new StringBuilder("SELECT " + COLUMNS + " FROM intelligence");

        if (category != null) {
            sql.append(" WHERE category = :category");
            params.addValue("category", category.name());
        }
        sql.append(" ORDER BY published DESC, seq ASC");
        if (limit > 0) {
            sql.append(" LIMIT :limit");
            params.addValue("limit", limit);
        }

        try {
            return jdbc.query(sql.toString(), params, ROW_MAPPER);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to query latest intelligence (category: " + category + ")", e);
        }
    }

    @Override
    public long count(Category category) {
        try {
            Long count = category == null
                    ? jdbc.queryForObject("SELECT COUNT(*) FROM intelligence",
                            new MapSqlParameterSource(), Long.class)
                    : jdbc.queryForObject("SELECT COUNT(*) FROM intelligence WHERE category = :category",
                            new MapSqlParameterSource("category", category.name()), Long.class);
            return count != null ? count : 0L;

        } catch (DataAccessException e) {
            throw new StoreException("Failed to count intelligence (category: " + category + ")", e);
        }
    }

    @Override
    public int evictOlderThan(Duration maxAge) {
        Instant cutoff = Instant.now().minus(maxAge);

        writeLock.lock();
        try {
            Integer evicted = transactionTemplate.execute(status -> jdbc.update(
                    "DELETE FROM intelligence WHERE published < :cutoff",
                    new MapSqlParameterSource("cutoff", utc(cutoff))));
            int count = evicted != null ? evicted : 0;
            logger.info("Evicted {} intelligence items published before {}", count, cutoff);
            return count;

        } catch (DataAccessException | TransactionException e) {
            throw new StoreException("Failed to evict items older than " + maxAge, e);

        } finally {
            writeLock.unlock();
        }
    }

    private BatchInsertResult insertNew(List<IntelligenceItem> items) {
        Set<String> knownHashes = existing("hash", items.stream().map(IntelligenceItem::hash).toList());
        Set<String> knownIds = existing("id", items.stream().map(IntelligenceItem::id).toList());

        List<IntelligenceItem> fresh = new ArrayList<>();
        for (IntelligenceItem item : items) {
            if (knownHashes.contains(item.hash()) || knownIds.contains(item.id())) {
                continue;
            }
            // later duplicates inside the same batch are skipped too
            if (item.hash() != null) knownHashes.add(item.hash());
            if (item.id() != null) knownIds.add(item.id());
            fresh.add(item);
        }

        if (!fresh.isEmpty()) {
            SqlParameterSource[] batch = fresh.stream()
                    .map(JdbcIntelligenceStore::toParameters)
                    .toArray(SqlParameterSource[]::new);
            jdbc.batchUpdate(INSERT_SQL, batch);
        }

        return new BatchInsertResult(List.copyOf(fresh), items.size() - fresh.size());
    }

    private Set<String> existing(String column, Collection<String> keys) {
        List<String> candidates = keys.stream().filter(Objects::nonNull).distinct().toList();
        if (candidates.isEmpty()) {
            return new HashSet<>();
        }

        return new HashSet<>(jdbc.queryForList(
                "SELECT " + column + " FROM intelligence WHERE " + column + " IN (:keys)",
                new MapSqlParameterSource("keys", candidates),
                String.class));
    }

    private static SqlParameterSource toParameters(IntelligenceItem item) {
        return new MapSqlParameterSource()
                .addValue("id", item.id())
                .addValue("sourceId", item.sourceId())
                .addValue("category", item.category() != null ? item.category().name() : null)
                .addValue("title", item.title())
                .addValue("url", item.url())
                .addValue("summary", item.summary())
                .addValue("published", utc(item.published()))
                .addValue("retrieved", utc(item.retrieved()))
                .addValue("hash", item.hash())
                .addValue("severity", item.severity() != null ? item.severity().name() : null);
    }

    // stored with an explicit offset so the JVM's default zone never takes part
    private static OffsetDateTime utc(Instant instant) {
        return instant != null ? OffsetDateTime.ofInstant(instant, ZoneOffset.UTC) : null;
    }
}
