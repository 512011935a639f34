package io.infopulse.ingestion.api.store;

import io.infopulse.ingestion.api.dto.IntelligenceItem;

import java.util.List;

/**
 * @param inserted items that were new, in submission order
 * @param skipped  items dropped as duplicates
 */
public record BatchInsertResult(
        List<IntelligenceItem> inserted,
        int skipped
) {
    public static BatchInsertResult empty() {
        return new BatchInsertResult(List.of(), 0);
    }

    public int insertedCount() {
        return inserted.size();
    }
}
