package io.infopulse.ingestion.api.util;

import org.apache.commons.codec.digest.DigestUtils;

import java.time.Instant;

/**
 * Identifier and fingerprint derivation for intelligence items.
 */
public final class Fingerprints {

    private Fingerprints() {
    }

    /**
     * Dedup key. Depends only on the content, so the same entry hashes identically no matter
     * which source carried it or when it was fetched. Case- and whitespace-sensitive.
     */
    public static String contentHash(String title, String url, String rawSummary) {
        return DigestUtils.md5Hex(nullToEmpty(title) + nullToEmpty(url) + nullToEmpty(rawSummary));
    }

    /**
     * Stable across cycles for the same (source, native entry id) pair.
     */
    public static String itemId(String sourceId, String nativeId) {
        return DigestUtils.md5Hex(sourceId + "|" + nativeId);
    }

    /**
     * Used when an entry has no native id. Changes on every fetch, so such items cannot be
     * looked up by id across cycles; the content hash still dedupes them.
     *
     * @param position index of the entry in the fetched feed, keeps ids distinct within one fetch
     */
    public static String fallbackItemId(String sourceId, Instant fetchedAt, int position) {
        return DigestUtils.md5Hex(sourceId + "|" + fetchedAt.toEpochMilli() + "|" + fetchedAt.getNano()
                + "|" + position);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
