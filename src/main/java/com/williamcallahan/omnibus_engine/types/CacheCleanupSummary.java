package com.williamcallahan.omnibus_engine.types;

/**
 * Outcome of a single sweep over the extracted-work cache directory.
 *
 * @param scanned files examined
 * @param deleted files removed because they reached the age limit
 * @param failed files that were due for removal but could not be deleted
 * @param skippedInFlight temporary files owned by a running extraction
 */
public record CacheCleanupSummary(int scanned, int deleted, int failed, int skippedInFlight) {

    public static CacheCleanupSummary empty() {
        return new CacheCleanupSummary(0, 0, 0, 0);
    }
}
