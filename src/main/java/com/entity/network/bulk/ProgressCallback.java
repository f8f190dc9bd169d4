package com.entity.network.bulk;

/**
 * Receives progress of a feed read or an artifact write.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed records handled so far
     * @param total     total records, or -1 while still unknown
     * @param message   short human-readable status
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
