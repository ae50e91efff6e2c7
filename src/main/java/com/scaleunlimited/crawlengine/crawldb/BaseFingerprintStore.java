package com.scaleunlimited.crawlengine.crawldb;

import com.scaleunlimited.crawlengine.pojos.Fingerprint;

/**
 * Set of fingerprints that have been admitted during one crawl. Entries are
 * never removed while the crawl is running.
 */
public abstract class BaseFingerprintStore {

    /**
     * Lifecycle management - called once when the crawl starts.
     */
    public void open() throws Exception {
    }

    public abstract void close() throws Exception;

    /**
     * Atomically test-and-set.
     * 
     * @param fingerprint
     * @return true if this fingerprint had never been seen before (and now has been).
     */
    public abstract boolean markSeen(Fingerprint fingerprint);

    public abstract boolean contains(Fingerprint fingerprint);

    public abstract int size();
}
