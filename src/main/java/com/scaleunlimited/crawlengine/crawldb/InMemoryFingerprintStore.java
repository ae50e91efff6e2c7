package com.scaleunlimited.crawlengine.crawldb;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.crawlengine.pojos.Fingerprint;

public class InMemoryFingerprintStore extends BaseFingerprintStore {
    static final Logger LOGGER = LoggerFactory.getLogger(InMemoryFingerprintStore.class);

    private Set<Fingerprint> _seen;

    public InMemoryFingerprintStore() {
        super();

        _seen = ConcurrentHashMap.newKeySet();
    }

    @Override
    public void open() throws Exception {
        super.open();

        _seen.clear();
    }

    @Override
    public void close() throws Exception {
        LOGGER.debug("Closing fingerprint store with {} entries", _seen.size());
        _seen.clear();
    }

    @Override
    public boolean markSeen(Fingerprint fingerprint) {
        return _seen.add(fingerprint);
    }

    @Override
    public boolean contains(Fingerprint fingerprint) {
        return _seen.contains(fingerprint);
    }

    @Override
    public int size() {
        return _seen.size();
    }
}
