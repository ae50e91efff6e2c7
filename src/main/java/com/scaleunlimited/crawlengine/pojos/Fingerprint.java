package com.scaleunlimited.crawlengine.pojos;

import java.io.Serializable;

/**
 * Canonical identity of a crawl target. Two requests with equal fingerprints
 * are the same target, and only one of them is ever fetched.
 */
@SuppressWarnings("serial")
public final class Fingerprint implements Serializable {

    private final String _key;

    public Fingerprint(String key) {
        _key = key;
    }

    public String getKey() {
        return _key;
    }

    @Override
    public int hashCode() {
        return _key.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        Fingerprint other = (Fingerprint) obj;
        return _key.equals(other._key);
    }

    @Override
    public String toString() {
        return _key;
    }
}
