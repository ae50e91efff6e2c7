package com.scaleunlimited.crawlengine.utils;

import java.util.Map;

public class UrlLogEntry {

    private final Class<?> _clazz;
    private final String _url;
    private final Map<String, String> _metaData;

    public UrlLogEntry(Class<?> clazz, String url, Map<String, String> metaData) {
        _clazz = clazz;
        _url = url;
        _metaData = metaData;
    }

    public Class<?> getClazz() {
        return _clazz;
    }

    public String getUrl() {
        return _url;
    }

    public Map<String, String> getMetaData() {
        return _metaData;
    }

    @Override
    public String toString() {
        return String.format("%s: %s %s", _clazz.getSimpleName(), _url, _metaData);
    }
}
