package com.scaleunlimited.crawlengine.utils;

import java.util.List;

import com.scaleunlimited.crawlengine.pojos.CrawlRequest;

public interface IUrlLogger {

    public void clear();

    public void record(Class<?> clazz, CrawlRequest request, String... metaData);

    public List<UrlLogEntry> getLog();

}
