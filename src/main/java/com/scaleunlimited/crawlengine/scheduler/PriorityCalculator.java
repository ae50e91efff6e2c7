package com.scaleunlimited.crawlengine.scheduler;

import com.scaleunlimited.crawlengine.pojos.CrawlRequest;

public interface PriorityCalculator {

    double calculate(CrawlRequest request);

}
