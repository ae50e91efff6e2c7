package com.scaleunlimited.crawlengine.config;

public enum CrawlStrategy {

    /** Breadth first: shallow requests before deep ones. */
    BFO,

    /** Depth first: deep requests before shallow ones. */
    DFO,

    /** Plain FIFO, in admission order. */
    BASIC,

    /** Breadth first, with slow or failing hosts pushed back. */
    FEEDBACK;

}
