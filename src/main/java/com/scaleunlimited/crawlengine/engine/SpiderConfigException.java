package com.scaleunlimited.crawlengine.engine;

/**
 * The spider can't be used to start a crawl.
 */
@SuppressWarnings("serial")
public class SpiderConfigException extends Exception {

    public SpiderConfigException(String msg) {
        super(msg);
    }

    public SpiderConfigException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
