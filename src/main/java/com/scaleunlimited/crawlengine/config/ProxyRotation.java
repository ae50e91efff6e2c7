package com.scaleunlimited.crawlengine.config;

public enum ProxyRotation {
    RANDOM,
    ROUND_ROBIN
}
