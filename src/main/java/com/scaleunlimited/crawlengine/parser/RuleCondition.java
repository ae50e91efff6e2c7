package com.scaleunlimited.crawlengine.parser;

public enum RuleCondition {
    FOLLOW,
    PARSE,
    BOTH;

    public boolean isFollow() {
        return this != PARSE;
    }

    public boolean isParse() {
        return this != FOLLOW;
    }
}
