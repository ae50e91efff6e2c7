package com.scaleunlimited.crawlengine.scheduler;

public enum AdmissionResult {
    ADMITTED,
    REJECTED_DUPLICATE,
    REJECTED_DEPTH,
    REJECTED_FILTERED;

    public boolean isAdmitted() {
        return this == ADMITTED;
    }
}
