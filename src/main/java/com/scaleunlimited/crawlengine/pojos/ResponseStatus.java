package com.scaleunlimited.crawlengine.pojos;

/**
 * Terminal classification of a single fetch attempt.
 */
public enum ResponseStatus {

    OK,
    CLIENT_ERROR,
    SERVER_ERROR,
    TIMEOUT,
    NETWORK_ERROR;

    /**
     * @return true if this status means the server (or the path to it) is struggling,
     *         and so is worth a retry and should slow down the host.
     */
    public boolean isServerSideError() {
        return (this == SERVER_ERROR) || (this == TIMEOUT) || (this == NETWORK_ERROR);
    }
}
