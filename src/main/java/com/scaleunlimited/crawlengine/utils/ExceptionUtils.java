package com.scaleunlimited.crawlengine.utils;

import org.apache.http.HttpStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.crawlengine.fetcher.AbortedFetchException;
import com.scaleunlimited.crawlengine.fetcher.BaseFetchException;
import com.scaleunlimited.crawlengine.fetcher.IOFetchException;
import com.scaleunlimited.crawlengine.fetcher.TimeoutFetchException;
import com.scaleunlimited.crawlengine.fetcher.UrlFetchException;
import com.scaleunlimited.crawlengine.pojos.ResponseStatus;

public class ExceptionUtils {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExceptionUtils.class);

    public static ResponseStatus mapHttpStatusToResponseStatus(int httpStatus) {
        switch (httpStatus) {
            case HttpStatus.SC_OK:
                return ResponseStatus.OK;

            case HttpStatus.SC_GATEWAY_TIMEOUT:
                return ResponseStatus.TIMEOUT;

            default:
                if (httpStatus < 100) {
                    LOGGER.warn("Invalid HTTP status: " + httpStatus);
                    return ResponseStatus.SERVER_ERROR;
                } else if (httpStatus < 400) {
                    return ResponseStatus.OK;
                } else if (httpStatus < 500) {
                    return ResponseStatus.CLIENT_ERROR;
                } else if (httpStatus < 600) {
                    return ResponseStatus.SERVER_ERROR;
                } else {
                    LOGGER.warn("Unknown status: " + httpStatus);
                    return ResponseStatus.SERVER_ERROR;
                }
        }
    }

    public static ResponseStatus mapExceptionToResponseStatus(BaseFetchException e) {
        if (e instanceof TimeoutFetchException) {
            return ResponseStatus.TIMEOUT;
        } else if (e instanceof AbortedFetchException) {
            AbortedFetchException afe = (AbortedFetchException) e;
            switch (afe.getAbortReason()) {
                case INTERRUPTED:
                    return ResponseStatus.TIMEOUT;

                case CONTENT_SIZE:
                case INVALID_MIMETYPE:
                    return ResponseStatus.CLIENT_ERROR;

                default:
                    throw new RuntimeException("Unknown abort reason: " + afe.getAbortReason());
            }
        } else if (e instanceof IOFetchException) {
            return ResponseStatus.NETWORK_ERROR;
        } else if (e instanceof UrlFetchException) {
            return ResponseStatus.CLIENT_ERROR;
        }

        LOGGER.warn("Unknown exception: " + e.getMessage());
        return ResponseStatus.NETWORK_ERROR;
    }

}
