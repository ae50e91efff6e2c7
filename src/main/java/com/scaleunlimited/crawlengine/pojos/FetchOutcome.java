package com.scaleunlimited.crawlengine.pojos;

/**
 * What happened to one dispatched request. Exactly one of these is reported
 * back to the scheduler for every request it hands out.
 */
public class FetchOutcome {

    public enum Kind {
        SUCCESS,
        REDIRECT,
        SOFT_FAILURE,
        RETRY,
        TERMINAL_FAILURE
    }

    private final Kind _kind;
    private final ResponseStatus _status;
    private final FetchedResponse _response;
    private final String _redirectUrl;
    private final long _retryDelayMs;
    private final long _latencyMs;
    private final String _reason;

    private FetchOutcome(Kind kind, ResponseStatus status, FetchedResponse response,
            String redirectUrl, long retryDelayMs, long latencyMs, String reason) {
        _kind = kind;
        _status = status;
        _response = response;
        _redirectUrl = redirectUrl;
        _retryDelayMs = retryDelayMs;
        _latencyMs = latencyMs;
        _reason = reason;
    }

    public static FetchOutcome success(FetchedResponse response) {
        return new FetchOutcome(Kind.SUCCESS, ResponseStatus.OK, response, null, 0,
                response.getLatencyMs(), null);
    }

    public static FetchOutcome redirect(FetchedResponse response, String redirectUrl) {
        return new FetchOutcome(Kind.REDIRECT, ResponseStatus.OK, response, redirectUrl, 0,
                response.getLatencyMs(), null);
    }

    public static FetchOutcome softFailure(ResponseStatus status, FetchedResponse response,
            String reason) {
        long latency = (response == null) ? 0 : response.getLatencyMs();
        return new FetchOutcome(Kind.SOFT_FAILURE, status, response, null, 0, latency, reason);
    }

    /**
     * @param response the error response, or null if the attempt failed without one
     */
    public static FetchOutcome retry(ResponseStatus status, FetchedResponse response,
            long retryDelayMs, long latencyMs, String reason) {
        return new FetchOutcome(Kind.RETRY, status, response, null, retryDelayMs, latencyMs, reason);
    }

    public static FetchOutcome terminalFailure(ResponseStatus status, FetchedResponse response,
            long latencyMs, String reason) {
        return new FetchOutcome(Kind.TERMINAL_FAILURE, status, response, null, 0, latencyMs, reason);
    }

    public Kind getKind() {
        return _kind;
    }

    public ResponseStatus getStatus() {
        return _status;
    }

    public FetchedResponse getResponse() {
        return _response;
    }

    /**
     * @return HTTP status code of the response, or 0 if there wasn't one.
     */
    public int getHttpStatus() {
        return (_response == null) ? 0 : _response.getStatusCode();
    }

    public String getRedirectUrl() {
        return _redirectUrl;
    }

    public long getRetryDelayMs() {
        return _retryDelayMs;
    }

    public long getLatencyMs() {
        return _latencyMs;
    }

    public String getReason() {
        return _reason;
    }

    /**
     * @return true if the host answered in a way that counts as healthy for
     *         politeness feedback.
     */
    public boolean isHealthy() {
        return !_status.isServerSideError();
    }

    @Override
    public String toString() {
        StringBuilder result = new StringBuilder(_kind.name());
        result.append(" (").append(_status).append(')');
        if (_redirectUrl != null) {
            result.append(" -> ").append(_redirectUrl);
        }
        if (_reason != null) {
            result.append(": ").append(_reason);
        }
        return result.toString();
    }
}
