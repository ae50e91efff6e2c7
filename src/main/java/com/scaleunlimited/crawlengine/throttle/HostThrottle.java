package com.scaleunlimited.crawlengine.throttle;

/**
 * Delay state for one host. All access goes through the owning
 * {@link AutoThrottle}, which synchronizes on this object.
 */
public class HostThrottle {

    private final String _host;

    private long _delayMs;
    private long _floorMs;
    private double _latencyEma;
    private double _errorRateEma;
    private int _numSamples;

    HostThrottle(String host, long startDelayMs, long floorMs) {
        _host = host;
        _delayMs = startDelayMs;
        _floorMs = floorMs;
        _latencyEma = 0.0;
        _errorRateEma = 0.0;
        _numSamples = 0;
    }

    public String getHost() {
        return _host;
    }

    public synchronized long getDelayMs() {
        return _delayMs;
    }

    public synchronized long getFloorMs() {
        return _floorMs;
    }

    public synchronized double getLatencyEma() {
        return _latencyEma;
    }

    public synchronized double getErrorRateEma() {
        return _errorRateEma;
    }

    public synchronized int getNumSamples() {
        return _numSamples;
    }

    void setDelayMs(long delayMs) {
        _delayMs = delayMs;
    }

    void setFloorMs(long floorMs) {
        _floorMs = floorMs;
    }

    void addSample(long latencyMs, boolean error, double alpha) {
        if (_numSamples == 0) {
            _latencyEma = latencyMs;
        } else {
            _latencyEma = (alpha * latencyMs) + ((1.0 - alpha) * _latencyEma);
        }

        _errorRateEma = (alpha * (error ? 1.0 : 0.0)) + ((1.0 - alpha) * _errorRateEma);
        _numSamples++;
    }

    @Override
    public synchronized String toString() {
        return String.format("%s: delay=%dms (floor %dms), latency=%.0fms, errorRate=%.2f", _host,
                _delayMs, _floorMs, _latencyEma, _errorRateEma);
    }
}
