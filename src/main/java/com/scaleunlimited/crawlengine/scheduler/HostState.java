package com.scaleunlimited.crawlengine.scheduler;

/**
 * Scheduler-side view of one host: what's in flight, when we last talked to
 * it, and how it has been behaving. Guarded by the scheduler's lock.
 */
public class HostState {

    public static final double LATENCY_ALPHA = 0.3;
    public static final double PENALTY_STEP = 1.0;
    public static final double PENALTY_DECAY = 0.5;
    public static final double MIN_PENALTY = 0.01;

    private final String _host;

    private int _inFlight;
    private long _lastDispatchTime;
    private long _lastCompletionTime;
    private double _latencyEma;
    private int _consecutiveFailures;
    private double _penalty;
    private boolean _degraded;
    private long _backoffUntil;

    public HostState(String host) {
        _host = host;
    }

    public String getHost() {
        return _host;
    }

    public int getInFlight() {
        return _inFlight;
    }

    public long getLastDispatchTime() {
        return _lastDispatchTime;
    }

    public long getLastCompletionTime() {
        return _lastCompletionTime;
    }

    /**
     * @return the later of the last dispatch and the last completion.
     */
    public long getLastActivityTime() {
        return Math.max(_lastDispatchTime, _lastCompletionTime);
    }

    public double getLatencyEma() {
        return _latencyEma;
    }

    public int getConsecutiveFailures() {
        return _consecutiveFailures;
    }

    public double getPenalty() {
        return _penalty;
    }

    public boolean isDegraded() {
        return _degraded;
    }

    public long getBackoffUntil() {
        return _backoffUntil;
    }

    void dispatched(long now) {
        _inFlight += 1;
        _lastDispatchTime = now;
    }

    void completed(long now, long latencyMs) {
        _inFlight -= 1;
        _lastCompletionTime = now;

        if (latencyMs > 0) {
            if (_latencyEma == 0.0) {
                _latencyEma = latencyMs;
            } else {
                _latencyEma = (LATENCY_ALPHA * latencyMs) + ((1.0 - LATENCY_ALPHA) * _latencyEma);
            }
        }
    }

    /**
     * @return true if this failure pushed the host over the threshold into degraded mode.
     */
    boolean failed(long now, int degradedThreshold, long degradedBackoffMs) {
        _consecutiveFailures += 1;
        if (_degraded) {
            _backoffUntil = now + degradedBackoffMs;
            return false;
        } else if (_consecutiveFailures >= degradedThreshold) {
            _degraded = true;
            _backoffUntil = now + degradedBackoffMs;
            return true;
        } else {
            return false;
        }
    }

    /**
     * @return true if the host was degraded, and now isn't.
     */
    boolean succeeded() {
        _consecutiveFailures = 0;
        if (_degraded) {
            _degraded = false;
            _backoffUntil = 0;
            return true;
        } else {
            return false;
        }
    }

    /**
     * @return true if the penalty changed.
     */
    boolean adjustPenalty(boolean unhealthy) {
        double oldPenalty = _penalty;
        if (unhealthy) {
            _penalty += PENALTY_STEP;
        } else {
            _penalty *= PENALTY_DECAY;
            if (_penalty < MIN_PENALTY) {
                _penalty = 0.0;
            }
        }

        return _penalty != oldPenalty;
    }

    @Override
    public String toString() {
        return String.format("%s: inFlight=%d, failures=%d, penalty=%.2f, degraded=%s", _host,
                _inFlight, _consecutiveFailures, _penalty, _degraded);
    }
}
