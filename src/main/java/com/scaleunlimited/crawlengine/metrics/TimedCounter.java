package com.scaleunlimited.crawlengine.metrics;

import java.util.Arrays;

/**
 * Rolling window of per-second counts, used for the fetches/second stat.
 */
public class TimedCounter {

    private int[] _countsPerSecond;
    private long _lastTimeInSeconds;
    private int _numSeconds;

    public TimedCounter(int numSeconds) {
        _numSeconds = numSeconds;
        _countsPerSecond = new int[_numSeconds];
        _lastTimeInSeconds = System.currentTimeMillis() / 1000L;
    }

    public void increment() {
        increment(System.currentTimeMillis());
    }

    public void increment(long timeInMS) {
        synchronized (_countsPerSecond) {
            shift(timeInMS);
            _countsPerSecond[_numSeconds - 1]++;
        }
    }

    public int getTotalCounts() {
        synchronized (_countsPerSecond) {
            int result = 0;
            for (int i = 0; i < _numSeconds; i++) {
                result += _countsPerSecond[i];
            }

            return result;
        }
    }

    /**
     * @param timeInMS current time
     * @return average count per second over the window ending at timeInMS
     */
    public double getRate(long timeInMS) {
        synchronized (_countsPerSecond) {
            shift(timeInMS);

            return (double) getTotalCounts() / _numSeconds;
        }
    }

    protected int[] getCountsPerSecond() {
        return _countsPerSecond;
    }

    private void shift(long timeInMS) {
        long timeInSeconds = timeInMS / 1000L;
        int deltaSeconds = (int) (timeInSeconds - _lastTimeInSeconds);
        if (deltaSeconds <= 0) {
            // Late arrivals count toward the current second.
            return;
        } else if (deltaSeconds >= _numSeconds) {
            // No need to shift, just clear everything.
            Arrays.fill(_countsPerSecond, 0);
        } else {
            // Shift values, clear new counts.
            System.arraycopy(_countsPerSecond, deltaSeconds, _countsPerSecond, 0,
                    _numSeconds - deltaSeconds);
            Arrays.fill(_countsPerSecond, _numSeconds - deltaSeconds, _numSeconds, 0);
        }

        _lastTimeInSeconds = timeInSeconds;
    }
}
