package com.scaleunlimited.crawlengine.metrics;

public class CounterUtils {

    private static final String DELIMITER = "->";

    private CounterUtils() {
        // Enforce class isn't instantiated
    }

    public static String enumToGroup(Enum<?> e) {
        return e.getDeclaringClass().getSimpleName();
    }

    /**
     * Convert an Enum to the counter portion of its name.
     *
     * @param e
     * @return
     */
    public static String enumToCounter(Enum<?> e) {
        return e.name();
    }

    public static String enumToKey(Enum<?> e) {
        return mergeGroupCounter(enumToGroup(e), enumToCounter(e));
    }

    public static String mergeGroupCounter(String group, String counter) {
        return group + DELIMITER + counter;
    }

    public static boolean accInGroup(String group, String accKey) {
        return accKey.startsWith(group + DELIMITER);
    }

    public static String groupCounterToGroup(String groupKey) {
        return groupKey.split(DELIMITER)[0];
    }

    public static String groupCounterToCounter(String groupKey) {
        return groupKey.split(DELIMITER)[1];
    }
}
