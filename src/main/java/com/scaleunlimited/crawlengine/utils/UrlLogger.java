package com.scaleunlimited.crawlengine.utils;

import java.lang.reflect.InvocationTargetException;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.crawlengine.pojos.CrawlRequest;

/**
 * Per-URL activity trail. Goes to the debug log, and (when the test logger is
 * on the classpath) into a list that tests can make assertions against.
 */
public class UrlLogger {
    private static final Logger LOGGER = LoggerFactory.getLogger(UrlLogger.class);

    public static long NO_ACTIVITY_TIME = 0;

    private static String[] NO_METADATA = new String[0];

    private static IUrlLogger URL_LOGGER = loadLogger();

    private static AtomicLong LAST_ACTIVITY_TIME = new AtomicLong(NO_ACTIVITY_TIME);

    public static void clear() {
        if (URL_LOGGER != null) {
            URL_LOGGER.clear();
        } else {
            throw new IllegalStateException("No URL logging enabled");
        }
    }

    public static void record(Class<?> clazz, CrawlRequest request) {
        record(clazz, request, NO_METADATA);
    }

    public static void record(Class<?> clazz, CrawlRequest request, String... metaData) {
        if (LOGGER.isDebugEnabled()) {
            StringBuilder msg = new StringBuilder();
            msg.append(String.format("%s: %s", clazz.getSimpleName(), request.getUrl()));
            if (metaData.length > 0) {
                msg.append(" (");
                for (int i = 0; i < metaData.length; i += 2) {
                    if (i > 0) {
                        msg.append(", ");
                    }

                    msg.append(metaData[i]);
                    msg.append('=');
                    msg.append(metaData[i + 1]);
                }

                msg.append(')');
            }

            LOGGER.debug(msg.toString());
        }

        if (URL_LOGGER != null) {
            URL_LOGGER.record(clazz, request, metaData);
        }

        LAST_ACTIVITY_TIME.set(System.currentTimeMillis());
    }

    public static void resetActivityTime() {
        LAST_ACTIVITY_TIME.set(NO_ACTIVITY_TIME);
    }

    /**
     * @return time of last URL activity that was logged.
     */
    public static long getLastActivityTime() {
        return LAST_ACTIVITY_TIME.get();
    }

    public static List<UrlLogEntry> getLog() {
        if (URL_LOGGER != null) {
            return URL_LOGGER.getLog();
        } else {
            throw new IllegalStateException("No URL logging enabled");
        }
    }

    private static IUrlLogger loadLogger() {
        try {
            Class<?> clazz = UrlLogger.class.getClassLoader()
                    .loadClass("com.scaleunlimited.crawlengine.utils.TestUrlLogger");
            return (IUrlLogger) clazz.getDeclaredConstructor().newInstance();
        } catch (ClassNotFoundException e) {
            return null;
        } catch (IllegalAccessException | InstantiationException | NoSuchMethodException
                | InvocationTargetException e) {
            throw new RuntimeException("Can't create URL logger", e);
        }
    }

}
