package io.github.flameyossnowy.skeletal.api.utils;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.util.function.Supplier;

/**
 * Small logging facade used across Skeletal.
 *
 * <p>{@link #ENABLED} switches every message off at once, {@link #DEEP} enables the
 * very chatty pipeline tracing emitted through {@link #deepInfo(Supplier)}.</p>
 */
public final class Logging {
    public static boolean ENABLED = true;
    public static boolean DEEP = false;

    private static final Logger LOGGER = LoggerFactory.getLogger("Skeletal");
    private static final Marker CRITICAL = MarkerFactory.getMarker("CRITICAL");

    private Logging() {}

    public static void info(String message) {
        if (ENABLED) LOGGER.info(message);
    }

    public static void warn(String message) {
        if (ENABLED) LOGGER.warn(message);
    }

    public static void error(String message) {
        if (ENABLED) LOGGER.error(message);
    }

    public static void error(String message, Throwable throwable) {
        if (ENABLED) LOGGER.error(message, throwable);
    }

    /**
     * Logs a data integrity problem. These are never filtered by {@link #ENABLED}.
     */
    public static void critical(String message) {
        LOGGER.error(CRITICAL, message);
    }

    public static void deepInfo(@NotNull Supplier<String> message) {
        if (ENABLED && DEEP) LOGGER.info(message.get());
    }
}
