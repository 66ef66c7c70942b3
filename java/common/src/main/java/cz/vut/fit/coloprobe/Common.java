package cz.vut.fit.coloprobe;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.MapperBuilder;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

import java.util.Properties;

/**
 * Common utility functions and constants.
 */
public final class Common {
    private Common() {
    }

    /**
     * Creates a new Jackson JSON {@link ObjectMapper} builder with the following settings:
     * <ul>
     *     <li>Include the JavaTimeModule to support Java 8 date/time datatypes.</li>
     *     <li>Include source locations in exceptions.</li>
     *     <li>Write date timestamps as ISO-8601 strings.</li>
     *     <li>Do not fail on unknown properties.</li>
     * </ul>
     *
     * @return a new {@link ObjectMapper} builder
     */
    public static MapperBuilder<? extends ObjectMapper, ?> makeMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .configure(JsonParser.Feature.INCLUDE_SOURCE_IN_LOCATION, true)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Creates a logger for a specific pipeline component. The logger name will be created by concatenating
     * the class name, a dot, and the value of the static field {@code COMPONENT_NAME} in the class.
     *
     * @param clazz the class to get the logger for
     * @return a SLF4J {@link Logger} instance
     */
    public static Logger getComponentLogger(Class<?> clazz) {
        try {
            final String componentName = clazz.getField("COMPONENT_NAME")
                    .get(null).toString();
            return org.slf4j.LoggerFactory.getLogger(clazz.getName() + "." + componentName);
        } catch (IllegalAccessException | NoSuchFieldException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Converts a duration in nanoseconds to milliseconds rounded half-up to two decimal places.
     *
     * @param nanos a non-negative duration in nanoseconds
     * @return the duration in milliseconds, e.g. {@code 12.35} for {@code 12_345_678} ns
     */
    public static double nanosToRoundedMillis(long nanos) {
        return Math.round(nanos / 10_000.0) / 100.0;
    }

    /**
     * Reads an integer configuration value.
     *
     * @throws NumberFormatException if the configured value is not an integer.
     */
    public static int getInt(@NotNull Properties properties, @NotNull String key, @NotNull String defaultValue) {
        return Integer.parseInt(properties.getProperty(key, defaultValue).trim());
    }

    /**
     * Reads a floating-point configuration value.
     *
     * @throws NumberFormatException if the configured value is not a number.
     */
    public static double getDouble(@NotNull Properties properties, @NotNull String key, @NotNull String defaultValue) {
        return Double.parseDouble(properties.getProperty(key, defaultValue).trim());
    }

    public static boolean getBoolean(@NotNull Properties properties, @NotNull String key, @NotNull String defaultValue) {
        return Boolean.parseBoolean(properties.getProperty(key, defaultValue).trim());
    }
}
