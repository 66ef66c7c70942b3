package cz.vut.fit.coloprobe.models.results;

import cz.vut.fit.coloprobe.models.ResultCodes;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * A result of a best-effort lookup (DNS, reverse DNS, geolocation). Callers that only need a value collapse
 * failed lookups to their documented default with {@link #orElse(Object)}.
 *
 * @param data The looked-up value. Non-null iff the lookup succeeded.
 * @param <T>  The type of the looked-up value.
 */
public record LookupResult<T>(int statusCode,
                              @Nullable String error,
                              @NotNull Instant lastAttempt,
                              @Nullable T data) implements Result {

    public static <T> LookupResult<T> of(@NotNull T data) {
        return new LookupResult<>(ResultCodes.OK, null, Instant.now(), data);
    }

    public static <T> LookupResult<T> error(int code, @Nullable String message) {
        return new LookupResult<>(code, message, Instant.now(), null);
    }

    public T orElse(T fallback) {
        return this.success() && data != null ? data : fallback;
    }
}
