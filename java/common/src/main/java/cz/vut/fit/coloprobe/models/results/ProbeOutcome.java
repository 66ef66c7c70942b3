package cz.vut.fit.coloprobe.models.results;

import cz.vut.fit.coloprobe.models.ResultCodes;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * A record representing a result of a single TLS handshake measurement.
 *
 * @param ip        The probed IP address.
 * @param latencyMs The time from the start of the connection to the handshake completion or to the failure,
 *                  in milliseconds rounded to two decimal places. Present on failures too.
 */
public record ProbeOutcome(int statusCode,
                           @Nullable String error,
                           @NotNull Instant lastAttempt,
                           @NotNull String ip,
                           double latencyMs) implements Result {

    public static ProbeOutcome ok(@NotNull String ip, double latencyMs) {
        return new ProbeOutcome(ResultCodes.OK, null, Instant.now(), ip, latencyMs);
    }

    public static ProbeOutcome failed(@NotNull String ip, double latencyMs, int code, @Nullable String message) {
        return new ProbeOutcome(code, message, Instant.now(), ip, latencyMs);
    }
}
