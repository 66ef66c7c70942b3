package cz.vut.fit.coloprobe.tls;

import cz.vut.fit.coloprobe.models.results.ProbeOutcome;
import org.jetbrains.annotations.NotNull;

/**
 * Measures how long it takes to establish a connection with a target.
 */
public interface HandshakeProber {
    /**
     * Probes a single IP address. Implementations never throw; failures are reported
     * in the returned outcome together with the time elapsed until the failure.
     *
     * @param ip          The IP address to connect to.
     * @param sniHostName The host name to present in the SNI extension.
     * @return The measurement.
     */
    @NotNull
    ProbeOutcome probe(@NotNull String ip, @NotNull String sniHostName);
}
