package cz.vut.fit.coloprobe.tls;

import com.google.common.net.InetAddresses;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import cz.vut.fit.coloprobe.Common;
import cz.vut.fit.coloprobe.ProbeConfig;
import cz.vut.fit.coloprobe.models.ResultCodes;
import cz.vut.fit.coloprobe.models.results.ProbeOutcome;
import org.jetbrains.annotations.NotNull;

import javax.net.ssl.*;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.security.GeneralSecurityException;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Measures the time of a TCP connect followed by a TLS handshake.
 * <p>
 * The peer certificate and the host name are not verified. Every handshake uses its own SSL context,
 * so no session is ever resumed. The connect and the handshake share a single time window; when it
 * runs out, the connection is closed no matter how far the handshake got.
 */
public class TLSHandshakeProber implements HandshakeProber, Closeable {
    public static final String COMPONENT_NAME = "prober-tls";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(TLSHandshakeProber.class);

    private final int _port;
    private final int _timeout;
    private final ScheduledThreadPoolExecutor _deadlines;

    public TLSHandshakeProber(int port, int timeoutMs) {
        _port = port;
        _timeout = timeoutMs;

        try {
            newContext();
        } catch (GeneralSecurityException e) {
            // Should not happen
            Logger.error("TLS context error", e);
            throw new IllegalStateException("Cannot create the TLS context", e);
        }

        _deadlines = new ScheduledThreadPoolExecutor(1, new ThreadFactoryBuilder()
                .setNameFormat(COMPONENT_NAME + "-deadline-%d")
                .setDaemon(true)
                .build());
        _deadlines.setRemoveOnCancelPolicy(true);
    }

    public TLSHandshakeProber(@NotNull Properties properties) {
        this(Common.getInt(properties, ProbeConfig.TLS_PORT_CONFIG, ProbeConfig.TLS_PORT_DEFAULT),
                Common.getInt(properties, ProbeConfig.TLS_TIMEOUT_MS_CONFIG, ProbeConfig.TLS_TIMEOUT_MS_DEFAULT));
    }

    @Override
    public @NotNull ProbeOutcome probe(@NotNull String ip, @NotNull String sniHostName) {
        final SSLSocketFactory factory;
        try {
            factory = newContext().getSocketFactory();
        } catch (GeneralSecurityException e) {
            Logger.error("[{}] TLS context error", sniHostName, e);
            return ProbeOutcome.failed(ip, 0.0, ResultCodes.INTERNAL_ERROR,
                    "Cannot create the TLS context: " + e.getMessage());
        }

        final long start = System.nanoTime();
        final InetAddress address;
        final SNIHostName serverName;
        try {
            address = InetAddresses.forString(ip);
        } catch (IllegalArgumentException e) {
            Logger.debug("[{}] Cannot use address {}", sniHostName, ip);
            return failed(ip, start, ResultCodes.UNSUPPORTED_ADDRESS, "Cannot use this address: " + ip);
        }
        try {
            serverName = new SNIHostName(sniHostName);
        } catch (IllegalArgumentException e) {
            Logger.debug("[{}] Invalid SNI host name", sniHostName);
            return failed(ip, start, ResultCodes.INVALID_DOMAIN_NAME, e.getMessage());
        }

        final var expired = new AtomicBoolean(false);
        try (var rawSocket = new Socket()) {
            // Closing the socket breaks any connect or read in progress
            final ScheduledFuture<?> deadline = _deadlines.schedule(() -> {
                expired.set(true);
                closeOnDeadline(rawSocket, sniHostName, ip);
            }, _timeout, TimeUnit.MILLISECONDS);

            try {
                return handshake(rawSocket, factory, address, ip, serverName, start);
            } finally {
                deadline.cancel(false);
            }
        } catch (SocketTimeoutException e) {
            Logger.debug("[{}] Connection to {} timed out", sniHostName, ip);
            return failed(ip, start, ResultCodes.TIMEOUT, "Timed out (%d ms)".formatted(_timeout));
        } catch (IOException e) {
            if (expired.get()) {
                Logger.debug("[{}] Handshake with {} did not finish in time", sniHostName, ip);
                return failed(ip, start, ResultCodes.TIMEOUT,
                        "Handshake did not finish within %d ms".formatted(_timeout));
            }
            if (e instanceof SSLHandshakeException) {
                Logger.debug("[{}] TLS handshake error at {}: {}", sniHostName, ip, e.getMessage());
                return failed(ip, start, ResultCodes.CANNOT_FETCH, "Handshake error: " + e.getMessage());
            }
            Logger.debug("[{}] TLS error at {}: {}", sniHostName, ip, e.getMessage());
            return failed(ip, start, ResultCodes.CANNOT_FETCH, e.getMessage());
        }
    }

    private ProbeOutcome handshake(Socket rawSocket, SSLSocketFactory factory, InetAddress address, String ip,
                                   SNIHostName serverName, long start) throws IOException {
        final var name = serverName.getAsciiName();
        Logger.trace("[{}] Connecting to {}:{}", name, ip, _port);
        rawSocket.connect(new InetSocketAddress(address, _port), _timeout);

        // Make the TLS layer
        try (var socket = (SSLSocket) factory.createSocket(rawSocket, ip, _port, false)) {
            socket.setSoTimeout(remainingMillis(start));

            // Enable SNI; no endpoint identification algorithm is set, so the host name is not verified
            SSLParameters sslParams = socket.getSSLParameters();
            sslParams.setServerNames(List.of(serverName));
            socket.setSSLParameters(sslParams);

            Logger.trace("[{}] Starting TLS handshake with {}", name, ip);
            socket.startHandshake();

            final var latency = Common.nanosToRoundedMillis(System.nanoTime() - start);
            Logger.trace("[{}] Handshake with {} done in {} ms", name, ip, latency);
            return ProbeOutcome.ok(ip, latency);
        }
    }

    private static SSLContext newContext() throws GeneralSecurityException {
        // A new SSL context with a naive trust manager that accepts all certificates
        var context = SSLContext.getInstance("TLS");
        context.init(null, new TrustManager[]{new NaiveTrustManager()}, null);
        return context;
    }

    private static void closeOnDeadline(Socket socket, String sniHostName, String ip) {
        Logger.trace("[{}] Time window for {} is over, closing the connection", sniHostName, ip);
        try {
            socket.close();
        } catch (IOException e) {
            Logger.debug("[{}] Cannot close the connection to {}: {}", sniHostName, ip, e.getMessage());
        }
    }

    private int remainingMillis(long start) {
        final long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        // Zero would mean an infinite timeout
        return (int) Math.max(1, _timeout - elapsedMs);
    }

    private static ProbeOutcome failed(String ip, long start, int code, String message) {
        return ProbeOutcome.failed(ip, Common.nanosToRoundedMillis(System.nanoTime() - start), code, message);
    }

    public int getPort() {
        return _port;
    }

    public int getTimeout() {
        return _timeout;
    }

    @Override
    public void close() {
        _deadlines.shutdownNow();
    }
}
