package cz.vut.fit.coloprobe.models;

/**
 * The verdict for a single probed target.
 */
public enum ColoStatus {
    /**
     * The handshake succeeded faster than the threshold.
     */
    COLO,
    /**
     * The handshake succeeded but was not faster than the threshold.
     */
    SLOW,
    /**
     * The connection or the handshake failed.
     */
    FAIL
}
