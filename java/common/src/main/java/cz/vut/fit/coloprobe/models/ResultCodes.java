package cz.vut.fit.coloprobe.models;

public final class ResultCodes {
    private ResultCodes() {
    }

    /**
     * The operation was successful.
     */
    public static final int OK = 0;

    /**
     * A generic error caused inside the probing system (e.g. invalid state).
     */
    public static final int INTERNAL_ERROR = 20;

    /**
     * Object does not exist.
     */
    public static final int NOT_FOUND = 30;

    /**
     * Invalid format of remote source's response.
     */
    public static final int INVALID_FORMAT = 40;

    /**
     * Error fetching from remote source.
     */
    public static final int CANNOT_FETCH = 50;

    /**
     * We are rate limited at the remote source.
     */
    public static final int RATE_LIMITED = 51;

    /**
     * The remote source did not respond in time.
     */
    public static final int TIMEOUT = 52;

    /**
     * Invalid domain name.
     */
    public static final int INVALID_DOMAIN_NAME = 60;

    /**
     * Invalid IP address.
     */
    public static final int INVALID_ADDRESS = 61;

    /**
     * The IP address is valid but cannot be used (e.g. IPv6 without local support).
     */
    public static final int UNSUPPORTED_ADDRESS = 62;

    /**
     * Unexpected DNS error.
     */
    public static final int OTHER_DNS_ERROR = 70;
}
