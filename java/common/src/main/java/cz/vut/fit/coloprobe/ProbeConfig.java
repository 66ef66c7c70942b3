package cz.vut.fit.coloprobe;

/**
 * The configuration keys, descriptions and default values for the prober.
 */
@SuppressWarnings("ALL")
public class ProbeConfig {
    /* --- Orchestration --- */
    public static final String WORKERS_CONFIG = "probe.workers";
    public static final String WORKERS_DOC = "The number of targets probed in parallel.";
    public static final String WORKERS_DEFAULT = "80";

    public static final String THRESHOLD_MS_CONFIG = "probe.threshold.ms";
    public static final String THRESHOLD_MS_DOC =
            "Handshakes faster than this (milliseconds, exclusive) are classified as co-located.";
    public static final String THRESHOLD_MS_DEFAULT = "12.0";

    /* --- TLS prober --- */
    public static final String TLS_PORT_CONFIG = "probe.tls.port";
    public static final String TLS_PORT_DOC = "The TCP port to connect to.";
    public static final String TLS_PORT_DEFAULT = "443";

    public static final String TLS_TIMEOUT_MS_CONFIG = "probe.tls.timeout.ms";
    public static final String TLS_TIMEOUT_MS_DOC =
            "The time window for the TCP connect and the TLS handshake together (milliseconds).";
    public static final String TLS_TIMEOUT_MS_DEFAULT = "4000";

    /* --- DNS --- */
    public static final String DNS_RESOLVER_IPS_CONFIG = "dns.resolver.ips";
    public static final String DNS_RESOLVER_IPS_DOC =
            "Comma-separated nameserver IPs. The system resolvers are used when empty.";
    public static final String DNS_RESOLVER_IPS_DEFAULT = "";

    public static final String DNS_TIMEOUT_MS_CONFIG = "dns.timeout.ms";
    public static final String DNS_TIMEOUT_MS_DOC = "The timeout of a single A or PTR query (milliseconds).";
    public static final String DNS_TIMEOUT_MS_DEFAULT = "5000";

    /* --- Geolocation --- */
    public static final String GEO_URL_CONFIG = "geo.url";
    public static final String GEO_URL_DOC = "The geolocation service URL prefix; the IP address is appended to it.";
    public static final String GEO_URL_DEFAULT = "https://ipwhois.app/json/";

    public static final String GEO_TIMEOUT_MS_CONFIG = "geo.timeout.ms";
    public static final String GEO_TIMEOUT_MS_DOC = "The geolocation request timeout (milliseconds).";
    public static final String GEO_TIMEOUT_MS_DEFAULT = "5000";

    public static final String GEO_CACHE_ENABLED_CONFIG = "geo.cache.enabled";
    public static final String GEO_CACHE_ENABLED_DOC =
            "If true, successful lookups are reused for the same IP instead of querying the service again.";
    public static final String GEO_CACHE_ENABLED_DEFAULT = "false";

    public static final String GEO_CACHE_LIFETIME_S_CONFIG = "geo.cache.lifetime";
    public static final String GEO_CACHE_LIFETIME_S_DOC = "Geolocation cache entry lifetime (seconds).";
    public static final String GEO_CACHE_LIFETIME_S_DEFAULT = "600";

    /* --- Region classifier --- */
    public static final String REGION_RULES_CONFIG = "region.rules";
    public static final String REGION_RULES_DOC =
            "Ordered PTR substring rules as marker=label pairs separated by ';'. The first matching rule wins.";
    public static final String REGION_RULES_DEFAULT = "ap-northeast-1=AWS TOKYO";
}
