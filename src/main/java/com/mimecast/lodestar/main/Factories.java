package com.mimecast.lodestar.main;

import com.mimecast.lodestar.dns.DnsClient;
import com.mimecast.lodestar.dns.XBillDnsClient;
import com.mimecast.lodestar.http.OkHttpWellKnownClient;
import com.mimecast.lodestar.http.WellKnownHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.Callable;

/**
 * Factories for pluggable components.
 *
 * <p>This is a factories container for the network clients used by the resolvers.
 * <p>Defaults are built once from {@link Config#getDiscovery()} on first use and shared,
 * <br>so all resolvers share one connection pool and one HTTP cache.
 * <p>Set the discovery config before the first resolver is built.
 */
public class Factories {
    private static final Logger log = LogManager.getLogger(Factories.class);

    /**
     * HTTP client.
     * <p>Used for well-known fetches and client target validation.
     */
    private static Callable<WellKnownHttpClient> httpClient;

    /**
     * DNS client.
     * <p>Used for SRV and address lookups.
     */
    private static Callable<DnsClient> dnsClient;

    /**
     * Shared default clients.
     */
    private static volatile WellKnownHttpClient defaultHttpClient;
    private static volatile DnsClient defaultDnsClient;

    /**
     * Protected constructor.
     */
    private Factories() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Sets HTTP client.
     *
     * @param callback WellKnownHttpClient callable, null restores the default.
     */
    public static void setHttpClient(Callable<WellKnownHttpClient> callback) {
        httpClient = callback;
    }

    /**
     * Gets HTTP client.
     *
     * @return WellKnownHttpClient instance.
     */
    public static WellKnownHttpClient getHttpClient() {
        if (httpClient != null) {
            try {
                return httpClient.call();
            } catch (Exception e) {
                log.error("Error calling HTTP client factory: {}", e.getMessage());
            }
        }

        return getDefaultHttpClient();
    }

    /**
     * Gets the shared default HTTP client, building it on first use.
     *
     * @return WellKnownHttpClient instance.
     */
    private static synchronized WellKnownHttpClient getDefaultHttpClient() {
        if (defaultHttpClient == null) {
            defaultHttpClient = new OkHttpWellKnownClient(Config.getDiscovery());
            log.debug("Built default HTTP client");
        }
        return defaultHttpClient;
    }

    /**
     * Sets DNS client.
     *
     * @param callback DnsClient callable, null restores the default.
     */
    public static void setDnsClient(Callable<DnsClient> callback) {
        dnsClient = callback;
    }

    /**
     * Gets DNS client.
     *
     * @return DnsClient instance.
     */
    public static DnsClient getDnsClient() {
        if (dnsClient != null) {
            try {
                return dnsClient.call();
            } catch (Exception e) {
                log.error("Error calling DNS client factory: {}", e.getMessage());
            }
        }

        return getDefaultDnsClient();
    }

    /**
     * Gets the shared default DNS client, building it on first use.
     *
     * @return DnsClient instance.
     */
    private static synchronized DnsClient getDefaultDnsClient() {
        if (defaultDnsClient == null) {
            defaultDnsClient = new XBillDnsClient();
        }
        return defaultDnsClient;
    }
}
