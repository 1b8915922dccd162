package com.mimecast.lodestar.config;

import java.io.IOException;
import java.util.Map;

/**
 * Discovery configuration.
 *
 * <p>This class provides type safe access to the settings used by the server and client resolvers
 * <br>and by the default HTTP client built for them.
 */
public class DiscoveryConfig extends ConfigFoundation {

    /**
     * Implicit federation port.
     */
    public static final int DEFAULT_PORT = 8448;

    /**
     * Constructs a new DiscoveryConfig instance with defaults.
     */
    public DiscoveryConfig() {
        super();
    }

    /**
     * Constructs a new DiscoveryConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public DiscoveryConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new DiscoveryConfig instance from file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public DiscoveryConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets URL scheme used for well-known fetches.
     *
     * @return Scheme string.
     */
    public String getScheme() {
        return getStringProperty("scheme", "https");
    }

    /**
     * Gets port used for the server well-known fetch.
     * <p>Zero means the scheme default.
     *
     * @return Port number.
     */
    public int getWellKnownPort() {
        return Math.toIntExact(getLongProperty("wellKnownPort", 0L));
    }

    /**
     * Gets implicit federation port.
     *
     * @return Port number.
     */
    public int getDefaultPort() {
        return Math.toIntExact(getLongProperty("defaultPort", (long) DEFAULT_PORT));
    }

    /**
     * Gets connect timeout in seconds.
     *
     * @return Timeout in seconds.
     */
    public int getConnectTimeout() {
        return Math.toIntExact(getLongProperty("connectTimeout", 10L));
    }

    /**
     * Gets read timeout in seconds.
     *
     * @return Timeout in seconds.
     */
    public int getReadTimeout() {
        return Math.toIntExact(getLongProperty("readTimeout", 10L));
    }

    /**
     * Should HTTP redirects be followed.
     *
     * @return Boolean.
     */
    public boolean isFollowRedirects() {
        return getBooleanProperty("followRedirects", true);
    }

    /**
     * Gets HTTP cache directory.
     * <p>Empty disables caching.
     *
     * @return Directory path string.
     */
    public String getCacheDirectory() {
        return getStringProperty("cacheDirectory", "");
    }

    /**
     * Gets HTTP cache size in bytes.
     *
     * @return Size in bytes.
     */
    public long getCacheSize() {
        return getLongProperty("cacheSize", 10L * 1024 * 1024);
    }

    /**
     * Gets User-Agent header value.
     *
     * @return User agent string.
     */
    public String getUserAgent() {
        return getStringProperty("userAgent", "lodestar");
    }
}
