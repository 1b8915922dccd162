package com.mimecast.lodestar.main;

import com.mimecast.lodestar.config.DiscoveryConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Master configuration container.
 *
 * <p>DiscoveryConfig holds the resolver and HTTP client settings.
 * <p>Defaults apply until a config is set.
 *
 * @see DiscoveryConfig
 */
public class Config {
    private static final Logger log = LogManager.getLogger(Config.class);

    /**
     * Protected constructor.
     */
    private Config() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Discovery configuration.
     */
    private static volatile DiscoveryConfig discovery = new DiscoveryConfig();

    /**
     * Gets discovery config.
     *
     * @return DiscoveryConfig.
     */
    public static DiscoveryConfig getDiscovery() {
        return discovery;
    }

    /**
     * Sets discovery config.
     *
     * @param config DiscoveryConfig instance.
     */
    public static void setDiscovery(DiscoveryConfig config) {
        discovery = config != null ? config : new DiscoveryConfig();
        log.debug("Discovery config set: scheme={} defaultPort={}", discovery.getScheme(), discovery.getDefaultPort());
    }
}
