package com.mimecast.lodestar.config;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DiscoveryConfigTest {

    private static String resource(String name) throws URISyntaxException {
        URL url = DiscoveryConfigTest.class.getClassLoader().getResource(name);
        assertNotNull(url, "Missing test resource " + name);
        return Path.of(url.toURI()).toString();
    }

    @Test
    void defaults() {
        DiscoveryConfig config = new DiscoveryConfig();

        assertEquals("https", config.getScheme());
        assertEquals(0, config.getWellKnownPort());
        assertEquals(DiscoveryConfig.DEFAULT_PORT, config.getDefaultPort());
        assertEquals(10, config.getConnectTimeout());
        assertEquals(10, config.getReadTimeout());
        assertTrue(config.isFollowRedirects());
        assertEquals("", config.getCacheDirectory());
        assertEquals(10L * 1024 * 1024, config.getCacheSize());
        assertEquals("lodestar", config.getUserAgent());
    }

    @Test
    void map() {
        Map<String, Object> map = new HashMap<>();
        map.put("scheme", "http");
        map.put("defaultPort", "8008");
        map.put("followRedirects", "false");
        map.put("cacheSize", 2048.0);
        DiscoveryConfig config = new DiscoveryConfig(map);

        assertEquals("http", config.getScheme());
        assertEquals(8008, config.getDefaultPort());
        assertFalse(config.isFollowRedirects());
        assertEquals(2048L, config.getCacheSize());
    }

    @Test
    void invalidNumberUsesDefault() {
        Map<String, Object> map = new HashMap<>();
        map.put("connectTimeout", "soon");

        assertEquals(10, new DiscoveryConfig(map).getConnectTimeout());
    }

    @Test
    void file() throws IOException, URISyntaxException {
        DiscoveryConfig config = new DiscoveryConfig(resource("cfg/discovery.json5"));

        assertEquals("http", config.getScheme());
        assertEquals(8080, config.getWellKnownPort());
        assertEquals(3, config.getConnectTimeout());
        assertEquals(5, config.getReadTimeout());
        assertFalse(config.isFollowRedirects());
        assertEquals("lodestar-test", config.getUserAgent());
        assertEquals("", config.getCacheDirectory());
    }

    @Test
    void missingFile() {
        assertThrows(IOException.class, () -> new DiscoveryConfig("/nonexistent/discovery.json5"));
    }
}
