package com.mimecast.lodestar.http;

import com.mimecast.lodestar.config.DiscoveryConfig;
import okhttp3.Cache;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * OkHttp well-known client.
 * <p>Production implementation backed by a pooled {@link OkHttpClient}.
 * <p>When a cache directory is configured responses are cached following their HTTP cache headers.
 */
public class OkHttpWellKnownClient implements WellKnownHttpClient {
    private static final Logger log = LogManager.getLogger(OkHttpWellKnownClient.class);

    private final OkHttpClient httpClient;
    private final String userAgent;

    /**
     * Constructs a new OkHttpWellKnownClient instance from configuration.
     *
     * @param config DiscoveryConfig instance.
     */
    public OkHttpWellKnownClient(DiscoveryConfig config) {
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .connectTimeout(config.getConnectTimeout(), TimeUnit.SECONDS)
                .readTimeout(config.getReadTimeout(), TimeUnit.SECONDS)
                .followRedirects(config.isFollowRedirects())
                .followSslRedirects(config.isFollowRedirects());

        String cacheDirectory = config.getCacheDirectory();
        if (!cacheDirectory.isEmpty()) {
            builder.cache(new Cache(new File(cacheDirectory), config.getCacheSize()));
            log.debug("HTTP cache enabled in {}", cacheDirectory);
        }

        this.httpClient = builder.build();
        this.userAgent = config.getUserAgent();
    }

    /**
     * Constructs a new OkHttpWellKnownClient instance with given client.
     *
     * @param httpClient OkHttpClient instance.
     * @param userAgent  User-Agent header value.
     */
    public OkHttpWellKnownClient(OkHttpClient httpClient, String userAgent) {
        this.httpClient = httpClient;
        this.userAgent = userAgent;
    }

    @Override
    public HttpResult get(String url) throws IOException {
        Request request = new Request.Builder()
                .url(url)
                .header("User-Agent", userAgent)
                .header("Accept", "application/json")
                .get()
                .build();

        log.debug("GET {}", url);
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            HttpResult result = new HttpResult(response.code(), body != null ? body.string() : "");
            log.debug("GET {} returned {}", url, response.code());
            return result;
        }
    }

    /**
     * Gets the underlying client.
     *
     * @return OkHttpClient instance.
     */
    public OkHttpClient getHttpClient() {
        return httpClient;
    }
}
