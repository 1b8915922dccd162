package com.mimecast.lodestar.server;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.Strictness;
import com.mimecast.lodestar.config.DiscoveryConfig;
import com.mimecast.lodestar.exception.ErrorClassifier;
import com.mimecast.lodestar.exception.ServerUnreachableException;
import com.mimecast.lodestar.http.HttpResult;
import com.mimecast.lodestar.http.WellKnownHttpClient;
import okhttp3.HttpUrl;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Optional;

/**
 * Delegation fetcher.
 * <p>Fetches the server well-known document of a server name.
 *
 * <p>Outcomes:
 * <ul>
 *   <li>Connect-level failure: thrown as {@link ServerUnreachableException}.</li>
 *   <li>Non-2xx status, other transport failure or unusable body: empty, no delegation.</li>
 *   <li>Document with an {@code m.server} value: present.</li>
 * </ul>
 * <p>No retries are made.
 */
public class DelegationFetcher {
    private static final Logger log = LogManager.getLogger(DelegationFetcher.class);

    static final String PATH = "/.well-known/matrix/server";

    static final String SERVER_KEY = "m.server";

    private static final Gson GSON = new GsonBuilder().setStrictness(Strictness.STRICT).create();

    private final WellKnownHttpClient httpClient;
    private final String scheme;
    private final int port;

    /**
     * Constructs a new DelegationFetcher instance.
     *
     * @param httpClient WellKnownHttpClient instance.
     * @param config     DiscoveryConfig instance.
     */
    public DelegationFetcher(WellKnownHttpClient httpClient, DiscoveryConfig config) {
        this.httpClient = httpClient;
        this.scheme = config.getScheme();
        this.port = config.getWellKnownPort();
    }

    /**
     * Fetches the delegation document.
     *
     * @param name Server name, a host without port.
     * @return Optional of ServerWellKnown instance.
     * @throws ServerUnreachableException Unable to connect.
     */
    public Optional<ServerWellKnown> fetch(String name) throws ServerUnreachableException {
        HttpUrl url = buildUrl(name);
        if (url == null) {
            log.debug("Unable to build well-known URL for: {}", name);
            return Optional.empty();
        }

        HttpResult result;
        try {
            result = httpClient.get(url.toString());
        } catch (IOException e) {
            if (ErrorClassifier.isConnectFailure(e)) {
                log.warn("Connect failure querying {}: {}", url, e.getMessage());
                throw new ServerUnreachableException(name, e);
            }
            log.debug("Well-known request to {} failed: {}", url, e.getMessage());
            return Optional.empty();
        }

        if (!result.isSuccessful()) {
            log.debug("Well-known request to {} returned status {}", url, result.getCode());
            return Optional.empty();
        }

        return parse(result.getBody());
    }

    /**
     * Parses a document body.
     * <p>The document must be a strict JSON object whose {@code m.server} member is a non-blank string.
     *
     * @param body Response body.
     * @return Optional of ServerWellKnown instance, empty when malformed.
     */
    static Optional<ServerWellKnown> parse(String body) {
        try {
            JsonObject document = GSON.fromJson(body, JsonObject.class);
            JsonElement server = document != null ? document.get(SERVER_KEY) : null;
            if (!isString(server) || server.getAsString().isBlank()) {
                log.debug("Well-known document has no m.server string");
                return Optional.empty();
            }
            return Optional.of(GSON.fromJson(document, ServerWellKnown.class));
        } catch (JsonParseException e) {
            log.debug("Well-known document is not valid JSON: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Checks element is a JSON string.
     *
     * @param element JsonElement instance, may be null.
     * @return Boolean.
     */
    private static boolean isString(JsonElement element) {
        return element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isString();
    }

    /**
     * Builds the well-known URL.
     *
     * @param name Server name.
     * @return HttpUrl instance or null if the name is not a valid host.
     */
    HttpUrl buildUrl(String name) {
        try {
            HttpUrl.Builder builder = new HttpUrl.Builder()
                    .scheme(scheme)
                    .host(name)
                    .encodedPath(PATH);
            if (port > 0) {
                builder.port(port);
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
