package com.mimecast.lodestar.client;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.Strictness;
import com.mimecast.lodestar.config.DiscoveryConfig;
import com.mimecast.lodestar.exception.ClientDiscoveryException;
import com.mimecast.lodestar.exception.ErrorClassifier;
import com.mimecast.lodestar.exception.HardFailureException;
import com.mimecast.lodestar.http.HttpResult;
import com.mimecast.lodestar.http.WellKnownHttpClient;
import com.mimecast.lodestar.main.Config;
import com.mimecast.lodestar.main.Factories;
import okhttp3.HttpUrl;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Client well-known resolver.
 * <p>Finds the client-server API base URL of an account domain.
 *
 * <p>Process:
 * <ol>
 *   <li>GET {@code /.well-known/matrix/client} on the domain.</li>
 *   <li>404: no delegation, the domain itself is the base URL.</li>
 *   <li>Transport failure, other non-2xx status or unusable document: prompt failure.</li>
 *   <li>Parse {@code m.homeserver.base_url}, invalid: hard failure.</li>
 *   <li>GET {@code <base_url>/_matrix/client/versions}, any failure: hard failure.</li>
 *   <li>If {@code m.identity_server} is present GET {@code <base_url>/_matrix/identity/api/v1}, any failure: hard failure.</li>
 * </ol>
 */
public class ClientWellKnownResolver {
    private static final Logger log = LogManager.getLogger(ClientWellKnownResolver.class);

    static final String WELL_KNOWN_PATH = ".well-known/matrix/client";
    static final String VERSIONS_PATH = "_matrix/client/versions";
    static final String IDENTITY_PATH = "_matrix/identity/api/v1";

    static final String HOMESERVER_KEY = "m.homeserver";
    static final String IDENTITY_SERVER_KEY = "m.identity_server";
    static final String BASE_URL_KEY = "base_url";

    private static final Gson GSON = new GsonBuilder().setStrictness(Strictness.STRICT).create();

    private final WellKnownHttpClient httpClient;
    private final String scheme;

    /**
     * Constructs a new ClientWellKnownResolver instance with the factory client and global config.
     */
    public ClientWellKnownResolver() {
        this(Factories.getHttpClient(), Config.getDiscovery());
    }

    /**
     * Constructs a new ClientWellKnownResolver instance.
     *
     * @param httpClient WellKnownHttpClient instance.
     * @param config     DiscoveryConfig instance.
     */
    public ClientWellKnownResolver(WellKnownHttpClient httpClient, DiscoveryConfig config) {
        this.httpClient = httpClient;
        this.scheme = config.getScheme();
    }

    /**
     * Resolves the base URL for the client-server API.
     *
     * @param domain Account domain, optionally with port.
     * @return Validated homeserver base URL.
     * @throws ClientDiscoveryException Prompt or hard failure.
     */
    public HttpUrl resolve(String domain) throws ClientDiscoveryException {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("Domain must not be blank");
        }

        HttpUrl base = HttpUrl.parse(scheme + "://" + domain);
        if (base == null) {
            throw ErrorClassifier.invalidUrl(domain, null);
        }

        HttpUrl wellKnownUrl = base.resolve(WELL_KNOWN_PATH);
        HttpResult response;
        try {
            response = httpClient.get(String.valueOf(wellKnownUrl));
        } catch (IOException e) {
            throw ErrorClassifier.prompt(domain, e);
        }

        if (response.getCode() == 404) {
            log.info("No client well-known for {}, using domain", domain);
            return base;
        }
        if (!response.isSuccessful()) {
            throw ErrorClassifier.prompt(domain, new IOException("HTTP " + response.getCode()));
        }

        JsonObject document;
        try {
            document = GSON.fromJson(response.getBody(), JsonObject.class);
        } catch (JsonParseException e) {
            throw ErrorClassifier.prompt(domain, e);
        }
        if (document == null || !isString(baseUrlOf(document, HOMESERVER_KEY))) {
            throw ErrorClassifier.prompt(domain, new JsonParseException("Missing m.homeserver.base_url string"));
        }

        JsonElement identityElement = document.get(IDENTITY_SERVER_KEY);
        if (identityElement != null && !identityElement.isJsonNull() && !isString(baseUrlOf(document, IDENTITY_SERVER_KEY))) {
            throw ErrorClassifier.invalidUrl(String.valueOf(identityElement), null);
        }

        ClientWellKnown wellKnown;
        try {
            wellKnown = GSON.fromJson(document, ClientWellKnown.class);
        } catch (JsonParseException e) {
            throw ErrorClassifier.prompt(domain, e);
        }

        HttpUrl homeserver = parseUrl(wellKnown.getHomeserver().getBaseUrl());
        validateVersions(homeserver);

        ClientWellKnown.IdentityServerInfo identity = wellKnown.getIdentityServer();
        if (identity != null) {
            validateIdentity(parseUrl(identity.getBaseUrl()));
        }

        log.info("Client base URL for {} is {}", domain, homeserver);
        return homeserver;
    }

    /**
     * Gets the base_url member of a server entry.
     *
     * @param document Well-known document.
     * @param key      Server entry key.
     * @return JsonElement instance or null if the entry is not an object.
     */
    private static JsonElement baseUrlOf(JsonObject document, String key) {
        JsonElement entry = document.get(key);
        return entry != null && entry.isJsonObject() ? entry.getAsJsonObject().get(BASE_URL_KEY) : null;
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
     * Parses a base URL found in the document.
     *
     * @param url URL string.
     * @return HttpUrl instance.
     * @throws HardFailureException Invalid URL.
     */
    private static HttpUrl parseUrl(String url) throws HardFailureException {
        HttpUrl parsed = url != null ? HttpUrl.parse(url) : null;
        if (parsed == null) {
            throw ErrorClassifier.invalidUrl(url, null);
        }
        return parsed;
    }

    /**
     * Validates the homeserver answers the versions endpoint.
     *
     * @param homeserver Homeserver base URL.
     * @throws HardFailureException Validation failed.
     */
    private void validateVersions(HttpUrl homeserver) throws HardFailureException {
        String url = String.valueOf(homeserver.resolve(VERSIONS_PATH));
        log.debug("Validating homeserver: {}", url);

        HttpResult response;
        try {
            response = httpClient.get(url);
        } catch (IOException e) {
            throw ErrorClassifier.validation(url, e.getMessage(), e);
        }
        if (!response.isSuccessful()) {
            throw ErrorClassifier.validation(url, "HTTP " + response.getCode(), null);
        }

        try {
            Versions versions = GSON.fromJson(response.getBody(), Versions.class);
            if (versions == null || versions.getVersions() == null) {
                throw ErrorClassifier.validation(url, "missing versions", null);
            }
            log.debug("Homeserver {} supports {} with unstable features {}", homeserver, versions.getVersions(), versions.getUnstableFeatures());
        } catch (JsonParseException e) {
            throw ErrorClassifier.validation(url, e.getMessage(), e);
        }
    }

    /**
     * Validates the identity server answers its API root.
     *
     * @param identity Identity server base URL.
     * @throws HardFailureException Validation failed.
     */
    private void validateIdentity(HttpUrl identity) throws HardFailureException {
        String url = String.valueOf(identity.resolve(IDENTITY_PATH));
        log.debug("Validating identity server: {}", url);

        HttpResult response;
        try {
            response = httpClient.get(url);
        } catch (IOException e) {
            throw ErrorClassifier.validation(url, e.getMessage(), e);
        }
        if (!response.isSuccessful()) {
            throw ErrorClassifier.validation(url, "HTTP " + response.getCode(), null);
        }
    }
}
