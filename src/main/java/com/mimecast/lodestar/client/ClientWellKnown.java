package com.mimecast.lodestar.client;

import com.google.gson.annotations.SerializedName;

/**
 * Client well-known document.
 * <p>Served at {@code /.well-known/matrix/client}.
 */
public class ClientWellKnown {

    /**
     * Information about the homeserver to connect to.
     */
    @SerializedName("m.homeserver")
    private HomeserverInfo homeserver;

    /**
     * Information about the identity server to connect to, optional.
     */
    @SerializedName("m.identity_server")
    private IdentityServerInfo identityServer;

    public HomeserverInfo getHomeserver() {
        return homeserver;
    }

    public IdentityServerInfo getIdentityServer() {
        return identityServer;
    }

    /**
     * Homeserver information.
     */
    public static class HomeserverInfo {

        /**
         * Base URL for client-server API endpoints.
         */
        @SerializedName("base_url")
        private String baseUrl;

        public String getBaseUrl() {
            return baseUrl;
        }
    }

    /**
     * Identity server information.
     */
    public static class IdentityServerInfo {

        /**
         * Base URL for identity server API endpoints.
         */
        @SerializedName("base_url")
        private String baseUrl;

        public String getBaseUrl() {
            return baseUrl;
        }
    }
}
