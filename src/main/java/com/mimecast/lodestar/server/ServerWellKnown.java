package com.mimecast.lodestar.server;

import com.google.gson.annotations.SerializedName;

/**
 * Server well-known document.
 * <p>Served at {@code /.well-known/matrix/server} as {@code {"m.server": "<host[:port]>"}}.
 */
public class ServerWellKnown {

    /**
     * Delegated server name with optional port.
     */
    @SerializedName("m.server")
    private String server;

    /**
     * Constructs a new empty ServerWellKnown instance.
     */
    public ServerWellKnown() {
    }

    /**
     * Constructs a new ServerWellKnown instance.
     *
     * @param server Delegated server name.
     */
    public ServerWellKnown(String server) {
        this.server = server;
    }

    /**
     * Gets delegated server name.
     *
     * @return Server string, may be null if the document omitted it.
     */
    public String getServer() {
        return server;
    }

    @Override
    public String toString() {
        return "ServerWellKnown{m.server='" + server + "'}";
    }
}
