package com.mimecast.lodestar.exception;

/**
 * Thrown when the server well-known endpoint could not be connected to.
 * <p>The only failure server resolution surfaces to the caller.
 */
public class ServerUnreachableException extends DiscoveryException {

    private final String serverName;

    /**
     * Constructs a new ServerUnreachableException.
     *
     * @param serverName Server name being resolved.
     * @param cause      Underlying connect failure.
     */
    public ServerUnreachableException(String serverName, Throwable cause) {
        super("Unable to connect to " + serverName + ": " + cause.getMessage(), cause);
        this.serverName = serverName;
    }

    /**
     * Gets the server name being resolved.
     *
     * @return Server name string.
     */
    public String getServerName() {
        return serverName;
    }
}
