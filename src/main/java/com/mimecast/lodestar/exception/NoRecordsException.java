package com.mimecast.lodestar.exception;

/**
 * Thrown when a forward address lookup yields no usable address.
 */
public class NoRecordsException extends DiscoveryException {

    private final String host;

    /**
     * Constructs a new NoRecordsException.
     *
     * @param host Host looked up.
     */
    public NoRecordsException(String host) {
        super("No records for " + host);
        this.host = host;
    }

    /**
     * Constructs a new NoRecordsException with cause.
     *
     * @param host  Host looked up.
     * @param cause Underlying lookup failure.
     */
    public NoRecordsException(String host, Throwable cause) {
        super("No records for " + host + ": " + cause.getMessage(), cause);
        this.host = host;
    }

    /**
     * Gets the host looked up.
     *
     * @return Host string.
     */
    public String getHost() {
        return host;
    }
}
