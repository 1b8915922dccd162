package com.mimecast.lodestar.server;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Literal address.
 * <p>Outcome of classifying a server name that needs no discovery.
 *
 * @see AddressClassifier
 */
public final class LiteralAddress {

    /**
     * Literal form.
     */
    public enum Form {
        /**
         * IP literal with port.
         */
        SOCKET,

        /**
         * Bare IP literal.
         */
        IP,

        /**
         * Host name with port.
         */
        HOST_PORT
    }

    private final Form form;
    private final InetAddress address;
    private final String host;
    private final int port;

    private LiteralAddress(Form form, InetAddress address, String host, int port) {
        this.form = form;
        this.address = address;
        this.host = host;
        this.port = port;
    }

    static LiteralAddress socket(InetAddress address, int port) {
        return new LiteralAddress(Form.SOCKET, address, null, port);
    }

    static LiteralAddress ip(InetAddress address) {
        return new LiteralAddress(Form.IP, address, null, -1);
    }

    static LiteralAddress hostPort(String host, int port) {
        return new LiteralAddress(Form.HOST_PORT, null, host, port);
    }

    public Form getForm() {
        return form;
    }

    /**
     * Gets IP address.
     *
     * @return InetAddress instance, null for HOST_PORT.
     */
    public InetAddress getAddress() {
        return address;
    }

    /**
     * Gets host name.
     *
     * @return Host string, null unless HOST_PORT.
     */
    public String getHost() {
        return host;
    }

    /**
     * Gets port.
     *
     * @return Port number, -1 for IP.
     */
    public int getPort() {
        return port;
    }

    /**
     * Gets socket address.
     *
     * @return InetSocketAddress instance, null unless SOCKET.
     */
    public InetSocketAddress getSocketAddress() {
        return form == Form.SOCKET ? new InetSocketAddress(address, port) : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LiteralAddress)) return false;
        LiteralAddress that = (LiteralAddress) o;
        return port == that.port && form == that.form
                && Objects.equals(address, that.address) && Objects.equals(host, that.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(form, address, host, port);
    }

    @Override
    public String toString() {
        return "LiteralAddress{form=" + form + ", address=" + address + ", host=" + host + ", port=" + port + "}";
    }
}
