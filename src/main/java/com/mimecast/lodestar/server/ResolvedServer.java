package com.mimecast.lodestar.server;

import com.google.common.net.HostAndPort;
import com.google.common.net.InetAddresses;
import com.mimecast.lodestar.config.DiscoveryConfig;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Resolved server.
 * <p>Outcome of server name resolution, holding exactly one of five forms.
 * <p>Immutable, use the factory methods.
 *
 * <p>Two derivations are total over all kinds:
 * <ul>
 *   <li>{@link #hostHeader()} - the value for the HTTP {@code Host} header.</li>
 *   <li>{@link #address()} - the {@code host:port} to connect to.</li>
 * </ul>
 */
public final class ResolvedServer {

    /**
     * Resolved form.
     */
    public enum Kind {
        /**
         * IP address with implicit default port.
         */
        IP,

        /**
         * IP address with explicit port.
         */
        SOCKET,

        /**
         * Host name with implicit default port.
         */
        HOST,

        /**
         * Host name with explicit port.
         */
        HOST_PORT,

        /**
         * Target from an SRV record, host header from the server name.
         */
        SRV
    }

    private final Kind kind;
    private final InetAddress ip;
    private final int port;
    private final String host;
    private final String target;

    private ResolvedServer(Kind kind, InetAddress ip, int port, String host, String target) {
        this.kind = kind;
        this.ip = ip;
        this.port = port;
        this.host = host;
        this.target = target;
    }

    /**
     * Creates an IP server on the default port.
     *
     * @param ip IP address.
     * @return ResolvedServer instance.
     */
    public static ResolvedServer ip(InetAddress ip) {
        return new ResolvedServer(Kind.IP, Objects.requireNonNull(ip, "ip"), -1, null, null);
    }

    /**
     * Creates an IP server with explicit port.
     *
     * @param socket Socket address, must not be unresolved.
     * @return ResolvedServer instance.
     */
    public static ResolvedServer socket(InetSocketAddress socket) {
        Objects.requireNonNull(socket, "socket");
        if (socket.isUnresolved()) {
            throw new IllegalArgumentException("Socket address must hold an IP: " + socket);
        }
        return new ResolvedServer(Kind.SOCKET, socket.getAddress(), socket.getPort(), null, null);
    }

    /**
     * Creates a host server on the default port.
     *
     * @param host Host name.
     * @return ResolvedServer instance.
     */
    public static ResolvedServer host(String host) {
        return new ResolvedServer(Kind.HOST, null, -1, Objects.requireNonNull(host, "host"), null);
    }

    /**
     * Creates a host server with explicit port.
     *
     * @param hostPort Host and port string, kept verbatim.
     * @return ResolvedServer instance.
     */
    public static ResolvedServer hostPort(String hostPort) {
        return new ResolvedServer(Kind.HOST_PORT, null, -1, Objects.requireNonNull(hostPort, "hostPort"), null);
    }

    /**
     * Creates an SRV delegated server.
     *
     * @param target       SRV target as {@code host:port}.
     * @param originalHost Server name the SRV record was found for.
     * @return ResolvedServer instance.
     */
    public static ResolvedServer srv(String target, String originalHost) {
        return new ResolvedServer(Kind.SRV, null, -1,
                Objects.requireNonNull(originalHost, "originalHost"), Objects.requireNonNull(target, "target"));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Gets IP address.
     *
     * @return InetAddress for IP and SOCKET, null otherwise.
     */
    public InetAddress getIp() {
        return ip;
    }

    /**
     * Gets socket address.
     *
     * @return InetSocketAddress for SOCKET, null otherwise.
     */
    public InetSocketAddress getSocket() {
        return kind == Kind.SOCKET ? new InetSocketAddress(ip, port) : null;
    }

    /**
     * Gets host.
     * <p>The name for HOST, the verbatim host and port for HOST_PORT and the original server name for SRV.
     *
     * @return Host string, null for IP and SOCKET.
     */
    public String getHost() {
        return host;
    }

    /**
     * Gets SRV target.
     *
     * @return Target {@code host:port} for SRV, null otherwise.
     */
    public String getTarget() {
        return target;
    }

    /**
     * Gets the value for the HTTP Host header.
     *
     * @return Host header string.
     */
    public String hostHeader() {
        switch (kind) {
            case IP:
                return HostAndPort.fromHost(InetAddresses.toAddrString(ip)).toString();
            case SOCKET:
                return address();
            case SRV:
            case HOST:
            case HOST_PORT:
            default:
                return host;
        }
    }

    /**
     * Gets the address to connect to using the implicit federation port.
     *
     * @return Address string as {@code host:port}.
     */
    public String address() {
        return address(DiscoveryConfig.DEFAULT_PORT);
    }

    /**
     * Gets the address to connect to.
     *
     * @param defaultPort Port used by kinds without an explicit one.
     * @return Address string as {@code host:port}.
     */
    public String address(int defaultPort) {
        switch (kind) {
            case IP:
                return HostAndPort.fromParts(InetAddresses.toAddrString(ip), defaultPort).toString();
            case SOCKET:
                return HostAndPort.fromParts(InetAddresses.toAddrString(ip), port).toString();
            case HOST:
                return host + ":" + defaultPort;
            case SRV:
                return target;
            case HOST_PORT:
            default:
                return host;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedServer)) return false;
        ResolvedServer that = (ResolvedServer) o;
        return port == that.port && kind == that.kind && Objects.equals(ip, that.ip)
                && Objects.equals(host, that.host) && Objects.equals(target, that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, ip, port, host, target);
    }

    @Override
    public String toString() {
        return String.format("ResolvedServer{kind=%s, address='%s', hostHeader='%s'}", kind, address(), hostHeader());
    }
}
