package com.mimecast.lodestar.server;

import com.google.common.net.InetAddresses;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.util.Optional;

/**
 * Address classifier.
 * <p>Recognises the literal forms of a server name without any I/O.
 *
 * <p>Forms are tried in order:
 * <ol>
 *   <li>IP literal with port: {@code 1.2.3.4:8448} or {@code [2001:db8::1]:8448}</li>
 *   <li>Bare IP literal: {@code 1.2.3.4}, {@code 2001:db8::1} or {@code [2001:db8::1]}</li>
 *   <li>Host with port: exactly one colon and a decimal port in 0..65535</li>
 * </ol>
 * <p>IPv6 literals are only given a port inside brackets, so an unbracketed IPv6 address
 * <br>is never split on its last colon.
 */
public final class AddressClassifier {
    private static final Logger log = LogManager.getLogger(AddressClassifier.class);

    private AddressClassifier() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Classifies a server name.
     *
     * @param name Server name.
     * @return Optional of LiteralAddress, empty if the name is a plain host name or unparsable.
     */
    public static Optional<LiteralAddress> classify(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }

        Optional<LiteralAddress> literal = parseSocket(name);
        if (literal.isEmpty()) {
            literal = parseIp(name);
        }
        if (literal.isEmpty()) {
            literal = parseHostPort(name);
        }

        log.trace("Classified {} as {}", name, literal.map(LiteralAddress::getForm).orElse(null));
        return literal;
    }

    /**
     * Parses IP literal with port.
     *
     * @param name Server name.
     * @return Optional of LiteralAddress.
     */
    private static Optional<LiteralAddress> parseSocket(String name) {
        if (name.startsWith("[")) {
            int close = name.indexOf(']');
            if (close < 0 || close + 1 >= name.length() || name.charAt(close + 1) != ':') {
                return Optional.empty();
            }
            InetAddress address = parseAddress(name.substring(1, close));
            int port = parsePort(name.substring(close + 2));
            if (address instanceof Inet6Address && port >= 0) {
                return Optional.of(LiteralAddress.socket(address, port));
            }
            return Optional.empty();
        }

        int colon = name.indexOf(':');
        if (colon < 0 || colon != name.lastIndexOf(':')) {
            return Optional.empty();
        }
        InetAddress address = parseAddress(name.substring(0, colon));
        int port = parsePort(name.substring(colon + 1));
        if (address instanceof Inet4Address && port >= 0) {
            return Optional.of(LiteralAddress.socket(address, port));
        }
        return Optional.empty();
    }

    /**
     * Parses bare IP literal.
     *
     * @param name Server name.
     * @return Optional of LiteralAddress.
     */
    private static Optional<LiteralAddress> parseIp(String name) {
        if (name.startsWith("[") && name.endsWith("]")) {
            InetAddress address = parseAddress(name.substring(1, name.length() - 1));
            return address instanceof Inet6Address ? Optional.of(LiteralAddress.ip(address)) : Optional.empty();
        }

        InetAddress address = parseAddress(name);
        return address != null ? Optional.of(LiteralAddress.ip(address)) : Optional.empty();
    }

    /**
     * Parses host with port.
     *
     * @param name Server name.
     * @return Optional of LiteralAddress.
     */
    private static Optional<LiteralAddress> parseHostPort(String name) {
        int colon = name.indexOf(':');
        if (colon <= 0 || colon != name.lastIndexOf(':') || name.startsWith("[")) {
            return Optional.empty();
        }
        int port = parsePort(name.substring(colon + 1));
        if (port < 0) {
            return Optional.empty();
        }
        return Optional.of(LiteralAddress.hostPort(name.substring(0, colon), port));
    }

    /**
     * Parses an IP literal without touching DNS.
     *
     * @param value Candidate string.
     * @return InetAddress instance or null.
     */
    private static InetAddress parseAddress(String value) {
        if (value.isEmpty() || !InetAddresses.isInetAddress(value)) {
            return null;
        }
        return InetAddresses.forString(value);
    }

    /**
     * Parses an unsigned 16 bit decimal port.
     *
     * @param value Candidate string.
     * @return Port number or -1.
     */
    static int parsePort(String value) {
        if (value.isEmpty() || value.length() > 5) {
            return -1;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
        }
        int port = Integer.parseInt(value);
        return port <= 0xFFFF ? port : -1;
    }
}
