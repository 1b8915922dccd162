package com.mimecast.lodestar.server;

import com.mimecast.lodestar.config.DiscoveryConfig;
import com.mimecast.lodestar.dns.DnsClient;
import com.mimecast.lodestar.exception.NoRecordsException;
import com.mimecast.lodestar.exception.ServerUnreachableException;
import com.mimecast.lodestar.http.WellKnownHttpClient;
import com.mimecast.lodestar.main.Config;
import com.mimecast.lodestar.main.Factories;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Optional;

/**
 * ServerResolver resolves a server name to the address and Host header to federate with.
 *
 * <p>Resolution order, stopping at the first match:
 * <ol>
 *   <li>The name is an IP literal with port: SOCKET.</li>
 *   <li>The name is a bare IP literal: IP.</li>
 *   <li>The name is a host with port: HOST_PORT, kept verbatim.</li>
 *   <li>The server well-known document delegates to another name:
 *     <ol>
 *       <li>an IP literal with port: SOCKET</li>
 *       <li>a bare IP literal: IP</li>
 *       <li>a host with port: HOST_PORT</li>
 *       <li>a host with an SRV record: SRV, else HOST with the delegated name</li>
 *     </ol>
 *   </li>
 *   <li>No delegation, the name has an SRV record: SRV, else HOST with the name.</li>
 * </ol>
 * <p>At most one HTTP request and one SRV query are made. Only a connect failure on the
 * <br>well-known request is thrown, every other outcome yields a ResolvedServer.
 * <p>Holds no mutable state, instances may be shared by concurrent resolutions.
 */
public class ServerResolver {
    private static final Logger log = LogManager.getLogger(ServerResolver.class);

    private final DelegationFetcher delegationFetcher;
    private final ServiceRecordLookup serviceRecordLookup;
    private final DnsClient dnsClient;
    private final int defaultPort;

    /**
     * Constructs a new ServerResolver instance with factory clients and global config.
     */
    public ServerResolver() {
        this(Factories.getHttpClient(), Factories.getDnsClient(), Config.getDiscovery());
    }

    /**
     * Constructs a new ServerResolver instance.
     *
     * @param httpClient WellKnownHttpClient instance.
     * @param dnsClient  DnsClient instance.
     * @param config     DiscoveryConfig instance.
     */
    public ServerResolver(WellKnownHttpClient httpClient, DnsClient dnsClient, DiscoveryConfig config) {
        this.delegationFetcher = new DelegationFetcher(httpClient, config);
        this.serviceRecordLookup = new ServiceRecordLookup(dnsClient);
        this.dnsClient = dnsClient;
        this.defaultPort = config.getDefaultPort();
    }

    /**
     * Resolves a server name.
     *
     * @param name Server name.
     * @return ResolvedServer instance.
     * @throws ServerUnreachableException Unable to connect for the well-known lookup.
     */
    public ResolvedServer resolve(String name) throws ServerUnreachableException {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Server name must not be blank");
        }

        // Steps 1 to 3.
        log.debug("Parsing literal forms of: {}", name);
        Optional<ResolvedServer> literal = fromLiteral(name);
        if (literal.isPresent()) {
            log.info("Server name {} is a literal: {}", name, literal.get().getKind());
            return literal.get();
        }

        // Step 4.
        log.debug("Querying well-known for: {}", name);
        Optional<ServerWellKnown> wellKnown = delegationFetcher.fetch(name);
        if (wellKnown.isPresent()) {
            String delegated = wellKnown.get().getServer();
            log.debug("Well-known received: {}", wellKnown.get());

            literal = fromLiteral(delegated);
            if (literal.isPresent()) {
                log.info("Server name {} is delegated to a literal: {}", name, literal.get().getKind());
                return literal.get();
            }

            return fromHost(delegated);
        }

        // Step 5.
        return fromHost(name);
    }

    /**
     * Gets the socket address of a resolved server.
     * <p>IP and SOCKET are used as is. Other kinds look up the host and pair the first address with the port.
     *
     * @param server ResolvedServer instance.
     * @return InetSocketAddress instance.
     * @throws NoRecordsException Lookup failed or returned no address.
     */
    public InetSocketAddress addressOf(ResolvedServer server) throws NoRecordsException {
        String host;
        int port;
        switch (server.getKind()) {
            case IP:
                return new InetSocketAddress(server.getIp(), defaultPort);
            case SOCKET:
                return server.getSocket();
            case HOST:
                host = server.getHost();
                port = defaultPort;
                break;
            case HOST_PORT:
            case SRV:
            default:
                String address = server.address(defaultPort);
                int colon = address.lastIndexOf(':');
                host = address.substring(0, colon);
                port = Integer.parseInt(address.substring(colon + 1));
                break;
        }

        List<InetAddress> addresses;
        try {
            addresses = dnsClient.lookupAddress(host);
        } catch (IOException e) {
            throw new NoRecordsException(host, e);
        }
        if (addresses.isEmpty()) {
            throw new NoRecordsException(host);
        }

        // Naively use the first address.
        return new InetSocketAddress(addresses.get(0), port);
    }

    /**
     * Maps a literal server name.
     *
     * @param name Server name.
     * @return Optional of ResolvedServer.
     */
    private static Optional<ResolvedServer> fromLiteral(String name) {
        return AddressClassifier.classify(name).map(literal -> {
            switch (literal.getForm()) {
                case SOCKET:
                    return ResolvedServer.socket(literal.getSocketAddress());
                case IP:
                    return ResolvedServer.ip(literal.getAddress());
                case HOST_PORT:
                default:
                    return ResolvedServer.hostPort(name);
            }
        });
    }

    /**
     * Resolves a host name through SRV, falling back to the host itself.
     *
     * @param host Host name.
     * @return ResolvedServer instance.
     */
    private ResolvedServer fromHost(String host) {
        log.debug("Looking up SRV record for: {}", host);
        Optional<String> target = serviceRecordLookup.lookup(host);
        if (target.isPresent()) {
            log.info("Server name {} has SRV target: {}", host, target.get());
            return ResolvedServer.srv(target.get(), host);
        }

        log.info("Using host name directly: {}", host);
        return ResolvedServer.host(host);
    }
}
