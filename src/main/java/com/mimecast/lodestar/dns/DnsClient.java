package com.mimecast.lodestar.dns;

import java.io.IOException;
import java.net.InetAddress;
import java.util.List;

/**
 * DNS client.
 * <p>SRV and forward address lookups consumed by server resolution.
 * <p>Implementations must be safe for concurrent use by multiple resolutions.
 *
 * @see XBillDnsClient
 */
public interface DnsClient {

    /**
     * Gets SRV records.
     *
     * @param name Fully formed query name, for example <i>_matrix._tcp.example.org</i>.
     * @return List of SrvRecord instances, empty if the name or type does not exist.
     * @throws IOException Lookup failure.
     */
    List<SrvRecord> lookupSrv(String name) throws IOException;

    /**
     * Gets IPv4 and IPv6 addresses of a host.
     *
     * @param host Host name.
     * @return List of InetAddress instances, empty if none.
     * @throws IOException Lookup failure.
     */
    List<InetAddress> lookupAddress(String host) throws IOException;
}
