package com.mimecast.lodestar.server;

import com.mimecast.lodestar.dns.DnsClient;
import com.mimecast.lodestar.dns.SrvRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Service record lookup.
 * <p>Queries {@code _matrix._tcp.<name>} and picks the record with the lowest priority value.
 * <p>Weight is not consulted. Among records sharing the lowest priority the first one in answer order wins.
 * <p>Lookup failures and empty answers both mean not found.
 */
public class ServiceRecordLookup {
    private static final Logger log = LogManager.getLogger(ServiceRecordLookup.class);

    static final String PREFIX = "_matrix._tcp.";

    private final DnsClient dnsClient;

    /**
     * Constructs a new ServiceRecordLookup instance.
     *
     * @param dnsClient DnsClient instance.
     */
    public ServiceRecordLookup(DnsClient dnsClient) {
        this.dnsClient = dnsClient;
    }

    /**
     * Looks up the SRV target of a host.
     *
     * @param name Host name.
     * @return Optional of target as {@code host:port}.
     */
    public Optional<String> lookup(String name) {
        String query = PREFIX + name;

        List<SrvRecord> records;
        try {
            records = dnsClient.lookupSrv(query);
        } catch (IOException e) {
            log.debug("SRV lookup for {} failed: {}", query, e.getMessage());
            return Optional.empty();
        }

        Optional<String> target = records.stream()
                .filter(record -> !trimDot(record.getTarget()).isEmpty())
                .min(Comparator.comparingInt(SrvRecord::getPriority))
                .map(record -> trimDot(record.getTarget()) + ":" + record.getPort());

        if (target.isEmpty()) {
            log.debug("No SRV records for {}", query);
        }
        return target;
    }

    /**
     * Removes trailing dots.
     *
     * @param host Host string.
     * @return Host without trailing dots.
     */
    private static String trimDot(String host) {
        int end = host.length();
        while (end > 0 && host.charAt(end - 1) == '.') {
            end--;
        }
        return host.substring(0, end);
    }
}
