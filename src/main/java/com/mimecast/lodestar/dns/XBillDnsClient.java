package com.mimecast.lodestar.dns;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.xbill.DNS.AAAARecord;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.Cache;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.SRVRecord;
import org.xbill.DNS.Type;

import java.io.IOException;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * XBill DNS client.
 * <p>DNS client implementation using the DNS Java library.
 * <p>A custom resolver can be provided via the constructor or Lookup.setDefaultResolver().
 *
 * @see Lookup
 */
public class XBillDnsClient implements DnsClient {
    private static final Logger log = LogManager.getLogger(XBillDnsClient.class);

    private static final Cache CACHE = new Cache();

    private final Resolver resolver;

    /**
     * Constructs a new XBillDnsClient instance using the default resolver.
     */
    public XBillDnsClient() {
        this(null);
    }

    /**
     * Constructs a new XBillDnsClient instance.
     *
     * @param resolver Resolver instance, null for the default one.
     */
    public XBillDnsClient(Resolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public List<SrvRecord> lookupSrv(String name) throws IOException {
        List<SrvRecord> records = new ArrayList<>();
        for (Record record : getRecords(name, Type.SRV)) {
            if (record instanceof SRVRecord) {
                records.add(toSrvRecord((SRVRecord) record));
            }
        }
        log.debug("SRV {} returned {} records", name, records.size());
        return records;
    }

    @Override
    public List<InetAddress> lookupAddress(String host) throws IOException {
        List<InetAddress> addresses = new ArrayList<>();
        for (Record record : getRecords(host, Type.A)) {
            if (record instanceof ARecord) {
                addresses.add(((ARecord) record).getAddress());
            }
        }
        List<Record> aaaa;
        try {
            aaaa = getRecords(host, Type.AAAA);
        } catch (IOException e) {
            if (addresses.isEmpty()) {
                throw e;
            }
            log.warn("AAAA lookup for {} failed, using A records: {}", host, e.getMessage());
            aaaa = Collections.emptyList();
        }
        for (Record record : aaaa) {
            if (record instanceof AAAARecord) {
                addresses.add(((AAAARecord) record).getAddress());
            }
        }
        log.debug("Address lookup {} returned {} records", host, addresses.size());
        return addresses;
    }

    /**
     * Converts a DNS Java SRV record.
     *
     * @param record SRVRecord instance.
     * @return SrvRecord instance.
     */
    static SrvRecord toSrvRecord(SRVRecord record) {
        return new SrvRecord(record.getPriority(), record.getWeight(), record.getTarget().toString(), record.getPort());
    }

    /**
     * Runs a lookup.
     * <p>Missing names and types are answered with an empty list, any other failure is thrown.
     *
     * @param name Lookup name.
     * @param type Lookup type int.
     * @return List of Record instances.
     * @throws IOException Lookup failure.
     */
    private List<Record> getRecords(String name, int type) throws IOException {
        Lookup lookup = new Lookup(name, type);
        Resolver active = resolver != null ? resolver : Lookup.getDefaultResolver();
        if (active == null) {
            active = new ExtendedResolver();
        }
        lookup.setResolver(active);
        lookup.setCache(CACHE);

        Record[] records = lookup.run();
        int result = lookup.getResult();
        if (result == Lookup.SUCCESSFUL && records != null) {
            List<Record> list = new ArrayList<>(records.length);
            Collections.addAll(list, records);
            return list;
        }
        if (result == Lookup.HOST_NOT_FOUND || result == Lookup.TYPE_NOT_FOUND) {
            return Collections.emptyList();
        }

        throw new IOException("Lookup of " + name + " " + Type.string(type) + " failed: " + lookup.getErrorString());
    }
}
