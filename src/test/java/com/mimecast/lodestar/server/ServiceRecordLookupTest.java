package com.mimecast.lodestar.server;

import com.mimecast.lodestar.dns.SrvRecord;
import com.mimecast.lodestar.dns.StaticDnsClient;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ServiceRecordLookupTest {

    @Test
    void lowestPriorityWins() {
        StaticDnsClient dns = new StaticDnsClient()
                .srv("_matrix._tcp.example.org",
                        new SrvRecord(20, 100, "backup.example.org.", 8448),
                        new SrvRecord(10, 0, "primary.example.org.", 443),
                        new SrvRecord(30, 0, "last.example.org.", 8448));

        assertEquals(Optional.of("primary.example.org:443"), new ServiceRecordLookup(dns).lookup("example.org"));
        assertEquals("_matrix._tcp.example.org", dns.getQueries().get(0));
    }

    @Test
    void weightIgnoredAndFirstTieWins() {
        StaticDnsClient dns = new StaticDnsClient()
                .srv("_matrix._tcp.example.org",
                        new SrvRecord(10, 1, "first.example.org.", 8448),
                        new SrvRecord(10, 1000, "second.example.org.", 8448));

        assertEquals(Optional.of("first.example.org:8448"), new ServiceRecordLookup(dns).lookup("example.org"));
    }

    @Test
    void targetWithoutTrailingDot() {
        StaticDnsClient dns = new StaticDnsClient()
                .srv("_matrix._tcp.example.org", new SrvRecord(0, 0, "matrix.example.org", 8449));

        assertEquals(Optional.of("matrix.example.org:8449"), new ServiceRecordLookup(dns).lookup("example.org"));
    }

    @Test
    void rootTargetSkipped() {
        StaticDnsClient dns = new StaticDnsClient()
                .srv("_matrix._tcp.example.org",
                        new SrvRecord(0, 0, ".", 0),
                        new SrvRecord(5, 0, "matrix.example.org.", 8448));

        assertEquals(Optional.of("matrix.example.org:8448"), new ServiceRecordLookup(dns).lookup("example.org"));
    }

    @Test
    void emptyAnswer() {
        assertEquals(Optional.empty(), new ServiceRecordLookup(new StaticDnsClient()).lookup("example.org"));
    }

    @Test
    void lookupFailureIsNotFound() {
        StaticDnsClient dns = new StaticDnsClient()
                .fail("_matrix._tcp.example.org", new IOException("SERVFAIL"));

        assertEquals(Optional.empty(), new ServiceRecordLookup(dns).lookup("example.org"));
    }
}
