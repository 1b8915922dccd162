package com.mimecast.lodestar.dns;

import com.google.common.net.InetAddresses;
import org.junit.jupiter.api.Test;
import org.xbill.DNS.AAAARecord;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.DClass;
import org.xbill.DNS.Name;
import org.xbill.DNS.Rcode;
import org.xbill.DNS.SRVRecord;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.io.IOException;
import java.net.InetAddress;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class XBillDnsClientTest {

    @Test
    void toSrvRecord() throws TextParseException {
        SRVRecord record = new SRVRecord(Name.fromString("_matrix._tcp.example.org."), DClass.IN, 3600,
                10, 5, 8448, Name.fromString("matrix.example.org."));

        SrvRecord srv = XBillDnsClient.toSrvRecord(record);

        assertEquals(10, srv.getPriority());
        assertEquals(5, srv.getWeight());
        assertEquals("matrix.example.org.", srv.getTarget());
        assertEquals(8448, srv.getPort());
    }

    @Test
    void srvRecordValidation() {
        assertThrows(IllegalArgumentException.class, () -> new SrvRecord(-1, 0, "example.org.", 8448));
        assertThrows(IllegalArgumentException.class, () -> new SrvRecord(0, 0, "example.org.", 65536));
        assertThrows(NullPointerException.class, () -> new SrvRecord(0, 0, null, 8448));
    }

    @Test
    void srvRecordEquality() {
        assertEquals(new SrvRecord(1, 2, "example.org.", 8448), new SrvRecord(1, 2, "example.org.", 8448));
        assertNotEquals(new SrvRecord(1, 2, "example.org.", 8448), new SrvRecord(1, 2, "example.org.", 443));
    }

    @Test
    void lookupSrv() throws IOException {
        StaticResolver resolver = new StaticResolver()
                .answer(new SRVRecord(Name.fromString("_matrix._tcp.srv.lodestar.test."), DClass.IN, 3600,
                        10, 0, 8448, Name.fromString("matrix.lodestar.test.")));

        List<SrvRecord> records = new XBillDnsClient(resolver).lookupSrv("_matrix._tcp.srv.lodestar.test.");

        assertEquals(List.of(new SrvRecord(10, 0, "matrix.lodestar.test.", 8448)), records);
    }

    @Test
    void lookupSrvMissing() throws IOException {
        assertTrue(new XBillDnsClient(new StaticResolver()).lookupSrv("_matrix._tcp.missing.lodestar.test.").isEmpty());
    }

    @Test
    void lookupAddress() throws IOException {
        InetAddress v4 = InetAddresses.forString("192.0.2.10");
        InetAddress v6 = InetAddresses.forString("2001:db8::10");
        StaticResolver resolver = new StaticResolver()
                .answer(new ARecord(Name.fromString("dual.lodestar.test."), DClass.IN, 3600, v4))
                .answer(new AAAARecord(Name.fromString("dual.lodestar.test."), DClass.IN, 3600, v6));

        assertEquals(List.of(v4, v6), new XBillDnsClient(resolver).lookupAddress("dual.lodestar.test."));
    }

    @Test
    void lookupAddressKeepsIpv4WhenIpv6Fails() throws IOException {
        InetAddress v4 = InetAddresses.forString("192.0.2.20");
        StaticResolver resolver = new StaticResolver()
                .answer(new ARecord(Name.fromString("v4.lodestar.test."), DClass.IN, 3600, v4))
                .rcode("v4.lodestar.test.", Type.AAAA, Rcode.SERVFAIL);

        assertEquals(List.of(v4), new XBillDnsClient(resolver).lookupAddress("v4.lodestar.test."));
    }

    @Test
    void lookupAddressFailure() {
        StaticResolver resolver = new StaticResolver()
                .rcode("broken.lodestar.test.", Type.A, Rcode.SERVFAIL)
                .rcode("broken.lodestar.test.", Type.AAAA, Rcode.SERVFAIL);

        assertThrows(IOException.class, () -> new XBillDnsClient(resolver).lookupAddress("broken.lodestar.test."));
    }
}
