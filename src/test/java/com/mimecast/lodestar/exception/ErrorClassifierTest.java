package com.mimecast.lodestar.exception;

import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLHandshakeException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorClassifierTest {

    @Test
    void connectFailures() {
        assertTrue(ErrorClassifier.isConnectFailure(new ConnectException("Connection refused")));
        assertTrue(ErrorClassifier.isConnectFailure(new NoRouteToHostException("No route to host")));
        assertTrue(ErrorClassifier.isConnectFailure(new UnknownHostException("example.invalid")));
        assertTrue(ErrorClassifier.isConnectFailure(new SSLHandshakeException("PKIX path building failed")));
        assertTrue(ErrorClassifier.isConnectFailure(new SocketTimeoutException("Connect timed out")));
    }

    @Test
    void wrappedConnectFailure() {
        IOException wrapped = new IOException("Failed to connect", new ConnectException("Connection refused"));

        assertTrue(ErrorClassifier.isConnectFailure(wrapped));
    }

    @Test
    void otherFailures() {
        assertFalse(ErrorClassifier.isConnectFailure(null));
        assertFalse(ErrorClassifier.isConnectFailure(new SocketTimeoutException("Read timed out")));
        assertFalse(ErrorClassifier.isConnectFailure(new SocketTimeoutException()));
        assertFalse(ErrorClassifier.isConnectFailure(new IOException("unexpected end of stream")));
    }

    @Test
    void prompt() {
        ConnectException cause = new ConnectException("Connection refused");
        PromptFailureException e = ErrorClassifier.prompt("example.org", cause);

        assertEquals(ClientDiscoveryException.Failure.PROMPT, e.getFailure());
        assertSame(cause, e.getCause());
        assertTrue(e.getMessage().contains("example.org"));
        assertTrue(e.getMessage().contains("Connection refused"));
    }

    @Test
    void invalidUrl() {
        HardFailureException e = ErrorClassifier.invalidUrl("not a url", null);

        assertEquals(ClientDiscoveryException.Failure.ERROR, e.getFailure());
        assertEquals(HardFailureException.Reason.URL, e.getReason());
        assertNull(e.getCause());
    }

    @Test
    void validation() {
        HardFailureException e = ErrorClassifier.validation("https://matrix.example.org/_matrix/client/versions", "HTTP 502", null);

        assertEquals(HardFailureException.Reason.HTTP, e.getReason());
        assertTrue(e.getMessage().contains("HTTP 502"));
    }

    @Test
    void unreachable() {
        ConnectException cause = new ConnectException("Connection refused");
        ServerUnreachableException e = new ServerUnreachableException("example.org", cause);

        assertEquals("example.org", e.getServerName());
        assertSame(cause, e.getCause());
    }
}
