package com.mimecast.lodestar.exception;

import javax.net.ssl.SSLHandshakeException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;

/**
 * Classifies transport failures and builds the client discovery failures.
 *
 * <p>Connect-level failures are the ones raised before a connection is established:
 * <ol>
 *   <li>Name resolution of the target host ({@link UnknownHostException})</li>
 *   <li>TCP connect ({@link ConnectException}, {@link NoRouteToHostException}, {@link PortUnreachableException})</li>
 *   <li>Connect timeouts ({@link SocketTimeoutException} raised by connect)</li>
 *   <li>TLS handshake ({@link SSLHandshakeException})</li>
 * </ol>
 * <p>The cause chain is walked as HTTP clients commonly wrap these.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Checks if the given failure happened while establishing a connection.
     *
     * @param error Throwable instance, may be null.
     * @return True if connect-level.
     */
    public static boolean isConnectFailure(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof ConnectException
                    || current instanceof NoRouteToHostException
                    || current instanceof PortUnreachableException
                    || current instanceof UnknownHostException
                    || current instanceof SSLHandshakeException) {
                return true;
            }
            if (current instanceof SocketTimeoutException && isConnectTimeout(current.getMessage())) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Checks timeout message for connect phase.
     *
     * @param message Exception message.
     * @return True if connect timeout.
     */
    private static boolean isConnectTimeout(String message) {
        return message != null && message.toLowerCase(Locale.ROOT).startsWith("connect timed out");
    }

    /**
     * Builds a prompt failure for the account domain well-known lookup.
     *
     * @param domain Account domain.
     * @param cause  Underlying cause.
     * @return PromptFailureException instance.
     */
    public static PromptFailureException prompt(String domain, Throwable cause) {
        return new PromptFailureException("Client well-known lookup failed for " + domain + ": " + describe(cause), cause);
    }

    /**
     * Builds a hard failure for a malformed base URL.
     *
     * @param url   URL string as found in the document.
     * @param cause Underlying parse failure, may be null.
     * @return HardFailureException instance.
     */
    public static HardFailureException invalidUrl(String url, Throwable cause) {
        return new HardFailureException(HardFailureException.Reason.URL, "Invalid base URL: " + url, cause);
    }

    /**
     * Builds a hard failure for a delegated target that failed validation.
     *
     * @param url    URL requested.
     * @param detail What went wrong.
     * @param cause  Underlying cause, may be null.
     * @return HardFailureException instance.
     */
    public static HardFailureException validation(String url, String detail, Throwable cause) {
        return new HardFailureException(HardFailureException.Reason.HTTP, "Validation of " + url + " failed: " + detail, cause);
    }

    /**
     * Short description of a throwable for messages.
     *
     * @param cause Throwable instance, may be null.
     * @return Description string.
     */
    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
