package org.apipulse.execution;

import javax.net.ssl.SSLException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;

/**
 * Turns transport exceptions into the short error strings stored on failed execution logs.
 */
public final class TransportErrors {

    private TransportErrors() {}

    public static String describe(Throwable error) {
        // HttpClient wraps the interesting cause more often than not
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof HttpConnectTimeoutException) {
                return "Connection timed out";
            }
            if (t instanceof HttpTimeoutException) {
                return "Request timed out";
            }
            if (t instanceof UnknownHostException || t instanceof UnresolvedAddressException) {
                return "Could not resolve host" + suffix(t);
            }
            if (t instanceof ConnectException) {
                return "Connection refused" + suffix(t);
            }
            if (t instanceof SSLException) {
                return "TLS handshake failed" + suffix(t);
            }
            if (t.getCause() == t) break;
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static String suffix(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isBlank() ? "" : ": " + message;
    }
}
