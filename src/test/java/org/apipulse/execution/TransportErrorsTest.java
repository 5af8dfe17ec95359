package org.apipulse.execution;

import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLHandshakeException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class TransportErrorsTest {

    @Test
    void describesKnownCauses() {
        assertThat(TransportErrors.describe(new HttpConnectTimeoutException("HTTP connect timed out")))
                .isEqualTo("Connection timed out");
        assertThat(TransportErrors.describe(new HttpTimeoutException("request timed out")))
                .isEqualTo("Request timed out");
        assertThat(TransportErrors.describe(new ConnectException()))
                .isEqualTo("Connection refused");
        assertThat(TransportErrors.describe(new SSLHandshakeException("PKIX path building failed")))
                .isEqualTo("TLS handshake failed: PKIX path building failed");
    }

    @Test
    void looksThroughWrappers() {
        IOException wrapped = new IOException("send failed", new UnknownHostException("nope.invalid"));

        assertThat(TransportErrors.describe(wrapped)).isEqualTo("Could not resolve host: nope.invalid");
    }

    @Test
    void fallsBackToMessageOrType() {
        assertThat(TransportErrors.describe(new IOException("stream reset"))).isEqualTo("stream reset");
        assertThat(TransportErrors.describe(new IOException())).isEqualTo("IOException");
    }
}
