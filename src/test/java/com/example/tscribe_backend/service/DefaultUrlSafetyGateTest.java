package com.example.tscribe_backend.service;

import com.example.tscribe_backend.exception.UrlRejectedException;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.UnknownHostException;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultUrlSafetyGateTest {

    /** Resolves every host to a fixed address so no DNS is needed. */
    private static DefaultUrlSafetyGate resolvingTo(String ip) {
        return new DefaultUrlSafetyGate() {
            @Override
            protected InetAddress[] resolve(String host) {
                try {
                    return new InetAddress[]{InetAddress.getByName(ip)};
                } catch (UnknownHostException e) {
                    throw new IllegalStateException(e);
                }
            }
        };
    }

    @Test
    void publicHttpsUrlPasses() {
        assertThatCode(() -> resolvingTo("142.250.74.110").validate("https://www.youtube.com/watch?v=abc"))
                .doesNotThrowAnyException();
    }

    @Test
    void nonHttpSchemesAreRejected() {
        DefaultUrlSafetyGate gate = resolvingTo("142.250.74.110");

        assertThatThrownBy(() -> gate.validate("file:///etc/passwd")).isInstanceOf(UrlRejectedException.class);
        assertThatThrownBy(() -> gate.validate("ftp://example.com/a")).isInstanceOf(UrlRejectedException.class);
        assertThatThrownBy(() -> gate.validate("https:///nohost")).isInstanceOf(UrlRejectedException.class);
    }

    @Test
    void internalAddressesAreRejected() {
        for (String ip : new String[]{"127.0.0.1", "10.1.2.3", "192.168.0.10", "169.254.169.254", "0.0.0.0", "::1", "fd00::1", "224.0.0.1"}) {
            assertThatThrownBy(() -> resolvingTo(ip).validate("http://internal.example/x"))
                    .as(ip)
                    .isInstanceOf(UrlRejectedException.class)
                    .hasMessageContaining("private or local");
        }
    }

    @Test
    void overlongUrlIsRejected() {
        String url = "https://example.com/" + "a".repeat(DefaultUrlSafetyGate.MAX_URL_LENGTH);

        assertThatThrownBy(() -> resolvingTo("93.184.216.34").validate(url))
                .isInstanceOf(UrlRejectedException.class)
                .hasMessageContaining("longer than");
    }
}
