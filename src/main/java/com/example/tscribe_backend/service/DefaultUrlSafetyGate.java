package com.example.tscribe_backend.service;

import com.example.tscribe_backend.exception.UrlRejectedException;
import com.example.tscribe_backend.service.Interfaces.UrlSafetyGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Set;

/**
 * Rejects URLs that are not plain http(s) or whose host resolves to an internal address
 * (loopback, private ranges, link-local, wildcard, multicast, IPv6 unique-local).
 */
@Component
public class DefaultUrlSafetyGate implements UrlSafetyGate {
    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultUrlSafetyGate.class);
    static final int MAX_URL_LENGTH = 2048;
    private static final Set<String> SCHEMES = Set.of("http", "https");

    @Override
    public void validate(String url) {
        if (url == null || url.isBlank()) {
            throw new UrlRejectedException("URL is required");
        }
        if (url.length() > MAX_URL_LENGTH) {
            throw new UrlRejectedException("URL is longer than " + MAX_URL_LENGTH + " characters");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new UrlRejectedException("URL is malformed");
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!SCHEMES.contains(scheme)) {
            throw new UrlRejectedException("Only http and https URLs are accepted");
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new UrlRejectedException("URL has no host");
        }

        InetAddress[] addresses = resolve(host);
        for (InetAddress address : addresses) {
            if (isInternal(address)) {
                LOGGER.warn("Rejected URL host={} resolved={}", host, address.getHostAddress());
                throw new UrlRejectedException("URL points to a private or local network address");
            }
        }
    }

    /** Overridable for tests that must not hit DNS. */
    protected InetAddress[] resolve(String host) {
        try {
            return InetAddress.getAllByName(host);
        } catch (UnknownHostException e) {
            throw new UrlRejectedException("Host cannot be resolved: " + host);
        }
    }

    static boolean isInternal(InetAddress address) {
        if (address.isLoopbackAddress()
                || address.isSiteLocalAddress()
                || address.isLinkLocalAddress()
                || address.isAnyLocalAddress()
                || address.isMulticastAddress()) {
            return true;
        }
        // fc00::/7
        return address instanceof Inet6Address && (address.getAddress()[0] & 0xFE) == 0xFC;
    }
}
