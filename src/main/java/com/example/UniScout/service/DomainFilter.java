package com.example.UniScout.service;

import com.example.UniScout.model.AllowedDomainSet;
import com.example.UniScout.model.SearchResult;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;

/**
 * Accepts a URL only when its host is an allowed domain or a subdomain of one.
 * Fails closed: anything that does not parse to a host is rejected.
 *
 * Search engines return raw, unencoded URLs (spaces in paths, underscores in hosts),
 * so a URL that strict RFC 2396 parsing rejects is re-read with the browser-style parser.
 */
public final class DomainFilter {

    private final AllowedDomainSet allowed;

    private DomainFilter(AllowedDomainSet allowed) {
        this.allowed = allowed;
    }

    public static DomainFilter of(AllowedDomainSet allowed) {
        return new DomainFilter(allowed);
    }

    public boolean isAllowed(String url) {
        String host = host(url);
        if (host == null) {
            return false;
        }
        for (String domain : allowed.domains()) {
            // the dot separator keeps "evilexample.edu" from matching "example.edu"
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }

    public List<SearchResult> filter(List<SearchResult> results) {
        return results.stream()
                .filter(result -> isAllowed(result.url()))
                .toList();
    }

    private static String host(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String trimmed = url.trim();
        String host = strictHost(trimmed);
        if (host == null) {
            host = lenientHost(trimmed);
        }
        if (host == null || host.isBlank()) {
            return null;
        }
        host = host.toLowerCase(Locale.ROOT);
        return host.endsWith(".") ? host.substring(0, host.length() - 1) : host;
    }

    private static String strictHost(String url) {
        try {
            return new URI(url).getHost();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static String lenientHost(String url) {
        try {
            return UriComponentsBuilder.fromUriString(url, UriComponentsBuilder.ParserType.WHAT_WG).build().getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
