package com.creatorradar.discovery.queue;

import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;

/**
 * Rebuilds the public URL of an inbound request. Proxies rewrite the Host header, so X-Forwarded-Host wins;
 * local hosts are plain http, everything else https.
 */
@Component
public class CallbackUrlResolver {

    public String baseUrl(ServerHttpRequest request) {
        HttpHeaders headers = request.getHeaders();
        String host = firstValue(headers.getFirst("X-Forwarded-Host"));
        if (host == null) {
            host = firstValue(headers.getFirst(HttpHeaders.HOST));
        }
        if (host == null) {
            host = request.getURI().getAuthority();
        }
        return baseUrl(host);
    }

    /** Full URL the queue signed: base URL plus request path, no query. */
    public String requestUrl(ServerHttpRequest request) {
        return baseUrl(request) + request.getPath().value();
    }

    static String baseUrl(String host) {
        if (host == null || host.isBlank()) {
            return null;
        }
        return (isLocal(host) ? "http://" : "https://") + host;
    }

    static boolean isLocal(String host) {
        return host.startsWith("localhost") || host.startsWith("127.");
    }

    private static String firstValue(String header) {
        if (header == null) {
            return null;
        }
        int comma = header.indexOf(',');
        String v = (comma >= 0 ? header.substring(0, comma) : header).trim();
        return v.isEmpty() ? null : v;
    }
}
