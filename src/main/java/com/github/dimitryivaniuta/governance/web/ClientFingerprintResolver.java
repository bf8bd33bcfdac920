package com.github.dimitryivaniuta.governance.web;

import com.github.dimitryivaniuta.governance.config.GovernanceProperties;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * Network identity of the caller, used to key quotas of anonymous and public traffic.
 * Forwarded headers are only honoured when the service runs behind a trusted proxy.
 */
@Component
public class ClientFingerprintResolver {

    private final boolean trustForwardedHeaders;

    public ClientFingerprintResolver(GovernanceProperties properties) {
        this.trustForwardedHeaders = properties.getWeb().isTrustForwardedHeaders();
    }

    public String resolve(HttpServletRequest req) {
        if (trustForwardedHeaders) {
            // X-Forwarded-For may contain "client, proxy1, proxy2"
            String xff = header(req, "X-Forwarded-For");
            if (xff != null) {
                int comma = xff.indexOf(',');
                String first = (comma >= 0 ? xff.substring(0, comma) : xff).trim();
                if (!first.isBlank()) return first;
            }
            String realIp = header(req, "X-Real-IP");
            if (realIp != null) return realIp;
        }
        String ra = req.getRemoteAddr();
        return (ra == null || ra.isBlank()) ? null : ra;
    }

    private static String header(HttpServletRequest req, String name) {
        String v = req.getHeader(name);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
