package com.phoenixdash.common.infra;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Set;

/**
 * Validates hostnames before the backend fetches from them on behalf of a
 * payment (Lightning Address domains, LNURL callbacks). Requests to
 * private/internal networks are blocked unless the policy allows them.
 */
public final class SsrfGuard {

    private SsrfGuard() {
    }

    private static final Set<String> BLOCKED_HOSTNAMES = Set.of(
            "localhost", "metadata.google.internal");

    private static final List<String> PRIVATE_IPV6_PREFIXES = List.of(
            "fe80:", "fec0:", "fc", "fd");

    public record SsrfPolicy(boolean allowPrivateNetwork) {
        public static final SsrfPolicy DEFAULT = new SsrfPolicy(false);
        public static final SsrfPolicy PERMISSIVE = new SsrfPolicy(true);
    }

    /**
     * Thrown when a host is rejected by the policy or cannot be resolved.
     */
    public static class SsrfBlockedError extends RuntimeException {
        private final boolean unresolvable;

        public SsrfBlockedError(String message, boolean unresolvable) {
            super(message);
            this.unresolvable = unresolvable;
        }

        public boolean isUnresolvable() {
            return unresolvable;
        }
    }

    public static void assertPublicHostname(String hostname, SsrfPolicy policy) {
        String normalized = normalizeHostname(hostname);
        if (normalized.isEmpty()) {
            throw new SsrfBlockedError("Missing hostname", false);
        }
        if (policy.allowPrivateNetwork()) {
            return;
        }
        if (isBlockedHostname(normalized)) {
            throw new SsrfBlockedError("Blocked hostname: " + hostname, false);
        }

        try {
            for (InetAddress addr : InetAddress.getAllByName(normalized)) {
                if (isPrivateIpAddress(addr)) {
                    throw new SsrfBlockedError(
                            "Blocked private IP: " + addr.getHostAddress() + " for hostname: " + hostname, false);
                }
            }
        } catch (UnknownHostException e) {
            throw new SsrfBlockedError("Cannot resolve hostname: " + hostname, true);
        }
    }

    public static boolean isBlockedHostname(String hostname) {
        return BLOCKED_HOSTNAMES.contains(normalizeHostname(hostname));
    }

    public static boolean isPrivateIpAddress(InetAddress address) {
        return address.isLoopbackAddress()
                || address.isSiteLocalAddress()
                || address.isLinkLocalAddress()
                || address.isAnyLocalAddress()
                || isPrivateIpv6(address.getHostAddress());
    }

    public static boolean isPrivateIpAddress(String literal) {
        try {
            return isPrivateIpAddress(InetAddress.getByName(literal));
        } catch (UnknownHostException e) {
            return false;
        }
    }

    private static boolean isPrivateIpv6(String address) {
        if (address == null || !address.contains(":"))
            return false;
        String lower = address.toLowerCase();
        return PRIVATE_IPV6_PREFIXES.stream().anyMatch(lower::startsWith);
    }

    static String normalizeHostname(String hostname) {
        if (hostname == null)
            return "";
        String h = hostname.trim().toLowerCase();
        if (h.startsWith("[") && h.endsWith("]")) {
            h = h.substring(1, h.length() - 1);
        }
        if (h.endsWith(".")) {
            h = h.substring(0, h.length() - 1);
        }
        return h;
    }
}
