package com.phoenixdash.common.infra;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SsrfGuardTest {

    @Nested
    class PrivateIpDetection {
        @Test
        void loopbackIsPrivate() {
            assertTrue(SsrfGuard.isPrivateIpAddress("127.0.0.1"));
            assertTrue(SsrfGuard.isPrivateIpAddress("::1"));
        }

        @Test
        void rfc1918IsPrivate() {
            assertTrue(SsrfGuard.isPrivateIpAddress("10.0.0.1"));
            assertTrue(SsrfGuard.isPrivateIpAddress("172.16.0.1"));
            assertTrue(SsrfGuard.isPrivateIpAddress("192.168.1.1"));
        }

        @Test
        void publicIsNotPrivate() {
            assertFalse(SsrfGuard.isPrivateIpAddress("8.8.8.8"));
            assertFalse(SsrfGuard.isPrivateIpAddress("1.1.1.1"));
        }
    }

    @Nested
    class HostnameChecks {
        @Test
        void localhostIsBlocked() {
            assertTrue(SsrfGuard.isBlockedHostname("localhost"));
            assertTrue(SsrfGuard.isBlockedHostname("LOCALHOST."));
        }

        @Test
        void normalHostnameNotBlocked() {
            assertFalse(SsrfGuard.isBlockedHostname("getalby.com"));
        }

        @Test
        void loopbackLiteral_defaultPolicy_throws() {
            SsrfGuard.SsrfBlockedError error = assertThrows(SsrfGuard.SsrfBlockedError.class,
                    () -> SsrfGuard.assertPublicHostname("127.0.0.1", SsrfGuard.SsrfPolicy.DEFAULT));
            assertFalse(error.isUnresolvable());
        }

        @Test
        void loopbackLiteral_permissivePolicy_passes() {
            assertDoesNotThrow(
                    () -> SsrfGuard.assertPublicHostname("127.0.0.1", SsrfGuard.SsrfPolicy.PERMISSIVE));
        }

        @Test
        void emptyHostname_alwaysRejected() {
            assertThrows(SsrfGuard.SsrfBlockedError.class,
                    () -> SsrfGuard.assertPublicHostname(" ", SsrfGuard.SsrfPolicy.PERMISSIVE));
        }
    }

    @Nested
    class HostnameNormalization {
        @Test
        void stripsTrailingDot() {
            assertEquals("example.com", SsrfGuard.normalizeHostname("example.com."));
        }

        @Test
        void stripsIpv6Brackets() {
            assertEquals("::1", SsrfGuard.normalizeHostname("[::1]"));
        }

        @Test
        void nullBecomesEmpty() {
            assertEquals("", SsrfGuard.normalizeHostname(null));
        }
    }
}
