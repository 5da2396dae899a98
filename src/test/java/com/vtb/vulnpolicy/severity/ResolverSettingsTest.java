package com.vtb.vulnpolicy.severity;

import com.vtb.vulnpolicy.config.PolicyGateConfig.Resolver;
import com.vtb.vulnpolicy.models.Finding;
import com.vtb.vulnpolicy.models.Severity;
import com.vtb.vulnpolicy.severity.FakeAdvisoryServer.Reply;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ResolverSettingsTest {

    @Test
    void bareBuilderUsesConfigDefaults() {
        ResolverSettings settings = ResolverSettings.builder().build();

        assertEquals(Resolver.DEFAULT_NVD_BASE_URL, settings.getNvdBaseUrl());
        assertEquals(Resolver.DEFAULT_GHSA_BASE_URL, settings.getGhsaBaseUrl());
        assertEquals(Resolver.DEFAULT_GHSA_API_VERSION, settings.getGhsaApiVersion());
        assertEquals(Resolver.DEFAULT_USER_AGENT, settings.getUserAgent());
        assertEquals(Duration.ofSeconds(Resolver.DEFAULT_TIMEOUT_SEC), settings.getRequestTimeout());
        assertEquals(Resolver.DEFAULT_MAX_ATTEMPTS, settings.getMaxAttempts());
        assertEquals(Duration.ofMillis(Resolver.DEFAULT_BACKOFF_WITH_CREDENTIALS_MS), settings.getBackoffWithCredentials());
        assertEquals(Duration.ofMillis(Resolver.DEFAULT_BACKOFF_ANONYMOUS_MS), settings.getBackoffAnonymous());
        assertFalse(settings.isOffline());
        assertTrue(settings.getSnapshot().isEmpty());
    }

    @Test
    void zeroAttemptsRejected() {
        ResolverSettings settings = ResolverSettings.builder().maxAttempts(0).build();

        assertThrows(IllegalArgumentException.class, () -> new AdvisorySeverityResolver(settings));
    }

    @Test
    void missingApiVersionAndUserAgentDoNotBreakLookup() throws Exception {
        try (FakeAdvisoryServer upstream = new FakeAdvisoryServer()) {
            upstream.ghsa((id, call) -> Reply.json("{\"ghsa_id\":\"GHSA-x\",\"severity\":\"high\"}"));
            ResolverSettings settings = ResolverSettings.builder()
                .ghsaBaseUrl(upstream.ghsaUrl())
                .nvdBaseUrl(upstream.nvdUrl())
                .ghsaApiVersion(null)
                .userAgent(null)
                .build();

            Finding finding = Finding.builder().id("GO-1").alias("GHSA-x").reachable(true).build();
            SeverityResolution resolution = new AdvisorySeverityResolver(settings).resolve(finding);

            assertEquals(Severity.HIGH, resolution.getAssessment().getSeverity());
            FakeAdvisoryServer.Recorded request = upstream.requests().get(0);
            assertNull(request.apiVersion());
            assertEquals(Resolver.DEFAULT_USER_AGENT, request.userAgent());
        }
    }
}
