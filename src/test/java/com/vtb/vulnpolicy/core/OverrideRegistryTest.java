package com.vtb.vulnpolicy.core;

import com.vtb.vulnpolicy.models.Finding;
import com.vtb.vulnpolicy.models.RiskOverride;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для OverrideRegistry
 */
class OverrideRegistryTest {

    @Test
    void loadsAndCanonicalisesIds() throws IOException {
        OverrideRegistry registry = load("{\"overrides\":[{\"id\":\" go-9 \",\"reason\":\" accepted \",\"expires_on\":\"2026-01-01\"}]}");

        assertEquals(1, registry.size());
        RiskOverride override = registry.get("GO-9").orElseThrow();
        assertEquals("GO-9", override.getId());
        assertEquals("accepted", override.getReason());
        assertEquals(LocalDate.of(2026, 1, 1), override.getExpiresOn());
    }

    @Test
    void ownIdMatchesBeforeAliases() throws IOException {
        OverrideRegistry registry = load("{\"overrides\":["
            + "{\"id\":\"CVE-1\",\"reason\":\"alias\",\"expires_on\":\"2030-01-01\"},"
            + "{\"id\":\"GO-1\",\"reason\":\"own\",\"expires_on\":\"2030-01-01\"}]}");

        Finding finding = Finding.builder().id("GO-1").alias("CVE-1").build();
        OverrideRegistry.Match match = registry.match(finding).orElseThrow();
        assertEquals("GO-1", match.matchedById());
        assertEquals("own", match.override().getReason());
    }

    @Test
    void aliasMatchReportsAlias() throws IOException {
        OverrideRegistry registry = load("{\"overrides\":[{\"id\":\"GHSA-AAAA\",\"reason\":\"x\",\"expires_on\":\"2030-01-01\"}]}");

        Finding finding = Finding.builder().id("GO-1").alias("CVE-1").alias("ghsa-aaaa").build();
        Optional<OverrideRegistry.Match> match = registry.match(finding);
        assertTrue(match.isPresent());
        assertEquals("GHSA-AAAA", match.get().matchedById());
    }

    @Test
    void noMatch() throws IOException {
        OverrideRegistry registry = load("{\"overrides\":[]}");
        assertTrue(registry.match(Finding.builder().id("GO-1").build()).isEmpty());
    }

    @Test
    void duplicateIdsRejected() {
        PolicyInputException error = assertThrows(PolicyInputException.class, () -> load("{\"overrides\":["
            + "{\"id\":\"GO-1\",\"reason\":\"a\",\"expires_on\":\"2030-01-01\"},"
            + "{\"id\":\"go-1\",\"reason\":\"b\",\"expires_on\":\"2030-01-01\"}]}"));
        assertTrue(error.getMessage().contains("GO-1"));
    }

    @Test
    void missingFieldsRejected() {
        assertThrows(PolicyInputException.class,
            () -> load("{\"overrides\":[{\"reason\":\"a\",\"expires_on\":\"2030-01-01\"}]}"));
        assertThrows(PolicyInputException.class,
            () -> load("{\"overrides\":[{\"id\":\"GO-1\",\"reason\":\" \",\"expires_on\":\"2030-01-01\"}]}"));
        assertThrows(PolicyInputException.class,
            () -> load("{\"overrides\":[{\"id\":\"GO-1\",\"reason\":\"a\"}]}"));
    }

    @Test
    void invalidDateRejected() {
        PolicyInputException error = assertThrows(PolicyInputException.class,
            () -> load("{\"overrides\":[{\"id\":\"GO-1\",\"reason\":\"a\",\"expires_on\":\"01/02/2030\"}]}"));
        assertTrue(error.getMessage().contains("01/02/2030"));
    }

    @Test
    void malformedJsonRejected() {
        assertThrows(PolicyInputException.class, () -> load("{\"overrides\": ["));
    }

    private static OverrideRegistry load(String json) throws IOException {
        return OverrideRegistry.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }
}
