package com.vtb.vulnpolicy.util;

import com.vtb.vulnpolicy.models.Finding;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IdentifiersTest {

    @Test
    void candidatesWithPrefixAreCanonicalUniqueAndSorted() {
        Finding finding = Finding.builder()
            .id("GO-2024-0001")
            .alias("cve-2024-2")
            .alias(" CVE-2024-1 ")
            .alias("CVE-2024-2")
            .alias("GHSA-aaaa-bbbb-cccc")
            .build();

        assertEquals(List.of("CVE-2024-1", "CVE-2024-2"), Identifiers.withPrefix(finding, Identifiers.CVE_PREFIX));
        assertEquals(List.of("GHSA-AAAA-BBBB-CCCC"), Identifiers.withPrefix(finding, Identifiers.GHSA_PREFIX));
    }

    @Test
    void findingIdItselfIsACandidate() {
        Finding finding = Finding.builder().id("CVE-2023-9").build();
        assertEquals(List.of("CVE-2023-9"), Identifiers.withPrefix(finding, Identifiers.CVE_PREFIX));
        assertTrue(Identifiers.withPrefix(finding, Identifiers.GHSA_PREFIX).isEmpty());
    }

    @Test
    void uniqueKeepsFirstSeenOrder() {
        assertEquals(List.of("b", "a"), Identifiers.unique(Arrays.asList(" b", null, "a", "", "b ")));
    }

    @Test
    void normalizeHandlesNull() {
        assertEquals("", Identifiers.normalize(null));
        assertEquals("GO-1", Identifiers.normalize(" go-1 "));
    }
}
