package com.vtb.vulnpolicy.util;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CvssScoresTest {

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    @Test
    void parseNumberAndNumericString() {
        assertEquals(7.5, CvssScores.parse(nodes.numberNode(7.5)).getAsDouble());
        assertEquals(9.1, CvssScores.parse(nodes.textNode(" 9.1 ")).getAsDouble());
    }

    @Test
    void parseRejectsEverythingElse() {
        assertTrue(CvssScores.parse(null).isEmpty());
        assertTrue(CvssScores.parse(nodes.nullNode()).isEmpty());
        assertTrue(CvssScores.parse(nodes.textNode("CVSS:3.1/AV:N")).isEmpty());
        assertTrue(CvssScores.parse(nodes.objectNode()).isEmpty());
    }

    @Test
    void scoreSegmentFromVector() {
        assertEquals(8.8, CvssScores.fromVector("CVSS:3.1/AV:N/AC:L/SCORE:8.8"));
        assertEquals(0, CvssScores.fromVector("CVSS:3.1/AV:N/AC:L/PR:N"));
        assertEquals(0, CvssScores.fromVector(null));
    }
}
