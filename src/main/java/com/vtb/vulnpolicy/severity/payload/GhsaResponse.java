package com.vtb.vulnpolicy.severity.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * Ответ GitHub Advisory API (GET /advisories/{ghsa_id}).
 * score может прийти числом или строкой, поэтому JsonNode.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GhsaResponse {

    @JsonProperty("ghsa_id")
    private String ghsaId;
    private String severity;
    private Cvss cvss;
    @JsonProperty("cvss_severities")
    private CvssSeverities cvssSeverities;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Cvss {
        private JsonNode score;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CvssSeverities {
        @JsonProperty("cvss_v3")
        private CvssEntry cvssV3;
        @JsonProperty("cvss_v4")
        private CvssEntry cvssV4;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CvssEntry {
        private JsonNode score;
        private String severity;
    }
}
