package com.vtb.vulnpolicy.severity.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Ответ NVD CVE API 2.0 (только поля, нужные для критичности)
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class NvdResponse {

    private List<Vulnerability> vulnerabilities = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Vulnerability {
        private Cve cve;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Cve {
        private Metrics metrics;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Metrics {
        private List<Metric> cvssMetricV31 = new ArrayList<>();
        private List<Metric> cvssMetricV30 = new ArrayList<>();
        private List<Metric> cvssMetricV2 = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Metric {
        private CvssData cvssData;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CvssData {
        private double baseScore;
        private String baseSeverity;
    }
}
