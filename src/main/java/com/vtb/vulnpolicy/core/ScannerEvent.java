package com.vtb.vulnpolicy.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Одно событие JSON-потока сканера: описание advisory ({"osv": ...})
 * либо находка с трассой вызовов ({"finding": ...}).
 * Прочие события (config, progress, SBOM) игнорируются.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScannerEvent {

    private Osv osv;
    private FindingTrace finding;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Osv {
        private String id;
        private List<String> aliases = new ArrayList<>();
        private String summary;
        /** Строка, объект {type, score, severity} или массив из них */
        private JsonNode severity;
        @JsonProperty("database_specific")
        private DatabaseSpecific databaseSpecific = new DatabaseSpecific();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DatabaseSpecific {
        private String url;
        private String severity;
        private double score;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FindingTrace {
        private String osv;
        @JsonProperty("fixed_version")
        private String fixedVersion;
        private List<Frame> trace = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Frame {
        @JsonProperty("package")
        private String packageName;
        private String function;
    }
}
