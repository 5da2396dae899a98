package com.vtb.vulnpolicy.severity;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.vulnpolicy.models.Severity;
import com.vtb.vulnpolicy.models.SeverityAssessment;
import com.vtb.vulnpolicy.models.SeverityMethod;
import com.vtb.vulnpolicy.severity.payload.NvdResponse;
import com.vtb.vulnpolicy.util.Identifiers;
import okhttp3.HttpUrl;
import okhttp3.Request;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * NVD CVE API: GET {base}?cveId=ID, необязательный заголовок apiKey.
 * Закрепленный снапшот проверяется до сети.
 */
class NvdAdvisorySource extends AdvisorySource {

    static final String UNAUTHORIZED_MESSAGE =
        "Missing or invalid NVD API key. Please configure a valid API key.";
    static final String FORBIDDEN_MESSAGE =
        "NVD API key valid but lacks required permissions. Please check your API key configuration.";

    private final ResolverSettings settings;

    NvdAdvisorySource(ResolverSettings settings) {
        this.settings = settings;
    }

    @Override
    String name() {
        return "NVD";
    }

    @Override
    String candidatePrefix() {
        return Identifiers.CVE_PREFIX;
    }

    @Override
    String aliasLabel() {
        return "CVE";
    }

    @Override
    HttpUrl lookupUrl(String id) {
        return parseBase(settings.getNvdBaseUrl()).newBuilder()
            .setQueryParameter("cveId", id)
            .build();
    }

    @Override
    void applyHeaders(Request.Builder request) {
        request.header("Accept", "application/json");
        if (hasCredentials()) {
            request.header("apiKey", settings.getNvdApiKey());
        }
    }

    @Override
    boolean hasCredentials() {
        return settings.hasNvdApiKey();
    }

    @Override
    String unauthorizedMessage() {
        return UNAUTHORIZED_MESSAGE;
    }

    @Override
    String forbiddenMessage() {
        return FORBIDDEN_MESSAGE;
    }

    @Override
    String rateLimitMessage(String id) {
        return "NVD API returned HTTP 429 for " + id + ". This indicates rate limiting. "
            + "Retry later, or configure --nvd-api-key-file or NVD_API_KEY for higher request limits";
    }

    @Override
    SeverityAssessment extract(ObjectMapper mapper, String body, String id) throws IOException {
        NvdResponse payload = mapper.readValue(body, NvdResponse.class);
        return bestSeverity(payload, id);
    }

    @Override
    Optional<LookupOutcome> resolveLocally(String id) {
        Optional<SeverityAssessment> pinned = settings.getSnapshot().get(id);
        if (pinned.isPresent()) {
            return Optional.of(LookupOutcome.success(pinned.get()));
        }
        if (settings.isOffline()) {
            return Optional.of(LookupOutcome.failed(SeverityAssessment.unknown(id),
                failure(id, FailureKind.OFFLINE,
                    "offline mode enabled and " + id + " is missing from severity snapshot")));
        }
        return Optional.empty();
    }

    /**
     * Лучшая метрика по всем записям ответа: CVSS v3.1, v3.0, v2.
     * Выше уровень - лучше, при равенстве уровней - выше score.
     */
    static SeverityAssessment bestSeverity(NvdResponse payload, String id) {
        Severity bestSeverity = Severity.UNKNOWN;
        double bestScore = -1;

        List<NvdResponse.Vulnerability> vulnerabilities =
            payload != null && payload.getVulnerabilities() != null ? payload.getVulnerabilities() : List.of();
        for (NvdResponse.Vulnerability vulnerability : vulnerabilities) {
            for (NvdResponse.Metric metric : metricsOf(vulnerability)) {
                if (metric == null || metric.getCvssData() == null) {
                    continue;
                }
                double score = metric.getCvssData().getBaseScore();
                Severity severity = Severity.normalize(metric.getCvssData().getBaseSeverity(), score);
                if (severity.getPriority() > bestSeverity.getPriority()) {
                    bestSeverity = severity;
                    bestScore = score;
                } else if (severity == bestSeverity && score > bestScore) {
                    bestScore = score;
                }
            }
        }

        return SeverityAssessment.builder()
            .severity(bestSeverity)
            .score(Math.max(0, bestScore))
            .source(id)
            .method(SeverityMethod.NVD)
            .build();
    }

    private static List<NvdResponse.Metric> metricsOf(NvdResponse.Vulnerability vulnerability) {
        List<NvdResponse.Metric> metrics = new ArrayList<>();
        if (vulnerability == null || vulnerability.getCve() == null || vulnerability.getCve().getMetrics() == null) {
            return metrics;
        }
        NvdResponse.Metrics source = vulnerability.getCve().getMetrics();
        if (source.getCvssMetricV31() != null) metrics.addAll(source.getCvssMetricV31());
        if (source.getCvssMetricV30() != null) metrics.addAll(source.getCvssMetricV30());
        if (source.getCvssMetricV2() != null) metrics.addAll(source.getCvssMetricV2());
        return metrics;
    }
}
