package com.vtb.vulnpolicy.severity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.vulnpolicy.models.Severity;
import com.vtb.vulnpolicy.models.SeverityAssessment;
import com.vtb.vulnpolicy.models.SeverityMethod;
import com.vtb.vulnpolicy.severity.payload.GhsaResponse;
import com.vtb.vulnpolicy.util.CvssScores;
import com.vtb.vulnpolicy.util.Identifiers;
import okhttp3.HttpUrl;
import okhttp3.Request;

import java.io.IOException;
import java.util.Arrays;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * GitHub Security Advisory API: GET {base}/{GHSA-ID}.
 * Офлайн-снапшота для GHSA нет: в офлайн-режиме поиск всегда неуспешен.
 */
class GhsaAdvisorySource extends AdvisorySource {

    static final String UNAUTHORIZED_MESSAGE = "Missing or invalid GHSA token. Remove --ghsa-token-file "
        + "(and GHSA_TOKEN/GITHUB_TOKEN) to use unauthenticated access, or configure a valid token.";
    static final String FORBIDDEN_MESSAGE =
        "GHSA token is valid but access is forbidden. Check token scope and account permissions.";

    private final ResolverSettings settings;

    GhsaAdvisorySource(ResolverSettings settings) {
        this.settings = settings;
    }

    @Override
    String name() {
        return "GHSA";
    }

    @Override
    String candidatePrefix() {
        return Identifiers.GHSA_PREFIX;
    }

    @Override
    String aliasLabel() {
        return "GHSA";
    }

    @Override
    HttpUrl lookupUrl(String id) {
        return parseBase(settings.getGhsaBaseUrl()).newBuilder()
            .addPathSegment(id)
            .build();
    }

    @Override
    void applyHeaders(Request.Builder request) {
        request.header("Accept", "application/vnd.github+json");
        String apiVersion = settings.getGhsaApiVersion();
        if (apiVersion != null && !apiVersion.isBlank()) {
            request.header("X-GitHub-Api-Version", apiVersion);
        }
        if (hasCredentials()) {
            request.header("Authorization", "Bearer " + settings.getGhsaToken());
        }
    }

    @Override
    boolean hasCredentials() {
        return settings.hasGhsaToken();
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
        return "GHSA API returned HTTP 429 for " + id + ". This indicates rate limiting. "
            + "Retry later, use unauthenticated fallback, or configure --ghsa-token-file for higher request limits";
    }

    @Override
    SeverityAssessment extract(ObjectMapper mapper, String body, String id) throws IOException {
        GhsaResponse payload = mapper.readValue(body, GhsaResponse.class);
        return bestSeverity(payload, id);
    }

    @Override
    Optional<LookupOutcome> resolveLocally(String id) {
        if (settings.isOffline()) {
            return Optional.of(LookupOutcome.failed(SeverityAssessment.unknown(id),
                failure(id, FailureKind.OFFLINE,
                    "offline mode enabled and " + id + " requires live GHSA lookup")));
        }
        return Optional.empty();
    }

    /**
     * Кандидаты: верхнеуровневые severity + cvss.score, затем cvss_v4 и cvss_v3.
     */
    static SeverityAssessment bestSeverity(GhsaResponse payload, String fallbackId) {
        String source = Identifiers.normalize(payload != null ? payload.getGhsaId() : null);
        if (source.isEmpty()) {
            source = Identifiers.normalize(fallbackId);
        }
        SeverityAssessment best = SeverityAssessment.builder()
            .source(source)
            .method(SeverityMethod.GHSA)
            .build();
        if (payload == null) {
            return best;
        }

        JsonNode topLevelScore = payload.getCvss() != null ? payload.getCvss().getScore() : null;
        best = better(best, candidate(source, payload.getSeverity(), topLevelScore));

        GhsaResponse.CvssSeverities severities = payload.getCvssSeverities();
        if (severities != null) {
            for (GhsaResponse.CvssEntry entry : Arrays.asList(severities.getCvssV4(), severities.getCvssV3())) {
                if (entry != null) {
                    best = better(best, candidate(source, entry.getSeverity(), entry.getScore()));
                }
            }
        }
        return best;
    }

    private static SeverityAssessment candidate(String source, String rawSeverity, JsonNode scoreNode) {
        OptionalDouble score = CvssScores.parse(scoreNode);
        double value = score.orElse(0);
        return SeverityAssessment.builder()
            .severity(Severity.normalize(rawSeverity, value))
            .score(value)
            .source(source)
            .method(SeverityMethod.GHSA)
            .build();
    }

    private static SeverityAssessment better(SeverityAssessment current, SeverityAssessment candidate) {
        return candidate.isBetterThan(current) ? candidate : current;
    }
}
