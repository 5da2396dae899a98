package com.vtb.vulnpolicy.severity;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.vulnpolicy.models.SeverityAssessment;
import okhttp3.HttpUrl;
import okhttp3.Request;

import java.io.IOException;
import java.util.Optional;

/**
 * Внешняя база advisory, опрашиваемая по одному идентификатору.
 * Описывает только то, чем источники различаются: URL, заголовки,
 * схему ответа и тексты ошибок. Повторы и кэш общие.
 */
abstract class AdvisorySource {

    /** Имя для сообщений и логов: GHSA, NVD */
    abstract String name();

    /** Префикс подходящих алиасов: GHSA-, CVE- */
    abstract String candidatePrefix();

    /** Как называть алиасы в тексте причины: GHSA, CVE */
    abstract String aliasLabel();

    /**
     * @throws IllegalArgumentException если базовый URL некорректен
     */
    abstract HttpUrl lookupUrl(String id);

    abstract void applyHeaders(Request.Builder request);

    abstract boolean hasCredentials();

    abstract String unauthorizedMessage();

    abstract String forbiddenMessage();

    abstract String rateLimitMessage(String id);

    /**
     * Разбор тела ответа 200. Если данных о критичности нет - UNKNOWN.
     *
     * @throws IOException если тело не является ожидаемым JSON
     */
    abstract SeverityAssessment extract(ObjectMapper mapper, String body, String id) throws IOException;

    /**
     * Ответ без сети (снапшот или офлайн-отказ). empty - нужен HTTP-запрос.
     */
    abstract Optional<LookupOutcome> resolveLocally(String id);

    LookupFailure failure(String id, FailureKind kind, String message) {
        return LookupFailure.of(name(), id, kind, message);
    }

    LookupFailure failure(String id, FailureKind kind, String message, Throwable cause) {
        return LookupFailure.builder()
            .source(name())
            .identifier(id)
            .kind(kind)
            .message(message)
            .cause(cause)
            .build();
    }

    static HttpUrl parseBase(String baseUrl) {
        String trimmed = baseUrl == null ? "" : baseUrl.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("advisory base URL is required");
        }
        HttpUrl parsed = HttpUrl.parse(trimmed);
        if (parsed == null) {
            throw new IllegalArgumentException("invalid advisory base URL: " + trimmed);
        }
        return parsed;
    }
}
