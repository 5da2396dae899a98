package com.vtb.vulnpolicy.severity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.vulnpolicy.config.PolicyGateConfig;
import com.vtb.vulnpolicy.models.SeverityAssessment;
import com.vtb.vulnpolicy.util.CancellationSignal;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * HTTP-запрос к источнику advisory с повторами.
 *
 * Каждый поиск - конечный автомат ATTEMPTING -> BACKOFF -> ATTEMPTING ... -> DONE | CANCELLED.
 * Повторяются только транспортные ошибки, 429 и 5xx. 401/403 терминальны.
 * Ожидание между попытками прерывается сигналом отмены.
 */
@Slf4j
class AdvisoryFetcher {

    private enum LookupState {
        ATTEMPTING,
        BACKOFF,
        DONE,
        CANCELLED
    }

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final BackoffPolicy backoff;
    private final long callTimeoutMs;
    private final int maxAttempts;
    private final String userAgent;

    AdvisoryFetcher(ResolverSettings settings) {
        this(settings, new BackoffPolicy(settings.getBackoffWithCredentials(), settings.getBackoffAnonymous()));
    }

    AdvisoryFetcher(ResolverSettings settings, BackoffPolicy backoff) {
        if (settings.getMaxAttempts() < 1) {
            throw new IllegalArgumentException("maxAttempts должен быть >= 1, получено " + settings.getMaxAttempts());
        }
        long timeoutMs = settings.getRequestTimeout() != null ? settings.getRequestTimeout().toMillis() : 15_000L;
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(timeoutMs, TimeUnit.MILLISECONDS)
            .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
            .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
            .retryOnConnectionFailure(false)
            .build();
        this.callTimeoutMs = timeoutMs;
        this.mapper = new ObjectMapper();
        this.backoff = backoff;
        this.maxAttempts = settings.getMaxAttempts();
        this.userAgent = settings.getUserAgent() == null || settings.getUserAgent().isBlank()
            ? PolicyGateConfig.Resolver.DEFAULT_USER_AGENT
            : settings.getUserAgent();
    }

    LookupOutcome fetch(AdvisorySource source, String id, CancellationSignal signal) {
        HttpUrl url;
        try {
            url = source.lookupUrl(id);
        } catch (IllegalArgumentException e) {
            return failed(source, id, FailureKind.INVALID_REQUEST, e.getMessage(), e);
        }

        LookupState state = LookupState.ATTEMPTING;
        int attempt = 1;
        AttemptResult last = null;

        while (state != LookupState.DONE && state != LookupState.CANCELLED) {
            switch (state) {
                case ATTEMPTING -> {
                    if (signal.isCancelled()) {
                        state = LookupState.CANCELLED;
                    } else {
                        last = attempt(source, id, url, signal);
                        if (last.cancelled()) {
                            state = LookupState.CANCELLED;
                        } else if (last.retryable() && attempt < maxAttempts) {
                            state = LookupState.BACKOFF;
                        } else {
                            state = LookupState.DONE;
                        }
                    }
                }
                case BACKOFF -> {
                    Duration delay = backoff.delay(attempt, source.hasCredentials());
                    log.debug("{} {}: попытка {} из {} неуспешна ({}), повтор через {} мс",
                        source.name(), id, attempt, maxAttempts, last.outcome().getFailure().getMessage(),
                        delay.toMillis());
                    if (signal.sleep(delay)) {
                        state = LookupState.CANCELLED;
                    } else {
                        attempt++;
                        state = LookupState.ATTEMPTING;
                    }
                }
                default -> throw new IllegalStateException("Неожиданное состояние: " + state);
            }
        }

        if (state == LookupState.CANCELLED) {
            log.debug("{} {}: поиск отменен на попытке {}", source.name(), id, attempt);
            return failed(source, id, FailureKind.CANCELLED,
                source.name() + " lookup for " + id + " cancelled", null);
        }
        if (last.outcome().isFailed()) {
            log.warn("{} {}: {}", source.name(), id, last.outcome().getFailure().getMessage());
        }
        return last.outcome();
    }

    private AttemptResult attempt(AdvisorySource source, String id, HttpUrl url, CancellationSignal signal) {
        Request.Builder builder = new Request.Builder()
            .url(url)
            .get()
            .header("User-Agent", userAgent);
        source.applyHeaders(builder);

        Call call = httpClient.newCall(builder.build());
        Duration left = signal.remaining();
        if (left != null) {
            call.timeout().timeout(Math.max(1L, Math.min(left.toMillis(), callTimeoutMs)), TimeUnit.MILLISECONDS);
        }
        try (CancellationSignal.Registration ignored = signal.onCancel(call::cancel);
             Response response = call.execute()) {
            if (signal.isCancelled()) {
                return AttemptResult.cancelledAttempt();
            }
            AttemptResult result = handleResponse(source, id, response);
            // ответ, дочитанный после дедлайна, не должен попасть в кэш
            return signal.isCancelled() ? AttemptResult.cancelledAttempt() : result;
        } catch (IOException e) {
            if (signal.isCancelled() || call.isCanceled()) {
                return AttemptResult.cancelledAttempt();
            }
            String message = source.name() + " request for " + id + " failed: " + e.getMessage();
            return AttemptResult.retryable(failed(source, id, FailureKind.NETWORK, message, e));
        }
    }

    private AttemptResult handleResponse(AdvisorySource source, String id, Response response) throws IOException {
        int code = response.code();
        if (code == 401) {
            return AttemptResult.terminal(failed(source, id, FailureKind.UNAUTHORIZED, source.unauthorizedMessage(), null));
        }
        if (code == 403) {
            return AttemptResult.terminal(failed(source, id, FailureKind.FORBIDDEN, source.forbiddenMessage(), null));
        }
        if (code == 429) {
            return AttemptResult.retryable(failed(source, id, FailureKind.RATE_LIMITED, source.rateLimitMessage(id), null));
        }
        if (code >= 500) {
            return AttemptResult.retryable(failed(source, id, FailureKind.HTTP_STATUS, statusMessage(source, id, code), null));
        }
        if (code != 200) {
            return AttemptResult.terminal(failed(source, id, FailureKind.HTTP_STATUS, statusMessage(source, id, code), null));
        }

        ResponseBody body = response.body();
        String content = body != null ? body.string() : "";
        SeverityAssessment assessment;
        try {
            assessment = source.extract(mapper, content, id);
        } catch (JsonProcessingException e) {
            String message = "decode " + source.name() + " response for " + id + ": " + e.getOriginalMessage();
            return AttemptResult.terminal(failed(source, id, FailureKind.DECODE, message, e));
        }
        if (!assessment.isKnown()) {
            LookupFailure failure = source.failure(id, FailureKind.NO_DATA,
                source.name() + " API returned no severity data for " + id);
            return AttemptResult.terminal(LookupOutcome.failed(assessment, failure));
        }
        log.debug("{} {}: {} ({})", source.name(), id, assessment.getSeverity(), assessment.getScore());
        return AttemptResult.terminal(LookupOutcome.success(assessment));
    }

    private static String statusMessage(AdvisorySource source, String id, int code) {
        return source.name() + " API returned HTTP " + code + " for " + id;
    }

    private static LookupOutcome failed(AdvisorySource source, String id, FailureKind kind,
                                        String message, Throwable cause) {
        return LookupOutcome.failed(SeverityAssessment.unknown(id), source.failure(id, kind, message, cause));
    }

    private record AttemptResult(LookupOutcome outcome, boolean retryable, boolean cancelled) {

        static AttemptResult terminal(LookupOutcome outcome) {
            return new AttemptResult(outcome, false, false);
        }

        static AttemptResult retryable(LookupOutcome outcome) {
            return new AttemptResult(outcome, true, false);
        }

        static AttemptResult cancelledAttempt() {
            return new AttemptResult(null, false, true);
        }
    }
}
