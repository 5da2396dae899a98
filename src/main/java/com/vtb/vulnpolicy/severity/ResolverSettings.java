package com.vtb.vulnpolicy.severity;

import com.vtb.vulnpolicy.config.PolicyGateConfig;
import com.vtb.vulnpolicy.config.PolicyGateConfig.Resolver;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Эффективные настройки резолвера на один прогон:
 * значения из policy-gate.yaml, поверх них опции CLI и учетные данные.
 * Без явных значений builder() берет те же умолчания, что и конфиг.
 */
@Value
@Builder(toBuilder = true)
public class ResolverSettings {
    @Builder.Default
    String nvdBaseUrl = Resolver.DEFAULT_NVD_BASE_URL;
    String nvdApiKey;
    @Builder.Default
    String ghsaBaseUrl = Resolver.DEFAULT_GHSA_BASE_URL;
    String ghsaToken;
    @Builder.Default
    String ghsaApiVersion = Resolver.DEFAULT_GHSA_API_VERSION;
    @Builder.Default
    String userAgent = Resolver.DEFAULT_USER_AGENT;
    boolean offline;
    @Builder.Default
    SeveritySnapshot snapshot = SeveritySnapshot.empty();
    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(Resolver.DEFAULT_TIMEOUT_SEC);
    @Builder.Default
    int maxAttempts = Resolver.DEFAULT_MAX_ATTEMPTS;
    @Builder.Default
    Duration backoffWithCredentials = Duration.ofMillis(Resolver.DEFAULT_BACKOFF_WITH_CREDENTIALS_MS);
    @Builder.Default
    Duration backoffAnonymous = Duration.ofMillis(Resolver.DEFAULT_BACKOFF_ANONYMOUS_MS);

    public static ResolverSettingsBuilder fromConfig(PolicyGateConfig.Resolver config) {
        return ResolverSettings.builder()
            .nvdBaseUrl(config.getNvdBaseUrl())
            .ghsaBaseUrl(config.getGhsaBaseUrl())
            .ghsaApiVersion(config.getGhsaApiVersion())
            .userAgent(config.getUserAgent())
            .requestTimeout(Duration.ofSeconds(config.getTimeoutSec()))
            .maxAttempts(config.getMaxAttempts())
            .backoffWithCredentials(Duration.ofMillis(config.getBackoffWithCredentialsMs()))
            .backoffAnonymous(Duration.ofMillis(config.getBackoffAnonymousMs()));
    }

    public static ResolverSettingsBuilder defaults() {
        return fromConfig(PolicyGateConfig.load().getResolver());
    }

    boolean hasNvdApiKey() {
        return nvdApiKey != null && !nvdApiKey.isBlank();
    }

    boolean hasGhsaToken() {
        return ghsaToken != null && !ghsaToken.isBlank();
    }
}
