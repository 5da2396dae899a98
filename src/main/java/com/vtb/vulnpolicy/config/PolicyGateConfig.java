package com.vtb.vulnpolicy.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;

import java.io.IOException;
import java.io.InputStream;

/**
 * Конфигурация policy gate из YAML файла (policy-gate.yaml в classpath).
 * Значения по умолчанию для резолвера критичности.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PolicyGateConfig {

    private static final String RESOURCE = "policy-gate.yaml";

    private Resolver resolver;

    private static PolicyGateConfig instance;

    /**
     * Загрузить конфигурацию из classpath
     */
    public static synchronized PolicyGateConfig load() {
        if (instance == null) {
            try (InputStream is = PolicyGateConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
                if (is == null) {
                    throw new IllegalStateException(RESOURCE + " не найден в classpath");
                }
                instance = read(is);
            } catch (IOException e) {
                throw new IllegalStateException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
            }
        }
        return instance;
    }

    static PolicyGateConfig read(InputStream is) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        PolicyGateConfig config = mapper.readValue(is, PolicyGateConfig.class);
        if (config == null) {
            config = new PolicyGateConfig();
        }
        if (config.resolver == null) {
            config.resolver = new Resolver();
        }
        config.resolver.ensureDefaults();
        return config;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Resolver {
        public static final String DEFAULT_NVD_BASE_URL = "https://services.nvd.nist.gov/rest/json/cves/2.0";
        public static final String DEFAULT_GHSA_BASE_URL = "https://api.github.com/advisories";
        public static final String DEFAULT_GHSA_API_VERSION = "2022-11-28";
        public static final String DEFAULT_USER_AGENT = "vtb-vuln-policy-gate/1.0";
        public static final int DEFAULT_TIMEOUT_SEC = 15;
        public static final int DEFAULT_MAX_ATTEMPTS = 3;
        public static final long DEFAULT_BACKOFF_WITH_CREDENTIALS_MS = 300L;
        public static final long DEFAULT_BACKOFF_ANONYMOUS_MS = 750L;

        private String nvdBaseUrl;
        private String ghsaBaseUrl;
        private String ghsaApiVersion;
        private String userAgent;
        private Integer timeoutSec;
        private Integer maxAttempts;
        private Long backoffWithCredentialsMs;
        private Long backoffAnonymousMs;

        public void ensureDefaults() {
            if (nvdBaseUrl == null || nvdBaseUrl.isBlank()) {
                nvdBaseUrl = DEFAULT_NVD_BASE_URL;
            }
            if (ghsaBaseUrl == null || ghsaBaseUrl.isBlank()) {
                ghsaBaseUrl = DEFAULT_GHSA_BASE_URL;
            }
            if (ghsaApiVersion == null || ghsaApiVersion.isBlank()) {
                ghsaApiVersion = DEFAULT_GHSA_API_VERSION;
            }
            if (userAgent == null || userAgent.isBlank()) {
                userAgent = DEFAULT_USER_AGENT;
            }
            if (timeoutSec == null || timeoutSec <= 0) {
                timeoutSec = DEFAULT_TIMEOUT_SEC;
            }
            if (maxAttempts == null || maxAttempts < 1) {
                maxAttempts = DEFAULT_MAX_ATTEMPTS;
            }
            if (backoffWithCredentialsMs == null || backoffWithCredentialsMs < 0) {
                backoffWithCredentialsMs = DEFAULT_BACKOFF_WITH_CREDENTIALS_MS;
            }
            if (backoffAnonymousMs == null || backoffAnonymousMs < 0) {
                backoffAnonymousMs = DEFAULT_BACKOFF_ANONYMOUS_MS;
            }
        }
    }
}
