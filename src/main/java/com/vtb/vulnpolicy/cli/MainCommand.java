package com.vtb.vulnpolicy.cli;

import com.vtb.vulnpolicy.config.CredentialResolver;
import com.vtb.vulnpolicy.core.ExclusionFilter;
import com.vtb.vulnpolicy.core.FindingAggregator;
import com.vtb.vulnpolicy.core.OverrideRegistry;
import com.vtb.vulnpolicy.core.PolicyEvaluator;
import com.vtb.vulnpolicy.integration.CICDIntegration;
import com.vtb.vulnpolicy.models.EvaluationResult;
import com.vtb.vulnpolicy.models.ExclusionSet;
import com.vtb.vulnpolicy.models.Finding;
import com.vtb.vulnpolicy.models.ScanMode;
import com.vtb.vulnpolicy.reports.JsonReportGenerator;
import com.vtb.vulnpolicy.severity.AdvisorySeverityResolver;
import com.vtb.vulnpolicy.severity.ResolverSettings;
import com.vtb.vulnpolicy.severity.SeveritySnapshot;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CI gate: агрегирует вывод сканера, определяет критичность и применяет политику исключений
 */
@Slf4j
@Command(
    name = "vuln-policy-gate",
    mixinStandardHelpOptions = true,
    version = "VTB Vulnerability Policy Gate 1.0.0",
    description = """
        
        VTB Vulnerability Policy Gate
        
        Проверка результатов сканирования зависимостей перед сборкой
        
        Возможности:
          • Агрегация JSON-потока сканера (source / binary)
          • Исключение уязвимостей базового скана
          • Критичность из OSV, GHSA и NVD (с офлайн-снапшотом)
          • Реестр принятых рисков со сроком действия
        
        """
)
public class MainCommand implements Callable<Integer> {

    @Option(
        names = {"--input"},
        required = true,
        description = "JSON-поток сканера для проверки"
    )
    private Path input;

    @Option(
        names = {"--overrides"},
        required = true,
        description = "JSON-реестр принятых рисков"
    )
    private Path overrides;

    @Option(
        names = {"--scan-mode"},
        description = "Режим сканирования: source или binary (по умолчанию: source)"
    )
    private String scanMode = "source";

    @Option(
        names = {"--exclude-input"},
        description = "JSON-поток базового скана, чьи уязвимости исключаются"
    )
    private Path excludeInput;

    @Option(
        names = {"--nvd-api-base-url"},
        description = "Базовый URL NVD CVE API"
    )
    private String nvdApiBaseUrl;

    @Option(
        names = {"--nvd-api-key-file"},
        description = "Файл с NVD API key (по умолчанию: переменная NVD_API_KEY)"
    )
    private String nvdApiKeyFile;

    @Option(
        names = {"--ghsa-api-base-url"},
        description = "Базовый URL GitHub Advisory API"
    )
    private String ghsaApiBaseUrl;

    @Option(
        names = {"--ghsa-token-file"},
        description = "Файл с GHSA token (по умолчанию: GHSA_TOKEN, затем GITHUB_TOKEN)"
    )
    private String ghsaTokenFile;

    @Option(
        names = {"--severity-snapshot"},
        description = "Закрепленный снапшот критичности CVE"
    )
    private String severitySnapshot;

    @Option(
        names = {"--offline"},
        description = "Без сетевых запросов: критичность CVE только из снапшота"
    )
    private boolean offline = false;

    @Option(
        names = {"--timeout"},
        description = "Таймаут одного запроса к API критичности, секунды (по умолчанию из policy-gate.yaml)"
    )
    private Integer timeoutSeconds;

    @Option(
        names = {"--json-report"},
        description = "Сохранить результат политики в JSON"
    )
    private Path jsonReport;

    @Option(
        names = {"--github-annotations"},
        description = "Дополнительно вывести аннотации GitHub Actions"
    )
    private boolean githubAnnotations = false;

    private final PrintStream out;
    private final PrintStream err;
    private final CredentialResolver credentials;

    public MainCommand() {
        this(System.out, System.err, new CredentialResolver());
    }

    MainCommand(PrintStream out, PrintStream err, CredentialResolver credentials) {
        this.out = out;
        this.err = err;
        this.credentials = credentials;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            ScanMode mode = ScanMode.parse(scanMode);

            // 1. Агрегация входного потока
            List<Finding> findings = new FindingAggregator(mode).aggregate(input);

            // 2. Исключение базового скана
            if (excludeInput != null) {
                ExclusionSet baseline = ExclusionFilter.load(excludeInput);
                findings = ExclusionFilter.filter(findings, baseline);
            }

            // 3. Реестр исключений
            OverrideRegistry registry = OverrideRegistry.load(overrides);

            // 4. Резолвер критичности
            ResolverSettings settings = buildSettings();
            AdvisorySeverityResolver resolver = new AdvisorySeverityResolver(settings);

            // 5. Политика
            EvaluationResult result = new PolicyEvaluator(resolver).evaluate(findings, registry, Instant.now());

            // 6. Вывод результатов
            CICDIntegration.printSummary(mode, result, out);
            if (githubAnnotations) {
                CICDIntegration.printGitHubAnnotations(result, out);
            }
            if (jsonReport != null) {
                new JsonReportGenerator().generate(result, mode, jsonReport);
            }

            return CICDIntegration.getExitCode(result);

        } catch (IOException | IllegalArgumentException e) {
            log.error("Ошибка проверки политики: {}", e.getMessage());
            err.println("vuln-policy-gate: " + e.getMessage());
            return 1;
        }
    }

    private ResolverSettings buildSettings() throws IOException {
        SeveritySnapshot snapshot = SeveritySnapshot.load(severitySnapshot);
        if (offline && snapshot.isEmpty()) {
            throw new IllegalArgumentException("Офлайн-режим требует непустой --severity-snapshot");
        }

        ResolverSettings.ResolverSettingsBuilder builder = ResolverSettings.defaults()
            .nvdApiKey(credentials.resolveNvdApiKey(nvdApiKeyFile))
            .ghsaToken(credentials.resolveGhsaToken(ghsaTokenFile))
            .offline(offline)
            .snapshot(snapshot);

        if (hasText(nvdApiBaseUrl)) {
            builder.nvdBaseUrl(nvdApiBaseUrl.trim());
        }
        if (hasText(ghsaApiBaseUrl)) {
            builder.ghsaBaseUrl(ghsaApiBaseUrl.trim());
        }
        if (timeoutSeconds != null) {
            if (timeoutSeconds <= 0) {
                throw new IllegalArgumentException("--timeout должен быть положительным: " + timeoutSeconds);
            }
            builder.requestTimeout(Duration.ofSeconds(timeoutSeconds));
        }

        if (offline) {
            log.info("Офлайн-режим: CVE из снапшота ({}), GHSA недоступен", snapshot.size());
        }
        return builder.build();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
