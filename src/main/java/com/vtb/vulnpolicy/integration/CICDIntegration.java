package com.vtb.vulnpolicy.integration;

import com.vtb.vulnpolicy.models.EvaluatedFinding;
import com.vtb.vulnpolicy.models.EvaluationResult;
import com.vtb.vulnpolicy.models.ScanMode;
import com.vtb.vulnpolicy.models.SeverityAssessment;
import com.vtb.vulnpolicy.severity.LookupFailure;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Интеграция с CI/CD системами
 * GitHub Actions, GitLab CI и т.д.
 */
@Slf4j
public class CICDIntegration {

    private static final int INFO_LIMIT = 10;
    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    /**
     * Определить exit code по результату политики
     *
     * @return 0 = успех, 1 = есть Fail или просроченные исключения
     */
    public static int getExitCode(EvaluationResult result) {
        if (result == null) {
            log.warn("Результат политики null, возвращаем код провала");
            return 1;
        }
        if (!result.getExpired().isEmpty()) {
            log.error("Обнаружены просроченные исключения: {}. Сборка провалена.", result.getExpired().size());
        }
        if (!result.getFail().isEmpty()) {
            log.error("Обнаружены блокирующие уязвимости: {}. Сборка провалена.", result.getFail().size());
        }
        if (result.isFailing()) {
            return 1;
        }
        log.info("Блокирующих уязвимостей не обнаружено");
        return 0;
    }

    /**
     * Вывести отчет политики для CI/CD
     */
    public static void printSummary(ScanMode scanMode, EvaluationResult result, PrintStream out) {
        out.printf("vulnerability policy results (%s)%n", scanMode);
        out.printf("  fail: %d%n", result.getFail().size() + result.getExpired().size());
        out.printf("  warn: %d%n", result.getWarn().size());
        out.printf("  accepted: %d%n", result.getAccepted().size());
        out.printf("  info: %d%n", result.getInfo().size());

        if (!result.getExpired().isEmpty()) {
            out.println();
            out.println("Expired overrides");
            for (EvaluatedFinding item : result.getExpired()) {
                out.printf("  - %s override %s expired on %s%n", item.getFinding().getId(), item.getMatchedById(),
                    DATE.format(item.getOverride().getExpiresOn()));
                out.printf("    reason: %s%n", item.getOverride().getReason());
            }
        }

        printSection(out, "Failing vulnerabilities", result.getFail());
        printSection(out, "Warning vulnerabilities", result.getWarn());

        if (!result.getAccepted().isEmpty()) {
            out.println();
            out.println("Accepted risk overrides");
            for (EvaluatedFinding item : result.getAccepted()) {
                out.printf("  - %s accepted by %s until %s%n", item.getFinding().getId(), item.getMatchedById(),
                    DATE.format(item.getOverride().getExpiresOn()));
                out.printf("    reason: %s%n", item.getOverride().getReason());
            }
        }

        if (!result.getInfo().isEmpty()) {
            out.println();
            String heading = infoHeading(scanMode);
            out.println(heading);
            List<EvaluatedFinding> info = result.getInfo();
            int limit = Math.min(INFO_LIMIT, info.size());
            for (int i = 0; i < limit; i++) {
                EvaluatedFinding item = info.get(i);
                out.printf("  - %s %s%n", item.getFinding().getId(), nullToEmpty(item.getFinding().getSummary()));
                if (hasText(item.getFinding().getUrl())) {
                    out.printf("    more info: %s%n", item.getFinding().getUrl());
                }
            }
            if (info.size() > limit) {
                out.printf("  ... and %d more %s%n", info.size() - limit, heading.toLowerCase(Locale.ROOT));
            }
        }
    }

    static String infoHeading(ScanMode scanMode) {
        return scanMode == ScanMode.BINARY ? "Informational vulnerabilities" : "Not reachable vulnerabilities";
    }

    /**
     * Создать аннотации для GitHub Actions
     */
    public static void printGitHubAnnotations(EvaluationResult result, PrintStream out) {
        if (result == null) {
            return;
        }
        for (EvaluatedFinding item : result.getFail()) {
            out.printf("::error title=%s::%s [%s] %s%n", item.getFinding().getId(), item.getFinding().getId(),
                item.getSeverity().getSeverity(), nullToEmpty(item.getFinding().getSummary()));
        }
        for (EvaluatedFinding item : result.getExpired()) {
            out.printf("::error title=%s::override %s expired on %s%n", item.getFinding().getId(),
                item.getMatchedById(), DATE.format(item.getOverride().getExpiresOn()));
        }
        for (EvaluatedFinding item : result.getWarn()) {
            out.printf("::warning title=%s::%s [%s] %s%n", item.getFinding().getId(), item.getFinding().getId(),
                item.getSeverity().getSeverity(), nullToEmpty(item.getFinding().getSummary()));
        }
        for (EvaluatedFinding item : result.getAccepted()) {
            out.printf("::notice title=%s::accepted by %s until %s%n", item.getFinding().getId(),
                item.getMatchedById(), DATE.format(item.getOverride().getExpiresOn()));
        }
    }

    private static void printSection(PrintStream out, String heading, List<EvaluatedFinding> items) {
        if (items.isEmpty()) {
            return;
        }
        out.println();
        out.println(heading);
        for (EvaluatedFinding item : items) {
            printEvaluated(out, item);
        }
    }

    private static void printEvaluated(PrintStream out, EvaluatedFinding item) {
        SeverityAssessment severity = item.getSeverity();
        out.printf("  - %s [%s] %s%n", item.getFinding().getId(), severity.getSeverity(),
            nullToEmpty(item.getFinding().getSummary()));
        if (severity.getScore() > 0) {
            out.printf(Locale.ROOT, "    cvss score: %.1f%n", severity.getScore());
        }
        if (hasText(severity.getSource())) {
            out.printf("    severity source: %s%n", severity.getSource());
        }
        out.printf("    severity method: %s%n", severity.getMethod());
        if (hasText(severity.getReason())) {
            out.printf("    severity reason: %s%n", severity.getReason());
        }
        if (!item.getFinding().getFixedVersions().isEmpty()) {
            out.printf("    fixed versions: %s%n", String.join(", ", item.getFinding().getFixedVersions()));
        }
        if (hasText(item.getFinding().getUrl())) {
            out.printf("    more info: %s%n", item.getFinding().getUrl());
        }
        if (item.hasResolverWarnings()) {
            out.printf("    resolver warning: %s%n", item.getResolverWarnings().stream()
                .map(LookupFailure::getMessage)
                .collect(Collectors.joining("; ")));
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
