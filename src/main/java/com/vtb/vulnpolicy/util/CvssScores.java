package com.vtb.vulnpolicy.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.OptionalDouble;

/**
 * Разбор CVSS score из разнородных JSON-представлений:
 * число, числовая строка или вектор вида "CVSS:3.1/.../SCORE:7.5".
 */
public final class CvssScores {

    private static final String SCORE_SEGMENT = "SCORE:";

    private CvssScores() {
    }

    /**
     * Число или числовая строка. Все остальное - отсутствие score.
     */
    public static OptionalDouble parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return OptionalDouble.empty();
        }
        if (node.isNumber()) {
            return OptionalDouble.of(node.asDouble());
        }
        if (node.isTextual()) {
            try {
                return OptionalDouble.of(Double.parseDouble(node.asText().trim()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * Ищет сегмент SCORE:n в векторе. 0, если сегмента нет.
     */
    public static double fromVector(String vector) {
        if (vector == null) {
            return 0;
        }
        for (String part : vector.split("/")) {
            String trimmed = part.trim();
            if (!trimmed.startsWith(SCORE_SEGMENT)) {
                continue;
            }
            try {
                return Double.parseDouble(trimmed.substring(SCORE_SEGMENT.length()));
            } catch (NumberFormatException e) {
                // следующий сегмент
            }
        }
        return 0;
    }
}
