package com.vtb.vulnpolicy.models;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Уязвимость в том виде, в каком ее увидел сканер.
 * Создается при агрегации событий и дальше не изменяется.
 */
@Value
@Builder(toBuilder = true)
public class Finding {
    /** Канонический идентификатор (trim + upper case), например GO-2024-0001 */
    String id;
    /** Алиасы CVE-/GHSA-, без дубликатов, отсортированы */
    @Singular("alias")
    List<String> aliases;
    String summary;
    String url;
    @Singular("fixedVersion")
    List<String> fixedVersions;
    boolean reachable;
    /** Критичность из собственного payload сканера, может быть null */
    SeverityAssessment osvSeverity;
}
