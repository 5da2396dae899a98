package com.vtb.vulnpolicy.models;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Принятый риск (waiver) с обязательным обоснованием и датой окончания.
 * Действует по день expiresOn включительно (UTC).
 */
@Value
@Builder
public class RiskOverride {
    String id;
    String reason;
    LocalDate expiresOn;

    public boolean isExpired(Instant now) {
        LocalDate today = now.atZone(ZoneOffset.UTC).toLocalDate();
        return today.isAfter(expiresOn);
    }
}
