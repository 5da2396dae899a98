package com.vtb.vulnpolicy.severity;

/**
 * Класс ошибки при поиске критичности по одному идентификатору
 */
public enum FailureKind {
    /** Транспортная ошибка после всех попыток */
    NETWORK,
    /** Неожиданный HTTP статус (включая 5xx после всех попыток) */
    HTTP_STATUS,
    /** HTTP 429 после всех попыток */
    RATE_LIMITED,
    /** HTTP 401, не повторяется */
    UNAUTHORIZED,
    /** HTTP 403, не повторяется */
    FORBIDDEN,
    /** Ответ 200, но тело не разобрано */
    DECODE,
    /** Ответ корректный, но без данных о критичности */
    NO_DATA,
    /** Офлайн-режим и нет данных в снапшоте */
    OFFLINE,
    /** Некорректный базовый URL и т.п. */
    INVALID_REQUEST,
    /** Сработал сигнал отмены вызывающей стороны */
    CANCELLED
}
