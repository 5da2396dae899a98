package com.vtb.vulnpolicy.core;

import java.io.IOException;

/**
 * Фатальная ошибка входных данных: битый JSON сканера, невалидный реестр
 * исключений или снапшот. Прерывает весь прогон, частичных результатов нет.
 */
public class PolicyInputException extends IOException {

    public PolicyInputException(String message) {
        super(message);
    }

    public PolicyInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
