package com.vtb.vulnpolicy.config;

import com.vtb.vulnpolicy.core.PolicyInputException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.function.Function;

/**
 * Получение NVD API key и GHSA token: явный файл либо переменные окружения.
 * Явно указанный, но пустой файл - фатальная ошибка.
 */
@Slf4j
public class CredentialResolver {

    static final String NVD_API_KEY_ENV = "NVD_API_KEY";
    static final String GHSA_TOKEN_ENV = "GHSA_TOKEN";
    static final String GITHUB_TOKEN_ENV = "GITHUB_TOKEN";

    private final Function<String, String> environment;

    public CredentialResolver() {
        this(System::getenv);
    }

    public CredentialResolver(Function<String, String> environment) {
        this.environment = environment;
    }

    public String resolveNvdApiKey(String keyFile) throws IOException {
        if (isBlank(keyFile)) {
            return env(NVD_API_KEY_ENV);
        }
        return readSecret(keyFile.trim(), "NVD API key");
    }

    /**
     * GHSA_TOKEN, затем GITHUB_TOKEN. Пустое значение - анонимный доступ.
     */
    public String resolveGhsaToken(String tokenFile) throws IOException {
        if (isBlank(tokenFile)) {
            String token = env(GHSA_TOKEN_ENV);
            if (!token.isEmpty()) {
                return token;
            }
            return env(GITHUB_TOKEN_ENV);
        }
        return readSecret(tokenFile.trim(), "GHSA token");
    }

    private String readSecret(String file, String label) throws IOException {
        String value;
        try {
            value = Files.readString(Path.of(file), StandardCharsets.UTF_8).trim();
        } catch (NoSuchFileException e) {
            throw new PolicyInputException("Файл " + label + " не найден: " + file, e);
        }
        if (value.isEmpty()) {
            throw new PolicyInputException("Файл " + label + " \"" + file + "\" пуст");
        }
        log.debug("{} загружен из файла {}", label, file);
        return value;
    }

    private String env(String name) {
        String value = environment.apply(name);
        return value == null ? "" : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
