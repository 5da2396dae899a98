package com.vtb.vulnpolicy.config;

import com.vtb.vulnpolicy.core.PolicyInputException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CredentialResolverTest {

    @TempDir
    Path tempDir;

    @Test
    void environmentFallbacks() throws IOException {
        CredentialResolver resolver = new CredentialResolver(Map.of(
            "NVD_API_KEY", " nvd ",
            "GITHUB_TOKEN", "github")::get);

        assertEquals("nvd", resolver.resolveNvdApiKey(null));
        assertEquals("github", resolver.resolveGhsaToken(""));
    }

    @Test
    void ghsaTokenPreferredOverGithubToken() throws IOException {
        CredentialResolver resolver = new CredentialResolver(Map.of(
            "GHSA_TOKEN", "ghsa",
            "GITHUB_TOKEN", "github")::get);

        assertEquals("ghsa", resolver.resolveGhsaToken(null));
    }

    @Test
    void missingEnvironmentMeansAnonymous() throws IOException {
        CredentialResolver resolver = new CredentialResolver(name -> null);

        assertEquals("", resolver.resolveNvdApiKey(null));
        assertEquals("", resolver.resolveGhsaToken(null));
    }

    @Test
    void explicitFileWinsOverEnvironment() throws IOException {
        Path keyFile = tempDir.resolve("nvd.key");
        Files.writeString(keyFile, "from-file\n");
        CredentialResolver resolver = new CredentialResolver(Map.of("NVD_API_KEY", "from-env")::get);

        assertEquals("from-file", resolver.resolveNvdApiKey(keyFile.toString()));
    }

    @Test
    void emptyExplicitFileIsFatal() throws IOException {
        Path tokenFile = tempDir.resolve("token");
        Files.writeString(tokenFile, "  \n");
        CredentialResolver resolver = new CredentialResolver(name -> "ignored");

        PolicyInputException error = assertThrows(PolicyInputException.class,
            () -> resolver.resolveGhsaToken(tokenFile.toString()));
        assertTrue(error.getMessage().contains("GHSA token"));
    }

    @Test
    void missingExplicitFileIsFatal() {
        CredentialResolver resolver = new CredentialResolver(name -> null);
        assertThrows(PolicyInputException.class,
            () -> resolver.resolveNvdApiKey(tempDir.resolve("absent").toString()));
    }
}
