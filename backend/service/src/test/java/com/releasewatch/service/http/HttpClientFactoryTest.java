package com.releasewatch.service.http;

import com.releasewatch.service.config.ConfigException;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpClientFactoryTest {
    @Test
    void defaultClientFollowsRedirects() {
        HttpClient client = HttpClientFactory.create(Duration.ofMillis(200), Map.of());

        assertEquals(HttpClient.Redirect.NORMAL, client.followRedirects());
        assertEquals(Duration.ofMillis(200), client.connectTimeout().orElseThrow());
    }

    @Test
    void truststoreWithoutPasswordIsAConfigError() {
        ConfigException ex = assertThrows(
                ConfigException.class,
                () -> HttpClientFactory.create(Duration.ofMillis(200), Map.of("TRUSTSTORE_PATH", "/tmp/store.jks"))
        );
        assertTrue(ex.getMessage().contains("TRUSTSTORE_PASSWORD"));
    }

    @Test
    void missingTruststoreFileIsAConfigError() {
        ConfigException ex = assertThrows(
                ConfigException.class,
                () -> HttpClientFactory.create(Duration.ofMillis(200), Map.of(
                        "TRUSTSTORE_PATH", "/tmp/release-watch-does-not-exist.jks",
                        "TRUSTSTORE_PASSWORD", "changeit"
                ))
        );
        assertTrue(ex.getMessage().contains("Truststore not found"));
    }

    @Test
    void loadsPkcs12Truststore() throws Exception {
        Path truststore = Files.createTempFile("truststore-", ".p12");
        writeEmptyTruststore(truststore, "PKCS12", "changeit".toCharArray());

        HttpClient client = HttpClientFactory.create(Duration.ofMillis(200), Map.of(
                "TRUSTSTORE_PATH", truststore.toString(),
                "TRUSTSTORE_PASSWORD", "changeit"
        ));

        assertEquals("PKCS12", HttpClientFactory.storeType(truststore));
        assertEquals(HttpClient.Redirect.NORMAL, client.followRedirects());
    }

    @Test
    void wrongPasswordIsAConfigError() throws Exception {
        Path truststore = Files.createTempFile("truststore-", ".jks");
        writeEmptyTruststore(truststore, "JKS", "correct-password".toCharArray());

        ConfigException ex = assertThrows(
                ConfigException.class,
                () -> HttpClientFactory.create(Duration.ofMillis(200), Map.of(
                        "TRUSTSTORE_PATH", truststore.toString(),
                        "TRUSTSTORE_PASSWORD", "wrong-password"
                ))
        );
        assertTrue(ex.getMessage().contains("Unable to load truststore"));
    }

    private static void writeEmptyTruststore(Path file, String type, char[] password) throws Exception {
        KeyStore keyStore = KeyStore.getInstance(type);
        keyStore.load(null, password);
        try (OutputStream out = Files.newOutputStream(file)) {
            keyStore.store(out, password);
        }
    }
}
