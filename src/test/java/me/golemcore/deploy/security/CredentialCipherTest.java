package me.golemcore.deploy.security;

import me.golemcore.deploy.infrastructure.config.DeployProperties;
import me.golemcore.deploy.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CredentialCipherTest {

    private static final String MASTER_KEY = Base64.getEncoder().encodeToString(new byte[32]);

    private DeployProperties properties;
    private StoragePort storagePort;

    @BeforeEach
    void setUp() {
        properties = new DeployProperties();
        storagePort = mock(StoragePort.class);
    }

    @Test
    void shouldDecryptWhatItEncrypted() {
        properties.getCredentials().setMasterKey(MASTER_KEY);
        CredentialCipher cipher = new CredentialCipher(properties, storagePort);
        cipher.init();

        byte[] plaintext = "{\"aws_secret_access_key\":\"abc\"}".getBytes(StandardCharsets.UTF_8);
        String encrypted = cipher.encrypt(plaintext);

        assertArrayEquals(plaintext, cipher.decrypt(encrypted));
        assertFalse(encrypted.contains("abc"));
        verify(storagePort, never()).getText(anyString(), anyString());
    }

    @Test
    void shouldUseFreshIvPerEncryption() {
        properties.getCredentials().setMasterKey(MASTER_KEY);
        CredentialCipher cipher = new CredentialCipher(properties, storagePort);
        cipher.init();

        byte[] plaintext = "same".getBytes(StandardCharsets.UTF_8);

        assertNotEquals(cipher.encrypt(plaintext), cipher.encrypt(plaintext));
    }

    @Test
    void shouldRejectTamperedCiphertext() {
        properties.getCredentials().setMasterKey(MASTER_KEY);
        CredentialCipher cipher = new CredentialCipher(properties, storagePort);
        cipher.init();
        byte[] payload = Base64.getDecoder().decode(cipher.encrypt("secret".getBytes(StandardCharsets.UTF_8)));
        payload[payload.length - 1] ^= 0x01;

        String tampered = Base64.getEncoder().encodeToString(payload);

        assertThrows(IllegalStateException.class, () -> cipher.decrypt(tampered));
    }

    @Test
    void shouldRejectMasterKeyOfWrongLength() {
        properties.getCredentials().setMasterKey(Base64.getEncoder().encodeToString(new byte[16]));
        CredentialCipher cipher = new CredentialCipher(properties, storagePort);

        IllegalStateException error = assertThrows(IllegalStateException.class, cipher::init);
        assertEquals("Credential master key must be 32 bytes, got 16", error.getMessage());
    }

    @Test
    void shouldGenerateAndPersistKeyFileWhenNoneConfigured() {
        when(storagePort.getText("credentials", "master.key")).thenReturn(CompletableFuture.completedFuture(null));
        when(storagePort.putTextAtomic(eq("credentials"), eq("master.key"), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));
        CredentialCipher cipher = new CredentialCipher(properties, storagePort);

        cipher.init();

        verify(storagePort).putTextAtomic(eq("credentials"), eq("master.key"), anyString());
        byte[] plaintext = "x".getBytes(StandardCharsets.UTF_8);
        assertArrayEquals(plaintext, cipher.decrypt(cipher.encrypt(plaintext)));
    }

    @Test
    void shouldReuseExistingKeyFile() {
        when(storagePort.getText("credentials", "master.key"))
                .thenReturn(CompletableFuture.completedFuture(MASTER_KEY + "\n"));
        CredentialCipher fromFile = new CredentialCipher(properties, storagePort);
        fromFile.init();

        DeployProperties configured = new DeployProperties();
        configured.getCredentials().setMasterKey(MASTER_KEY);
        CredentialCipher fromConfig = new CredentialCipher(configured, storagePort);
        fromConfig.init();

        byte[] plaintext = "shared".getBytes(StandardCharsets.UTF_8);
        assertArrayEquals(plaintext, fromConfig.decrypt(fromFile.encrypt(plaintext)));
        verify(storagePort, never()).putTextAtomic(anyString(), anyString(), anyString());
    }
}
