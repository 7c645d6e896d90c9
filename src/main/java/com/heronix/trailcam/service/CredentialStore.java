package com.heronix.trailcam.service;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.stereotype.Service;

import com.heronix.trailcam.config.TrailCamProperties;
import com.heronix.trailcam.model.domain.Credential;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Holds the account credential.
 *
 * The secret may be configured as {@code enc:<Base64>} where the payload is
 * [12-byte IV][ciphertext][16-byte auth tag] under AES-256-GCM, keyed by
 * PBKDF2 from the master key. It is decrypted only when {@link #get()} is called.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialStore {

    static final String ENCRYPTED_PREFIX = "enc:";

    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128; // bits
    private static final byte[] KEY_SALT = "HeronixTrailCam-Cred-Salt".getBytes(StandardCharsets.UTF_8);

    private final TrailCamProperties properties;
    private SecretKey secretKey;

    @PostConstruct
    void init() {
        String masterKey = properties.getEncryption().getMasterKey();
        if (masterKey == null || masterKey.isBlank()) {
            if (isEncrypted(properties.getAccount().getSecret())) {
                log.error("Account secret is encrypted but TRAILCAM_MASTER_KEY is not set!");
            }
            return;
        }

        PBEKeySpec spec = new PBEKeySpec(masterKey.toCharArray(), KEY_SALT, 100_000, 256);
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
            this.secretKey = new SecretKeySpec(factory.generateSecret(spec).getEncoded(), "AES");
            log.info("Credential encryption initialized from master key");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to derive credential key", e);
        } finally {
            spec.clearPassword();
        }
    }

    /**
     * Get the credential with its secret in plain text.
     */
    public Credential get() {
        TrailCamProperties.AccountConfig account = properties.getAccount();
        String secret = account.getSecret();
        return new Credential(account.getIdentifier(), isEncrypted(secret) ? decrypt(secret) : secret);
    }

    /**
     * Encrypt a secret into the {@code enc:} form accepted in configuration.
     */
    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isBlank()) {
            return null;
        }
        requireKey();

        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            new SecureRandom().nextBytes(iv);

            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            ByteBuffer buffer = ByteBuffer.allocate(iv.length + ciphertext.length);
            buffer.put(iv);
            buffer.put(ciphertext);

            return ENCRYPTED_PREFIX + Base64.getEncoder().encodeToString(buffer.array());

        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt credential", e);
        }
    }

    String decrypt(String encryptedValue) {
        requireKey();

        try {
            byte[] decoded = Base64.getDecoder().decode(encryptedValue.substring(ENCRYPTED_PREFIX.length()));

            ByteBuffer buffer = ByteBuffer.wrap(decoded);
            byte[] iv = new byte[GCM_IV_LENGTH];
            buffer.get(iv);
            byte[] ciphertext = new byte[buffer.remaining()];
            buffer.get(ciphertext);

            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));

            return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);

        } catch (GeneralSecurityException | IllegalArgumentException | BufferUnderflowException e) {
            throw new IllegalStateException("Failed to decrypt credential", e);
        }
    }

    private void requireKey() {
        if (secretKey == null) {
            throw new IllegalStateException("Encryption key not initialized. Set TRAILCAM_MASTER_KEY.");
        }
    }

    private static boolean isEncrypted(String secret) {
        return secret != null && secret.startsWith(ENCRYPTED_PREFIX);
    }
}
