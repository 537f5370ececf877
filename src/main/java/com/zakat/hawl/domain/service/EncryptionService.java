package com.zakat.hawl.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * AES-256-GCM field encryption for financial snapshots and unlock reasons at rest.
 *
 * Ciphertext format: Base64(IV || ciphertext+tag), 96-bit random IV per value.
 */
@Slf4j
@Service
public class EncryptionService {

    private static final String ALGORITHM = "AES";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH_BITS = 128;

    private final SecretKey key;
    private final SecureRandom secureRandom = new SecureRandom();

    public EncryptionService(@Value("${app.encryption.key}") String base64Key) {
        byte[] keyBytes = Base64.getDecoder().decode(base64Key);
        if (keyBytes.length != 32) {
            throw new IllegalArgumentException("app.encryption.key must be a base64-encoded 256-bit key");
        }
        this.key = new SecretKeySpec(keyBytes, ALGORITHM);
    }

    public String encrypt(String plaintext) {
        if (plaintext == null) {
            return null;
        }
        try {
            byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH_BITS, iv));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] combined = new byte[iv.length + ciphertext.length];
            System.arraycopy(iv, 0, combined, 0, iv.length);
            System.arraycopy(ciphertext, 0, combined, iv.length, ciphertext.length);
            return Base64.getEncoder().encodeToString(combined);

        } catch (GeneralSecurityException e) {
            log.error("Failed to encrypt value: {}", e.getMessage());
            throw new IllegalStateException("Encryption failed", e);
        }
    }

    public String decrypt(String encrypted) {
        if (encrypted == null) {
            return null;
        }
        try {
            return decryptWith(Cipher.getInstance(TRANSFORMATION), encrypted);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.error("Failed to decrypt value: {}", e.getMessage());
            throw new IllegalStateException("Decryption failed", e);
        }
    }

    /**
     * Decrypt many values in one pass with a single cipher instance.
     * Order of the result matches the input; null entries stay null.
     */
    public List<String> decryptAll(List<String> encryptedValues) {
        List<String> result = new ArrayList<>(encryptedValues.size());
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            for (String encrypted : encryptedValues) {
                result.add(encrypted == null ? null : decryptWith(cipher, encrypted));
            }
            return result;
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.error("Failed to decrypt batch of {} values: {}", encryptedValues.size(), e.getMessage());
            throw new IllegalStateException("Batch decryption failed", e);
        }
    }

    private String decryptWith(Cipher cipher, String encrypted) throws GeneralSecurityException {
        byte[] combined = Base64.getDecoder().decode(encrypted);
        if (combined.length <= IV_LENGTH) {
            throw new IllegalArgumentException("Ciphertext too short");
        }
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH_BITS, combined, 0, IV_LENGTH));
        byte[] plaintext = cipher.doFinal(combined, IV_LENGTH, combined.length - IV_LENGTH);
        return new String(plaintext, StandardCharsets.UTF_8);
    }
}
