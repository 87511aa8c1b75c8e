package com.llmgateway.security;

import com.llmgateway.config.AiProviderConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Symmetric encryption of provider API keys at rest.
 *
 * <p>Ciphertext is stored as {@code ivHex:cipherHex} (AES-256-CBC, fresh 16 byte IV per call).
 * A value without the {@code :} separator is treated as a legacy plaintext key and passed
 * through untouched. Cipher failures are logged and the input is returned unchanged so a
 * broken key never takes the gateway down.
 */
@Slf4j
@Component
public class CredentialVault {

    private static final String TRANSFORMATION = "AES/CBC/PKCS5Padding";
    private static final String SEPARATOR = ":";
    private static final int IV_LENGTH = 16;
    private static final HexFormat HEX = HexFormat.of();

    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    @Autowired
    public CredentialVault(AiProviderConfig config) {
        this(config.getSecurity().getEncryptionKey());
    }

    public CredentialVault(String encryptionKey) {
        this.key = new SecretKeySpec(deriveKey(encryptionKey), "AES");
    }

    public String encrypt(String plaintext) {
        if (plaintext == null) {
            return null;
        }
        try {
            byte[] iv = new byte[IV_LENGTH];
            random.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new IvParameterSpec(iv));
            byte[] encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return HEX.formatHex(iv) + SEPARATOR + HEX.formatHex(encrypted);
        } catch (GeneralSecurityException e) {
            log.error("API key encryption failed, keeping original value: {}", e.getMessage());
            return plaintext;
        }
    }

    public String decrypt(String value) {
        if (value == null || !value.contains(SEPARATOR)) {
            return value;
        }
        int idx = value.indexOf(SEPARATOR);
        String ivHex = value.substring(0, idx);
        String cipherHex = value.substring(idx + 1);
        if (ivHex.isEmpty() || cipherHex.isEmpty()) {
            return value;
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new IvParameterSpec(HEX.parseHex(ivHex)));
            byte[] decrypted = cipher.doFinal(HEX.parseHex(cipherHex));
            return new String(decrypted, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.error("API key decryption failed, returning stored value: {}", e.getMessage());
            return value;
        }
    }

    /**
     * True when the value has the {@code ivHex:cipherHex} shape. Says nothing about whether it decrypts.
     */
    public boolean isEncrypted(String value) {
        if (value == null) {
            return false;
        }
        int idx = value.indexOf(SEPARATOR);
        return idx > 0 && idx < value.length() - 1;
    }

    /**
     * Log-safe rendering of a secret: first and last four characters only.
     */
    public static String mask(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "<none>";
        }
        if (secret.length() <= 8) {
            return "****";
        }
        return secret.substring(0, 4) + "****" + secret.substring(secret.length() - 4);
    }

    private static byte[] deriveKey(String encryptionKey) {
        byte[] raw = encryptionKey.getBytes(StandardCharsets.UTF_8);
        if (raw.length == 32) {
            return raw;
        }
        try {
            return MessageDigest.getInstance("SHA-256").digest(raw);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
