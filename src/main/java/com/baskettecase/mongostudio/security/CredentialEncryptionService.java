package com.baskettecase.mongostudio.security;

import com.baskettecase.mongostudio.config.MongoStudioProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Encrypts and decrypts stored connection passwords using AES-256-GCM.
 *
 * The key is taken from {@code mongo.studio.security.encryption-key} (32 bytes, base64).
 * When that is blank a key is generated once and kept in {@value #KEY_FILE} inside the
 * storage directory, readable by the owner only.
 */
@Service
@Slf4j
public class CredentialEncryptionService {

    static final String KEY_FILE = "secret.key";

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12; // 96 bits
    private static final int GCM_TAG_LENGTH = 128; // 128 bits
    private static final int KEY_LENGTH = 32;

    private final SecretKey secretKey;
    private final SecureRandom secureRandom = new SecureRandom();

    public CredentialEncryptionService(MongoStudioProperties properties) {
        String configuredKey = properties.getSecurity().getEncryptionKey();
        byte[] keyBytes;
        if (configuredKey != null && !configuredKey.trim().isEmpty()) {
            keyBytes = decodeKey(configuredKey);
            log.info("Credential encryption initialized with configured AES-256-GCM key");
        } else {
            keyBytes = loadOrCreateKeyFile(properties.getStoragePath().resolve(KEY_FILE));
        }
        this.secretKey = new SecretKeySpec(keyBytes, "AES");
    }

    /**
     * Encrypts a plaintext credential.
     * Returns base64-encoded ciphertext with the IV prepended.
     */
    public String encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Cannot encrypt null value");
        }

        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            ByteBuffer byteBuffer = ByteBuffer.allocate(iv.length + ciphertext.length);
            byteBuffer.put(iv);
            byteBuffer.put(ciphertext);
            return Base64.getEncoder().encodeToString(byteBuffer.array());

        } catch (GeneralSecurityException e) {
            log.error("Encryption failed", e);
            throw new IllegalStateException("Failed to encrypt credential", e);
        }
    }

    /**
     * Decrypts a base64-encoded ciphertext produced by {@link #encrypt(String)}.
     */
    public String decrypt(String ciphertext) {
        if (ciphertext == null || ciphertext.trim().isEmpty()) {
            throw new IllegalArgumentException("Cannot decrypt null or empty value");
        }

        byte[] combined = Base64.getDecoder().decode(ciphertext.trim());
        if (combined.length < GCM_IV_LENGTH) {
            throw new IllegalArgumentException("Ciphertext too short");
        }

        try {
            ByteBuffer byteBuffer = ByteBuffer.wrap(combined);
            byte[] iv = new byte[GCM_IV_LENGTH];
            byteBuffer.get(iv);
            byte[] ciphertextBytes = new byte[byteBuffer.remaining()];
            byteBuffer.get(ciphertextBytes);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            return new String(cipher.doFinal(ciphertextBytes), StandardCharsets.UTF_8);

        } catch (GeneralSecurityException e) {
            log.error("Decryption failed", e);
            throw new IllegalStateException("Failed to decrypt credential", e);
        }
    }

    private static byte[] decodeKey(String encodedKey) {
        try {
            byte[] keyBytes = Base64.getDecoder().decode(encodedKey.trim());
            if (keyBytes.length != KEY_LENGTH) {
                throw new IllegalArgumentException(
                    "Encryption key must be 32 bytes (256 bits). Current length: " + keyBytes.length
                );
            }
            return keyBytes;
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid encryption key format: " + e.getMessage(), e);
        }
    }

    private byte[] loadOrCreateKeyFile(Path keyFile) {
        try {
            if (Files.exists(keyFile)) {
                log.info("Credential encryption initialized with key file {}", keyFile);
                return decodeKey(Files.readString(keyFile, StandardCharsets.US_ASCII));
            }

            byte[] keyBytes = new byte[KEY_LENGTH];
            secureRandom.nextBytes(keyBytes);

            Files.createDirectories(keyFile.getParent());
            // owner-only from creation
            if (keyFile.getFileSystem().supportedFileAttributeViews().contains("posix")) {
                Files.createFile(keyFile, PosixFilePermissions.asFileAttribute(
                    PosixFilePermissions.fromString("rw-------")));
            } else {
                Files.createFile(keyFile);
            }
            Files.writeString(keyFile, Base64.getEncoder().encodeToString(keyBytes), StandardCharsets.US_ASCII);

            log.info("🔐 Generated new credential encryption key at {}", keyFile);
            return keyBytes;
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load or create encryption key file " + keyFile, e);
        }
    }
}
