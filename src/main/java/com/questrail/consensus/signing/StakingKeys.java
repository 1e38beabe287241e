package com.questrail.consensus.signing;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.consensus.model.Address;

import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * StakingKeys
 * -----------------------------------------------------------------------------
 * Password-encrypted staking key files.
 *
 * <h2>File layout</h2>
 * <pre>
 *   salt (16 bytes) | nonce (12 bytes) | AES-256-GCM ciphertext
 * </pre>
 * The AES key is derived from the password with PBKDF2-HMAC-SHA256. The
 * plaintext is a JSON array of base64 PKCS#8 private keys. Public keys are
 * not stored; they are derived from the private seed on load.
 */
public final class StakingKeys
{
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final int SALT_LENGTH = 16;
    private static final int NONCE_LENGTH = 12;
    private static final int TAG_BITS = 128;
    private static final int KEY_BITS = 256;
    private static final int PBKDF2_ITERATIONS = 10_000;

    private StakingKeys() {}

    /**
     * Loads staking keys and indexes them by derived address.
     *
     * @return an empty map if {@code path} is not a regular file
     * @throws SigningException if the file cannot be read, decrypted or parsed
     */
    public static Map<Address, KeyPair> load(Path path, String password)
    {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(password, "password");
        if (!Files.isRegularFile(path)) {
            return Map.of();
        }

        try {
            byte[] plain = decrypt(password, Files.readAllBytes(path));
            List<String> privateKeys = MAPPER.readValue(plain, new TypeReference<List<String>>() {});
            Map<Address, KeyPair> keys = new LinkedHashMap<>();
            for (String privateKey : privateKeys) {
                KeyPair pair = KeyPairs.fromPrivate(privateKey);
                keys.put(Address.fromPublicKey(pair.getPublic()), pair);
            }
            return keys;
        } catch (IOException e) {
            throw new SigningException("could not read staking keys from " + path, e);
        }
    }

    /**
     * Writes an encrypted staking key file readable by {@link #load(Path, String)}.
     */
    public static void write(Path path, String password, Collection<KeyPair> keys)
    {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(password, "password");
        List<String> privateKeys = new ArrayList<>();
        for (KeyPair pair : keys) {
            privateKeys.add(KeyPairs.encodePrivate(pair));
        }
        try {
            Files.write(path, encrypt(password, MAPPER.writeValueAsBytes(privateKeys)));
        } catch (IOException e) {
            throw new SigningException("could not write staking keys to " + path, e);
        }
    }

    static byte[] encrypt(String password, byte[] plain)
    {
        SecureRandom random = new SecureRandom();
        byte[] salt = new byte[SALT_LENGTH];
        byte[] nonce = new byte[NONCE_LENGTH];
        random.nextBytes(salt);
        random.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, deriveKey(password, salt), new GCMParameterSpec(TAG_BITS, nonce));
            byte[] sealed = cipher.doFinal(plain);
            return ByteBuffer.allocate(SALT_LENGTH + NONCE_LENGTH + sealed.length)
                    .put(salt).put(nonce).put(sealed).array();
        } catch (GeneralSecurityException e) {
            throw new SigningException("could not encrypt staking keys", e);
        }
    }

    static byte[] decrypt(String password, byte[] data)
    {
        if (data.length <= SALT_LENGTH + NONCE_LENGTH) {
            throw new SigningException("staking key file is truncated");
        }
        ByteBuffer buffer = ByteBuffer.wrap(data);
        byte[] salt = new byte[SALT_LENGTH];
        byte[] nonce = new byte[NONCE_LENGTH];
        buffer.get(salt).get(nonce);
        byte[] sealed = new byte[buffer.remaining()];
        buffer.get(sealed);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, deriveKey(password, salt), new GCMParameterSpec(TAG_BITS, nonce));
            return cipher.doFinal(sealed);
        } catch (GeneralSecurityException e) {
            throw new SigningException("could not decrypt staking keys (wrong password?)", e);
        }
    }

    private static SecretKeySpec deriveKey(String password, byte[] salt) throws GeneralSecurityException
    {
        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), salt, PBKDF2_ITERATIONS, KEY_BITS);
        try {
            byte[] key = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256").generateSecret(spec).getEncoded();
            return new SecretKeySpec(key, "AES");
        } finally {
            spec.clearPassword();
        }
    }
}
