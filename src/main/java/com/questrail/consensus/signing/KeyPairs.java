package com.questrail.consensus.signing;

import net.i2p.crypto.eddsa.EdDSAPrivateKey;
import net.i2p.crypto.eddsa.spec.EdDSANamedCurveSpec;
import net.i2p.crypto.eddsa.spec.EdDSANamedCurveTable;
import net.i2p.crypto.eddsa.spec.EdDSAPrivateKeySpec;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.EdECPrivateKey;
import java.security.spec.EdECPoint;
import java.security.spec.EdECPublicKeySpec;
import java.security.spec.NamedParameterSpec;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Base64;

/**
 * Ed25519 key generation and base64 PKCS#8 encoding.
 *
 * <p>Only the private key is ever encoded. The public key is derived from the
 * private seed on decode.
 */
public final class KeyPairs
{
    private static final EdDSANamedCurveSpec ED25519_PARAMS =
            EdDSANamedCurveTable.getByName(EdDSANamedCurveTable.ED_25519);

    private KeyPairs() {}

    public static KeyPair generate()
    {
        try {
            return KeyPairGenerator.getInstance(Ed25519ContentSigner.ALGORITHM).generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new SigningException("Ed25519 key generation unavailable", e);
        }
    }

    public static String encodePrivate(KeyPair keys) {
        return Base64.getEncoder().encodeToString(keys.getPrivate().getEncoded());
    }

    /**
     * Rebuilds the full key pair from a base64 PKCS#8 private key.
     */
    public static KeyPair fromPrivate(String privateKeyBase64)
    {
        PrivateKey privateKey;
        KeyFactory factory;
        try {
            factory = KeyFactory.getInstance(Ed25519ContentSigner.ALGORITHM);
            privateKey = factory.generatePrivate(
                    new PKCS8EncodedKeySpec(Base64.getDecoder().decode(privateKeyBase64)));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new SigningException("malformed Ed25519 key material", e);
        }

        byte[] seed = ((EdECPrivateKey) privateKey).getBytes()
                .orElseThrow(() -> new SigningException("Ed25519 private key carries no seed"));
        byte[] publicBytes = new EdDSAPrivateKey(new EdDSAPrivateKeySpec(seed, ED25519_PARAMS)).getAbyte();

        try {
            PublicKey publicKey = factory.generatePublic(
                    new EdECPublicKeySpec(NamedParameterSpec.ED25519, toPoint(publicBytes)));
            return new KeyPair(publicKey, privateKey);
        } catch (GeneralSecurityException e) {
            throw new SigningException("derived Ed25519 public key rejected", e);
        }
    }

    // RFC 8032 point encoding: little-endian y, top bit of the last byte is the x parity.
    private static EdECPoint toPoint(byte[] encoded)
    {
        byte[] bigEndian = new byte[encoded.length];
        for (int i = 0; i < encoded.length; i++) {
            bigEndian[i] = encoded[encoded.length - 1 - i];
        }
        boolean xOdd = (bigEndian[0] & 0x80) != 0;
        bigEndian[0] &= 0x7f;
        return new EdECPoint(xOdd, new BigInteger(1, bigEndian));
    }
}
