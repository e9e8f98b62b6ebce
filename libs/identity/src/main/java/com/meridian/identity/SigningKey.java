package com.meridian.identity;

import com.meridian.common.SignEncryptException;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.Signature;
import java.security.interfaces.RSAPrivateKey;
import java.util.Objects;

/**
 * RSA key used to sign outgoing messages ({@value #ALGORITHM}), tagged with the key id receivers
 * use to find the matching certificate.
 *
 * @param privateKey the RSA private key
 * @param keyId formatted certificate serial, or null before the certificate is known
 */
public record SigningKey(RSAPrivateKey privateKey, String keyId) {

    /** JOSE name of the signature algorithm. */
    public static final String ALGORITHM = "RS256";

    static final String JCA_ALGORITHM = "SHA256withRSA";

    public SigningKey {
        Objects.requireNonNull(privateKey, "privateKey must not be null");
    }

    /** Returns a copy of this key tagged with {@code keyId}. */
    public SigningKey withKeyId(String keyId) {
        return new SigningKey(privateKey, Objects.requireNonNull(keyId, "keyId must not be null"));
    }

    /**
     * Signs {@code data} with {@value #JCA_ALGORITHM}.
     *
     * @throws SignEncryptException if the JCA provider rejects the key
     */
    public byte[] sign(byte[] data) throws SignEncryptException {
        try {
            Signature signature = Signature.getInstance(JCA_ALGORITHM);
            signature.initSign(privateKey);
            signature.update(data);
            return signature.sign();
        } catch (GeneralSecurityException e) {
            throw new SignEncryptException("Unable to sign message: " + e.getMessage(), e);
        }
    }

    /**
     * Checks a signature produced by {@link #sign} against the signer's public key.
     *
     * @throws SignEncryptException if the key cannot be used for verification
     */
    public static boolean verify(PublicKey publicKey, byte[] data, byte[] signatureBytes)
            throws SignEncryptException {
        try {
            Signature signature = Signature.getInstance(JCA_ALGORITHM);
            signature.initVerify(publicKey);
            signature.update(data);
            return signature.verify(signatureBytes);
        } catch (GeneralSecurityException e) {
            throw new SignEncryptException("Unable to verify signature: " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "SigningKey[keyId=" + keyId + ", algorithm=" + ALGORITHM + "]";
    }
}
