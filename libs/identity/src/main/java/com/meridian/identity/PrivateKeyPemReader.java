package com.meridian.identity;

import com.meridian.common.ConfigurationFailedException;
import java.io.IOException;
import java.io.StringReader;
import java.security.PrivateKey;
import java.security.interfaces.RSAPrivateKey;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.util.encoders.DecoderException;

/**
 * Reads the node's RSA private key from PEM text in either of the two encodings enrollment tools
 * produce: PKCS#1 ({@code RSA PRIVATE KEY}) first, PKCS#8 ({@code PRIVATE KEY}) as fallback.
 */
public final class PrivateKeyPemReader {

    /** Supported PEM encodings, in the order they are tried. */
    enum KeyEncoding {
        PKCS1("PKCS#1"),
        PKCS8("PKCS#8");

        private final String label;

        KeyEncoding(String label) {
            this.label = label;
        }
    }

    private static final JcaPEMKeyConverter CONVERTER = new JcaPEMKeyConverter();

    private PrivateKeyPemReader() {
        // utility class
    }

    /**
     * Parses {@code pem} as a raw RSA private key.
     *
     * @throws ConfigurationFailedException if the text is neither PKCS#1 nor PKCS#8 RSA key PEM
     */
    public static RSAPrivateKey readPrivateKey(String pem) throws ConfigurationFailedException {
        try {
            return read(pem, KeyEncoding.PKCS1);
        } catch (IOException pkcs1Failure) {
            try {
                return read(pem, KeyEncoding.PKCS8);
            } catch (IOException pkcs8Failure) {
                pkcs8Failure.addSuppressed(pkcs1Failure);
                throw new ConfigurationFailedException(
                        "Unable to interpret private key PEM as PKCS#1 or PKCS#8: " + pkcs8Failure.getMessage(),
                        pkcs8Failure);
            }
        }
    }

    /**
     * Parses {@code pem} as a signing key. The text is parsed again, independently of {@link
     * #readPrivateKey}; the returned key has no key id yet.
     *
     * @throws ConfigurationFailedException if the text is neither PKCS#1 nor PKCS#8 RSA key PEM
     */
    public static SigningKey readSigningKey(String pem) throws ConfigurationFailedException {
        return new SigningKey(readPrivateKey(pem), null);
    }

    static RSAPrivateKey read(String pem, KeyEncoding encoding) throws IOException {
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            Object entry = parser.readObject();
            PrivateKeyInfo info = switch (encoding) {
                case PKCS1 -> entry instanceof PEMKeyPair keyPair ? keyPair.getPrivateKeyInfo() : null;
                case PKCS8 -> entry instanceof PrivateKeyInfo keyInfo ? keyInfo : null;
            };
            if (info == null) {
                throw new IOException("No %s private key found [ entryType = %s ]"
                        .formatted(encoding.label, entry == null ? "none" : entry.getClass().getSimpleName()));
            }

            PrivateKey key = CONVERTER.getPrivateKey(info);
            if (!(key instanceof RSAPrivateKey rsaKey)) {
                throw new IOException("Not an RSA private key [ algorithm = %s ]".formatted(key.getAlgorithm()));
            }
            return rsaKey;
        } catch (DecoderException | IllegalArgumentException e) {
            throw new IOException("Malformed %s PEM: %s".formatted(encoding.label, e.getMessage()), e);
        }
    }
}
