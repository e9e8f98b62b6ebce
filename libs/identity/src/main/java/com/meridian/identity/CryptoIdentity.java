package com.meridian.identity;

import java.security.interfaces.RSAPrivateKey;
import java.util.Objects;

/**
 * Everything this node needs to sign, encrypt and decrypt: created once at startup by {@link
 * IdentityBootstrapper}, handed to {@link IdentityPublisher}, then shared read-only for the rest of
 * the process. Immutable, so concurrent readers need no locking.
 *
 * @param signingKey key for signing outgoing messages, tagged with the formatted certificate serial
 * @param privateKey raw RSA key for decrypting payload keys addressed to this node
 * @param publicPortion own certificate and public key as known to the directory
 */
public record CryptoIdentity(SigningKey signingKey, RSAPrivateKey privateKey, CryptoPublicPortion publicPortion) {

    public CryptoIdentity {
        Objects.requireNonNull(signingKey, "signingKey must not be null");
        Objects.requireNonNull(privateKey, "privateKey must not be null");
        Objects.requireNonNull(publicPortion, "publicPortion must not be null");
        Objects.requireNonNull(signingKey.keyId(), "signingKey must carry a key id");
    }

    /** The signing key's id (formatted certificate serial). */
    public String keyId() {
        return signingKey.keyId();
    }

    @Override
    public String toString() {
        return "CryptoIdentity[nodeId=" + publicPortion.nodeId() + ", keyId=" + keyId() + "]";
    }
}
