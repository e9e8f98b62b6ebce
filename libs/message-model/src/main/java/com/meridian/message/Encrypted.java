package com.meridian.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;

/**
 * Ciphertext payload as produced by a {@link PayloadEncrypter}. The content is opaque: there is no
 * way to obtain cleartext from it except through {@link MessageEnvelopes#decrypt}.
 *
 * @param ciphertext the encoded ciphertext blob
 */
public record Encrypted(@JsonValue String ciphertext) implements MsgState {

    public Encrypted {
        Objects.requireNonNull(ciphertext, "ciphertext must not be null");
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Encrypted of(String ciphertext) {
        return new Encrypted(ciphertext);
    }

    @Override
    public String toString() {
        return "Encrypted[" + ciphertext.length() + " chars]";
    }
}
