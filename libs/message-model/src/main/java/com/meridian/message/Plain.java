package com.meridian.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;

/**
 * Cleartext payload. Only ever held by envelopes that have not yet been encrypted for transmission
 * or have been decrypted after receipt.
 *
 * @param text the cleartext body
 */
public record Plain(@JsonValue String text) implements MsgState {

    public Plain {
        Objects.requireNonNull(text, "text must not be null");
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Plain of(String text) {
        return new Plain(text);
    }
}
