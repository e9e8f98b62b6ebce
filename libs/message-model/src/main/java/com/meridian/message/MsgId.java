package com.meridian.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;
import java.util.UUID;

/**
 * Unique message identifier. Stable for the lifetime of an envelope and used as the correlation key
 * when matching a later response to the request that carried it.
 *
 * @param value the UUID
 */
public record MsgId(@JsonValue UUID value) {

    public MsgId {
        Objects.requireNonNull(value, "value must not be null");
    }

    /** Generates a new random (v4) id. */
    public static MsgId random() {
        return new MsgId(UUID.randomUUID());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static MsgId of(UUID value) {
        return new MsgId(value);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
