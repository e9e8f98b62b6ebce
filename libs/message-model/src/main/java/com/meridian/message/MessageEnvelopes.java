package com.meridian.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.meridian.common.NodeId;
import com.meridian.common.SignEncryptException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Factory and state transitions for {@link MessageEnvelope}.
 *
 * <p>{@link #encrypt} and {@link #decrypt} are the only ways to change an envelope's payload state.
 * They are pure: the source envelope is left untouched and may be converted again, concurrently if
 * need be.
 */
public final class MessageEnvelopes {

    private MessageEnvelopes() {
        // utility class
    }

    /**
     * Creates a cleartext envelope with a fresh id that expires {@code ttl} from now.
     */
    public static MessageEnvelope<Plain> create(
            NodeId from, List<NodeId> to, Duration ttl, String body, JsonNode metadata) {
        return create(from, to, ttl, body, metadata, Clock.systemUTC());
    }

    /**
     * Creates a cleartext envelope with a fresh id, taking the current time from {@code clock}.
     */
    public static MessageEnvelope<Plain> create(
            NodeId from,
            List<NodeId> to,
            Duration ttl,
            String body,
            JsonNode metadata,
            Clock clock) {
        Objects.requireNonNull(ttl, "ttl must not be null");
        Instant expire = clock.instant().plus(ttl);
        return new MessageEnvelope<>(from, to, expire, MsgId.random(), new Plain(body), metadata);
    }

    /**
     * Replaces the cleartext payload with ciphertext produced by {@code encrypter}.
     *
     * @throws SignEncryptException if the encrypter fails
     */
    public static MessageEnvelope<Encrypted> encrypt(
            MessageEnvelope<Plain> envelope, PayloadEncrypter encrypter) throws SignEncryptException {
        Encrypted body = encrypter.encrypt(envelope.secret(), envelope.to());
        return withSecret(envelope, body);
    }

    /**
     * Replaces the ciphertext payload with the cleartext recovered by {@code decrypter}.
     *
     * @throws SignEncryptException if the decrypter fails (wrong key, corrupted ciphertext)
     */
    public static MessageEnvelope<Plain> decrypt(
            MessageEnvelope<Encrypted> envelope, PayloadDecrypter decrypter) throws SignEncryptException {
        Plain body = decrypter.decrypt(envelope.secret());
        return withSecret(envelope, body);
    }

    private static <T extends MsgState> MessageEnvelope<T> withSecret(MessageEnvelope<?> source, T secret) {
        return new MessageEnvelope<>(
                source.from(), source.to(), source.expire(), source.id(), secret, source.metadata());
    }
}
