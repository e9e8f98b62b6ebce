package com.meridian.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Optional;

/**
 * JSON wire codec for {@link MessageEnvelope}.
 *
 * <p>The wire document carries {@code from}, {@code to}, {@code ttl} (ISO-8601 instant), {@code
 * id}, {@code secret} and {@code metadata}. {@code secret} is a bare string and nothing on the wire
 * says whether it holds cleartext or ciphertext, so the caller names the expected state by picking
 * {@link #deserializePlain} or {@link #deserializeEncrypted}. Unknown fields are ignored, so peers
 * may add fields without breaking older readers.
 */
public final class MessageSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private MessageSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Serializes an envelope in either state.
     *
     * @throws EnvelopeSerializationException if serialization fails
     */
    public static String serialize(MessageEnvelope<?> envelope) {
        try {
            return MAPPER.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new EnvelopeSerializationException("Failed to serialize message: " + envelope.id(), e);
        }
    }

    /** Reads an envelope whose {@code secret} is known to hold cleartext. */
    public static MessageEnvelope<Plain> deserializePlain(String json) {
        return deserialize(json, Plain.class);
    }

    /** Reads an envelope whose {@code secret} is known to hold ciphertext. */
    public static MessageEnvelope<Encrypted> deserializeEncrypted(String json) {
        return deserialize(json, Encrypted.class);
    }

    /**
     * Reads an envelope in the given payload state.
     *
     * @throws EnvelopeSerializationException if the JSON is malformed, is not an object, or a required
     *     field is missing
     */
    public static <S extends MsgState> MessageEnvelope<S> deserialize(String json, Class<S> state) {
        MessageEnvelope<S> envelope;
        try {
            JavaType type = MAPPER.getTypeFactory().constructParametricType(MessageEnvelope.class, state);
            envelope = MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new EnvelopeSerializationException("Failed to deserialize message", e);
        }
        if (envelope == null) {
            throw new EnvelopeSerializationException("Failed to deserialize message: document is JSON null");
        }
        return envelope;
    }

    /** Like {@link #deserialize}, returning empty instead of throwing. */
    public static <S extends MsgState> Optional<MessageEnvelope<S>> tryDeserialize(String json, Class<S> state) {
        try {
            return Optional.of(deserialize(json, state));
        } catch (EnvelopeSerializationException e) {
            return Optional.empty();
        }
    }

    /** Returns the shared ObjectMapper, e.g. for building {@code metadata} documents. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /** Thrown when an envelope cannot be written or read. */
    public static class EnvelopeSerializationException extends RuntimeException {
        public EnvelopeSerializationException(String message) {
            super(message);
        }

        public EnvelopeSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
