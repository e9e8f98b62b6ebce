package com.meridian.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.meridian.common.NodeId;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Message exchanged between Meridian nodes, typed by the state of its payload.
 *
 * <p>A {@code MessageEnvelope<Plain>} can only be turned into a {@code MessageEnvelope<Encrypted>}
 * through {@link MessageEnvelopes#encrypt}, and back through {@link MessageEnvelopes#decrypt}. Code
 * that transmits messages accepts {@code MessageEnvelope<Encrypted>} only, so an unencrypted
 * payload cannot reach the wire and ciphertext cannot be read as text.
 *
 * <p>Envelopes are immutable. Every conversion produces a new instance that carries the routing
 * fields, id, expiry and metadata of its source unchanged.
 *
 * @param from sending node
 * @param to recipients in sender order
 * @param expire instant after which the message is no longer delivered ({@code ttl} on the wire)
 * @param id correlation id
 * @param secret payload in state {@code S}
 * @param metadata free-form JSON document, never Java {@code null}
 * @param <S> payload state
 */
@JsonPropertyOrder({"from", "to", "ttl", "id", "secret", "metadata"})
public record MessageEnvelope<S extends MsgState>(
        NodeId from,
        List<NodeId> to,
        @JsonProperty("ttl") Instant expire,
        MsgId id,
        S secret,
        JsonNode metadata)
        implements Msg, HasCorrelationId<MsgId> {

    public MessageEnvelope {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(expire, "expire must not be null");
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(secret, "secret must not be null");
        to = List.copyOf(Objects.requireNonNull(to, "to must not be null"));
        metadata = metadata == null ? NullNode.getInstance() : metadata;
    }

    @Override
    @JsonIgnore
    public MsgId correlationId() {
        return id;
    }

    /** Returns true once {@code now} has passed the envelope's expiry. */
    public boolean isExpired(Instant now) {
        return now.isAfter(expire);
    }
}
