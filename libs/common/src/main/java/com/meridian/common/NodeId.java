package com.meridian.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identifier of a node (proxy or application) within the Meridian relay network.
 *
 * <p>A node id is one or more dot-separated DNS-style labels, most specific first, e.g. {@code
 * app1.proxy1.broker.example.org}. On the wire it is a bare JSON string.
 *
 * @param value the canonical (lowercase) identifier
 */
public record NodeId(@JsonValue String value) {

    /** Regular expression for a canonical node id. Also usable in {@code @Pattern} constraints. */
    public static final String SYNTAX = "[a-z0-9](?:[a-z0-9-]*[a-z0-9])?(?:\\.[a-z0-9](?:[a-z0-9-]*[a-z0-9])?)*";

    private static final Pattern LABELS = Pattern.compile(SYNTAX);

    /**
     * Compact constructor: rejects identifiers that are not a sequence of lowercase labels.
     *
     * @throws IllegalArgumentException if {@code value} is null or malformed
     */
    public NodeId {
        if (value == null || !LABELS.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid node id: '%s'".formatted(value));
        }
    }

    /**
     * Parses a node id, accepting mixed case input.
     *
     * @throws IllegalArgumentException if {@code value} is null or malformed
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static NodeId of(String value) {
        return new NodeId(value == null ? null : value.strip().toLowerCase(Locale.ROOT));
    }

    /**
     * Returns true if this id lies inside {@code domain}, matching on label boundaries only:
     * {@code proxy1.broker.example.org} is within {@code broker.example.org} but {@code
     * proxy1.xbroker.example.org} is not.
     */
    public boolean isWithin(String domain) {
        if (domain == null || domain.isBlank()) {
            return false;
        }
        String normalized = domain.strip().toLowerCase(Locale.ROOT);
        return value.endsWith("." + normalized);
    }

    @Override
    public String toString() {
        return value;
    }
}
