package com.meridian.message;

import com.meridian.common.NodeId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a {@link MessageEnvelope} before it is handed to transport. All problems are reported at
 * once in an {@link EnvelopeValidation}.
 */
public final class EnvelopeValidator {

    private EnvelopeValidator() {
        // utility class
    }

    public static EnvelopeValidation validate(MessageEnvelope<?> envelope) {
        List<String> problems = new ArrayList<>();

        if (envelope.to().isEmpty()) {
            problems.add("to must name at least one recipient");
        }
        Set<NodeId> seen = new HashSet<>();
        for (NodeId recipient : envelope.to()) {
            if (!seen.add(recipient)) {
                problems.add("duplicate recipient: " + recipient);
            }
        }
        if (!envelope.metadata().isNull() && !envelope.metadata().isObject()) {
            problems.add("metadata must be a JSON object or null");
        }

        return new EnvelopeValidation(envelope.id(), problems);
    }
}
