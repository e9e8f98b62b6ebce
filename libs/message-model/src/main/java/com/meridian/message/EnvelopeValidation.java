package com.meridian.message;

import java.util.List;
import java.util.Objects;

/**
 * Problems {@link EnvelopeValidator} found in one envelope; none means it may be sent.
 *
 * @param envelopeId id of the checked envelope
 * @param problems human-readable descriptions, in the order they were found
 */
public record EnvelopeValidation(MsgId envelopeId, List<String> problems) {

    public EnvelopeValidation {
        Objects.requireNonNull(envelopeId, "envelopeId must not be null");
        problems = List.copyOf(problems);
    }

    public boolean isValid() {
        return problems.isEmpty();
    }

    /**
     * @throws IllegalArgumentException naming every problem, if there is one
     */
    public void requireValid() {
        if (!isValid()) {
            throw new IllegalArgumentException(
                    "Envelope %s is invalid: %s".formatted(envelopeId, String.join("; ", problems)));
        }
    }
}
