package com.meridian.identity;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The single slot holding this process's {@link CryptoIdentity}.
 *
 * <p>The identity can be published exactly once. A second {@link #publish} is a programming error
 * and fails with {@link IllegalStateException} every time, whichever thread wins the race; the slot
 * is never overwritten. Startup code lets that exception escape so the process does not come up
 * with two sets of key material. One instance is shared by reference with every consumer.
 */
public final class IdentityPublisher {

    private final AtomicReference<CryptoIdentity> slot = new AtomicReference<>();

    /**
     * Publishes {@code identity}.
     *
     * @throws IllegalStateException if an identity has already been published
     */
    public void publish(CryptoIdentity identity) {
        Objects.requireNonNull(identity, "identity must not be null");
        if (!slot.compareAndSet(null, identity)) {
            throw new IllegalStateException("Tried to initialize crypto identity twice (publish())");
        }
    }

    /**
     * Returns the published identity.
     *
     * @throws IllegalStateException if nothing has been published yet
     */
    public CryptoIdentity current() {
        CryptoIdentity identity = slot.get();
        if (identity == null) {
            throw new IllegalStateException("Crypto identity has not been published yet");
        }
        return identity;
    }

    /** Returns the published identity, or empty before startup has completed. */
    public Optional<CryptoIdentity> get() {
        return Optional.ofNullable(slot.get());
    }

    public boolean isPublished() {
        return slot.get() != null;
    }
}
