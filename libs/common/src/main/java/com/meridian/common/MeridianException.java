package com.meridian.common;

/**
 * Base type of the recoverable errors a Meridian node reports to its operator.
 *
 * <p>These are checked: a caller of a bootstrap or conversion step must decide what to do with bad
 * external input. Broken call sequencing (publishing an identity twice, bootstrapping without a
 * node id) is reported with unchecked {@link IllegalStateException}s instead and never surfaces as
 * a {@code MeridianException}.
 */
public abstract sealed class MeridianException extends Exception
        permits ConfigurationFailedException, SignEncryptException {

    protected MeridianException(String message) {
        super(message);
    }

    protected MeridianException(String message, Throwable cause) {
        super(message, cause);
    }
}
