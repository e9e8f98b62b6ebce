package com.meridian.message;

/**
 * A message that a caller can wait on: the returned key matches the message to its later response.
 *
 * @param <K> the correlation key type
 */
public interface HasCorrelationId<K> {

    K correlationId();
}
