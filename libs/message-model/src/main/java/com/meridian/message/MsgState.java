package com.meridian.message;

/**
 * Payload state of a {@link MessageEnvelope}: either {@link Plain} cleartext or {@link Encrypted}
 * ciphertext. No other states exist.
 */
public sealed interface MsgState permits Plain, Encrypted {}
