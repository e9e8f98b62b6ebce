/**
 * Messages exchanged between Meridian nodes.
 *
 * <p>{@link com.meridian.message.MessageEnvelope} is generic over its payload state ({@link
 * com.meridian.message.Plain} or {@link com.meridian.message.Encrypted}); {@link
 * com.meridian.message.MessageEnvelopes} holds the only transitions between the two. {@link
 * com.meridian.message.MessageSerializer} is the JSON wire codec.
 */
package com.meridian.message;
